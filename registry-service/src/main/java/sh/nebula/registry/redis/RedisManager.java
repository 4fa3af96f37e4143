package sh.nebula.registry.redis;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisNoScriptException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Shared Lettuce connection for the registry store, plus loading and running the
 * Lua scripts that keep read-modify-write updates atomic.
 */
public final class RedisManager implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RedisManager.class);
    private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(5);

    private final RedisConfiguration configuration;
    private final RedisClient redisClient;
    private final StatefulRedisConnection<String, String> connection;

    public RedisManager(RedisConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        RedisURI.Builder uri = RedisURI.builder()
                .withHost(configuration.host())
                .withPort(configuration.port())
                .withDatabase(configuration.database())
                .withTimeout(COMMAND_TIMEOUT);
        if (configuration.hasPassword()) {
            uri.withPassword(configuration.password().toCharArray());
        }
        this.redisClient = RedisClient.create(uri.build());
        this.connection = redisClient.connect();
        LOGGER.info("Connected to Redis at {}", configuration.describe());
    }

    public RedisConfiguration configuration() {
        return configuration;
    }

    public RedisCommands<String, String> sync() {
        return connection.sync();
    }

    public RedisScript loadScript(String name, ScriptOutputType outputType, String resourcePath) {
        String source = RedisScript.readResource(resourcePath);
        String sha = sync().scriptLoad(source);
        LOGGER.debug("Loaded Redis script {} ({})", name, sha);
        return new RedisScript(name, outputType, source, sha);
    }

    /**
     * Runs a script by digest, loading it again once if the server reports NOSCRIPT
     * (after a restart or {@code SCRIPT FLUSH}).
     */
    public <T> T eval(RedisScript script, List<String> keys, String... args) {
        Objects.requireNonNull(script, "script");
        String[] keyArray = keys.toArray(String[]::new);
        try {
            return sync().evalsha(script.sha(), script.outputType(), keyArray, args);
        } catch (RedisNoScriptException ex) {
            LOGGER.info("Redis script {} missing on server, reloading", script.name());
            script.reloaded(sync().scriptLoad(script.source()));
            return sync().evalsha(script.sha(), script.outputType(), keyArray, args);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (Exception ex) {
            LOGGER.warn("Failed to close Redis connection cleanly", ex);
        }
        try {
            redisClient.shutdown(Duration.ofSeconds(1), Duration.ofSeconds(5));
        } catch (Exception ex) {
            LOGGER.warn("Failed to shutdown Redis client cleanly", ex);
        }
    }
}
