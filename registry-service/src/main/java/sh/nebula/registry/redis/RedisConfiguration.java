package sh.nebula.registry.redis;

import java.util.Objects;

/**
 * Connection settings for the Redis-backed registration store.
 */
public record RedisConfiguration(String host, int port, String password, int database) {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 6379;

    public RedisConfiguration {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) {
            throw new IllegalArgumentException("Redis host must not be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Redis port must be between 1 and 65535");
        }
        password = password == null ? "" : password;
        if (database < 0 || database > 15) {
            throw new IllegalArgumentException("Redis database must be between 0 and 15");
        }
    }

    public static RedisConfiguration defaults() {
        return new RedisConfiguration(DEFAULT_HOST, DEFAULT_PORT, "", 0);
    }

    public boolean hasPassword() {
        return !password.isBlank();
    }

    public String describe() {
        return host + ":" + port + "/" + database;
    }
}
