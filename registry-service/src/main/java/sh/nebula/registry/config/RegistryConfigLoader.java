package sh.nebula.registry.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import sh.nebula.api.discovery.HealthPolicy;
import sh.nebula.registry.redis.RedisConfiguration;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads {@code application.yml} (external path or classpath), substitutes
 * {@code ${ENV:default}} placeholders and binds the result to {@link RegistryConfiguration}.
 */
public final class RegistryConfigLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(RegistryConfigLoader.class);
    public static final String CLASSPATH_RESOURCE = "/application.yml";

    private final PlaceholderResolver placeholders;

    public RegistryConfigLoader() {
        this(PlaceholderResolver.systemEnvironment());
    }

    public RegistryConfigLoader(PlaceholderResolver placeholders) {
        this.placeholders = Objects.requireNonNull(placeholders, "placeholders");
    }

    /**
     * Loads the external file when given, otherwise the bundled resource. A missing
     * bundled resource yields the built-in defaults.
     *
     * @throws RegistryConfigurationException when a file exists but cannot be parsed or bound
     */
    public RegistryConfiguration load(Path externalFile) {
        if (externalFile != null) {
            if (!Files.isRegularFile(externalFile)) {
                throw new RegistryConfigurationException("Configuration file not found: " + externalFile);
            }
            try (InputStream in = Files.newInputStream(externalFile)) {
                LOGGER.info("Loading configuration from {}", externalFile.toAbsolutePath());
                return bind(parse(in));
            } catch (IOException ex) {
                throw new RegistryConfigurationException("Failed to read " + externalFile, ex);
            }
        }
        try (InputStream in = RegistryConfigLoader.class.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in == null) {
                LOGGER.warn("application.yml not found, using default configuration");
                return bind(Map.of());
            }
            return bind(parse(in));
        } catch (IOException ex) {
            throw new RegistryConfigurationException("Failed to read " + CLASSPATH_RESOURCE, ex);
        }
    }

    public RegistryConfiguration loadFromString(String yaml) {
        return bind(parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
    }

    private Map<String, Object> parse(InputStream in) {
        try {
            Object loaded = new Yaml().load(in);
            if (loaded == null) {
                return Map.of();
            }
            if (!(loaded instanceof Map<?, ?> map)) {
                throw new RegistryConfigurationException("Configuration root must be a mapping");
            }
            return substitute(map);
        } catch (YAMLException ex) {
            throw new RegistryConfigurationException("Malformed YAML configuration", ex);
        }
    }

    private Map<String, Object> substitute(Map<?, ?> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        source.forEach((key, value) -> result.put(String.valueOf(key), substituteValue(value)));
        return result;
    }

    private Object substituteValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return substitute(map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>();
            collection.forEach(item -> items.add(substituteValue(item)));
            return items;
        }
        if (value instanceof String text) {
            return placeholders.resolve(text);
        }
        return value;
    }

    RegistryConfiguration bind(Map<String, Object> root) {
        Map<String, Object> registry = section(root, "registry");
        Map<String, Object> prune = section(registry, "prune");
        Map<String, Object> self = section(root, "self");
        Map<String, Object> store = section(root, "store");
        Map<String, Object> postgres = section(store, "postgres");
        Map<String, Object> redis = section(store, "redis");
        Map<String, Object> remote = section(root, "remote");

        try {
            HealthPolicy healthPolicy = new HealthPolicy(
                    Duration.ofSeconds(longValue(registry, "heartbeat-interval-seconds",
                            HealthPolicy.DEFAULT_HEARTBEAT_INTERVAL.toSeconds())),
                    Duration.ofSeconds(longValue(registry, "health-timeout-seconds",
                            HealthPolicy.DEFAULT_HEALTH_TIMEOUT.toSeconds())));

            RegistrySettings registrySettings = new RegistrySettings(
                    stringValue(registry, "environment", null),
                    booleanValue(registry, "debug", false),
                    healthPolicy,
                    booleanValue(prune, "enabled", true),
                    Duration.ofMinutes(longValue(prune, "interval-minutes", 60)),
                    Duration.ofHours(longValue(prune, "max-age-hours", 24)));

            SelfSettings selfSettings = new SelfSettings(
                    booleanValue(self, "enabled", true),
                    stringValue(self, "name", "registry"),
                    stringSet(self, "capabilities", Set.of("registry")),
                    (int) longValue(self, "port", 5000),
                    section(self, "metadata"));

            PostgresSettings defaults = PostgresSettings.defaults();
            PostgresSettings postgresSettings = new PostgresSettings(
                    stringValue(postgres, "jdbc-url", defaults.jdbcUrl()),
                    stringValue(postgres, "username", defaults.username()),
                    stringValue(postgres, "password", defaults.password()),
                    stringValue(postgres, "database", defaults.databaseName()),
                    (int) longValue(postgres, "maximum-pool-size", defaults.maximumPoolSize()),
                    longValue(postgres, "connection-timeout-millis", defaults.connectionTimeoutMillis()));

            RedisConfiguration redisConfiguration = new RedisConfiguration(
                    stringValue(redis, "host", RedisConfiguration.DEFAULT_HOST),
                    (int) longValue(redis, "port", RedisConfiguration.DEFAULT_PORT),
                    stringValue(redis, "password", ""),
                    (int) longValue(redis, "database", 0));

            StoreSettings storeSettings = new StoreSettings(
                    StoreSettings.Type.parse(stringValue(store, "type", "memory")),
                    postgresSettings,
                    redisConfiguration);

            RemoteSettings remoteSettings = RemoteSettings.resolve(
                    stringValue(remote, "base-url", null),
                    stringValue(remote, "token", null),
                    Duration.ofSeconds(longValue(remote, "timeout-seconds",
                            RemoteSettings.DEFAULT_TIMEOUT.toSeconds())),
                    placeholders);

            return new RegistryConfiguration(registrySettings, selfSettings, storeSettings, remoteSettings);
        } catch (IllegalArgumentException ex) {
            throw new RegistryConfigurationException(ex.getMessage(), ex);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> parent, String key) {
        Object value = parent.get(key);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?>) {
            return (Map<String, Object>) value;
        }
        throw RegistryConfigurationException.invalidValue(key, value);
    }

    private static String stringValue(Map<String, Object> section, String key, String fallback) {
        Object value = section.get(key);
        if (value == null) {
            return fallback;
        }
        String text = value.toString();
        return text.isBlank() ? fallback : text;
    }

    private static long longValue(Map<String, Object> section, String key, long fallback) {
        Object value = section.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        String text = value == null ? null : value.toString().trim();
        if (text == null || text.isEmpty()) {
            return fallback;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException ex) {
            throw RegistryConfigurationException.invalidValue(key, value);
        }
    }

    private static boolean booleanValue(Map<String, Object> section, String key, boolean fallback) {
        Object value = section.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = value == null ? null : value.toString().trim();
        if (text == null || text.isEmpty()) {
            return fallback;
        }
        return Boolean.parseBoolean(text);
    }

    private static Set<String> stringSet(Map<String, Object> section, String key, Set<String> fallback) {
        Object value = section.get(key);
        if (value == null) {
            return fallback;
        }
        Set<String> result = new LinkedHashSet<>();
        if (value instanceof Collection<?> items) {
            items.forEach(item -> result.add(String.valueOf(item).trim()));
        } else {
            for (String part : value.toString().split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }
}
