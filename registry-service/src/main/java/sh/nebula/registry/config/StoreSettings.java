package sh.nebula.registry.config;

import sh.nebula.registry.redis.RedisConfiguration;

import java.util.Locale;
import java.util.Objects;

/**
 * Which local store backs the registry, plus connection settings for each kind.
 */
public record StoreSettings(Type type, PostgresSettings postgres, RedisConfiguration redis) {

    public enum Type {
        POSTGRES,
        REDIS,
        MEMORY,
        NONE;

        public static Type parse(String value) {
            if (value == null || value.isBlank()) {
                return NONE;
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw RegistryConfigurationException.invalidValue("store.type", value);
            }
        }
    }

    public StoreSettings {
        Objects.requireNonNull(type, "type");
        postgres = postgres == null ? PostgresSettings.defaults() : postgres;
        redis = redis == null ? RedisConfiguration.defaults() : redis;
    }

    public static StoreSettings defaults() {
        return new StoreSettings(Type.MEMORY, null, null);
    }
}
