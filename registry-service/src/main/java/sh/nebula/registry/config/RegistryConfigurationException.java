package sh.nebula.registry.config;

/**
 * Configuration could not be read or contains an invalid value.
 */
public class RegistryConfigurationException extends RuntimeException {

    public RegistryConfigurationException(String message) {
        super(message);
    }

    public RegistryConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static RegistryConfigurationException invalidValue(String key, Object value) {
        return new RegistryConfigurationException("Invalid value for '" + key + "': " + value);
    }
}
