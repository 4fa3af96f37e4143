package sh.nebula.api.discovery;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Registration request submitted by a process announcing itself.
 */
public record ServiceRegistration(
        String name,
        Set<String> capabilities,
        String endpoint,
        Map<String, Object> metadata
) {

    public ServiceRegistration {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Service name must not be blank");
        }
        Objects.requireNonNull(endpoint, "endpoint");
        capabilities = capabilities == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(capabilities));
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ServiceRegistration of(String name, Collection<String> capabilities, String endpoint) {
        return new ServiceRegistration(name, capabilities == null ? null : new LinkedHashSet<>(capabilities), endpoint, Map.of());
    }

    /**
     * Copy with one extra metadata entry; existing keys are overwritten.
     */
    public ServiceRegistration withMetadata(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return new ServiceRegistration(name, capabilities, endpoint, merged);
    }

    /**
     * Environment tag carried in the metadata by remote registrants, if any.
     */
    public String metadataEnvironment() {
        Object value = metadata.get("environment");
        if (value == null) {
            return null;
        }
        String environment = value.toString();
        return environment.isBlank() ? null : environment;
    }
}
