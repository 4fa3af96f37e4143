package sh.nebula.registry.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * How the standalone service registers itself on startup.
 */
public record SelfSettings(boolean enabled,
                           String name,
                           Set<String> capabilities,
                           int port,
                           Map<String, Object> metadata) {

    public SelfSettings {
        if (enabled && (name == null || name.isBlank())) {
            throw new IllegalArgumentException("self.name is required when self registration is enabled");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("self.port must be between 1 and 65535");
        }
        capabilities = capabilities == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(capabilities));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static SelfSettings defaults() {
        return new SelfSettings(true, "registry", Set.of("registry"), 5000, Map.of());
    }
}
