package sh.nebula.api.discovery;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read-side view of a registration. Rebuilt on every read, never persisted.
 *
 * @param name         logical service name
 * @param environment  deployment environment of the registrant
 * @param endpoint     scheme, host and port the service listens on
 * @param capabilities feature tags offered by the service
 * @param lastSeen     time of the last registration or heartbeat
 * @param healthy      whether {@code lastSeen} falls inside the health timeout
 * @param metadata     free-form annotations, not interpreted by the registry
 */
public record RegisteredService(
        String name,
        String environment,
        String endpoint,
        Set<String> capabilities,
        Instant lastSeen,
        boolean healthy,
        Map<String, Object> metadata
) {

    public RegisteredService {
        Objects.requireNonNull(name, "name");
        environment = environment == null || environment.isBlank() ? Environments.UNKNOWN : environment;
        capabilities = capabilities == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(capabilities));
        Objects.requireNonNull(lastSeen, "lastSeen");
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean hasCapability(String capability) {
        return capability != null && capabilities.contains(capability);
    }

    public boolean hasAnyCapability(Collection<String> wanted) {
        for (String capability : wanted) {
            if (capabilities.contains(capability)) {
                return true;
            }
        }
        return false;
    }

    public RegisteredService withHealthy(boolean value) {
        if (value == healthy) {
            return this;
        }
        return new RegisteredService(name, environment, endpoint, capabilities, lastSeen, value, metadata);
    }
}
