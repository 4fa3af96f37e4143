package sh.nebula.registry.store;

import sh.nebula.api.discovery.HealthPolicy;
import sh.nebula.api.discovery.RegisteredService;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Stored registration row. {@code (serviceName, environment)} is the natural key;
 * {@code id} is assigned by the store on first insert and survives updates.
 */
public record RegistrationRecord(
        long id,
        String serviceName,
        String environment,
        String endpoint,
        Set<String> capabilities,
        Instant lastHeartbeat,
        Map<String, Object> metadata
) {

    public RegistrationRecord {
        Objects.requireNonNull(serviceName, "serviceName");
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(lastHeartbeat, "lastHeartbeat");
        capabilities = capabilities == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(capabilities));
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean matches(String name, String env) {
        return serviceName.equals(name) && environment.equals(env);
    }

    public RegistrationRecord withHeartbeat(Instant heartbeat) {
        if (!heartbeat.isAfter(lastHeartbeat)) {
            return this;
        }
        return new RegistrationRecord(id, serviceName, environment, endpoint, capabilities, heartbeat, metadata);
    }

    public RegisteredService toService(boolean healthy) {
        return new RegisteredService(serviceName, environment, endpoint, capabilities, lastHeartbeat, healthy, metadata);
    }

    public RegisteredService toService(HealthPolicy policy, Instant now) {
        return toService(policy.isHealthy(lastHeartbeat, now));
    }
}
