package sh.nebula.api.discovery;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate counts over every known registration.
 */
public record ServiceHealthSummary(
        int totalServices,
        int healthyServices,
        int unhealthyServices,
        Map<String, Integer> byEnvironment
) {

    public ServiceHealthSummary {
        byEnvironment = byEnvironment == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(byEnvironment));
    }

    public static ServiceHealthSummary of(Collection<RegisteredService> services) {
        int healthy = 0;
        Map<String, Integer> byEnvironment = new TreeMap<>();
        for (RegisteredService service : services) {
            if (service.healthy()) {
                healthy++;
            }
            byEnvironment.merge(service.environment(), 1, Integer::sum);
        }
        return new ServiceHealthSummary(services.size(), healthy, services.size() - healthy, byEnvironment);
    }
}
