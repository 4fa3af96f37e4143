package sh.nebula.api.discovery;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Discovery registry shared by every Nebula node.
 * <p>
 * Reads are best effort: an empty result means "could not find", which callers
 * cannot tell apart from "temporarily unreachable". Futures never complete
 * exceptionally for backend failures.
 */
public interface ServiceRegistry {

    Duration DEFAULT_RETENTION = Duration.ofHours(24);
    String AI_CAPABILITY = "ai";
    String DASHBOARD_SERVICE = "dashboard";

    /**
     * Registers (or refreshes) this process under the detected environment and
     * starts the heartbeat when it is not already running.
     */
    CompletableFuture<Boolean> register(ServiceRegistration registration);

    default CompletableFuture<Boolean> register(String name,
                                                Collection<String> capabilities,
                                                String endpoint,
                                                Map<String, Object> metadata) {
        return register(new ServiceRegistration(name,
                capabilities == null ? null : new LinkedHashSet<>(capabilities),
                endpoint,
                metadata));
    }

    /**
     * Removes the identity this process last registered.
     */
    CompletableFuture<Boolean> unregister();

    CompletableFuture<Boolean> unregister(String name);

    CompletableFuture<Boolean> unregister(String name, String environment);

    /**
     * Freshest registration with the given name.
     */
    CompletableFuture<Optional<RegisteredService>> discover(String name);

    /**
     * Healthy registrations offering the capability (exact, case-sensitive match).
     */
    CompletableFuture<List<RegisteredService>> discoverByCapability(String capability);

    /**
     * Registrations in one environment, answered by the local store only.
     */
    CompletableFuture<List<RegisteredService>> discoverByEnvironment(String environment);

    /**
     * Refreshes the heartbeat of the current identity.
     */
    CompletableFuture<Boolean> heartbeat();

    CompletableFuture<List<RegisteredService>> getHealthyPeers();

    CompletableFuture<List<RegisteredService>> getAllServices();

    /**
     * Deletes local registrations whose heartbeat is older than {@code maxAge}.
     *
     * @return number of deleted registrations
     */
    CompletableFuture<Integer> pruneStaleServices(Duration maxAge);

    default CompletableFuture<Integer> pruneStaleServices() {
        return pruneStaleServices(DEFAULT_RETENTION);
    }

    /**
     * AI-capable peer, preferring the GPU node.
     */
    default CompletableFuture<Optional<RegisteredService>> findAIService() {
        return discoverByCapability(AI_CAPABILITY).thenApply(services -> {
            if (services.isEmpty()) {
                return Optional.empty();
            }
            return services.stream()
                    .filter(service -> Environments.PREFERRED_AI_ENVIRONMENT.equals(service.environment()))
                    .findFirst()
                    .or(() -> Optional.of(services.get(0)));
        });
    }

    default CompletableFuture<Optional<RegisteredService>> findDashboard() {
        return discover(DASHBOARD_SERVICE);
    }

    default CompletableFuture<ServiceHealthSummary> getServiceHealth() {
        return getAllServices().thenApply(ServiceHealthSummary::of);
    }
}
