package sh.nebula.api.discovery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class ServiceRegistryTest {

    private static final Instant NOW = Instant.parse("2026-01-10T12:00:00Z");

    @Test
    @DisplayName("AI lookup prefers the Windows VM provider")
    void findAIServicePrefersWindowsVm() {
        FixedRegistry registry = new FixedRegistry(List.of(
                service("ollama-home", Environments.UBUNTU_HOME, Set.of("ai"), true),
                service("ollama-vm", Environments.WINDOWS_VM, Set.of("ai"), true)));

        Optional<RegisteredService> found = registry.findAIService().join();

        assertThat(found).map(RegisteredService::name).contains("ollama-vm");
    }

    @Test
    @DisplayName("AI lookup falls back to the first provider")
    void findAIServiceFallsBackToFirst() {
        FixedRegistry registry = new FixedRegistry(List.of(
                service("ollama-home", Environments.UBUNTU_HOME, Set.of("ai"), true),
                service("ollama-cloud", Environments.LINODE, Set.of("ai"), true)));

        assertThat(registry.findAIService().join()).map(RegisteredService::name).contains("ollama-home");
    }

    @Test
    @DisplayName("AI lookup is empty without providers")
    void findAIServiceEmpty() {
        assertThat(new FixedRegistry(List.of()).findAIService().join()).isEmpty();
    }

    @Test
    @DisplayName("Health summary counts every registration by environment")
    void healthSummary() {
        FixedRegistry registry = new FixedRegistry(List.of(
                service("a", Environments.LINODE, Set.of(), true),
                service("b", Environments.LINODE, Set.of(), false),
                service("c", Environments.REPLIT, Set.of(), true)));

        ServiceHealthSummary summary = registry.getServiceHealth().join();

        assertThat(summary.totalServices()).isEqualTo(3);
        assertThat(summary.healthyServices()).isEqualTo(2);
        assertThat(summary.unhealthyServices()).isEqualTo(1);
        assertThat(summary.byEnvironment()).containsEntry(Environments.LINODE, 2).containsEntry(Environments.REPLIT, 1);
    }

    @Test
    @DisplayName("Prune without an age uses the default retention")
    void pruneUsesDefaultRetention() {
        FixedRegistry registry = new FixedRegistry(List.of());

        registry.pruneStaleServices().join();

        assertThat(registry.pruneRequests).containsExactly(Duration.ofHours(24));
    }

    private static RegisteredService service(String name, String environment, Set<String> capabilities, boolean healthy) {
        return new RegisteredService(name, environment, "http://" + name + ":80", capabilities, NOW, healthy, Map.of());
    }

    private static final class FixedRegistry implements ServiceRegistry {
        private final List<RegisteredService> services;
        private final List<Duration> pruneRequests = new ArrayList<>();

        private FixedRegistry(List<RegisteredService> services) {
            this.services = services;
        }

        @Override
        public CompletableFuture<Boolean> register(ServiceRegistration registration) {
            return CompletableFuture.completedFuture(true);
        }

        @Override
        public CompletableFuture<Boolean> unregister() {
            return CompletableFuture.completedFuture(false);
        }

        @Override
        public CompletableFuture<Boolean> unregister(String name) {
            return CompletableFuture.completedFuture(false);
        }

        @Override
        public CompletableFuture<Boolean> unregister(String name, String environment) {
            return CompletableFuture.completedFuture(false);
        }

        @Override
        public CompletableFuture<Optional<RegisteredService>> discover(String name) {
            return CompletableFuture.completedFuture(
                    services.stream().filter(service -> service.name().equals(name)).findFirst());
        }

        @Override
        public CompletableFuture<List<RegisteredService>> discoverByCapability(String capability) {
            return CompletableFuture.completedFuture(services.stream()
                    .filter(RegisteredService::healthy)
                    .filter(service -> service.hasCapability(capability))
                    .toList());
        }

        @Override
        public CompletableFuture<List<RegisteredService>> discoverByEnvironment(String environment) {
            return CompletableFuture.completedFuture(services.stream()
                    .filter(service -> service.environment().equals(environment))
                    .toList());
        }

        @Override
        public CompletableFuture<Boolean> heartbeat() {
            return CompletableFuture.completedFuture(false);
        }

        @Override
        public CompletableFuture<List<RegisteredService>> getHealthyPeers() {
            return CompletableFuture.completedFuture(services.stream().filter(RegisteredService::healthy).toList());
        }

        @Override
        public CompletableFuture<List<RegisteredService>> getAllServices() {
            return CompletableFuture.completedFuture(services);
        }

        @Override
        public CompletableFuture<Integer> pruneStaleServices(Duration maxAge) {
            pruneRequests.add(maxAge);
            return CompletableFuture.completedFuture(0);
        }
    }
}
