package sh.nebula.registry.peer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sh.nebula.api.discovery.EnvironmentDetector;
import sh.nebula.api.discovery.RegisteredService;
import sh.nebula.api.discovery.ServiceRegistry;
import sh.nebula.registry.MutableClock;
import sh.nebula.registry.config.PlaceholderResolver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Peer discovery")
class PeerDiscoveryTest {

    private static final Instant NOW = Instant.parse("2026-07-01T15:00:00Z");

    @TempDir
    Path configDir;

    private final Map<String, String> env = new HashMap<>();
    private final Set<String> healthyEndpoints = new HashSet<>();
    private ServiceRegistry registry;
    private MutableClock clock;
    private PeerDiscovery discovery;

    @BeforeEach
    void setUp() {
        registry = mock(ServiceRegistry.class);
        clock = new MutableClock(NOW);
        PlaceholderResolver placeholders = new PlaceholderResolver(env::get);
        EnvironmentConfigLoader configLoader = new EnvironmentConfigLoader(List.of(configDir),
                EnvironmentDetector.fixed("linode"), placeholders, clock);
        discovery = new PeerDiscovery(registry, configLoader, new FallbackEndpoints(placeholders),
                healthyEndpoints::contains, clock);
    }

    private static RegisteredService service(String name, String environment, String endpoint, boolean healthy, String... capabilities) {
        return new RegisteredService(name, environment, endpoint, Set.of(capabilities), NOW, healthy, Map.of());
    }

    private void registryReturns(String capability, RegisteredService... services) {
        when(registry.discoverByCapability(capability)).thenReturn(CompletableFuture.completedFuture(List.of(services)));
    }

    private void writeConfig(String json) throws IOException {
        Files.writeString(configDir.resolve("linode.json"), json);
    }

    @Test
    @DisplayName("Capability results are cached for the TTL")
    void capabilityCache() {
        registryReturns("ai", service("ollama", "windows-vm", "http://vm:11434", true, "ai"));

        discovery.discoverByCapability("ai");
        discovery.discoverByCapability("ai");
        verify(registry, times(1)).discoverByCapability("ai");

        clock.advance(Duration.ofSeconds(61));
        discovery.discoverByCapability("ai");
        verify(registry, times(2)).discoverByCapability("ai");
    }

    @Test
    @DisplayName("Stale cache answers when the registry is down")
    void staleCacheOnOutage() {
        RegisteredService ollama = service("ollama", "windows-vm", "http://vm:11434", true, "ai");
        when(registry.discoverByCapability("ai"))
                .thenReturn(CompletableFuture.completedFuture(List.of(ollama)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        discovery.discoverByCapability("ai");
        clock.advance(Duration.ofMinutes(5));

        assertThat(discovery.discoverByCapability("ai")).containsExactly(ollama);
        assertThat(discovery.isRegistryAvailable()).isFalse();
    }

    @Test
    @DisplayName("Name lookups are cached and fall back to stale entries")
    void discoverByName() {
        RegisteredService dashboard = service("dashboard", "linode", "http://dash:5000", true, "web");
        when(registry.discover("dashboard"))
                .thenReturn(CompletableFuture.completedFuture(Optional.of(dashboard)))
                .thenReturn(CompletableFuture.completedFuture(Optional.empty()));

        assertThat(discovery.discover("dashboard")).contains(dashboard);
        assertThat(discovery.discover("dashboard")).contains(dashboard);
        verify(registry, times(1)).discover("dashboard");

        clock.advance(Duration.ofSeconds(90));
        assertThat(discovery.discover("dashboard")).contains(dashboard);
        assertThat(discovery.isRegistryAvailable()).isTrue();
    }

    @Test
    @DisplayName("Preferred environment wins among healthy providers")
    void preferEnvironment() {
        registryReturns("ai",
                service("ollama-home", "ubuntu-home", "http://home:11434", true, "ai"),
                service("ollama-vm", "windows-vm", "http://vm:11434", true, "ai"));

        assertThat(discovery.getEndpointWithFallback("ai", "windows-vm", false))
                .contains(new EndpointResolution("http://vm:11434", EndpointSource.REGISTRY));
        assertThat(discovery.getEndpointWithFallback("ai"))
                .contains(new EndpointResolution("http://home:11434", EndpointSource.REGISTRY));
    }

    @Test
    @DisplayName("Unhealthy-only providers are still used before fallbacks")
    void unhealthyProviderBeatsFallbacks() {
        registryReturns("comfyui", service("comfy", "windows-vm", "http://vm:8188", false, "comfyui"));

        assertThat(discovery.getEndpointWithFallback("comfyui"))
                .contains(new EndpointResolution("http://vm:8188", EndpointSource.REGISTRY));
    }

    @Test
    @DisplayName("Failed probe moves on to the environment config file")
    void probeFallsToConfigFile() throws IOException {
        registryReturns("ollama", service("ollama", "windows-vm", "http://vm:11434", true, "ollama"));
        env.put("VM_IP", "100.64.0.9");
        writeConfig("""
                {"environment":"linode","peers":{
                  "windows-vm":{"endpoint":"http://${VM_IP}:11434","capabilities":["ollama"],"requiresVpn":true}
                }}
                """);
        healthyEndpoints.add("http://100.64.0.9:11434");

        assertThat(discovery.getEndpointWithFallback("ollama", null, true))
                .contains(new EndpointResolution("http://100.64.0.9:11434", EndpointSource.CONFIG));
    }

    @Test
    @DisplayName("Environment variables are used when nothing is registered or configured")
    void environmentFallback() {
        registryReturns("ai");
        env.put("WINDOWS_VM_TAILSCALE_IP", "100.64.0.5");

        assertThat(discovery.getEndpointWithFallback("ai"))
                .contains(new EndpointResolution("http://100.64.0.5:9765", EndpointSource.ENV));
    }

    @Test
    @DisplayName("Static localhost defaults come last and are not probed")
    void staticDefaults() {
        registryReturns("stable-diffusion");
        registryReturns("telemetry");

        assertThat(discovery.getEndpointWithFallback("stable-diffusion", null, true))
                .contains(new EndpointResolution("http://localhost:7860", EndpointSource.CONFIG));
        assertThat(discovery.getEndpointWithFallback("telemetry")).isEmpty();
    }

    @Test
    @DisplayName("Best endpoint prefers the freshest healthy provider")
    void bestEndpoint() {
        RegisteredService older = new RegisteredService("a", "linode", "http://a:1", Set.of("web"),
                NOW.minusSeconds(30), true, Map.of());
        RegisteredService newer = new RegisteredService("b", "linode", "http://b:1", Set.of("web"),
                NOW.minusSeconds(5), true, Map.of());
        registryReturns("web", older, newer);

        assertThat(discovery.getBestEndpoint("web")).contains("http://b:1");
    }

    @Test
    @DisplayName("AI discovery merges capabilities without duplicates")
    void aiServices() {
        RegisteredService vm = service("ollama-vm", "windows-vm", "http://vm:11434", true, "ai", "ollama");
        registryReturns("ai", vm);
        registryReturns("ollama", vm);
        registryReturns("stable-diffusion", service("sd", "windows-vm", "http://vm:7860", true, "stable-diffusion"));
        registryReturns("comfyui");

        assertThat(discovery.discoverAIServices()).extracting(RegisteredService::name).containsExactly("ollama-vm", "sd");
    }

    @Test
    @DisplayName("Wake-on-LAN relay is synthesised from HOME_SSH_HOST")
    void wakeOnLanRelay() {
        registryReturns("wol");
        env.put("HOME_SSH_HOST", "100.64.0.7");

        assertThat(discovery.discoverWakeOnLanRelay()).hasValueSatisfying(relay -> {
            assertThat(relay.name()).isEqualTo("home");
            assertThat(relay.environment()).isEqualTo("ubuntu-home");
            assertThat(relay.endpoint()).isEqualTo("ssh://100.64.0.7:22");
            assertThat(relay.capabilities()).contains("wol");
        });
    }

    @Test
    @DisplayName("Windows agent endpoint is split into host and port")
    void windowsAgentEndpoint() {
        registryReturns("ai", service("agent", "windows-vm", "http://100.64.0.5:9800/api", true, "ai"));

        assertThat(discovery.getWindowsAgentEndpoint()).contains(EndpointAddress.http("100.64.0.5", 9800));
    }

    @Test
    @DisplayName("Clearing the cache forces a registry round trip")
    void clearCache() {
        registryReturns("web", service("web", "linode", "http://a:1", true, "web"));

        discovery.discoverByCapability("web");
        discovery.clearCache();
        discovery.discoverByCapability("web");

        verify(registry, times(2)).discoverByCapability("web");
    }

    @Test
    @DisplayName("Listeners hear additions and endpoint changes until unsubscribed")
    void changeListeners() {
        List<String> events = new ArrayList<>();
        Runnable unsubscribe = discovery.onServiceChange((service, change) -> events.add(change + ":" + service.endpoint()));
        when(registry.discoverByCapability("web"))
                .thenReturn(CompletableFuture.completedFuture(List.of(service("web", "linode", "http://a:1", true, "web"))))
                .thenReturn(CompletableFuture.completedFuture(List.of(service("web", "linode", "http://b:1", true, "web"))));

        discovery.discoverByCapability("web");
        clock.advance(Duration.ofSeconds(61));
        discovery.discoverByCapability("web");
        unsubscribe.run();
        discovery.notifyChange(service("web", "linode", "http://b:1", true), ServiceChangeListener.Change.REMOVED);

        assertThat(events).containsExactly("ADDED:http://a:1", "UPDATED:http://b:1");
    }
}
