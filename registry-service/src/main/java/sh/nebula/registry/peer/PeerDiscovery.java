package sh.nebula.registry.peer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.nebula.api.discovery.Environments;
import sh.nebula.api.discovery.RegisteredService;
import sh.nebula.api.discovery.ServiceRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Endpoint lookup for callers that need an answer even when the registry is down.
 * Tiers, in order: registry (local store, then remote API), in-process cache,
 * environment config file, environment variables, localhost defaults.
 * <p>
 * Calls block on the registry; use from worker threads.
 */
public class PeerDiscovery {
    private static final Logger LOGGER = LoggerFactory.getLogger(PeerDiscovery.class);

    public static final Duration CACHE_TTL = Duration.ofSeconds(60);
    public static final List<String> AI_CAPABILITIES = List.of("ai", "ollama", "stable-diffusion", "comfyui");
    static final Set<String> RELAY_CAPABILITIES = Set.of("wol", "ssh", "relay");

    private final ServiceRegistry registry;
    private final EnvironmentConfigLoader configLoader;
    private final FallbackEndpoints fallbackEndpoints;
    private final EndpointHealthProbe healthProbe;
    private final Clock clock;

    private final Map<String, Cached<RegisteredService>> serviceCache = new ConcurrentHashMap<>();
    private final Map<String, Cached<List<RegisteredService>>> capabilityCache = new ConcurrentHashMap<>();
    private final List<ServiceChangeListener> listeners = new CopyOnWriteArrayList<>();
    private volatile Boolean registryAvailable;

    public PeerDiscovery(ServiceRegistry registry,
                         EnvironmentConfigLoader configLoader,
                         FallbackEndpoints fallbackEndpoints,
                         EndpointHealthProbe healthProbe,
                         Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.fallbackEndpoints = Objects.requireNonNull(fallbackEndpoints, "fallbackEndpoints");
        this.healthProbe = Objects.requireNonNull(healthProbe, "healthProbe");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Fresh cache entry, else the registry, else a stale cache entry.
     */
    public Optional<RegisteredService> discover(String name) {
        Cached<RegisteredService> cached = serviceCache.get(name);
        if (cached != null && cached.isFresh(clock.instant())) {
            return Optional.of(cached.value());
        }

        Optional<RegisteredService> found = query("discover " + name, () -> registry.discover(name).join())
                .flatMap(result -> result);
        if (found.isPresent()) {
            remember(found.get());
            return found;
        }
        if (cached != null) {
            LOGGER.info("Using stale cache for {}", name);
            return Optional.of(cached.value());
        }
        return Optional.empty();
    }

    public List<RegisteredService> discoverByCapability(String capability) {
        Cached<List<RegisteredService>> cached = capabilityCache.get(capability);
        if (cached != null && cached.isFresh(clock.instant())) {
            return cached.value();
        }

        List<RegisteredService> found = query("capability " + capability,
                () -> registry.discoverByCapability(capability).join())
                .orElse(List.of());
        if (!found.isEmpty()) {
            capabilityCache.put(capability, new Cached<>(found, clock.instant()));
            found.forEach(this::remember);
            return found;
        }
        if (cached != null) {
            LOGGER.info("Using stale cache for capability {}", capability);
            return cached.value();
        }
        return List.of();
    }

    /**
     * Freshest healthy provider, else the freshest provider, else a configured fallback.
     */
    public Optional<String> getBestEndpoint(String capability) {
        List<RegisteredService> services = discoverByCapability(capability);
        Comparator<RegisteredService> newestFirst = Comparator.comparing(RegisteredService::lastSeen).reversed();

        Optional<RegisteredService> healthy = services.stream()
                .filter(RegisteredService::healthy)
                .min(newestFirst);
        if (healthy.isPresent()) {
            return Optional.ofNullable(healthy.get().endpoint());
        }
        if (!services.isEmpty()) {
            LOGGER.info("No healthy services for {}, using most recent", capability);
            return services.stream().min(newestFirst).map(RegisteredService::endpoint);
        }

        Optional<String> fallback = firstOf(configLoader.endpointsFor(capability))
                .or(() -> firstOf(fallbackEndpoints.fromEnvironment(capability)))
                .or(() -> firstOf(fallbackEndpoints.staticDefaults(capability)));
        fallback.ifPresent(endpoint -> LOGGER.info("Using fallback endpoint for {}: {}", capability, endpoint));
        return fallback;
    }

    public Optional<EndpointResolution> getEndpointWithFallback(String capability) {
        return getEndpointWithFallback(capability, null, false);
    }

    /**
     * @param preferEnvironment environment whose healthy provider wins, or null
     * @param healthCheck       probe candidates before returning them
     */
    public Optional<EndpointResolution> getEndpointWithFallback(String capability,
                                                                String preferEnvironment,
                                                                boolean healthCheck) {
        List<RegisteredService> services = discoverByCapability(capability);

        Optional<RegisteredService> selected = Optional.empty();
        if (preferEnvironment != null) {
            selected = services.stream()
                    .filter(service -> preferEnvironment.equals(service.environment()) && service.healthy())
                    .findFirst();
        }
        if (selected.isEmpty()) {
            selected = services.stream().filter(RegisteredService::healthy).findFirst();
        }
        if (selected.isEmpty() && !services.isEmpty()) {
            selected = Optional.of(services.get(0));
        }
        if (selected.isPresent() && selected.get().endpoint() != null
                && (!healthCheck || healthProbe.isHealthy(selected.get().endpoint()))) {
            return Optional.of(new EndpointResolution(selected.get().endpoint(), EndpointSource.REGISTRY));
        }

        Cached<List<RegisteredService>> cached = capabilityCache.get(capability);
        if (cached != null) {
            for (RegisteredService service : cached.value()) {
                if (service.endpoint() != null && (!healthCheck || healthProbe.isHealthy(service.endpoint()))) {
                    return Optional.of(new EndpointResolution(service.endpoint(), EndpointSource.CACHE));
                }
            }
        }

        Optional<EndpointResolution> configured = probeFirst(configLoader.endpointsFor(capability),
                EndpointSource.CONFIG, healthCheck);
        if (configured.isPresent()) {
            return configured;
        }
        Optional<EndpointResolution> fromEnv = probeFirst(fallbackEndpoints.fromEnvironment(capability),
                EndpointSource.ENV, healthCheck);
        if (fromEnv.isPresent()) {
            return fromEnv;
        }
        // localhost defaults are returned without probing
        return firstOf(fallbackEndpoints.staticDefaults(capability))
                .map(endpoint -> new EndpointResolution(endpoint, EndpointSource.CONFIG));
    }

    /**
     * Providers of any AI capability, first occurrence per name kept.
     */
    public List<RegisteredService> discoverAIServices() {
        Map<String, RegisteredService> unique = new LinkedHashMap<>();
        for (String capability : AI_CAPABILITIES) {
            for (RegisteredService service : discoverByCapability(capability)) {
                unique.putIfAbsent(service.name(), service);
            }
        }
        return new ArrayList<>(unique.values());
    }

    /**
     * A Wake-on-LAN capable peer; when none is registered, a synthetic {@code home}
     * relay built from the config file or {@code HOME_SSH_HOST}.
     */
    public Optional<RegisteredService> discoverWakeOnLanRelay() {
        List<RegisteredService> relays = discoverByCapability("wol");
        if (!relays.isEmpty()) {
            return relays.stream().filter(RegisteredService::healthy).findFirst()
                    .or(() -> Optional.of(relays.get(0)));
        }
        List<EndpointAddress> candidates = configLoader.endpointsFor("wol");
        if (candidates.isEmpty()) {
            candidates = fallbackEndpoints.fromEnvironment("wol");
        }
        return candidates.stream().findFirst().map(address -> new RegisteredService(
                "home",
                Environments.UBUNTU_HOME,
                "ssh://" + address.host() + ":" + address.port(),
                RELAY_CAPABILITIES,
                clock.instant(),
                true,
                Map.of()));
    }

    /**
     * Host and port of the AI agent, preferring the Windows VM.
     */
    public Optional<EndpointAddress> getWindowsAgentEndpoint() {
        Optional<EndpointResolution> resolved = getEndpointWithFallback("ai", Environments.WINDOWS_VM, false);
        if (resolved.isPresent()) {
            String withoutScheme = resolved.get().endpoint().replaceFirst("^https?://", "");
            String[] parts = withoutScheme.split("[:/]");
            int port = FallbackEndpoints.WINDOWS_AGENT_PORT;
            if (parts.length > 1 && parts[1].matches("\\d+")) {
                port = Integer.parseInt(parts[1]);
            }
            return Optional.of(EndpointAddress.http(parts[0], port));
        }
        List<EndpointAddress> configured = configLoader.endpointsFor("ai");
        if (!configured.isEmpty()) {
            return Optional.of(configured.get(0));
        }
        String host = fallbackEndpoints.lookup("WINDOWS_VM_TAILSCALE_IP");
        if (host == null) {
            return Optional.empty();
        }
        String port = fallbackEndpoints.lookup("WINDOWS_AGENT_PORT");
        return Optional.of(EndpointAddress.http(host,
                port != null && port.matches("\\d+") ? Integer.parseInt(port) : FallbackEndpoints.WINDOWS_AGENT_PORT));
    }

    /**
     * @return handle that removes the listener when run
     */
    public Runnable onServiceChange(ServiceChangeListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void notifyChange(RegisteredService service, ServiceChangeListener.Change change) {
        for (ServiceChangeListener listener : listeners) {
            try {
                listener.onChange(service, change);
            } catch (RuntimeException ex) {
                LOGGER.error("Service change listener failed for {}", service.name(), ex);
            }
        }
    }

    public void clearCache() {
        serviceCache.clear();
        capabilityCache.clear();
    }

    public boolean isRegistryAvailable() {
        return Boolean.TRUE.equals(registryAvailable);
    }

    private <T> Optional<T> query(String description, Supplier<T> call) {
        try {
            T result = call.get();
            registryAvailable = true;
            return Optional.ofNullable(result);
        } catch (CompletionException ex) {
            LOGGER.warn("Registry unavailable for {}", description, ex);
            registryAvailable = false;
            return Optional.empty();
        }
    }

    private void remember(RegisteredService service) {
        Cached<RegisteredService> previous = serviceCache.put(service.name(), new Cached<>(service, clock.instant()));
        if (previous == null) {
            notifyChange(service, ServiceChangeListener.Change.ADDED);
        } else if (!Objects.equals(previous.value().endpoint(), service.endpoint())
                || previous.value().healthy() != service.healthy()) {
            notifyChange(service, ServiceChangeListener.Change.UPDATED);
        }
    }

    private Optional<EndpointResolution> probeFirst(List<EndpointAddress> candidates,
                                                    EndpointSource source,
                                                    boolean healthCheck) {
        for (EndpointAddress candidate : candidates) {
            String endpoint = candidate.toUrl();
            if (!healthCheck || healthProbe.isHealthy(endpoint)) {
                return Optional.of(new EndpointResolution(endpoint, source));
            }
        }
        return Optional.empty();
    }

    private static Optional<String> firstOf(List<EndpointAddress> candidates) {
        return candidates.stream().findFirst().map(EndpointAddress::toUrl);
    }

    private record Cached<T>(T value, Instant cachedAt) {
        boolean isFresh(Instant now) {
            return Duration.between(cachedAt, now).compareTo(CACHE_TTL) < 0;
        }
    }
}
