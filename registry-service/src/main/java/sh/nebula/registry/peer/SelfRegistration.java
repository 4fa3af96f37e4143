package sh.nebula.registry.peer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.nebula.api.discovery.EnvironmentDetector;
import sh.nebula.api.discovery.ServiceRegistration;
import sh.nebula.api.discovery.ServiceRegistry;
import sh.nebula.registry.config.PlaceholderResolver;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Registers the running process under an endpoint derived from its host environment.
 */
public class SelfRegistration {
    private static final Logger LOGGER = LoggerFactory.getLogger(SelfRegistration.class);

    private final ServiceRegistry registry;
    private final EnvironmentDetector environmentDetector;
    private final PlaceholderResolver environment;
    private final Clock clock;

    public SelfRegistration(ServiceRegistry registry,
                            EnvironmentDetector environmentDetector,
                            PlaceholderResolver environment,
                            Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.environmentDetector = Objects.requireNonNull(environmentDetector, "environmentDetector");
        this.environment = Objects.requireNonNull(environment, "environment");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * {@code https://<REPLIT_DEV_DOMAIN>:port} on Replit, otherwise http on
     * {@code TAILSCALE_IP}, {@code PUBLIC_HOST} or localhost.
     */
    public String endpointFor(int port) {
        String replitDomain = environment.lookup("REPLIT_DEV_DOMAIN");
        if (replitDomain != null) {
            return "https://" + replitDomain + ":" + port;
        }
        String host = environment.lookup("TAILSCALE_IP");
        if (host == null) {
            host = environment.lookup("PUBLIC_HOST");
        }
        return "http://" + (host == null ? "localhost" : host) + ":" + port;
    }

    public CompletableFuture<Boolean> register(String name,
                                               Collection<String> capabilities,
                                               int port,
                                               Map<String, Object> metadata) {
        Map<String, Object> enriched = new LinkedHashMap<>(metadata == null ? Map.of() : metadata);
        enriched.put("environment", environmentDetector.detectEnvironment());
        enriched.put("startedAt", clock.instant().toString());

        ServiceRegistration registration = new ServiceRegistration(name,
                new LinkedHashSet<>(capabilities), endpointFor(port), enriched);
        return registry.register(registration).thenApply(registered -> {
            if (registered) {
                LOGGER.info("Registered {} with capabilities: {}", name, String.join(", ", registration.capabilities()));
            }
            return registered;
        });
    }
}
