package sh.nebula.registry.peer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.nebula.api.discovery.EnvironmentDetector;
import sh.nebula.registry.config.PlaceholderResolver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads the per-environment peer file from the first search directory that has one.
 * The result, including "no file", is cached for five minutes.
 */
public class EnvironmentConfigLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(EnvironmentConfigLoader.class);

    static final Duration CACHE_TTL = Duration.ofMinutes(5);

    public static final List<Path> DEFAULT_SEARCH_DIRECTORIES = List.of(
            Path.of("config/environments"),
            Path.of("../../config/environments"),
            Path.of("/opt/homelab/NebulaCommand/config/environments"),
            Path.of("/opt/nebula/config/environments"));

    private final List<Path> searchDirectories;
    private final EnvironmentDetector environmentDetector;
    private final PlaceholderResolver placeholders;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Optional<EnvironmentConfig> cached;
    private Instant loadedAt;

    public EnvironmentConfigLoader(List<Path> searchDirectories,
                                   EnvironmentDetector environmentDetector,
                                   PlaceholderResolver placeholders,
                                   Clock clock) {
        this.searchDirectories = List.copyOf(searchDirectories);
        this.environmentDetector = Objects.requireNonNull(environmentDetector, "environmentDetector");
        this.placeholders = Objects.requireNonNull(placeholders, "placeholders");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized Optional<EnvironmentConfig> load() {
        Instant now = clock.instant();
        if (cached != null && Duration.between(loadedAt, now).compareTo(CACHE_TTL) < 0) {
            return cached;
        }
        cached = read(environmentDetector.detectEnvironment());
        loadedAt = now;
        return cached;
    }

    /**
     * Endpoints of configured peers offering {@code capability}, with placeholders expanded.
     */
    public List<EndpointAddress> endpointsFor(String capability) {
        List<EndpointAddress> endpoints = new ArrayList<>();
        load().ifPresent(config -> config.peers().values().forEach(peer -> {
            if (peer.offers(capability) && peer.endpoint() != null) {
                EndpointAddress.parse(placeholders.resolve(peer.endpoint())).ifPresent(endpoints::add);
            }
        }));
        return endpoints;
    }

    public synchronized void invalidate() {
        cached = null;
    }

    private Optional<EnvironmentConfig> read(String environment) {
        for (Path directory : searchDirectories) {
            Path file = directory.resolve(environment + ".json");
            if (!Files.isRegularFile(file)) {
                continue;
            }
            try {
                EnvironmentConfig config = objectMapper.readValue(file.toFile(), EnvironmentConfig.class);
                LOGGER.info("Loaded environment config from {}", file);
                return Optional.of(config);
            } catch (IOException ex) {
                LOGGER.warn("Failed to load environment config from {}", file, ex);
            }
        }
        LOGGER.warn("No environment config found for {}", environment);
        return Optional.empty();
    }
}
