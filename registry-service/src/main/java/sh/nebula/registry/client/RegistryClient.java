package sh.nebula.registry.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.nebula.api.discovery.EnvironmentDetector;
import sh.nebula.api.discovery.Environments;
import sh.nebula.api.discovery.HealthPolicy;
import sh.nebula.api.discovery.RegisteredService;
import sh.nebula.api.discovery.RegistryBackend;
import sh.nebula.api.discovery.ServiceRegistration;
import sh.nebula.api.discovery.ServiceRegistry;
import sh.nebula.registry.heartbeat.HeartbeatScheduler;
import sh.nebula.registry.remote.RemoteRegistryClient;
import sh.nebula.registry.store.RegistrationRecord;
import sh.nebula.registry.store.RegistrationStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * {@link ServiceRegistry} that asks the local store first and the shared registry API
 * second. One instance represents one registering process: it remembers the identity
 * it registered and runs at most one heartbeat for it.
 */
public class RegistryClient implements ServiceRegistry, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(RegistryClient.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(2);

    private final TieredResolver resolver;
    private final RemoteRegistryClient remote;
    private final HeartbeatScheduler heartbeatScheduler;
    private final EnvironmentDetector environmentDetector;
    private final HealthPolicy healthPolicy;
    private final Clock clock;
    private final Executor executor;

    private volatile RegistrationIdentity identity;
    private volatile RegistryBackend activeBackend = RegistryBackend.NONE;

    private RegistryClient(Builder builder) {
        this.resolver = new TieredResolver(builder.store);
        this.remote = Objects.requireNonNull(builder.remote, "remote");
        this.environmentDetector = Objects.requireNonNull(builder.environmentDetector, "environmentDetector");
        this.healthPolicy = builder.healthPolicy;
        this.clock = builder.clock;
        this.executor = Objects.requireNonNull(builder.executor, "executor");
        this.heartbeatScheduler = new HeartbeatScheduler(
                Objects.requireNonNull(builder.scheduler, "scheduler"),
                healthPolicy.heartbeatInterval());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public CompletableFuture<Boolean> register(ServiceRegistration registration) {
        Objects.requireNonNull(registration, "registration");
        return async(() -> {
            String environment = environmentDetector.detectEnvironment();
            Resolution<Boolean> result = resolver.resolve("register",
                    store -> {
                        store.upsert(registration.name(), environment, registration.endpoint(),
                                registration.capabilities(), registration.metadata(), now());
                        return true;
                    },
                    () -> remote.register(registration.withMetadata("environment", environment)),
                    FallbackPolicy.localAuthoritative(false));

            if (!Boolean.TRUE.equals(result.value())) {
                LOGGER.error("Registration of {}@{} failed on every backend", registration.name(), environment);
                return false;
            }
            identity = new RegistrationIdentity(registration.name(), environment);
            activeBackend = result.backend();
            LOGGER.info("Registered {}@{} via {} backend", registration.name(), environment,
                    result.backend().name().toLowerCase(Locale.ROOT));
            startHeartbeat(result.backend());
            return true;
        });
    }

    @Override
    public CompletableFuture<Boolean> unregister() {
        return unregister(null, null);
    }

    @Override
    public CompletableFuture<Boolean> unregister(String name) {
        return unregister(name, null);
    }

    @Override
    public CompletableFuture<Boolean> unregister(String name, String environment) {
        RegistrationIdentity current = identity;
        String target = name != null ? name : current == null ? null : current.name();
        if (target == null) {
            LOGGER.debug("Nothing to unregister: no service has been registered");
            return CompletableFuture.completedFuture(false);
        }

        // any unregister ends this process's own heartbeat, even one naming another service
        heartbeatScheduler.stop();
        return async(() -> {
            String targetEnvironment = environment != null ? environment
                    : current != null && current.name().equals(target) ? current.environment()
                    : environmentDetector.detectEnvironment();
            Resolution<Boolean> result = resolver.resolve("unregister",
                    store -> {
                        store.delete(target, targetEnvironment);
                        return true;
                    },
                    () -> remote.unregister(target),
                    FallbackPolicy.localAuthoritative(false));

            boolean success = Boolean.TRUE.equals(result.value());
            if (success) {
                LOGGER.info("Unregistered {}@{}", target, targetEnvironment);
                RegistrationIdentity latest = identity;
                if (latest != null && latest.name().equals(target) && latest.environment().equals(targetEnvironment)) {
                    identity = null;
                    activeBackend = RegistryBackend.NONE;
                }
            }
            return success;
        });
    }

    /**
     * Deletes the name in every environment. Local store only.
     */
    public CompletableFuture<Boolean> unregisterByName(String name) {
        if (name == null || name.isBlank()) {
            return CompletableFuture.completedFuture(false);
        }
        return async(() -> resolver.localOnly("unregisterByName", store -> {
            int removed = store.deleteByName(name);
            LOGGER.info("Unregistered {} ({} registrations)", name, removed);
            return true;
        }, false).value());
    }

    @Override
    public CompletableFuture<Optional<RegisteredService>> discover(String name) {
        Objects.requireNonNull(name, "name");
        return async(() -> resolver.resolve("discover",
                store -> {
                    Instant now = now();
                    return store.findLatestByName(name).map(record -> record.toService(healthPolicy, now));
                },
                () -> remote.discover(name),
                FallbackPolicy.fallThroughWhenEmpty(Optional.<RegisteredService>empty(), Optional::isEmpty)).value());
    }

    @Override
    public CompletableFuture<List<RegisteredService>> discoverByCapability(String capability) {
        Objects.requireNonNull(capability, "capability");
        return async(() -> resolver.resolve("discoverByCapability",
                store -> healthy(store.findByCapabilitySince(capability, healthPolicy.healthyCutoff(now()))),
                () -> remote.discoverByCapability(capability),
                FallbackPolicy.fallThroughWhenEmpty(List.<RegisteredService>of(), List::isEmpty)).value());
    }

    @Override
    public CompletableFuture<List<RegisteredService>> discoverByEnvironment(String environment) {
        Objects.requireNonNull(environment, "environment");
        return async(() -> resolver.localOnly("discoverByEnvironment",
                store -> classify(store.findByEnvironment(environment)),
                List.<RegisteredService>of()).value());
    }

    @Override
    public CompletableFuture<Boolean> heartbeat() {
        RegistrationIdentity current = identity;
        if (current == null) {
            return CompletableFuture.completedFuture(false);
        }
        return async(() -> sendHeartbeat(current));
    }

    @Override
    public CompletableFuture<List<RegisteredService>> getHealthyPeers() {
        return async(() -> resolver.resolve("getHealthyPeers",
                store -> healthy(store.findSince(healthPolicy.healthyCutoff(now()))),
                remote::getHealthyServices,
                FallbackPolicy.fallThroughWhenEmpty(List.<RegisteredService>of(), List::isEmpty)).value());
    }

    @Override
    public CompletableFuture<List<RegisteredService>> getAllServices() {
        return async(() -> resolver.resolve("getAllServices",
                store -> classify(store.findAll()),
                remote::getAllServices,
                FallbackPolicy.localAuthoritative(List.<RegisteredService>of())).value());
    }

    @Override
    public CompletableFuture<Integer> pruneStaleServices(Duration maxAge) {
        Objects.requireNonNull(maxAge, "maxAge");
        if (maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must not be negative");
        }
        return async(() -> resolver.localOnly("pruneStaleServices", store -> {
            int removed = store.deleteOlderThan(now().minus(maxAge));
            LOGGER.info("Pruned {} registrations older than {}", removed, maxAge);
            return removed;
        }, 0).value());
    }

    /**
     * Stores a registration received from another host through the registry API.
     * The environment comes from {@code metadata.environment}.
     */
    public CompletableFuture<Boolean> registerRemote(ServiceRegistration registration) {
        Objects.requireNonNull(registration, "registration");
        String environment = Optional.ofNullable(registration.metadataEnvironment()).orElse(Environments.UNKNOWN);
        return async(() -> resolver.localOnly("registerRemote", store -> {
            store.upsert(registration.name(), environment, registration.endpoint(),
                    registration.capabilities(), registration.metadata(), now());
            LOGGER.info("Remote registration for {}@{}", registration.name(), environment);
            return true;
        }, false).value());
    }

    /**
     * Refreshes every environment's registration for {@code name}. Local store only.
     */
    public CompletableFuture<Boolean> heartbeatByName(String name) {
        if (name == null || name.isBlank()) {
            return CompletableFuture.completedFuture(false);
        }
        return async(() -> resolver.localOnly("heartbeatByName", store -> {
            store.touchByName(name, now());
            return true;
        }, false).value());
    }

    /**
     * Local-store read of one service, used when answering the registry API so a
     * server never forwards a query to itself.
     */
    public CompletableFuture<Optional<RegisteredService>> discoverLocal(String name) {
        return async(() -> resolver.localOnly("discoverLocal",
                store -> {
                    Instant now = now();
                    return store.findLatestByName(name).map(record -> record.toService(healthPolicy, now));
                },
                Optional.<RegisteredService>empty()).value());
    }

    public CompletableFuture<List<RegisteredService>> discoverLocalByCapability(String capability) {
        return async(() -> resolver.localOnly("discoverLocalByCapability",
                store -> healthy(store.findByCapabilitySince(capability, healthPolicy.healthyCutoff(now()))),
                List.<RegisteredService>of()).value());
    }

    public CompletableFuture<List<RegisteredService>> getLocalServices() {
        return async(() -> resolver.localOnly("getLocalServices",
                store -> classify(store.findAll()),
                List.<RegisteredService>of()).value());
    }

    public Optional<RegistrationIdentity> currentIdentity() {
        return Optional.ofNullable(identity);
    }

    public RegistryBackend activeBackend() {
        return activeBackend;
    }

    public boolean hasLocalStore() {
        return resolver.hasLocalStore();
    }

    public Optional<RegistrationStore> localStore() {
        return resolver.store();
    }

    public RemoteRegistryClient remote() {
        return remote;
    }

    public HeartbeatScheduler heartbeatScheduler() {
        return heartbeatScheduler;
    }

    public HealthPolicy healthPolicy() {
        return healthPolicy;
    }

    public String environment() {
        return environmentDetector.detectEnvironment();
    }

    /**
     * Best-effort unregister of the current identity, then stops the heartbeat.
     * Never throws; a failed unregister is left to the health timeout.
     */
    @Override
    public void close() {
        RegistrationIdentity current = identity;
        if (current != null) {
            long waitMillis = remote.settings().timeout().plus(SHUTDOWN_GRACE).toMillis();
            try {
                boolean removed = unregister().get(waitMillis, TimeUnit.MILLISECONDS);
                if (!removed) {
                    LOGGER.warn("Could not unregister {} during shutdown", current);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                LOGGER.warn("Interrupted while unregistering {}", current);
            } catch (ExecutionException | TimeoutException ex) {
                LOGGER.warn("Unregister of {} did not complete during shutdown", current, ex);
            }
        }
        heartbeatScheduler.stop();
    }

    private boolean sendHeartbeat(RegistrationIdentity current) {
        Resolution<Boolean> result = resolver.resolve("heartbeat",
                store -> {
                    store.touch(current.name(), current.environment(), now());
                    return true;
                },
                () -> remote.heartbeat(current.name()),
                FallbackPolicy.localAuthoritative(false));
        LOGGER.debug("Heartbeat for {} via {}: {}", current, result.backend(), result.value());
        return Boolean.TRUE.equals(result.value());
    }

    private void startHeartbeat(RegistryBackend backend) {
        Runnable beat = backend == RegistryBackend.LOCAL
                ? () -> {
                    RegistrationIdentity current = identity;
                    if (current != null) {
                        sendHeartbeat(current);
                    }
                }
                : () -> {
                    RegistrationIdentity current = identity;
                    if (current != null) {
                        remote.heartbeat(current.name());
                    }
                };
        if (!heartbeatScheduler.start(backend, beat)) {
            LOGGER.debug("Heartbeat already running, not starting another");
        }
    }

    private List<RegisteredService> healthy(List<RegistrationRecord> records) {
        return records.stream().map(record -> record.toService(true)).toList();
    }

    private List<RegisteredService> classify(List<RegistrationRecord> records) {
        Instant now = now();
        return records.stream().map(record -> record.toService(healthPolicy, now)).toList();
    }

    private Instant now() {
        return clock.instant();
    }

    private <T> CompletableFuture<T> async(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, executor);
    }

    public static final class Builder {
        private RegistrationStore store;
        private RemoteRegistryClient remote;
        private EnvironmentDetector environmentDetector;
        private HealthPolicy healthPolicy = HealthPolicy.defaults();
        private Clock clock = Clock.systemUTC();
        private Executor executor;
        private ScheduledExecutorService scheduler;

        private Builder() {
        }

        /**
         * Local store, or null to always use the remote registry.
         */
        public Builder store(RegistrationStore store) {
            this.store = store;
            return this;
        }

        public Builder remote(RemoteRegistryClient remote) {
            this.remote = remote;
            return this;
        }

        public Builder environmentDetector(EnvironmentDetector environmentDetector) {
            this.environmentDetector = environmentDetector;
            return this;
        }

        public Builder healthPolicy(HealthPolicy healthPolicy) {
            this.healthPolicy = Objects.requireNonNull(healthPolicy, "healthPolicy");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Executor for blocking store and HTTP calls.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public RegistryClient build() {
            return new RegistryClient(this);
        }
    }
}
