package sh.nebula.registry;

import org.fusesource.jansi.AnsiConsole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.nebula.api.discovery.EnvironmentDetector;
import sh.nebula.registry.client.RegistryClient;
import sh.nebula.registry.config.PlaceholderResolver;
import sh.nebula.registry.config.RegistryConfigLoader;
import sh.nebula.registry.config.RegistryConfiguration;
import sh.nebula.registry.config.SelfSettings;
import sh.nebula.registry.config.StoreSettings;
import sh.nebula.registry.console.CommandRegistry;
import sh.nebula.registry.console.InteractiveConsole;
import sh.nebula.registry.console.commands.CapabilityCommand;
import sh.nebula.registry.console.commands.DiscoverCommand;
import sh.nebula.registry.console.commands.EnvironmentCommand;
import sh.nebula.registry.console.commands.HealthCommand;
import sh.nebula.registry.console.commands.HeartbeatCommand;
import sh.nebula.registry.console.commands.HelpCommand;
import sh.nebula.registry.console.commands.PeersCommand;
import sh.nebula.registry.console.commands.PruneCommand;
import sh.nebula.registry.console.commands.ResolveCommand;
import sh.nebula.registry.console.commands.ServicesCommand;
import sh.nebula.registry.console.commands.StatusCommand;
import sh.nebula.registry.console.commands.StopCommand;
import sh.nebula.registry.environment.SystemEnvironmentDetector;
import sh.nebula.registry.heartbeat.StaleRegistrationReaper;
import sh.nebula.registry.peer.EnvironmentConfigLoader;
import sh.nebula.registry.peer.FallbackEndpoints;
import sh.nebula.registry.peer.HttpEndpointHealthProbe;
import sh.nebula.registry.peer.PeerDiscovery;
import sh.nebula.registry.peer.SelfRegistration;
import sh.nebula.registry.redis.RedisManager;
import sh.nebula.registry.remote.RemoteRegistryClient;
import sh.nebula.registry.store.InMemoryRegistrationStore;
import sh.nebula.registry.store.RegistrationStore;
import sh.nebula.registry.store.RegistryStoreException;
import sh.nebula.registry.store.postgres.PostgresConnectionAdapter;
import sh.nebula.registry.store.postgres.PostgresRegistrationStore;
import sh.nebula.registry.store.redis.RedisRegistrationStore;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Standalone Nebula service registry: local store, remote fallback, self registration,
 * stale registration reaping and an operator console.
 */
public class RegistryService {
    private static final Logger LOGGER = LoggerFactory.getLogger(RegistryService.class);

    private final RegistryConfiguration config;
    private final Clock clock;
    private final PlaceholderResolver environment;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private RegistrationStore store;
    private RegistryClient client;
    private StaleRegistrationReaper reaper;
    private PeerDiscovery peerDiscovery;
    private InteractiveConsole console;
    private Instant startedAt;

    public RegistryService(RegistryConfiguration config) {
        this.config = config;
        this.clock = Clock.systemUTC();
        this.environment = PlaceholderResolver.systemEnvironment();
        this.scheduler = Executors.newScheduledThreadPool(2);
        this.workers = Executors.newFixedThreadPool(4);
    }

    public static void main(String[] args) {
        Path externalConfig = args.length > 0 ? Path.of(args[0]) : null;
        RegistryConfiguration config = new RegistryConfigLoader().load(externalConfig);
        RegistryService service = new RegistryService(config);
        service.start();
    }

    public void start() {
        AnsiConsole.systemInstall();
        applyDebugMode(config.registry().debug());
        startedAt = clock.instant();
        LOGGER.info("Starting Nebula Registry Service...");
        LOGGER.info("Debug mode: {}", config.registry().debug() ? "ENABLED" : "DISABLED");

        try {
            store = createStore(config.store());
            EnvironmentDetector detector = new SystemEnvironmentDetector(config.registry().environment());
            RemoteRegistryClient remote = new RemoteRegistryClient(config.remote(), config.registry().healthPolicy(), clock);

            client = RegistryClient.builder()
                    .store(store)
                    .remote(remote)
                    .environmentDetector(detector)
                    .healthPolicy(config.registry().healthPolicy())
                    .clock(clock)
                    .executor(workers)
                    .scheduler(scheduler)
                    .build();
            LOGGER.info("Environment: {}, local store: {}, remote registry: {}",
                    client.environment(),
                    store == null ? "none" : store.describe(),
                    config.remote().baseUrl());

            peerDiscovery = new PeerDiscovery(client,
                    new EnvironmentConfigLoader(EnvironmentConfigLoader.DEFAULT_SEARCH_DIRECTORIES, detector, environment, clock),
                    new FallbackEndpoints(environment),
                    new HttpEndpointHealthProbe(),
                    clock);

            registerSelf(detector);

            if (config.registry().pruneEnabled() && store != null) {
                reaper = new StaleRegistrationReaper(client, scheduler,
                        config.registry().pruneInterval(), config.registry().pruneMaxAge());
                reaper.start();
            }

            initializeConsole();
            Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "Registry-Shutdown"));

            LOGGER.info("Registry Service started successfully");
            shutdownLatch.await();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Registry Service interrupted");
            shutdown();
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to start Registry Service", ex);
            shutdown();
            throw ex;
        }
    }

    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        LOGGER.info("Shutting down Registry Service...");

        try {
            if (console != null) {
                console.stop();
            }
            if (client != null) {
                client.close();
            }
            if (reaper != null) {
                reaper.stop();
            }

            scheduler.shutdown();
            workers.shutdown();
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }

            if (store != null) {
                try {
                    store.close();
                } catch (Exception ex) {
                    LOGGER.warn("Failed to close local store", ex);
                }
            }
            LOGGER.info("Registry Service shut down successfully");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while shutting down", ex);
        } finally {
            shutdownLatch.countDown();
            AnsiConsole.systemUninstall();
        }
    }

    /**
     * Pool and connection failures surface as runtime exceptions from HikariCP and Lettuce.
     * A store that cannot be opened leaves the registry running remote-only.
     */
    private RegistrationStore createStore(StoreSettings settings) {
        try {
            return switch (settings.type()) {
                case POSTGRES -> {
                    PostgresRegistrationStore postgres =
                            new PostgresRegistrationStore(new PostgresConnectionAdapter(settings.postgres()));
                    try {
                        postgres.installSchema();
                    } catch (RegistryStoreException ex) {
                        postgres.close();
                        throw ex;
                    }
                    yield postgres;
                }
                case REDIS -> new RedisRegistrationStore(new RedisManager(settings.redis()));
                case MEMORY -> new InMemoryRegistrationStore();
                case NONE -> null;
            };
        } catch (RuntimeException ex) {
            LOGGER.warn("Local {} store unavailable, falling back to the remote registry only", settings.type(), ex);
            return null;
        }
    }

    private void registerSelf(EnvironmentDetector detector) {
        SelfSettings self = config.self();
        if (!self.enabled()) {
            return;
        }
        SelfRegistration registration = new SelfRegistration(client, detector, environment, clock);
        registration.register(self.name(), self.capabilities(), self.port(), self.metadata())
                .thenAccept(registered -> {
                    if (!registered) {
                        LOGGER.warn("Self registration of {} failed, continuing without it", self.name());
                    }
                });
    }

    private void initializeConsole() {
        PrintStream out = System.out;
        CommandRegistry commands = new CommandRegistry(out);
        commands.register(new HelpCommand(commands, out));
        commands.register(new ServicesCommand(client, clock, out));
        commands.register(new PeersCommand(client, clock, out));
        commands.register(new DiscoverCommand(client, clock, out));
        commands.register(new CapabilityCommand(client, clock, out));
        commands.register(new EnvironmentCommand(client, clock, out));
        commands.register(new HealthCommand(client, out));
        commands.register(new PruneCommand(client, out));
        commands.register(new HeartbeatCommand(client, out));
        commands.register(new ResolveCommand(peerDiscovery, out));
        commands.register(new StatusCommand(client, startedAt, clock, out));
        commands.register(new StopCommand(() -> {
            shutdown();
            System.exit(0);
        }, out));

        console = new InteractiveConsole(commands, System.in, out);
        console.start();
    }

    private static void applyDebugMode(boolean debug) {
        ch.qos.logback.classic.Logger rootLogger =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.setLevel(debug ? ch.qos.logback.classic.Level.DEBUG : ch.qos.logback.classic.Level.INFO);
    }
}
