package sh.nebula.registry.heartbeat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.nebula.api.discovery.ServiceRegistry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically deletes registrations that stopped heartbeating long ago.
 */
public class StaleRegistrationReaper {
    private static final Logger LOGGER = LoggerFactory.getLogger(StaleRegistrationReaper.class);

    private final ServiceRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private final Duration maxAge;

    private ScheduledFuture<?> reaperTask;

    public StaleRegistrationReaper(ServiceRegistry registry,
                                   ScheduledExecutorService scheduler,
                                   Duration interval,
                                   Duration maxAge) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.maxAge = Objects.requireNonNull(maxAge, "maxAge");
    }

    public synchronized void start() {
        if (reaperTask != null) {
            return;
        }
        reaperTask = scheduler.scheduleWithFixedDelay(this::reap,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        LOGGER.info("Stale registration reaper started (every {}m, max age {}h)",
                interval.toMinutes(), maxAge.toHours());
    }

    public synchronized void stop() {
        if (reaperTask != null) {
            reaperTask.cancel(false);
            reaperTask = null;
            LOGGER.info("Stale registration reaper stopped");
        }
    }

    void reap() {
        try {
            int removed = registry.pruneStaleServices(maxAge).join();
            if (removed > 0) {
                LOGGER.info("Reaped {} stale registrations", removed);
            }
        } catch (RuntimeException ex) {
            LOGGER.warn("Stale registration sweep failed", ex);
        }
    }
}
