package sh.nebula.registry.heartbeat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.nebula.api.discovery.RegistryBackend;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns the single periodic heartbeat task of a registry client.
 */
public class HeartbeatScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(HeartbeatScheduler.class);

    private final ScheduledExecutorService scheduler;
    private final Duration interval;

    private ScheduledFuture<?> heartbeatTask;
    private RegistryBackend mode = RegistryBackend.NONE;

    public HeartbeatScheduler(ScheduledExecutorService scheduler, Duration interval) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.interval = Objects.requireNonNull(interval, "interval");
    }

    /**
     * Schedules {@code beat} every interval, first run one interval from now.
     *
     * @return false when a heartbeat is already running
     */
    public synchronized boolean start(RegistryBackend mode, Runnable beat) {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(beat, "beat");
        if (heartbeatTask != null) {
            return false;
        }

        long millis = interval.toMillis();
        heartbeatTask = scheduler.scheduleAtFixedRate(() -> runBeat(beat), millis, millis, TimeUnit.MILLISECONDS);
        this.mode = mode;
        LOGGER.info("Started {} heartbeat (every {}s)", mode.name().toLowerCase(Locale.ROOT), interval.toSeconds());
        return true;
    }

    /**
     * Cancels the heartbeat. Safe to call when nothing is running.
     */
    public synchronized void stop() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
            mode = RegistryBackend.NONE;
            LOGGER.info("Stopped heartbeat");
        }
    }

    public synchronized boolean isRunning() {
        return heartbeatTask != null;
    }

    public synchronized RegistryBackend mode() {
        return mode;
    }

    public Duration interval() {
        return interval;
    }

    private void runBeat(Runnable beat) {
        try {
            beat.run();
        } catch (RuntimeException ex) {
            LOGGER.warn("Heartbeat failed", ex);
        }
    }
}
