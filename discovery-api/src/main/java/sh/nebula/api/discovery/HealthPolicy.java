package sh.nebula.api.discovery;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Heartbeat cadence and the staleness window used to classify peers.
 * The timeout must be strictly longer than the interval so a single late
 * heartbeat never flips a live peer to unhealthy.
 */
public record HealthPolicy(Duration heartbeatInterval, Duration healthTimeout) {

    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_HEALTH_TIMEOUT = Duration.ofSeconds(90);

    public HealthPolicy {
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(healthTimeout, "healthTimeout");
        if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
            throw new IllegalArgumentException("Heartbeat interval must be positive");
        }
        if (healthTimeout.compareTo(heartbeatInterval) <= 0) {
            throw new IllegalArgumentException("Health timeout (" + healthTimeout
                    + ") must be longer than the heartbeat interval (" + heartbeatInterval + ")");
        }
    }

    public static HealthPolicy defaults() {
        return new HealthPolicy(DEFAULT_HEARTBEAT_INTERVAL, DEFAULT_HEALTH_TIMEOUT);
    }

    /**
     * @return true when the heartbeat is strictly younger than the health timeout
     */
    public boolean isHealthy(Instant lastHeartbeat, Instant now) {
        if (lastHeartbeat == null) {
            return false;
        }
        return Duration.between(lastHeartbeat, now).compareTo(healthTimeout) < 0;
    }

    /**
     * Oldest heartbeat that still counts as healthy at {@code now} (exclusive bound).
     */
    public Instant healthyCutoff(Instant now) {
        return now.minus(healthTimeout);
    }
}
