package sh.nebula.registry.config;

import sh.nebula.api.discovery.HealthPolicy;

import java.time.Duration;

/**
 * Registry-wide timing and housekeeping settings.
 *
 * @param environment explicit environment name, or null to detect it
 */
public record RegistrySettings(String environment,
                               boolean debug,
                               HealthPolicy healthPolicy,
                               boolean pruneEnabled,
                               Duration pruneInterval,
                               Duration pruneMaxAge) {

    public RegistrySettings {
        environment = environment == null || environment.isBlank() ? null : environment.trim();
        healthPolicy = healthPolicy == null ? HealthPolicy.defaults() : healthPolicy;
        pruneInterval = pruneInterval == null ? Duration.ofMinutes(60) : pruneInterval;
        pruneMaxAge = pruneMaxAge == null ? Duration.ofHours(24) : pruneMaxAge;
        if (pruneInterval.isNegative() || pruneInterval.isZero()) {
            throw new IllegalArgumentException("prune interval must be positive");
        }
        if (pruneMaxAge.isNegative() || pruneMaxAge.isZero()) {
            throw new IllegalArgumentException("prune max age must be positive");
        }
    }

    public static RegistrySettings defaults() {
        return new RegistrySettings(null, false, HealthPolicy.defaults(), true, null, null);
    }
}
