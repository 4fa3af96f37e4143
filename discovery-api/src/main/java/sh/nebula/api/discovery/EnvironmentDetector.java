package sh.nebula.api.discovery;

/**
 * Resolves the deployment environment the current process runs in.
 * Implementations must be side-effect free and cheap to call repeatedly.
 */
@FunctionalInterface
public interface EnvironmentDetector {

    String detectEnvironment();

    static EnvironmentDetector fixed(String environment) {
        if (environment == null || environment.isBlank()) {
            throw new IllegalArgumentException("environment must not be blank");
        }
        return () -> environment;
    }
}
