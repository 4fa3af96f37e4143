package sh.nebula.registry.peer;

/**
 * Checks whether an endpoint answers its health route.
 */
@FunctionalInterface
public interface EndpointHealthProbe {

    boolean isHealthy(String endpoint);
}
