package sh.nebula.registry.peer;

/**
 * Tier that produced an endpoint.
 */
public enum EndpointSource {
    REGISTRY,
    CACHE,
    CONFIG,
    ENV
}
