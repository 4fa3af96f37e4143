package sh.nebula.registry.peer;

import java.util.Objects;

public record EndpointResolution(String endpoint, EndpointSource source) {

    public EndpointResolution {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(source, "source");
    }
}
