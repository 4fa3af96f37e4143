package sh.nebula.registry.client;

import sh.nebula.api.discovery.RegistryBackend;

import java.util.Objects;

/**
 * Value produced by a tiered lookup together with the backend that answered.
 */
public record Resolution<T>(T value, RegistryBackend backend) {

    public Resolution {
        Objects.requireNonNull(backend, "backend");
    }

    public static <T> Resolution<T> none(T empty) {
        return new Resolution<>(empty, RegistryBackend.NONE);
    }

    public boolean answered() {
        return backend != RegistryBackend.NONE;
    }
}
