package sh.nebula.registry.client;

import java.util.Objects;

/**
 * The name and environment this process last registered under.
 */
public record RegistrationIdentity(String name, String environment) {

    public RegistrationIdentity {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(environment, "environment");
    }

    @Override
    public String toString() {
        return name + "@" + environment;
    }
}
