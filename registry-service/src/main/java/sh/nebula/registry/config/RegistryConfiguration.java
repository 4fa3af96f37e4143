package sh.nebula.registry.config;

import java.util.Objects;

/**
 * Root of the parsed {@code application.yml}.
 */
public record RegistryConfiguration(RegistrySettings registry,
                                    SelfSettings self,
                                    StoreSettings store,
                                    RemoteSettings remote) {

    public RegistryConfiguration {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(self, "self");
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(remote, "remote");
    }
}
