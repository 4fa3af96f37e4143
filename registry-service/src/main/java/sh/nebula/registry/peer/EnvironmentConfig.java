package sh.nebula.registry.peer;

import java.util.List;
import java.util.Map;

/**
 * Subset of {@code config/environments/<env>.json} used for peer lookup.
 */
public record EnvironmentConfig(String environment,
                                String description,
                                String registryApiUrl,
                                Map<String, PeerConfig> peers) {

    public EnvironmentConfig {
        peers = peers == null ? Map.of() : Map.copyOf(peers);
    }

    public record PeerConfig(String endpoint,
                             List<String> capabilities,
                             String vmName,
                             String macAddress,
                             Boolean requiresVpn) {

        public PeerConfig {
            capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        }

        public boolean offers(String capability) {
            return capabilities.contains(capability);
        }
    }
}
