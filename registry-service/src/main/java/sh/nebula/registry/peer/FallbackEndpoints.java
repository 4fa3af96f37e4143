package sh.nebula.registry.peer;

import sh.nebula.registry.config.PlaceholderResolver;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Last-resort endpoints from well-known environment variables and localhost defaults.
 */
public class FallbackEndpoints {

    public static final int WINDOWS_AGENT_PORT = 9765;

    private static final Map<String, Integer> SERVICE_PORTS = Map.of(
            "ai", WINDOWS_AGENT_PORT,
            "ollama", 11434,
            "stable-diffusion", 7860,
            "comfyui", 8188,
            "wol", 22,
            "ssh", 22,
            "ssh-gateway", 22,
            "dashboard", 5000,
            "registry", 5000);

    private static final List<String> STATIC_CAPABILITIES =
            List.of("ai", "ollama", "stable-diffusion", "comfyui", "wol", "dashboard");

    private final PlaceholderResolver environment;

    public FallbackEndpoints(PlaceholderResolver environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    /**
     * Endpoint built from {@code WINDOWS_VM_TAILSCALE_IP}, {@code HOME_SSH_HOST} or
     * {@code DASHBOARD_HOST}, depending on the capability.
     */
    public List<EndpointAddress> fromEnvironment(String capability) {
        String variable = switch (capability) {
            case "ai", "ollama", "stable-diffusion", "comfyui" -> "WINDOWS_VM_TAILSCALE_IP";
            case "wol", "ssh", "ssh-gateway" -> "HOME_SSH_HOST";
            case "dashboard", "registry" -> "DASHBOARD_HOST";
            default -> null;
        };
        if (variable == null) {
            return List.of();
        }
        String host = environment.lookup(variable);
        return host == null ? List.of() : List.of(EndpointAddress.http(host, SERVICE_PORTS.get(capability)));
    }

    public List<EndpointAddress> staticDefaults(String capability) {
        if (!STATIC_CAPABILITIES.contains(capability)) {
            return List.of();
        }
        return List.of(EndpointAddress.http("localhost", SERVICE_PORTS.get(capability)));
    }

    public String lookup(String variable) {
        return environment.lookup(variable);
    }
}
