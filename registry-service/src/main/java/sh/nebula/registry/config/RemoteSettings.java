package sh.nebula.registry.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Where the shared registry API lives and how to authenticate against it.
 */
public record RemoteSettings(String baseUrl, String token, Duration timeout) {

    public static final String DEFAULT_BASE_URL = "https://dash.evindrake.net/api/registry";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    public RemoteSettings {
        Objects.requireNonNull(baseUrl, "baseUrl");
        if (baseUrl.isBlank()) {
            throw new IllegalArgumentException("Remote registry base url must not be blank");
        }
        baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        token = token == null || token.isBlank() ? null : token;
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Remote timeout must be positive");
        }
    }

    /**
     * Configured url, then {@code NEBULA_REGISTRY_API_URL}, then {@code REGISTRY_API_URL},
     * then the public dashboard. Token falls back from {@code NEBULA_AGENT_TOKEN} to configuration.
     */
    public static RemoteSettings resolve(String configuredUrl,
                                         String configuredToken,
                                         Duration timeout,
                                         PlaceholderResolver environment) {
        String baseUrl = firstNonBlank(
                configuredUrl,
                environment.lookup("NEBULA_REGISTRY_API_URL"),
                environment.lookup("REGISTRY_API_URL"),
                DEFAULT_BASE_URL);
        String token = firstNonBlank(environment.lookup("NEBULA_AGENT_TOKEN"), configuredToken);
        return new RemoteSettings(baseUrl, token, timeout);
    }

    public boolean hasToken() {
        return token != null;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
