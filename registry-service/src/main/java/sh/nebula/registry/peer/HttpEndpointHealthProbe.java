package sh.nebula.registry.peer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@code GET <endpoint>/api/health}, healthy on any 2xx within the timeout.
 */
public class HttpEndpointHealthProbe implements EndpointHealthProbe {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpEndpointHealthProbe.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    static final String HEALTH_PATH = "/api/health";

    private final HttpClient httpClient;
    private final Duration timeout;

    public HttpEndpointHealthProbe() {
        this(DEFAULT_TIMEOUT);
    }

    public HttpEndpointHealthProbe(Duration timeout) {
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    @Override
    public boolean isHealthy(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            return false;
        }
        String base = endpoint.contains("://") ? endpoint : "http://" + endpoint;
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(base + HEALTH_PATH))
                    .timeout(timeout)
                    .GET()
                    .build();
            int status = httpClient.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
            return status >= 200 && status < 300;
        } catch (IOException | IllegalArgumentException ex) {
            LOGGER.debug("Health probe of {} failed: {}", endpoint, ex.toString());
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
