package sh.nebula.registry.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.nebula.api.discovery.HealthPolicy;
import sh.nebula.api.discovery.RegisteredService;
import sh.nebula.api.discovery.ServiceRegistration;
import sh.nebula.registry.config.RemoteSettings;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Client for the shared registry API used by hosts that cannot reach the database.
 * Mutations are a single POST distinguished by {@code action}; reads are GETs.
 * Every failure is logged and reported as {@code false} or an empty result.
 */
public class RemoteRegistryClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteRegistryClient.class);

    static final String ACTION_REGISTER = "register";
    static final String ACTION_UNREGISTER = "unregister";
    static final String ACTION_HEARTBEAT = "heartbeat";

    private final RemoteSettings settings;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RemoteServiceParser parser;

    public RemoteRegistryClient(RemoteSettings settings, HealthPolicy healthPolicy, Clock clock) {
        this(settings,
                HttpClient.newBuilder().connectTimeout(settings.timeout()).build(),
                new ObjectMapper().findAndRegisterModules(),
                healthPolicy,
                clock);
    }

    public RemoteRegistryClient(RemoteSettings settings,
                                HttpClient httpClient,
                                ObjectMapper objectMapper,
                                HealthPolicy healthPolicy,
                                Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.parser = new RemoteServiceParser(objectMapper, healthPolicy, clock);
    }

    public RemoteSettings settings() {
        return settings;
    }

    public boolean register(ServiceRegistration registration) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", registration.name());
        body.put("capabilities", new ArrayList<>(registration.capabilities()));
        body.put("endpoint", registration.endpoint());
        body.put("metadata", registration.metadata());
        body.put("action", ACTION_REGISTER);
        boolean success = post(ACTION_REGISTER, body);
        if (success) {
            LOGGER.info("Registered {} via remote API", registration.name());
        }
        return success;
    }

    public boolean unregister(String name) {
        boolean success = post(ACTION_UNREGISTER, Map.of("name", name, "action", ACTION_UNREGISTER));
        if (success) {
            LOGGER.info("Unregistered {} via remote API", name);
        }
        return success;
    }

    public boolean heartbeat(String name) {
        return post(ACTION_HEARTBEAT, Map.of("name", name, "action", ACTION_HEARTBEAT));
    }

    public Optional<RegisteredService> discover(String name) {
        return get("discover", "?name=" + encode(name))
                .filter(RemoteRegistryClient::succeeded)
                .flatMap(root -> parser.parse(root.get("service")));
    }

    public List<RegisteredService> discoverByCapability(String capability) {
        return get("discoverByCapability", "?capability=" + encode(capability))
                .filter(RemoteRegistryClient::succeeded)
                .map(root -> parser.parseAll(root.get("services")))
                .orElseGet(List::of);
    }

    /**
     * Full listing, including entries the server reports as unhealthy.
     */
    public List<RegisteredService> getAllServices() {
        return get("getAllServices", "")
                .filter(RemoteRegistryClient::succeeded)
                .map(root -> parser.parseAll(root.get("services")))
                .orElseGet(List::of);
    }

    public List<RegisteredService> getHealthyServices() {
        return getAllServices().stream()
                .filter(RegisteredService::healthy)
                .toList();
    }

    private boolean post(String action, Map<String, Object> body) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException ex) {
            LOGGER.error("Failed to encode remote {} request", action, ex);
            return false;
        }
        HttpRequest request = requestBuilder("")
                .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
                .build();
        return send(action, request)
                .map(RemoteRegistryClient::succeeded)
                .orElse(false);
    }

    private Optional<JsonNode> get(String operation, String query) {
        return send(operation, requestBuilder(query).GET().build());
    }

    private HttpRequest.Builder requestBuilder(String query) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(settings.baseUrl() + query))
                .timeout(settings.timeout())
                .header("Content-Type", "application/json")
                .header("Accept", "application/json");
        if (settings.hasToken()) {
            builder.header("Authorization", "Bearer " + settings.token());
        }
        return builder;
    }

    private Optional<JsonNode> send(String operation, HttpRequest request) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                LOGGER.warn("Remote registry {} failed with HTTP {}: {}", operation, response.statusCode(), response.body());
                return Optional.empty();
            }
            return Optional.of(objectMapper.readTree(response.body()));
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Remote registry {} returned malformed JSON: {}", operation, ex.getOriginalMessage());
            return Optional.empty();
        } catch (IOException ex) {
            LOGGER.warn("Remote registry {} unreachable at {}: {}", operation, settings.baseUrl(), ex.toString());
            return Optional.empty();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Remote registry {} interrupted", operation);
            return Optional.empty();
        }
    }

    private static boolean succeeded(JsonNode root) {
        JsonNode success = root.get("success");
        return success != null && success.asBoolean(false);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
