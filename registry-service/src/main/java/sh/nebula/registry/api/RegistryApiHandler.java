package sh.nebula.registry.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.nebula.api.discovery.RegisteredService;
import sh.nebula.api.discovery.ServiceRegistration;
import sh.nebula.registry.client.RegistryClient;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Server half of the registry wire protocol, independent of any HTTP framework.
 * Answers from the local store only.
 * A web layer decodes the request, calls {@link #handlePost} or {@link #handleGet}
 * and writes the returned status and body.
 */
public class RegistryApiHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(RegistryApiHandler.class);

    private final RegistryClient registry;
    private final ObjectMapper objectMapper;
    private final String expectedToken;

    /**
     * @param expectedToken bearer token callers must present, or null to accept anonymous calls
     */
    public RegistryApiHandler(RegistryClient registry, ObjectMapper objectMapper, String expectedToken) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.expectedToken = expectedToken == null || expectedToken.isBlank() ? null : expectedToken;
    }

    public ApiResponse handlePost(JsonNode body, String authorizationHeader) {
        if (!authorized(authorizationHeader)) {
            return error(ApiResponse.UNAUTHORIZED, "Unauthorized");
        }
        if (body == null || !body.isObject()) {
            return error(ApiResponse.BAD_REQUEST, "Request body must be a JSON object");
        }
        String action = body.path("action").asText("");
        String name = body.path("name").asText("").trim();
        if (name.isEmpty()) {
            return error(ApiResponse.BAD_REQUEST, "Missing service name");
        }

        return switch (action) {
            case "register" -> register(name, body);
            case "heartbeat" -> result(registry.heartbeatByName(name).join());
            case "unregister" -> result(registry.unregisterByName(name).join());
            default -> error(ApiResponse.BAD_REQUEST, "Unknown action: " + action);
        };
    }

    /**
     * {@code name} returns one service, {@code capability} the healthy matches,
     * no parameter the full listing.
     */
    public ApiResponse handleGet(Map<String, String> query, String authorizationHeader) {
        if (!authorized(authorizationHeader)) {
            return error(ApiResponse.UNAUTHORIZED, "Unauthorized");
        }
        Map<String, String> params = query == null ? Map.of() : query;
        String name = params.get("name");
        if (name != null && !name.isBlank()) {
            Optional<RegisteredService> service = registry.discoverLocal(name.trim()).join();
            ObjectNode body = objectMapper.createObjectNode();
            body.put("success", service.isPresent());
            service.ifPresent(found -> body.set("service", toJson(found)));
            return new ApiResponse(ApiResponse.OK, body);
        }
        String capability = params.get("capability");
        if (capability != null && !capability.isBlank()) {
            return listing(registry.discoverLocalByCapability(capability.trim()).join());
        }
        return listing(registry.getLocalServices().join());
    }

    private ApiResponse register(String name, JsonNode body) {
        String endpoint = body.path("endpoint").asText("").trim();
        if (endpoint.isEmpty()) {
            return error(ApiResponse.BAD_REQUEST, "Missing endpoint");
        }
        Set<String> capabilities = new LinkedHashSet<>();
        body.path("capabilities").forEach(item -> capabilities.add(item.asText()));
        Map<String, Object> metadata = new LinkedHashMap<>();
        JsonNode metadataNode = body.get("metadata");
        if (metadataNode != null && metadataNode.isObject()) {
            metadataNode.fields().forEachRemaining(entry ->
                    metadata.put(entry.getKey(), objectMapper.convertValue(entry.getValue(), Object.class)));
        }
        boolean stored = registry.registerRemote(new ServiceRegistration(name, capabilities, endpoint, metadata)).join();
        if (!stored) {
            LOGGER.warn("Could not store remote registration for {}", name);
        }
        return result(stored);
    }

    private ApiResponse listing(List<RegisteredService> services) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("success", true);
        ArrayNode array = body.putArray("services");
        services.forEach(service -> array.add(toJson(service)));
        return new ApiResponse(ApiResponse.OK, body);
    }

    private ObjectNode toJson(RegisteredService service) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("serviceName", service.name());
        node.put("environment", service.environment());
        node.put("endpoint", service.endpoint());
        ArrayNode capabilities = node.putArray("capabilities");
        service.capabilities().forEach(capabilities::add);
        node.put("lastHeartbeat", service.lastSeen().toString());
        node.put("isHealthy", service.healthy());
        node.set("metadata", objectMapper.valueToTree(service.metadata()));
        return node;
    }

    private ApiResponse result(boolean success) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("success", success);
        return new ApiResponse(success ? ApiResponse.OK : ApiResponse.UNAVAILABLE, body);
    }

    private ApiResponse error(int status, String message) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("success", false);
        body.put("error", message);
        return new ApiResponse(status, body);
    }

    private boolean authorized(String header) {
        if (expectedToken == null) {
            return true;
        }
        if (header == null || !header.startsWith("Bearer ")) {
            return false;
        }
        byte[] presented = header.substring("Bearer ".length()).trim().getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(presented, expectedToken.getBytes(StandardCharsets.UTF_8));
    }
}
