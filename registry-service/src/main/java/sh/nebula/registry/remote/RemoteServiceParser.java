package sh.nebula.registry.remote;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.nebula.api.discovery.Environments;
import sh.nebula.api.discovery.HealthPolicy;
import sh.nebula.api.discovery.RegisteredService;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Lenient mapping of service entries returned by the registry API. Older servers
 * send {@code name}/{@code lastSeen}; newer ones {@code serviceName}/{@code lastHeartbeat}.
 */
public final class RemoteServiceParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteServiceParser.class);
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final HealthPolicy healthPolicy;
    private final Clock clock;

    public RemoteServiceParser(ObjectMapper objectMapper, HealthPolicy healthPolicy, Clock clock) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.healthPolicy = Objects.requireNonNull(healthPolicy, "healthPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return empty when the entry has no usable name
     */
    public Optional<RegisteredService> parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        String name = text(node, "serviceName");
        if (name == null) {
            name = text(node, "name");
        }
        if (name == null) {
            LOGGER.debug("Skipping registry entry without a name: {}", node);
            return Optional.empty();
        }

        String environment = text(node, "environment");
        Instant lastSeen = timestamp(node.get("lastHeartbeat"));
        if (lastSeen == null) {
            lastSeen = timestamp(node.get("lastSeen"));
        }
        Instant now = clock.instant();
        if (lastSeen == null) {
            lastSeen = now;
        }

        JsonNode healthyNode = node.get("isHealthy");
        boolean healthy = healthyNode != null && healthyNode.isBoolean()
                ? healthyNode.booleanValue()
                : healthPolicy.isHealthy(lastSeen, now);

        return Optional.of(new RegisteredService(
                name,
                environment == null ? Environments.UNKNOWN : environment,
                text(node, "endpoint"),
                capabilities(node.get("capabilities")),
                lastSeen,
                healthy,
                metadata(node.get("metadata"))
        ));
    }

    public List<RegisteredService> parseAll(JsonNode array) {
        List<RegisteredService> services = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return services;
        }
        for (JsonNode entry : array) {
            parse(entry).ifPresent(services::add);
        }
        return services;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static Instant timestamp(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return Instant.ofEpochMilli(value.longValue());
        }
        String text = value.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ex) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(text));
            } catch (NumberFormatException ignored) {
                LOGGER.debug("Unparseable registry timestamp '{}'", text);
                return null;
            }
        }
    }

    private static Set<String> capabilities(JsonNode value) {
        Set<String> capabilities = new LinkedHashSet<>();
        if (value != null && value.isArray()) {
            value.forEach(item -> {
                if (item.isTextual() && !item.asText().isBlank()) {
                    capabilities.add(item.asText());
                }
            });
        }
        return capabilities;
    }

    private Map<String, Object> metadata(JsonNode value) {
        if (value == null || !value.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(value, METADATA_TYPE);
    }
}
