package sh.nebula.registry.store.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.nebula.registry.store.RegistrationRecord;
import sh.nebula.registry.store.RegistrationStore;
import sh.nebula.registry.store.RegistryStoreException;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link RegistrationStore} over the {@code service_registry} table.
 */
public class PostgresRegistrationStore implements RegistrationStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresRegistrationStore.class);
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    public static final String MIGRATION_RESOURCE = "migrations/service-registry-001.sql";

    private static final String COLUMNS =
            "id, service_name, environment, endpoint, capabilities, last_heartbeat, metadata";

    private final PostgresConnectionAdapter adapter;
    private final ObjectMapper objectMapper;

    public PostgresRegistrationStore(PostgresConnectionAdapter adapter) {
        this(adapter, new ObjectMapper());
    }

    public PostgresRegistrationStore(PostgresConnectionAdapter adapter, ObjectMapper objectMapper) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Installs the registry table if it has not been applied to this database yet.
     */
    public void installSchema() {
        SchemaDefinition definition = SchemaDefinition.fromResource(
                "service-registry-001",
                "service registry table",
                PostgresRegistrationStore.class.getClassLoader(),
                MIGRATION_RESOURCE);
        SchemaInstaller.ensureSchema(adapter, definition);
    }

    @Override
    public String describe() {
        return "postgres(" + adapter.getDatabaseName() + ")";
    }

    @Override
    public RegistrationRecord upsert(String name,
                                     String environment,
                                     String endpoint,
                                     Set<String> capabilities,
                                     Map<String, Object> metadata,
                                     Instant now) {
        String sql = """
                INSERT INTO service_registry
                    (service_name, environment, endpoint, capabilities, last_heartbeat, metadata)
                VALUES (?, ?, ?, ?, ?, ?::jsonb)
                ON CONFLICT (service_name, environment) DO UPDATE SET
                    endpoint = EXCLUDED.endpoint,
                    capabilities = EXCLUDED.capabilities,
                    metadata = EXCLUDED.metadata,
                    last_heartbeat = GREATEST(service_registry.last_heartbeat, EXCLUDED.last_heartbeat)
                RETURNING %s""".formatted(COLUMNS);
        try (Connection connection = adapter.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, name);
            statement.setString(2, environment);
            statement.setString(3, endpoint);
            statement.setArray(4, connection.createArrayOf("text",
                    capabilities == null ? new String[0] : capabilities.toArray(String[]::new)));
            statement.setObject(5, toTimestamp(now));
            statement.setString(6, writeMetadata(metadata));
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    throw new RegistryStoreException("Upsert returned no row for " + name + "@" + environment);
                }
                return map(resultSet);
            }
        } catch (SQLException ex) {
            throw RegistryStoreException.operationFailed("upsert", ex);
        }
    }

    @Override
    public Optional<RegistrationRecord> findLatestByName(String name) {
        List<RegistrationRecord> rows = query("findLatestByName",
                "SELECT " + COLUMNS + " FROM service_registry WHERE service_name = ?"
                        + " ORDER BY last_heartbeat DESC LIMIT 1",
                name);
        return rows.stream().findFirst();
    }

    @Override
    public List<RegistrationRecord> findByCapabilitySince(String capability, Instant cutoff) {
        return query("findByCapabilitySince",
                "SELECT " + COLUMNS + " FROM service_registry"
                        + " WHERE last_heartbeat > ? AND capabilities @> ARRAY[?]::text[]"
                        + " ORDER BY last_heartbeat DESC",
                toTimestamp(cutoff), capability);
    }

    @Override
    public List<RegistrationRecord> findSince(Instant cutoff) {
        return query("findSince",
                "SELECT " + COLUMNS + " FROM service_registry WHERE last_heartbeat > ?"
                        + " ORDER BY last_heartbeat DESC",
                toTimestamp(cutoff));
    }

    @Override
    public List<RegistrationRecord> findByEnvironment(String environment) {
        return query("findByEnvironment",
                "SELECT " + COLUMNS + " FROM service_registry WHERE environment = ?"
                        + " ORDER BY last_heartbeat DESC",
                environment);
    }

    @Override
    public List<RegistrationRecord> findAll() {
        return query("findAll",
                "SELECT " + COLUMNS + " FROM service_registry ORDER BY last_heartbeat DESC");
    }

    @Override
    public int touch(String name, String environment, Instant now) {
        return update("touch",
                "UPDATE service_registry SET last_heartbeat = GREATEST(last_heartbeat, ?)"
                        + " WHERE service_name = ? AND environment = ?",
                toTimestamp(now), name, environment);
    }

    @Override
    public int touchByName(String name, Instant now) {
        return update("touchByName",
                "UPDATE service_registry SET last_heartbeat = GREATEST(last_heartbeat, ?) WHERE service_name = ?",
                toTimestamp(now), name);
    }

    @Override
    public int delete(String name, String environment) {
        return update("delete",
                "DELETE FROM service_registry WHERE service_name = ? AND environment = ?",
                name, environment);
    }

    @Override
    public int deleteByName(String name) {
        return update("deleteByName", "DELETE FROM service_registry WHERE service_name = ?", name);
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        return update("deleteOlderThan", "DELETE FROM service_registry WHERE last_heartbeat < ?",
                toTimestamp(cutoff));
    }

    @Override
    public void close() {
        adapter.close();
    }

    private List<RegistrationRecord> query(String operation, String sql, Object... parameters) {
        try (Connection connection = adapter.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            bind(statement, parameters);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<RegistrationRecord> rows = new ArrayList<>();
                while (resultSet.next()) {
                    rows.add(map(resultSet));
                }
                return rows;
            }
        } catch (SQLException ex) {
            throw RegistryStoreException.operationFailed(operation, ex);
        }
    }

    private int update(String operation, String sql, Object... parameters) {
        try (Connection connection = adapter.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            bind(statement, parameters);
            return statement.executeUpdate();
        } catch (SQLException ex) {
            throw RegistryStoreException.operationFailed(operation, ex);
        }
    }

    private static void bind(PreparedStatement statement, Object... parameters) throws SQLException {
        for (int i = 0; i < parameters.length; i++) {
            statement.setObject(i + 1, parameters[i]);
        }
    }

    private RegistrationRecord map(ResultSet resultSet) throws SQLException {
        Array array = resultSet.getArray("capabilities");
        Set<String> capabilities = new LinkedHashSet<>();
        if (array != null) {
            capabilities.addAll(Arrays.asList((String[]) array.getArray()));
        }
        return new RegistrationRecord(
                resultSet.getLong("id"),
                resultSet.getString("service_name"),
                resultSet.getString("environment"),
                resultSet.getString("endpoint"),
                capabilities,
                resultSet.getObject("last_heartbeat", OffsetDateTime.class).toInstant(),
                readMetadata(resultSet.getString("metadata"))
        );
    }

    private String writeMetadata(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? Map.of() : metadata);
        } catch (JsonProcessingException ex) {
            throw new RegistryStoreException("Failed to serialise registration metadata", ex);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Ignoring unreadable registration metadata: {}", ex.getOriginalMessage());
            return Map.of();
        }
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
