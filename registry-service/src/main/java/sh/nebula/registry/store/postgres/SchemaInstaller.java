package sh.nebula.registry.store.postgres;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.nebula.registry.store.RegistryStoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies each {@link SchemaDefinition} once and records it in a metadata table.
 * A changed checksum for an applied schema is reported, never re-applied.
 */
public final class SchemaInstaller {

    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaInstaller.class);
    static final String METADATA_TABLE = "nebula_schema_metadata";

    private SchemaInstaller() {
    }

    /**
     * @return true when the schema was installed by this call
     */
    public static boolean ensureSchema(PostgresConnectionAdapter adapter, SchemaDefinition definition) {
        Objects.requireNonNull(adapter, "adapter");
        Objects.requireNonNull(definition, "definition");

        try (Connection connection = adapter.getConnection()) {
            connection.setAutoCommit(false);
            try {
                ensureMetadataTable(connection);
                Optional<String> applied = findChecksum(connection, definition.id());
                if (applied.isPresent()) {
                    if (!applied.get().equals(definition.checksum())) {
                        LOGGER.error("Schema '{}' has changed since it was applied; run a manual migration",
                                definition.id());
                    }
                    connection.rollback();
                    return false;
                }

                for (String sql : SqlStatementSplitter.split(definition.sql())) {
                    try (Statement statement = connection.createStatement()) {
                        statement.execute(sql);
                    }
                }
                insertRecord(connection, definition);
                connection.commit();
                LOGGER.info("Installed schema '{}'{}", definition.id(),
                        definition.description().isBlank() ? "" : " (" + definition.description() + ")");
                return true;
            } catch (SQLException ex) {
                connection.rollback();
                throw ex;
            }
        } catch (SQLException ex) {
            throw new RegistryStoreException("Failed to ensure schema '" + definition.id() + "'", ex);
        }
    }

    private static void ensureMetadataTable(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        schema_id VARCHAR(200) PRIMARY KEY,
                        checksum VARCHAR(128) NOT NULL,
                        applied_at TIMESTAMPTZ DEFAULT NOW()
                    )""".formatted(METADATA_TABLE));
        }
    }

    private static Optional<String> findChecksum(Connection connection, String schemaId) throws SQLException {
        String sql = "SELECT checksum FROM " + METADATA_TABLE + " WHERE schema_id = ?";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, schemaId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(resultSet.getString(1)) : Optional.empty();
            }
        }
    }

    private static void insertRecord(Connection connection, SchemaDefinition definition) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO " + METADATA_TABLE + " (schema_id, checksum) VALUES (?, ?)")) {
            statement.setString(1, definition.id());
            statement.setString(2, definition.checksum());
            statement.executeUpdate();
        }
    }
}
