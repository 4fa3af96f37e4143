package sh.nebula.registry.store.postgres;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import sh.nebula.registry.config.PostgresSettings;
import sh.nebula.registry.store.RegistrationStore;
import sh.nebula.registry.store.RegistrationStoreContract;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class PostgresRegistrationStoreTest extends RegistrationStoreContract {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("nebula")
            .withUsername("nebula")
            .withPassword("nebula");

    private static PostgresConnectionAdapter adapter;
    private static PostgresRegistrationStore store;

    @BeforeAll
    static void installSchema() {
        adapter = new PostgresConnectionAdapter(new PostgresSettings(
                POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword(), "nebula", 2, 5_000));
        store = new PostgresRegistrationStore(adapter);
        store.installSchema();
    }

    @AfterAll
    static void closePool() {
        if (store != null) {
            store.close();
        }
    }

    @BeforeEach
    void truncate() throws SQLException {
        try (Connection connection = adapter.getConnection();
             Statement statement = connection.createStatement()) {
            statement.execute("TRUNCATE service_registry RESTART IDENTITY");
        }
    }

    @Override
    protected RegistrationStore store() {
        return store;
    }

    @Test
    void schemaInstallIsIdempotent() {
        SchemaDefinition definition = SchemaDefinition.fromResource(
                "service-registry-001",
                "service registry table",
                PostgresRegistrationStore.class.getClassLoader(),
                PostgresRegistrationStore.MIGRATION_RESOURCE);

        assertThat(SchemaInstaller.ensureSchema(adapter, definition)).isFalse();
    }
}
