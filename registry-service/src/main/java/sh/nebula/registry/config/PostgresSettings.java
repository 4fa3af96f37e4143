package sh.nebula.registry.config;

import java.util.Objects;

public record PostgresSettings(String jdbcUrl,
                               String username,
                               String password,
                               String databaseName,
                               int maximumPoolSize,
                               long connectionTimeoutMillis) {

    public PostgresSettings {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        if (!jdbcUrl.startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("Not a PostgreSQL JDBC url: " + jdbcUrl);
        }
        username = username == null ? "" : username;
        password = password == null ? "" : password;
        databaseName = databaseName == null || databaseName.isBlank() ? "nebula" : databaseName;
        if (maximumPoolSize <= 0) {
            throw new IllegalArgumentException("maximumPoolSize must be positive");
        }
        if (connectionTimeoutMillis < 250) {
            throw new IllegalArgumentException("connectionTimeoutMillis must be at least 250");
        }
    }

    public static PostgresSettings defaults() {
        return new PostgresSettings("jdbc:postgresql://localhost:5432/nebula", "nebula", "", "nebula", 4, 5_000);
    }
}
