package sh.nebula.registry.store.postgres;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A named SQL migration loaded from the classpath, identified by a SHA-256 checksum
 * so that edits to an already-applied script can be detected.
 */
public record SchemaDefinition(String id, String description, String sql) {

    public SchemaDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sql, "sql");
        description = description == null ? "" : description;
    }

    public static SchemaDefinition fromResource(String id,
                                                String description,
                                                ClassLoader classLoader,
                                                String resourcePath) {
        Objects.requireNonNull(classLoader, "classLoader");
        Objects.requireNonNull(resourcePath, "resourcePath");
        try (InputStream in = classLoader.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalArgumentException("Schema resource not found: " + resourcePath);
            }
            return new SchemaDefinition(id, description, new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read schema resource " + resourcePath, ex);
        }
    }

    public String checksum() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(sql.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm unavailable", ex);
        }
    }
}
