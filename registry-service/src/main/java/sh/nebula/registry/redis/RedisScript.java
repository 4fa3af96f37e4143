package sh.nebula.registry.redis;

import io.lettuce.core.ScriptOutputType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Lua source plus the digest Redis knows it by. The digest is refreshed when the
 * server has forgotten the script.
 */
public final class RedisScript {

    private final String name;
    private final ScriptOutputType outputType;
    private final String source;
    private volatile String sha;

    RedisScript(String name, ScriptOutputType outputType, String source, String sha) {
        this.name = Objects.requireNonNull(name, "name");
        this.outputType = Objects.requireNonNull(outputType, "outputType");
        this.source = Objects.requireNonNull(source, "source");
        this.sha = Objects.requireNonNull(sha, "sha");
    }

    static String readResource(String resourcePath) {
        Objects.requireNonNull(resourcePath, "resourcePath");
        try (InputStream in = RedisScript.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalArgumentException("Redis script resource not found: " + resourcePath);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read Redis script: " + resourcePath, ex);
        }
    }

    public String name() {
        return name;
    }

    public ScriptOutputType outputType() {
        return outputType;
    }

    String source() {
        return source;
    }

    public String sha() {
        return sha;
    }

    void reloaded(String newSha) {
        this.sha = newSha;
    }
}
