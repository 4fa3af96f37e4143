package sh.nebula.registry.store.redis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lettuce.core.RedisException;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.nebula.registry.redis.RedisManager;
import sh.nebula.registry.redis.RedisScript;
import sh.nebula.registry.store.RegistrationRecord;
import sh.nebula.registry.store.RegistrationStore;
import sh.nebula.registry.store.RegistryStoreException;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Registrations kept as one hash per {@code (name, environment)} with fields {@code id},
 * {@code heartbeat} (epoch millis) and {@code document} (JSON). Every update that depends
 * on the stored state runs as a Lua script, so a heartbeat racing a delete cannot bring
 * the row back.
 */
public class RedisRegistrationStore implements RegistrationStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(RedisRegistrationStore.class);

    static final String SERVICE_KEY_PREFIX = "nebula:registry:services:";
    static final String ID_SEQUENCE_KEY = "nebula:registry:services:id";

    static final String FIELD_ID = "id";
    static final String FIELD_HEARTBEAT = "heartbeat";
    static final String FIELD_DOCUMENT = "document";

    private static final Comparator<RegistrationRecord> NEWEST_FIRST =
            Comparator.comparing(RegistrationRecord::lastHeartbeat).reversed();

    private final RedisManager redisManager;
    private final ObjectMapper objectMapper;
    private final RedisScript upsertScript;
    private final RedisScript touchScript;
    private final RedisScript deleteStaleScript;

    public RedisRegistrationStore(RedisManager redisManager) {
        this.redisManager = Objects.requireNonNull(redisManager, "redisManager");
        this.objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
        this.upsertScript = execute("loadScripts", () -> redisManager.loadScript(
                "registry-upsert", ScriptOutputType.MULTI, "redis/scripts/registry/upsert_registration.lua"));
        this.touchScript = execute("loadScripts", () -> redisManager.loadScript(
                "registry-touch", ScriptOutputType.INTEGER, "redis/scripts/registry/touch_registration.lua"));
        this.deleteStaleScript = execute("loadScripts", () -> redisManager.loadScript(
                "registry-delete-stale", ScriptOutputType.INTEGER, "redis/scripts/registry/delete_stale_registration.lua"));
    }

    /**
     * Both parts are URL-encoded, so a {@code ':'} inside a name or environment cannot
     * make two registrations share a key.
     */
    static String serviceKey(String name, String environment) {
        return SERVICE_KEY_PREFIX + encode(name) + ":" + encode(environment);
    }

    private static String encode(String part) {
        return URLEncoder.encode(part, StandardCharsets.UTF_8);
    }

    @Override
    public String describe() {
        return "redis(" + redisManager.configuration().describe() + ")";
    }

    @Override
    public RegistrationRecord upsert(String name,
                                     String environment,
                                     String endpoint,
                                     Set<String> capabilities,
                                     Map<String, Object> metadata,
                                     Instant now) {
        RegistrationDocument document = new RegistrationDocument(name, environment, endpoint,
                new ArrayList<>(capabilities == null ? Set.of() : capabilities), metadata);
        String payload = serialise(document);
        return execute("upsert", () -> {
            List<Object> stored = redisManager.eval(upsertScript,
                    List.of(serviceKey(name, environment), ID_SEQUENCE_KEY),
                    payload, Long.toString(now.toEpochMilli()));
            long id = Long.parseLong(String.valueOf(stored.get(0)));
            Instant heartbeat = Instant.ofEpochMilli(Long.parseLong(String.valueOf(stored.get(1))));
            return document.toRecord(id, heartbeat);
        });
    }

    @Override
    public Optional<RegistrationRecord> findLatestByName(String name) {
        return execute("findLatestByName", () -> loadAll().stream()
                .filter(record -> record.serviceName().equals(name))
                .max(Comparator.comparing(RegistrationRecord::lastHeartbeat)));
    }

    @Override
    public List<RegistrationRecord> findByCapabilitySince(String capability, Instant cutoff) {
        return select("findByCapabilitySince", record -> record.lastHeartbeat().isAfter(cutoff)
                && record.capabilities().contains(capability));
    }

    @Override
    public List<RegistrationRecord> findSince(Instant cutoff) {
        return select("findSince", record -> record.lastHeartbeat().isAfter(cutoff));
    }

    @Override
    public List<RegistrationRecord> findByEnvironment(String environment) {
        return select("findByEnvironment", record -> record.environment().equals(environment));
    }

    @Override
    public List<RegistrationRecord> findAll() {
        return select("findAll", record -> true);
    }

    @Override
    public int touch(String name, String environment, Instant now) {
        return execute("touch", () -> touchKey(serviceKey(name, environment), now));
    }

    @Override
    public int touchByName(String name, Instant now) {
        return execute("touchByName", () -> {
            int matched = 0;
            for (RegistrationRecord record : loadAll()) {
                if (record.serviceName().equals(name)) {
                    matched += touchKey(serviceKey(record.serviceName(), record.environment()), now);
                }
            }
            return matched;
        });
    }

    @Override
    public int delete(String name, String environment) {
        return execute("delete", () -> redisManager.sync().del(serviceKey(name, environment)).intValue());
    }

    @Override
    public int deleteByName(String name) {
        return execute("deleteByName", () -> {
            RedisCommands<String, String> commands = redisManager.sync();
            int removed = 0;
            for (RegistrationRecord record : loadAll()) {
                if (record.serviceName().equals(name)) {
                    removed += commands.del(serviceKey(record.serviceName(), record.environment())).intValue();
                }
            }
            return removed;
        });
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        String cutoffMillis = Long.toString(cutoff.toEpochMilli());
        return execute("deleteOlderThan", () -> {
            int removed = 0;
            for (RegistrationRecord record : loadAll()) {
                if (record.lastHeartbeat().isBefore(cutoff)) {
                    // re-checked inside the script; a heartbeat since the scan keeps the row
                    Long deleted = redisManager.eval(deleteStaleScript,
                            List.of(serviceKey(record.serviceName(), record.environment())), cutoffMillis);
                    removed += deleted == null ? 0 : deleted.intValue();
                }
            }
            return removed;
        });
    }

    @Override
    public void close() {
        redisManager.close();
    }

    private int touchKey(String key, Instant now) {
        Long touched = redisManager.eval(touchScript, List.of(key), Long.toString(now.toEpochMilli()));
        return touched == null ? 0 : touched.intValue();
    }

    private List<RegistrationRecord> select(String operation, Predicate<RegistrationRecord> filter) {
        return execute(operation, () -> {
            List<RegistrationRecord> result = new ArrayList<>();
            for (RegistrationRecord record : loadAll()) {
                if (filter.test(record)) {
                    result.add(record);
                }
            }
            result.sort(NEWEST_FIRST);
            return result;
        });
    }

    private List<RegistrationRecord> loadAll() {
        RedisCommands<String, String> commands = redisManager.sync();
        List<RegistrationRecord> results = new ArrayList<>();
        for (String key : commands.keys(SERVICE_KEY_PREFIX + "*")) {
            if (ID_SEQUENCE_KEY.equals(key)) {
                continue;
            }
            read(key, commands.hgetall(key)).ifPresent(results::add);
        }
        return results;
    }

    private Optional<RegistrationRecord> read(String key, Map<String, String> fields) {
        // deleted between KEYS and HGETALL
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }
        try {
            RegistrationDocument document = objectMapper.readValue(fields.get(FIELD_DOCUMENT), RegistrationDocument.class);
            return Optional.of(document.toRecord(
                    Long.parseLong(fields.get(FIELD_ID)),
                    Instant.ofEpochMilli(Long.parseLong(fields.get(FIELD_HEARTBEAT)))));
        } catch (IOException | RuntimeException ex) {
            LOGGER.error("Failed to deserialise registration at key {}", key, ex);
            return Optional.empty();
        }
    }

    private String serialise(RegistrationDocument document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new RegistryStoreException("Failed to serialise registration for " + document.serviceName(), ex);
        }
    }

    private static <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (RedisException ex) {
            throw RegistryStoreException.operationFailed(operation, ex);
        }
    }

    record RegistrationDocument(
            String serviceName,
            String environment,
            String endpoint,
            List<String> capabilities,
            Map<String, Object> metadata
    ) {
        RegistrationRecord toRecord(long id, Instant heartbeat) {
            return new RegistrationRecord(id, serviceName, environment, endpoint,
                    capabilities == null ? Set.of() : new LinkedHashSet<>(capabilities),
                    heartbeat, metadata);
        }
    }
}
