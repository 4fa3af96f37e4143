package sh.nebula.registry.store;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Local persistence for registration rows. All calls block; failures surface as
 * {@link RegistryStoreException}. Timestamps are supplied by the caller so the
 * resolver's clock is the single source of "now".
 */
public interface RegistrationStore extends AutoCloseable {

    /**
     * Short name used in log lines.
     */
    String describe();

    /**
     * Inserts or updates the row for {@code (name, environment)}, keeping its id.
     */
    RegistrationRecord upsert(String name,
                              String environment,
                              String endpoint,
                              Set<String> capabilities,
                              Map<String, Object> metadata,
                              Instant now);

    /**
     * Row with the given name and the newest heartbeat, across environments.
     */
    Optional<RegistrationRecord> findLatestByName(String name);

    /**
     * Rows offering {@code capability} whose heartbeat is strictly after {@code cutoff}.
     */
    List<RegistrationRecord> findByCapabilitySince(String capability, Instant cutoff);

    /**
     * Rows whose heartbeat is strictly after {@code cutoff}.
     */
    List<RegistrationRecord> findSince(Instant cutoff);

    List<RegistrationRecord> findByEnvironment(String environment);

    /**
     * Every row, newest heartbeat first.
     */
    List<RegistrationRecord> findAll();

    /**
     * Moves the heartbeat of one row forward. Never moves it backwards.
     *
     * @return rows matched
     */
    int touch(String name, String environment, Instant now);

    /**
     * Moves the heartbeat of every row with the name forward.
     *
     * @return rows matched
     */
    int touchByName(String name, Instant now);

    int delete(String name, String environment);

    int deleteByName(String name);

    /**
     * Deletes rows whose heartbeat is strictly before {@code cutoff}.
     */
    int deleteOlderThan(Instant cutoff);

    @Override
    default void close() {
    }
}
