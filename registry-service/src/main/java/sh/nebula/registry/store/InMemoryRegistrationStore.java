package sh.nebula.registry.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Process-local store used when no database is configured, and by tests.
 */
public final class InMemoryRegistrationStore implements RegistrationStore {

    private static final Comparator<RegistrationRecord> NEWEST_FIRST =
            Comparator.comparing(RegistrationRecord::lastHeartbeat).reversed();

    private final List<RegistrationRecord> records = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public String describe() {
        return "memory";
    }

    @Override
    public synchronized RegistrationRecord upsert(String name,
                                                  String environment,
                                                  String endpoint,
                                                  Set<String> capabilities,
                                                  Map<String, Object> metadata,
                                                  Instant now) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(environment, "environment");
        for (int i = 0; i < records.size(); i++) {
            RegistrationRecord existing = records.get(i);
            if (existing.matches(name, environment)) {
                Instant heartbeat = now.isAfter(existing.lastHeartbeat()) ? now : existing.lastHeartbeat();
                RegistrationRecord updated = new RegistrationRecord(existing.id(), name, environment,
                        endpoint, capabilities, heartbeat, metadata);
                records.set(i, updated);
                return updated;
            }
        }
        RegistrationRecord created = new RegistrationRecord(ids.incrementAndGet(), name, environment,
                endpoint, capabilities, now, metadata);
        records.add(created);
        return created;
    }

    @Override
    public synchronized Optional<RegistrationRecord> findLatestByName(String name) {
        return records.stream()
                .filter(record -> record.serviceName().equals(name))
                .max(Comparator.comparing(RegistrationRecord::lastHeartbeat));
    }

    @Override
    public List<RegistrationRecord> findByCapabilitySince(String capability, Instant cutoff) {
        return select(record -> record.lastHeartbeat().isAfter(cutoff)
                && record.capabilities().contains(capability));
    }

    @Override
    public List<RegistrationRecord> findSince(Instant cutoff) {
        return select(record -> record.lastHeartbeat().isAfter(cutoff));
    }

    @Override
    public List<RegistrationRecord> findByEnvironment(String environment) {
        return select(record -> record.environment().equals(environment));
    }

    @Override
    public List<RegistrationRecord> findAll() {
        return select(record -> true);
    }

    @Override
    public synchronized int touch(String name, String environment, Instant now) {
        return touchMatching(record -> record.matches(name, environment), now);
    }

    @Override
    public synchronized int touchByName(String name, Instant now) {
        return touchMatching(record -> record.serviceName().equals(name), now);
    }

    @Override
    public synchronized int delete(String name, String environment) {
        return removeMatching(record -> record.matches(name, environment));
    }

    @Override
    public synchronized int deleteByName(String name) {
        return removeMatching(record -> record.serviceName().equals(name));
    }

    @Override
    public synchronized int deleteOlderThan(Instant cutoff) {
        return removeMatching(record -> record.lastHeartbeat().isBefore(cutoff));
    }

    public synchronized int size() {
        return records.size();
    }

    private synchronized List<RegistrationRecord> select(Predicate<RegistrationRecord> filter) {
        List<RegistrationRecord> result = new ArrayList<>();
        for (RegistrationRecord record : records) {
            if (filter.test(record)) {
                result.add(record);
            }
        }
        result.sort(NEWEST_FIRST);
        return result;
    }

    private int touchMatching(Predicate<RegistrationRecord> filter, Instant now) {
        int matched = 0;
        for (int i = 0; i < records.size(); i++) {
            RegistrationRecord record = records.get(i);
            if (filter.test(record)) {
                records.set(i, record.withHeartbeat(now));
                matched++;
            }
        }
        return matched;
    }

    private int removeMatching(Predicate<RegistrationRecord> filter) {
        int before = records.size();
        records.removeIf(filter);
        return before - records.size();
    }
}
