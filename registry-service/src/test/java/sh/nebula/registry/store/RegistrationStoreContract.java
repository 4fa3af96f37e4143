package sh.nebula.registry.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Behaviour every {@link RegistrationStore} backend must share. Subclasses supply an empty store.
 */
public abstract class RegistrationStoreContract {

    protected static final Instant T0 = Instant.parse("2026-05-01T12:00:00Z");

    protected abstract RegistrationStore store();

    @Test
    @DisplayName("Upsert assigns an id and keeps it across updates")
    void upsertKeepsId() {
        RegistrationRecord created = store().upsert("dashboard", "linode", "http://a:5000",
                Set.of("web"), Map.of("version", "1"), T0);
        RegistrationRecord updated = store().upsert("dashboard", "linode", "http://b:5000",
                Set.of("web", "api"), Map.of("version", "2"), T0.plusSeconds(30));

        assertThat(created.id()).isPositive();
        assertThat(updated.id()).isEqualTo(created.id());
        assertThat(updated.endpoint()).isEqualTo("http://b:5000");
        assertThat(updated.capabilities()).containsExactlyInAnyOrder("web", "api");
        assertThat(updated.metadata()).containsEntry("version", "2");
        assertThat(updated.lastHeartbeat()).isEqualTo(T0.plusSeconds(30));
        assertThat(store().findAll()).hasSize(1);
    }

    @Test
    @DisplayName("An older upsert never moves the heartbeat backwards")
    void upsertIsMonotonic() {
        store().upsert("dashboard", "linode", "http://a:5000", Set.of(), Map.of(), T0.plusSeconds(60));
        RegistrationRecord late = store().upsert("dashboard", "linode", "http://a:5000", Set.of(), Map.of(), T0);

        assertThat(late.lastHeartbeat()).isEqualTo(T0.plusSeconds(60));
    }

    @Test
    @DisplayName("Metadata survives a round trip")
    void metadataRoundTrip() {
        store().upsert("agent", "windows-vm", "http://agent:9765", Set.of("wol"),
                Map.of("gpu", "rtx-3060", "slots", 2), T0);

        assertThat(store().findLatestByName("agent")).hasValueSatisfying(record -> {
            assertThat(record.metadata()).containsEntry("gpu", "rtx-3060").containsEntry("slots", 2);
            assertThat(record.environment()).isEqualTo("windows-vm");
        });
    }

    @Test
    @DisplayName("Latest by name picks the freshest environment")
    void latestByName() {
        store().upsert("ollama", "ubuntu-home", "http://home:11434", Set.of("ai"), Map.of(), T0);
        store().upsert("ollama", "windows-vm", "http://vm:11434", Set.of("ai"), Map.of(), T0.plusSeconds(5));

        assertThat(store().findLatestByName("ollama")).map(RegistrationRecord::endpoint).contains("http://vm:11434");
        assertThat(store().findLatestByName("missing")).isEmpty();
    }

    @Test
    @DisplayName("Capability lookup matches exactly and excludes rows on the cutoff")
    void capabilityLookup() {
        store().upsert("on-cutoff", "linode", "http://a:1", Set.of("ai"), Map.of(), T0);
        store().upsert("fresh", "linode", "http://b:1", Set.of("ai", "web"), Map.of(), T0.plusSeconds(10));
        store().upsert("other", "linode", "http://c:1", Set.of("AI"), Map.of(), T0.plusSeconds(10));

        assertThat(store().findByCapabilitySince("ai", T0))
                .extracting(RegistrationRecord::serviceName)
                .containsExactly("fresh");
    }

    @Test
    @DisplayName("Since and listing queries return newest first")
    void listingOrder() {
        store().upsert("a", "linode", "http://a:1", Set.of(), Map.of(), T0);
        store().upsert("b", "replit", "http://b:1", Set.of(), Map.of(), T0.plusSeconds(20));
        store().upsert("c", "linode", "http://c:1", Set.of(), Map.of(), T0.plusSeconds(10));

        assertThat(store().findAll()).extracting(RegistrationRecord::serviceName).containsExactly("b", "c", "a");
        assertThat(store().findSince(T0)).extracting(RegistrationRecord::serviceName).containsExactly("b", "c");
        assertThat(store().findByEnvironment("linode")).extracting(RegistrationRecord::serviceName).containsExactly("c", "a");
    }

    @Test
    @DisplayName("Touch refreshes matching rows and reports the count")
    void touch() {
        store().upsert("api", "linode", "http://a:1", Set.of(), Map.of(), T0);
        store().upsert("api", "replit", "http://b:1", Set.of(), Map.of(), T0);

        assertThat(store().touch("api", "linode", T0.plusSeconds(30))).isEqualTo(1);
        assertThat(store().touch("api", "missing", T0.plusSeconds(30))).isZero();
        assertThat(store().findSince(T0)).extracting(RegistrationRecord::environment).containsExactly("linode");

        assertThat(store().touchByName("api", T0.plusSeconds(60))).isEqualTo(2);
        assertThat(store().findSince(T0.plusSeconds(59))).hasSize(2);
    }

    @Test
    @DisplayName("Deletes report how many rows went away")
    void deletes() {
        store().upsert("api", "linode", "http://a:1", Set.of(), Map.of(), T0);
        store().upsert("api", "replit", "http://b:1", Set.of(), Map.of(), T0);
        store().upsert("web", "linode", "http://c:1", Set.of(), Map.of(), T0);

        assertThat(store().delete("api", "linode")).isEqualTo(1);
        assertThat(store().delete("api", "linode")).isZero();
        assertThat(store().deleteByName("api")).isEqualTo(1);
        assertThat(store().findAll()).extracting(RegistrationRecord::serviceName).containsExactly("web");
    }

    @Test
    @DisplayName("Pruning keeps rows exactly on the cutoff")
    void deleteOlderThan() {
        store().upsert("old", "linode", "http://a:1", Set.of(), Map.of(), T0.minusSeconds(3600));
        store().upsert("edge", "linode", "http://b:1", Set.of(), Map.of(), T0);
        store().upsert("new", "linode", "http://c:1", Set.of(), Map.of(), T0.plusSeconds(1));

        assertThat(store().deleteOlderThan(T0)).isEqualTo(1);
        assertThat(store().findAll()).extracting(RegistrationRecord::serviceName).containsExactly("new", "edge");
    }

    @Test
    @DisplayName("Names and environments containing separators stay distinct")
    void naturalKeyWithSeparators() {
        store().upsert("a:b", "c", "http://first:1", Set.of(), Map.of(), T0);
        store().upsert("a", "b:c", "http://second:1", Set.of(), Map.of(), T0.plusSeconds(1));

        assertThat(store().findAll()).hasSize(2);
        assertThat(store().findLatestByName("a:b")).map(RegistrationRecord::endpoint).contains("http://first:1");
        assertThat(store().findLatestByName("a")).map(RegistrationRecord::endpoint).contains("http://second:1");
    }

    @Test
    @DisplayName("A heartbeat racing a delete never brings the row back")
    void touchRacingDeleteStaysDeleted() {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 300; round++) {
                Instant now = T0.plusSeconds(round);
                store().upsert("svc", "linode", "http://svc:1", Set.of("web"), Map.of(), now);
                CountDownLatch go = new CountDownLatch(1);
                CompletableFuture<Integer> touch = CompletableFuture.supplyAsync(() -> {
                    awaitQuietly(go);
                    return store().touch("svc", "linode", now.plusMillis(500));
                }, pool);
                CompletableFuture<Integer> delete = CompletableFuture.supplyAsync(() -> {
                    awaitQuietly(go);
                    return store().delete("svc", "linode");
                }, pool);
                go.countDown();
                CompletableFuture.allOf(touch, delete).join();

                assertThat(delete.join()).as("delete in round %d", round).isEqualTo(1);
                assertThat(store().findLatestByName("svc")).as("row after round %d", round).isEmpty();
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }
}
