package de.htwsaar.tierstore.engine.service;

import static de.htwsaar.tierstore.engine.EngineHarness.TIMEOUT;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.htwsaar.tierstore.engine.EngineHarness;
import de.htwsaar.tierstore.engine.cache.CacheEntry;
import de.htwsaar.tierstore.engine.domain.ObjectRecord;
import de.htwsaar.tierstore.engine.domain.QuotaExceededException;
import de.htwsaar.tierstore.engine.domain.UnknownBackendException;
import de.htwsaar.tierstore.engine.domain.UnknownObjectException;
import de.htwsaar.tierstore.engine.policy.CachePolicy;
import de.htwsaar.tierstore.engine.policy.PolicyKind;
import de.htwsaar.tierstore.engine.policy.ReplicationPolicy;
import de.htwsaar.tierstore.engine.policy.ReplicationStrategy;
import de.htwsaar.tierstore.engine.policy.RetentionPolicy;
import de.htwsaar.tierstore.engine.policy.StorageQuotaPolicy;
import de.htwsaar.tierstore.engine.replication.ReplicaSet;
import de.htwsaar.tierstore.engine.usage.UsageRecord;
import de.htwsaar.tierstore.engine.violation.Severity;
import de.htwsaar.tierstore.engine.violation.Violation;
import de.htwsaar.tierstore.engine.violation.ViolationFilter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests für Speicher-, Lese- und Löschfluss der Engine. */
class StorageEngineTest {

    private static final byte[] TEN = "0123456789".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path dir;

    private EngineHarness h;

    @BeforeEach
    void setUp() {
        h = new EngineHarness(dir);
    }

    @AfterEach
    void tearDown() {
        h.close();
    }

    @Test
    void shouldStoreReadAndDeleteObject() {
        StoreResult stored = h.engine.store("docs/a.txt", TEN, "hot", TIMEOUT);

        assertEquals("hot", stored.record().primaryBackend());
        assertEquals(10, stored.record().sizeBytes());
        assertNotNull(stored.cached());
        assertEquals("warm", stored.cached().tier());
        assertNull(stored.replicas());
        UsageRecord afterStore = h.tracker.snapshot("hot");
        assertEquals(10, afterStore.bytesUsed());
        assertEquals(1, afterStore.fileCount());
        assertEquals(1, afterStore.requestCountInWindow());

        assertArrayEquals(TEN, h.engine.read("docs/a.txt", TIMEOUT));
        assertEquals(20, h.tracker.snapshot("hot").bytesTransferredInWindow());
        assertEquals("hot", h.cache.lookup("docs/a.txt").orElseThrow().tier());
        assertEquals(1, h.repository.loadCatalog().size());

        h.engine.delete("docs/a.txt", TIMEOUT);

        assertFalse(h.hot.holds("docs/a.txt"));
        assertEquals(0, h.tracker.snapshot("hot").bytesUsed());
        assertEquals(0, h.tracker.snapshot("hot").fileCount());
        assertTrue(h.cache.lookup("docs/a.txt").isEmpty());
        assertTrue(h.engine.record("docs/a.txt").isEmpty());
        assertTrue(h.repository.loadCatalog().isEmpty());
        assertThrows(UnknownObjectException.class, () -> h.engine.read("docs/a.txt", TIMEOUT));
    }

    @Test
    void shouldRejectStoreOverQuotaWithoutTouchingBackend() {
        h.engine.setPolicy("hot", new StorageQuotaPolicy(15, 0, 0.8));
        h.engine.store("a", TEN, "hot", TIMEOUT);

        QuotaExceededException e = assertThrows(QuotaExceededException.class,
                () -> h.engine.store("b", TEN, "hot", TIMEOUT));

        assertEquals(20, e.getProjected());
        assertEquals(15, e.getLimit());
        assertEquals(1, h.hot.puts());
        assertTrue(h.engine.record("b").isEmpty());
        assertEquals(10, h.tracker.snapshot("hot").bytesUsed());
        assertEquals(0, h.tracker.snapshot("hot").reservedBytes());
    }

    @Test
    void shouldOverwriteOnSameBackendOnly() {
        ObjectRecord first = h.engine.store("a", TEN, "hot", TIMEOUT).record();
        h.clock.plusSeconds(30);

        ObjectRecord second = h.engine.store("a", new byte[4], "hot", TIMEOUT).record();

        assertEquals(4, second.sizeBytes());
        assertEquals(first.storedAt(), second.storedAt());
        assertEquals(4, h.tracker.snapshot("hot").bytesUsed());
        assertEquals(1, h.tracker.snapshot("hot").fileCount());
        assertThrows(IllegalArgumentException.class, () -> h.engine.store("a", TEN, "warm", TIMEOUT));
        assertEquals(0, h.warm.puts());
    }

    @Test
    void shouldReleaseReservationWhenPutFails() {
        h.hot.down(true);

        assertThrows(RuntimeException.class, () -> h.engine.store("a", TEN, "hot", TIMEOUT));

        UsageRecord usage = h.tracker.snapshot("hot");
        assertEquals(0, usage.bytesUsed());
        assertEquals(0, usage.reservedBytes());
        assertTrue(h.engine.record("a").isEmpty());
    }

    @Test
    void shouldRefuseDeleteBeforeMinimumAgeAndUnderLegalHold() {
        h.engine.setPolicy("hot", new RetentionPolicy(Duration.ofHours(1), Duration.ZERO, false));
        h.engine.store("young", TEN, "hot", TIMEOUT);

        RetentionViolationException e = assertThrows(RetentionViolationException.class,
                () -> h.engine.delete("young", TIMEOUT));
        assertEquals(409, e.getStatusCode());
        assertTrue(h.hot.holds("young"));
        List<Violation> reported = h.violations.list(new ViolationFilter("hot", Severity.WARN, false));
        assertEquals(PolicyKind.RETENTION, reported.get(0).policyKind());

        h.clock.plus(Duration.ofHours(2));
        h.engine.delete("young", TIMEOUT);
        assertFalse(h.hot.holds("young"));
        assertTrue(h.violations.list(new ViolationFilter("hot", Severity.WARN, false)).isEmpty());

        h.engine.setPolicy("hot", new RetentionPolicy(Duration.ZERO, Duration.ZERO, true));
        h.engine.store("held", TEN, "hot", TIMEOUT);
        h.clock.plus(Duration.ofDays(3650));
        assertThrows(RetentionViolationException.class, () -> h.engine.delete("held", TIMEOUT));
    }

    @Test
    void shouldReplicateOnStoreAndReadFromReplicaWhenPrimaryIsDown() {
        h.engine.setPolicy("hot", new ReplicationPolicy(ReplicationStrategy.SIMPLE, 1, 1, List.of("warm")));

        StoreResult stored = h.engine.store("a", TEN, "hot", TIMEOUT);

        assertEquals(List.of("warm"), stored.replicas().verifiedBackends());
        assertEquals(10, h.tracker.snapshot("warm").bytesUsed());
        assertNotNull(h.repository.loadCatalog().get(0).replicas());

        h.hot.down(true);
        assertArrayEquals(TEN, h.engine.read("a", TIMEOUT));
        assertEquals(20, h.tracker.snapshot("warm").bytesTransferredInWindow());

        h.hot.down(false);
        h.engine.delete("a", TIMEOUT);
        assertFalse(h.warm.holds("a"));
        assertEquals(0, h.tracker.snapshot("warm").bytesUsed());
        assertTrue(h.replication.replicaSet("a").isEmpty());
    }

    @Test
    void shouldRecopyReplicasWhenObjectIsOverwritten() {
        h.engine.setPolicy("hot", new ReplicationPolicy(ReplicationStrategy.SIMPLE, 1, 1, List.of("warm")));
        byte[] shorter = "abcd".getBytes(StandardCharsets.UTF_8);
        h.engine.store("a", TEN, "hot", TIMEOUT);

        StoreResult overwritten = h.engine.store("a", shorter, "hot", TIMEOUT);

        assertEquals(4, overwritten.replicas().sizeBytes());
        assertEquals(List.of("warm"), overwritten.replicas().verifiedBackends());
        assertEquals(4, h.tracker.snapshot("hot").bytesUsed());
        assertEquals(4, h.tracker.snapshot("warm").bytesUsed());
        assertEquals(1, h.tracker.snapshot("warm").fileCount());
        CacheEntry grown = h.engine.store("a", new byte[400], "hot", TIMEOUT).cached();
        assertEquals(400, grown.sizeBytes());
        assertEquals("warm", grown.tier());
        h.engine.store("a", shorter, "hot", TIMEOUT);

        h.hot.down(true);
        assertArrayEquals(shorter, h.engine.read("a", TIMEOUT));

        h.hot.down(false);
        h.engine.delete("a", TIMEOUT);
        assertEquals(0, h.tracker.snapshot("warm").bytesUsed());
        assertEquals(0, h.tracker.snapshot("warm").fileCount());
    }

    @Test
    void shouldNotResurrectReplicasWhenDeleteRacesRepair() throws Exception {
        h.engine.setPolicy("hot", new ReplicationPolicy(ReplicationStrategy.SIMPLE, 1, 1, List.of("warm")));
        h.engine.store("a", TEN, "hot", TIMEOUT);
        h.warm.lose("a");
        h.warm.putDelayMs(500);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<ReplicaSet> repair = pool.submit(() -> h.engine.repair("a", TIMEOUT));
            long until = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (h.warm.puts() < 2 && System.nanoTime() < until) {
                Thread.sleep(5);
            }
            assertEquals(2, h.warm.puts());

            h.engine.delete("a", TIMEOUT);
            repair.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertTrue(h.replication.replicaSet("a").isEmpty());
        assertFalse(h.warm.holds("a"));
        assertEquals(0, h.tracker.snapshot("warm").bytesUsed());
    }

    @Test
    void shouldKeepObjectWhenTooFewReplicaTargetsExist() {
        h.engine.setPolicy("hot", new ReplicationPolicy(ReplicationStrategy.SIMPLE, 2, 2, List.of("warm")));

        StoreResult stored = h.engine.store("a", TEN, "hot", TIMEOUT);

        assertNull(stored.replicas());
        assertTrue(h.hot.holds("a"));
        assertEquals(1, h.violations.list(new ViolationFilter("hot", Severity.CRITICAL, false)).size());
    }

    @Test
    void shouldListArchiveCandidatesByAge() {
        h.engine.setPolicy("hot", new RetentionPolicy(Duration.ZERO, Duration.ofDays(1), false));
        h.engine.store("old", TEN, "hot", TIMEOUT);
        h.clock.plus(Duration.ofDays(2));
        h.engine.store("new", TEN, "hot", TIMEOUT);
        h.engine.store("elsewhere", TEN, "warm", TIMEOUT);

        List<ObjectRecord> candidates = h.engine.archiveCandidates();

        assertEquals(1, candidates.size());
        assertEquals("old", candidates.get(0).objectId());
    }

    @Test
    void shouldReconfigureCacheTierWhenCachePolicyIsSet() {
        h.engine.setPolicy("hot", new CachePolicy(500, 4, Duration.ofMinutes(5)));

        assertEquals(500, h.cache.tiers().get(0).capacityBytes());
        assertEquals(4, h.cache.tiers().get(0).promoteThreshold());
        assertEquals(List.of(new CachePolicy(500, 4, Duration.ofMinutes(5))),
                h.repository.loadPolicies().get("hot"));

        assertTrue(h.engine.removePolicy("hot", PolicyKind.CACHE));
        assertFalse(h.engine.removePolicy("hot", PolicyKind.CACHE));
        assertEquals(500, h.cache.tiers().get(0).capacityBytes());
        assertTrue(h.repository.loadPolicies().isEmpty());
    }

    @Test
    void shouldRejectUnknownBackendsAndBlankIds() {
        assertThrows(UnknownBackendException.class,
                () -> h.engine.setPolicy("nope", new StorageQuotaPolicy(10, 0, 0.5)));
        assertThrows(UnknownBackendException.class, () -> h.engine.store("a", TEN, "nope", TIMEOUT));
        assertThrows(IllegalArgumentException.class, () -> h.engine.store(" ", TEN, "hot", TIMEOUT));
        assertThrows(UnknownObjectException.class, () -> h.engine.delete("missing", TIMEOUT));
    }

    @Test
    void shouldCheckpointUsage() {
        h.engine.store("a", TEN, "hot", TIMEOUT);

        h.engine.checkpointUsage();

        assertEquals(10, h.repository.loadUsage().orElseThrow().get("hot").bytesUsed());
    }
}
