package de.htwsaar.tierstore.engine.replication;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.htwsaar.tierstore.engine.FlakyBackendAdapter;
import de.htwsaar.tierstore.engine.MutableClock;
import de.htwsaar.tierstore.engine.adapter.AdapterInvoker;
import de.htwsaar.tierstore.engine.adapter.BackendRegistry;
import de.htwsaar.tierstore.engine.domain.Backend;
import de.htwsaar.tierstore.engine.domain.CostTier;
import de.htwsaar.tierstore.engine.domain.UnknownObjectException;
import de.htwsaar.tierstore.engine.policy.PolicyKind;
import de.htwsaar.tierstore.engine.policy.PolicyStore;
import de.htwsaar.tierstore.engine.policy.ReplicationPolicy;
import de.htwsaar.tierstore.engine.policy.ReplicationStrategy;
import de.htwsaar.tierstore.engine.policy.StorageQuotaPolicy;
import de.htwsaar.tierstore.engine.quota.QuotaEnforcer;
import de.htwsaar.tierstore.engine.usage.ResourceTracker;
import de.htwsaar.tierstore.engine.violation.Severity;
import de.htwsaar.tierstore.engine.violation.ViolationFilter;
import de.htwsaar.tierstore.engine.violation.ViolationReporter;
import de.htwsaar.tierstore.engine.violation.ViolationStore;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests für Zielauswahl, Kopien, Reparatur und Koaleszierung der Replikation. */
class ReplicationCoordinatorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final byte[] CONTENT = "0123456789".getBytes();

    private MutableClock clock;
    private BackendRegistry registry;
    private PolicyStore policies;
    private ResourceTracker tracker;
    private ViolationReporter violations;
    private QuotaEnforcer quota;
    private ExecutorService adapterPool;
    private ExecutorService copyPool;

    @BeforeEach
    void setUp() {
        clock = MutableClock.start();
        registry = new BackendRegistry();
        policies = new PolicyStore();
        tracker = new ResourceTracker(clock, id -> null);
        violations = new ViolationReporter(clock, ViolationStore.NONE);
        quota = new QuotaEnforcer(policies, tracker, violations);
        adapterPool = Executors.newCachedThreadPool();
        copyPool = Executors.newFixedThreadPool(4);
        registry.register(new Backend("P", "eu", false, false, CostTier.HOT), new FlakyBackendAdapter("P"));
    }

    @AfterEach
    void tearDown() {
        adapterPool.shutdownNow();
        copyPool.shutdownNow();
    }

    private ReplicationCoordinator coordinator(RetryPolicy retry) {
        return new ReplicationCoordinator(registry, policies, quota, tracker, violations,
                new AdapterInvoker(adapterPool), retry, copyPool, clock);
    }

    private FlakyBackendAdapter add(String id, String region) {
        FlakyBackendAdapter adapter = new FlakyBackendAdapter(id, id.hashCode());
        registry.register(new Backend(id, region, true, false, CostTier.WARM), adapter);
        return adapter;
    }

    private static Map<String, ReplicaTarget> byBackend(ReplicaSet set) {
        return set.targets().stream().collect(Collectors.toMap(ReplicaTarget::backendId, Function.identity()));
    }

    @Test
    void shouldSkipQuotaRejectedBackendThenRetryFailedAndAddItOnceItHasCapacity() {
        add("A", "eu");
        add("B", "eu");
        FlakyBackendAdapter c = add("C", "eu");
        policies.set("A", new StorageQuotaPolicy(100, 0, 0.8));
        tracker.restore("A", 95, 1);
        ReplicationPolicy policy = new ReplicationPolicy(ReplicationStrategy.SIMPLE, 2, 3, List.of("A", "B", "C"));
        policies.set("P", policy);
        ReplicationCoordinator coordinator = coordinator(new RetryPolicy(2, Duration.ZERO, 1.0));

        ReplicaSet first = coordinator.ensure("obj", CONTENT, "P", policy, TIMEOUT);
        assertEquals(List.of("B", "C"), first.verifiedBackends());
        assertEquals(2, first.targets().size());
        assertEquals(10, tracker.snapshot("B").bytesUsed());
        assertEquals(95, tracker.snapshot("A").bytesUsed());

        // C fällt aus: die Reparatur versucht C erneut, A ist weiter voll
        c.down(true);
        ReplicaSet afterFailure = coordinator.repair("obj", TIMEOUT);
        Map<String, ReplicaTarget> targets = byBackend(afterFailure);
        assertEquals(ReplicaStatus.FAILED, targets.get("C").status());
        assertEquals(3, targets.get("C").attempts());
        assertEquals(List.of("B"), afterFailure.verifiedBackends());
        assertFalse(targets.containsKey("A"));
        assertFalse(afterFailure.hasStatus(ReplicaStatus.PENDING));
        assertEquals(0, tracker.snapshot("C").bytesUsed());
        assertEquals(1, violations.list(new ViolationFilter("P", Severity.CRITICAL, false)).size());

        // A hat wieder Platz
        tracker.restore("A", 0, 0);
        ReplicaSet withA = coordinator.repair("obj", TIMEOUT);
        targets = byBackend(withA);
        assertEquals(ReplicaStatus.VERIFIED, targets.get("A").status());
        assertEquals(ReplicaStatus.FAILED, targets.get("C").status());
        assertEquals(2, withA.verifiedCount());
        assertEquals(10, tracker.snapshot("A").bytesUsed());
        assertTrue(violations.list(new ViolationFilter("P", Severity.CRITICAL, false)).isEmpty());

        c.down(false);
        ReplicaSet healed = coordinator.repair("obj", TIMEOUT);
        assertEquals(3, healed.verifiedCount());
        assertEquals(healed, coordinator.repair("obj", TIMEOUT));
    }

    @Test
    void shouldConvergeToMinRedundancyDespiteFlakyBackends() {
        add("F1", "eu").putFailureRate(0.5);
        add("F2", "eu").putFailureRate(0.5);
        add("G1", "eu");
        add("G2", "us");
        add("G3", "ap");
        ReplicationPolicy policy = new ReplicationPolicy(
                ReplicationStrategy.SIMPLE, 2, 3, List.of("F1", "F2", "G1", "G2", "G3"));
        policies.set("P", policy);
        ReplicationCoordinator coordinator = coordinator(new RetryPolicy(2, Duration.ZERO, 1.0));

        ReplicaSet set = coordinator.ensure("obj", CONTENT, "P", policy, TIMEOUT);
        assertTrue(set.verifiedCount() >= 2);
        assertFalse(set.hasStatus(ReplicaStatus.PENDING));

        for (int i = 0; i < 10; i++) {
            set = coordinator.repair("obj", TIMEOUT);
            assertTrue(set.verifiedCount() >= 2, "round " + i + ": " + set);
            assertFalse(set.hasStatus(ReplicaStatus.PENDING));
        }
    }

    @Test
    void shouldDoNothingOnRepairWhenFullyVerified() {
        FlakyBackendAdapter b = add("B", "eu");
        add("C", "eu");
        ReplicationPolicy policy = new ReplicationPolicy(ReplicationStrategy.SIMPLE, 2, 2, List.of("B", "C"));
        ReplicationCoordinator coordinator = coordinator(RetryPolicy.none());

        ReplicaSet first = coordinator.ensure("obj", CONTENT, "P", policy, TIMEOUT);
        policies.set("P", policy);
        ReplicaSet again = coordinator.repair("obj", TIMEOUT);

        assertEquals(first, again);
        assertEquals(1, b.puts());
    }

    @Test
    void shouldRejectWhenTooFewEligibleBackends() {
        add("B", "eu");
        ReplicationPolicy policy = new ReplicationPolicy(ReplicationStrategy.SIMPLE, 2, 2, List.of("B", "missing"));
        ReplicationCoordinator coordinator = coordinator(RetryPolicy.none());

        InsufficientRedundancyException e = assertThrows(InsufficientRedundancyException.class,
                () -> coordinator.ensure("obj", CONTENT, "P", policy, TIMEOUT));

        assertEquals(1, e.getEligible());
        assertEquals(2, e.getRequired());
        assertEquals(503, e.getStatusCode());
        assertEquals(PolicyKind.REPLICATION,
                violations.list(new ViolationFilter("P", Severity.CRITICAL, false)).get(0).policyKind());
        assertTrue(coordinator.replicaSet("obj").isEmpty());
    }

    @Test
    void shouldCountOwnerAsReplicaWhenItIsCandidate() {
        add("A", "eu");
        FlakyBackendAdapter b = add("B", "eu");
        add("C", "eu");
        ReplicationPolicy policy = new ReplicationPolicy(ReplicationStrategy.SIMPLE, 2, 2, List.of());
        ReplicationCoordinator coordinator = coordinator(RetryPolicy.none());

        ReplicaSet set = coordinator.ensure("obj", CONTENT, "A", policy, TIMEOUT);

        assertEquals(List.of("A", "B"), set.verifiedBackends());
        assertEquals(0, byBackend(set).get("A").attempts());
        assertEquals(1, b.puts());
    }

    @Test
    void shouldSpreadAcrossRegionsWithGeoAwareStrategy() {
        add("A", "eu");
        add("B", "eu");
        add("C", "us");
        ReplicationCoordinator coordinator = coordinator(RetryPolicy.none());

        ReplicaSet geo = coordinator.ensure("geo", CONTENT, "P",
                new ReplicationPolicy(ReplicationStrategy.GEO_AWARE, 2, 2, List.of()), TIMEOUT);
        ReplicaSet simple = coordinator.ensure("simple", CONTENT, "P",
                new ReplicationPolicy(ReplicationStrategy.SIMPLE, 2, 2, List.of()), TIMEOUT);

        assertEquals(List.of("A", "C"), geo.verifiedBackends());
        assertEquals(List.of("A", "B"), simple.verifiedBackends());
    }

    @Test
    void shouldMarkTimedOutCopyAsFailedNotPending() {
        add("B", "eu").putDelayMs(5_000);
        ReplicationCoordinator coordinator = coordinator(RetryPolicy.none());
        ReplicationPolicy policy = new ReplicationPolicy(ReplicationStrategy.SIMPLE, 1, 1, List.of("B"));

        long started = System.nanoTime();
        ReplicaSet set = coordinator.ensure("obj", CONTENT, "P", policy, Duration.ofMillis(300));
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

        assertTrue(elapsedMs < 3_000, "took " + elapsedMs + " ms");
        assertEquals(ReplicaStatus.FAILED, set.targets().get(0).status());
        assertEquals(0, tracker.snapshot("B").bytesUsed());
        assertEquals(0, tracker.snapshot("B").reservedBytes());
    }

    @Test
    void shouldCoalesceConcurrentEnsureForSameObject() throws Exception {
        FlakyBackendAdapter b = add("B", "eu").putDelayMs(300);
        ReplicationCoordinator coordinator = coordinator(RetryPolicy.none());
        ReplicationPolicy policy = new ReplicationPolicy(ReplicationStrategy.SIMPLE, 1, 1, List.of("B"));
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<ReplicaSet> first = caller.submit(() -> coordinator.ensure("obj", CONTENT, "P", policy, TIMEOUT));
            long waitUntil = System.currentTimeMillis() + 2_000;
            while (b.puts() == 0 && System.currentTimeMillis() < waitUntil) {
                Thread.sleep(5);
            }

            ReplicaSet second = coordinator.ensure("obj", CONTENT, "P", policy, TIMEOUT);

            assertEquals(first.get(5, TimeUnit.SECONDS), second);
            assertEquals(1, b.puts());
            assertEquals(10, tracker.snapshot("B").bytesUsed());
        } finally {
            caller.shutdownNow();
        }
    }

    @Test
    void shouldDeleteCopiesAndReleaseUsageOnRemove() {
        FlakyBackendAdapter b = add("B", "eu");
        FlakyBackendAdapter c = add("C", "eu");
        ReplicationCoordinator coordinator = coordinator(RetryPolicy.none());
        coordinator.ensure("obj", CONTENT, "P",
                new ReplicationPolicy(ReplicationStrategy.SIMPLE, 2, 2, List.of("B", "C")), TIMEOUT);
        assertEquals(List.of("obj"), coordinator.exportReplicas("C"));

        ReplicaSet removed = coordinator.remove("obj", TIMEOUT).orElseThrow();

        assertEquals(2, removed.targets().size());
        assertFalse(b.holds("obj"));
        assertFalse(c.holds("obj"));
        assertEquals(0, tracker.snapshot("B").bytesUsed());
        assertEquals(0, tracker.snapshot("C").fileCount());
        assertTrue(coordinator.remove("obj", TIMEOUT).isEmpty());
        assertThrows(UnknownObjectException.class, () -> coordinator.repair("obj", TIMEOUT));
    }

    @Test
    void shouldTurnPendingIntoFailedOnRestore() {
        add("B", "eu");
        ReplicationCoordinator coordinator = coordinator(RetryPolicy.none());
        Instant at = clock.instant();
        coordinator.restore(new ReplicaSet("obj", 10, "P", List.of(
                ReplicaTarget.verified("P", 0, at),
                ReplicaTarget.pending("B", 1, at))));

        ReplicaSet restored = coordinator.replicaSet("obj").orElseThrow();
        assertEquals(ReplicaStatus.FAILED, byBackend(restored).get("B").status());
        assertEquals(List.of("P"), restored.verifiedBackends());
    }

    @Test
    void shouldGrowBackoffExponentially() {
        RetryPolicy retry = new RetryPolicy(4, Duration.ofMillis(100), 2.0);
        assertEquals(Duration.ZERO, retry.delayFor(0));
        assertEquals(Duration.ofMillis(100), retry.delayFor(1));
        assertEquals(Duration.ofMillis(400), retry.delayFor(3));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, 1.0));
    }
}
