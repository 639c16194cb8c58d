package de.htwsaar.tierstore.engine.usage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.htwsaar.tierstore.engine.MutableClock;
import de.htwsaar.tierstore.engine.domain.QuotaExceededException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

/** Tests für Nutzungszähler, Reservierungen und Traffic-Fenster. */
class ResourceTrackerTest {

    @Test
    void shouldCountStoresAndDeletes() {
        ResourceTracker tracker = new ResourceTracker(MutableClock.start(), id -> null);

        tracker.record("a", UsageDelta.store(100));
        tracker.record("a", UsageDelta.store(50));
        tracker.record("a", UsageDelta.delete(100));

        UsageRecord r = tracker.snapshot("a");
        assertEquals(50, r.bytesUsed());
        assertEquals(1, r.fileCount());
        assertEquals(150, r.bytesTransferredInWindow());
        assertEquals(2, r.requestCountInWindow());
    }

    @Test
    void shouldNeverGoBelowZero() {
        ResourceTracker tracker = new ResourceTracker(MutableClock.start(), id -> null);

        tracker.record("a", 10, 1, false);
        tracker.record("a", -50, -3, false);

        UsageRecord r = tracker.snapshot("a");
        assertEquals(0, r.bytesUsed());
        assertEquals(0, r.fileCount());
    }

    @Test
    void shouldResetTrafficWindowLazily() {
        MutableClock clock = MutableClock.start();
        ResourceTracker tracker = new ResourceTracker(clock, id -> Duration.ofSeconds(10));

        tracker.record("a", 500, 0, true);
        clock.plusSeconds(9);
        assertEquals(500, tracker.snapshot("a").bytesTransferredInWindow());

        clock.plusSeconds(1);
        UsageRecord after = tracker.snapshot("a");
        assertEquals(0, after.bytesTransferredInWindow());
        assertEquals(0, after.requestCountInWindow());
        assertEquals(clock.instant(), after.lastResetTime());
    }

    @Test
    void shouldRejectReservationBeyondLimitAndKeepUsage() {
        ResourceTracker tracker = new ResourceTracker(MutableClock.start(), id -> null);
        UsageLimits limits = new UsageLimits(1000, 0, 0, 0);

        Reservation r = tracker.reserve("a", UsageDelta.store(850), limits);
        assertTrue(tracker.commit(r));

        QuotaExceededException e = assertThrows(QuotaExceededException.class,
                () -> tracker.reserve("a", UsageDelta.store(200), limits));
        assertEquals("bytes", e.getDimension());
        assertEquals(1050, e.getProjected());
        assertEquals(850, tracker.snapshot("a").bytesUsed());
        assertEquals(0, tracker.snapshot("a").reservedBytes());
    }

    @Test
    void shouldApplyCommitAndReleaseOnlyOnce() {
        ResourceTracker tracker = new ResourceTracker(MutableClock.start(), id -> null);
        UsageLimits limits = new UsageLimits(100, 0, 0, 0);

        Reservation committed = tracker.reserve("a", UsageDelta.store(40), limits);
        Reservation released = tracker.reserve("a", UsageDelta.store(40), limits);
        assertEquals(80, tracker.snapshot("a").projectedBytes());

        assertTrue(tracker.commit(committed));
        assertFalse(tracker.commit(committed));
        assertFalse(tracker.release(committed));
        assertTrue(tracker.release(released));
        assertFalse(tracker.commit(released));

        UsageRecord r = tracker.snapshot("a");
        assertEquals(40, r.bytesUsed());
        assertEquals(0, r.reservedBytes());
    }

    @Test
    void shouldCountReservedBytesAgainstLimit() {
        ResourceTracker tracker = new ResourceTracker(MutableClock.start(), id -> null);
        UsageLimits limits = new UsageLimits(100, 0, 0, 0);

        tracker.reserve("a", UsageDelta.store(60), limits);
        assertThrows(QuotaExceededException.class, () -> tracker.reserve("a", UsageDelta.store(60), limits));
    }

    @Test
    void shouldLimitRequestsPerWindow() {
        MutableClock clock = MutableClock.start();
        ResourceTracker tracker = new ResourceTracker(clock, id -> Duration.ofMinutes(1));
        UsageLimits limits = new UsageLimits(0, 0, 0, 2);

        tracker.commit(tracker.reserve("a", UsageDelta.read(1), limits));
        tracker.commit(tracker.reserve("a", UsageDelta.read(1), limits));
        QuotaExceededException e = assertThrows(QuotaExceededException.class,
                () -> tracker.reserve("a", UsageDelta.read(1), limits));
        assertTrue(e.isTraffic());

        clock.plusSeconds(60);
        tracker.commit(tracker.reserve("a", UsageDelta.read(1), limits));
        assertEquals(1, tracker.snapshot("a").requestCountInWindow());
    }

    @Test
    void shouldNeverExceedMaxBytesUnderConcurrentReservations() throws Exception {
        ResourceTracker tracker = new ResourceTracker(MutableClock.start(), id -> null);
        long maxBytes = 10_000;
        UsageLimits limits = new UsageLimits(maxBytes, 0, 0, 0);
        AtomicLong peak = new AtomicLong();
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            long seed = 42L + t;
            futures.add(pool.submit(() -> {
                Random random = new Random(seed);
                start.await();
                for (int i = 0; i < 2_000; i++) {
                    try {
                        Reservation r = tracker.reserve("a", UsageDelta.store(1 + random.nextInt(700)), limits);
                        UsageRecord seen = tracker.snapshot("a");
                        peak.accumulateAndGet(seen.projectedBytes(), Math::max);
                        if (random.nextBoolean()) {
                            tracker.commit(r);
                            if (random.nextInt(3) == 0) {
                                tracker.record("a", UsageDelta.delete(r.delta().bytes()));
                            }
                        } else {
                            tracker.release(r);
                        }
                    } catch (QuotaExceededException expected) {
                        tracker.record("a", UsageDelta.delete(random.nextInt(2_000)));
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        UsageRecord end = tracker.snapshot("a");
        assertTrue(peak.get() <= maxBytes, "peak " + peak.get());
        assertTrue(end.bytesUsed() <= maxBytes);
        assertEquals(0, end.reservedBytes());
    }
}
