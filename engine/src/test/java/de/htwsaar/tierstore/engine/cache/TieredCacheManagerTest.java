package de.htwsaar.tierstore.engine.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.htwsaar.tierstore.engine.MutableClock;
import de.htwsaar.tierstore.engine.cache.CacheMetricsService.CacheStatsSnapshot;
import de.htwsaar.tierstore.engine.policy.CachePolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

/** Tests für Platzierung, Beförderung, Herabstufung und Verdrängung im gestuften Cache. */
class TieredCacheManagerTest {

    private final MutableClock clock = MutableClock.start();
    private final List<String> evicted = new ArrayList<>();

    private TieredCacheManager fastSlow() {
        return manager(ReplacementStrategy.LRU,
                new CacheTier("fast", 100, 3, Duration.ZERO),
                new CacheTier("slow", 1000, 1, Duration.ZERO));
    }

    private TieredCacheManager manager(ReplacementStrategy strategy, CacheTier... tiers) {
        TieredCacheManager cache =
                new TieredCacheManager(List.of(tiers), strategy, clock, Runnable::run, new CacheMetricsService(clock));
        cache.addEvictionListener((id, size) -> evicted.add(id));
        return cache;
    }

    private CacheEntry access(TieredCacheManager cache, String id, int times) {
        CacheEntry last = null;
        for (int i = 0; i < times; i++) {
            clock.plusSeconds(1);
            last = cache.access(id, 30);
        }
        return last;
    }

    private static Set<String> ids(List<CacheEntry> entries) {
        return entries.stream().map(CacheEntry::objectId).collect(Collectors.toSet());
    }

    @Test
    void shouldPlaceNewObjectsInSlowestTierWithHeadroom() {
        TieredCacheManager cache = fastSlow();

        CacheEntry e = access(cache, "o1", 1);

        assertEquals("slow", e.tier());
        assertEquals(1, e.accessCount());
        assertEquals(30, cache.usedBytes("slow"));
        assertEquals(0, cache.usedBytes("fast"));
    }

    @Test
    void shouldDemoteLeastRecentlyUsedWhenSixthObjectIsPromoted() {
        TieredCacheManager cache = fastSlow();
        for (int i = 1; i <= 5; i++) {
            access(cache, "o" + i, 1);
        }
        // aufsteigende Zugriffszahlen; ab drei Zugriffen wird nach "fast" befördert
        access(cache, "o1", 2);
        access(cache, "o2", 3);
        access(cache, "o3", 4);
        access(cache, "o4", 5);
        access(cache, "o5", 6);
        assertEquals(Set.of("o3", "o4", "o5"), ids(cache.entries("fast")));

        CacheEntry sixth = access(cache, "o6", 3);

        assertEquals("fast", sixth.tier());
        assertEquals(Set.of("o4", "o5", "o6"), ids(cache.entries("fast")));
        assertEquals(90, cache.usedBytes("fast"));
        CacheEntry demoted = cache.lookup("o3").orElseThrow();
        assertEquals("slow", demoted.tier());
        assertEquals(0, demoted.accessCount());
        assertEquals(Set.of("o1", "o2", "o3"), ids(cache.entries("slow")));
        assertTrue(evicted.isEmpty());

        CacheStatsSnapshot stats = cache.stats();
        assertEquals(6, stats.misses());
        assertEquals(22, stats.hits());
        assertEquals(6, stats.promotions());
        assertEquals(3, stats.demotions());
        assertEquals(0, stats.evictions());
    }

    @Test
    void shouldDoNothingWhenEvictingTierWithinCapacity() {
        TieredCacheManager cache = fastSlow();
        access(cache, "a", 3);
        access(cache, "b", 3);
        List<CacheEntry> before = cache.entries("fast");

        assertEquals(0, cache.evict("fast"));
        assertEquals(0, cache.evict("fast"));
        assertEquals(0, cache.evict("slow"));

        assertEquals(before, cache.entries("fast"));
        assertTrue(evicted.isEmpty());
    }

    @Test
    void shouldEvictImmediatelyWhenTierShrinks() {
        TieredCacheManager cache = fastSlow();
        access(cache, "a", 3);
        access(cache, "b", 3);
        access(cache, "c", 3);

        cache.reconfigureTier("fast", new CachePolicy(60, 3, Duration.ZERO));

        assertEquals(60, cache.usedBytes("fast"));
        assertEquals(Set.of("b", "c"), ids(cache.entries("fast")));
        assertEquals("slow", cache.lookup("a").orElseThrow().tier());
        assertEquals(0, cache.evict("fast"));
    }

    @Test
    void shouldFailWithTierFullWhenOnlyPinnedEntriesRemain() {
        TieredCacheManager cache = manager(ReplacementStrategy.LRU, new CacheTier("only", 60, 1, Duration.ZERO));
        access(cache, "a", 1);
        access(cache, "b", 1);
        assertTrue(cache.pin("a"));
        assertTrue(cache.pin("b"));

        assertThrows(TierFullException.class, () -> access(cache, "c", 1));
        assertTrue(cache.lookup("c").isEmpty());

        assertTrue(cache.unpin("a"));
        access(cache, "c", 1);
        assertEquals(Set.of("b", "c"), ids(cache.entries("only")));
        assertEquals(List.of("a"), evicted);
        assertFalse(cache.pin("a"));
    }

    @Test
    void shouldRejectObjectLargerThanAnyTier() {
        TieredCacheManager cache = fastSlow();
        assertThrows(TierFullException.class, () -> cache.access("huge", 5_000));
    }

    @Test
    void shouldDemoteAndEvictIdleEntriesOnSweep() {
        TieredCacheManager cache = manager(ReplacementStrategy.LRU,
                new CacheTier("fast", 100, 3, Duration.ofSeconds(10)),
                new CacheTier("slow", 1000, 1, Duration.ofSeconds(60)));
        access(cache, "x", 3);
        assertEquals("fast", cache.lookup("x").orElseThrow().tier());

        clock.plusSeconds(11);
        assertEquals(1, cache.sweep());
        assertEquals("slow", cache.lookup("x").orElseThrow().tier());

        clock.plusSeconds(61);
        assertEquals(1, cache.sweep());
        assertTrue(cache.lookup("x").isEmpty());
        assertEquals(List.of("x"), evicted);
    }

    @Test
    void shouldKeepPinnedEntryOnSweep() {
        TieredCacheManager cache = manager(ReplacementStrategy.LRU,
                new CacheTier("only", 100, 1, Duration.ofSeconds(5)));
        access(cache, "p", 1);
        cache.pin("p");

        clock.plusSeconds(60);
        assertEquals(0, cache.sweep());
        assertTrue(cache.lookup("p").isPresent());
    }

    @Test
    void shouldPickLeastFrequentlyUsedVictimWithLfu() {
        TieredCacheManager cache = manager(ReplacementStrategy.LFU, new CacheTier("only", 60, 1, Duration.ZERO));
        access(cache, "often", 1);
        access(cache, "rare", 1);
        access(cache, "often", 3);

        access(cache, "new", 1);

        assertEquals(Set.of("often", "new"), ids(cache.entries("only")));
        assertEquals(List.of("rare"), evicted);
    }

    @Test
    void shouldRemoveEntryWithoutNotifying() {
        TieredCacheManager cache = fastSlow();
        access(cache, "a", 1);

        assertTrue(cache.remove("a"));
        assertFalse(cache.remove("a"));
        assertEquals(0, cache.usedBytes("slow"));
        assertTrue(evicted.isEmpty());
    }

    @Test
    void shouldDemoteOnRequest() {
        TieredCacheManager cache = fastSlow();
        access(cache, "a", 3);

        assertTrue(cache.demote("a"));
        assertEquals("slow", cache.lookup("a").orElseThrow().tier());
        assertTrue(cache.demote("a"));
        assertTrue(cache.lookup("a").isEmpty());
        assertFalse(cache.demote("a"));
    }

    @Test
    void shouldKeepEveryObjectInAtMostOneTierUnderConcurrentAccess() throws Exception {
        ExecutorService demotions = Executors.newFixedThreadPool(2);
        TieredCacheManager cache = new TieredCacheManager(
                List.of(new CacheTier("l1", 200, 2, Duration.ZERO),
                        new CacheTier("l2", 600, 2, Duration.ZERO),
                        new CacheTier("l3", 2000, 1, Duration.ZERO)),
                ReplacementStrategy.LRU, clock, demotions, new CacheMetricsService(clock));
        int threads = 8;
        ExecutorService workers = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            long seed = 7L * (t + 1);
            futures.add(workers.submit(() -> {
                Random random = new Random(seed);
                start.await();
                for (int i = 0; i < 3_000; i++) {
                    String id = "obj-" + random.nextInt(80);
                    int op = random.nextInt(20);
                    try {
                        if (op == 0) {
                            cache.demote(id);
                        } else if (op == 1) {
                            cache.remove(id);
                        } else {
                            cache.access(id, 10 + (id.hashCode() & 31));
                        }
                    } catch (TierFullException ignored) {
                        // erlaubt, wenn die letzte Tier gerade voll ist
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(60, TimeUnit.SECONDS);
        }
        workers.shutdown();
        demotions.shutdown();
        assertTrue(demotions.awaitTermination(10, TimeUnit.SECONDS));

        Set<String> seen = new HashSet<>();
        for (CacheTier tier : cache.tiers()) {
            List<CacheEntry> entries = cache.entries(tier.name());
            long used = entries.stream().mapToLong(CacheEntry::sizeBytes).sum();
            assertEquals(used, cache.usedBytes(tier.name()));
            assertTrue(used <= tier.capacityBytes(), tier.name() + " over capacity: " + used);
            for (CacheEntry e : entries) {
                assertTrue(seen.add(e.objectId()), e.objectId() + " in two tiers");
                assertEquals(tier.name(), cache.lookup(e.objectId()).orElseThrow().tier());
            }
        }
    }

    /**
     * Ändert sich die Objektgröße (Überschreiben), wird der Eintrag mit der neuen Größe neu
     * platziert; die schnelle Tier darf dabei nie über Kapazität laufen.
     */
    @Test
    void shouldReplaceEntryWhenObjectSizeChanges() {
        TieredCacheManager cache = fastSlow();
        access(cache, "b", 3);
        assertEquals("fast", cache.lookup("b").orElseThrow().tier());

        clock.plusSeconds(1);
        CacheEntry grown = cache.access("b", 400);

        assertEquals("slow", grown.tier());
        assertEquals(400, grown.sizeBytes());
        assertEquals(4, grown.accessCount());
        assertEquals(0, cache.usedBytes("fast"));
        assertEquals(400, cache.usedBytes("slow"));

        CacheEntry shrunk = cache.access("b", 20);
        assertEquals("slow", shrunk.tier());
        assertEquals(20, cache.usedBytes("slow"));
        assertTrue(evicted.isEmpty());
    }

    @Test
    void shouldDropEntryThatNoLongerFitsAnyTier() {
        TieredCacheManager cache = fastSlow();
        access(cache, "b", 1);
        cache.pin("b");

        assertThrows(TierFullException.class, () -> cache.access("b", 5_000));

        assertTrue(cache.lookup("b").isEmpty());
        assertEquals(0, cache.usedBytes("slow"));
        assertEquals(List.of("b"), evicted);
    }

    /**
     * Ein Eintrag, der während seiner Herabstufung gepinnt wird, darf nicht verdrängt werden,
     * auch wenn die Zieltier nur gepinnte Einträge hält.
     */
    @Test
    void shouldKeepEntryPinnedWhileInTransit() {
        List<Runnable> queued = new ArrayList<>();
        TieredCacheManager cache = new TieredCacheManager(
                List.of(new CacheTier("fast", 100, 2, Duration.ZERO), new CacheTier("slow", 100, 1, Duration.ZERO)),
                ReplacementStrategy.LRU, clock, queued::add, new CacheMetricsService(clock));
        cache.addEvictionListener((id, size) -> evicted.add(id));
        cache.access("p1", 50);
        cache.access("p2", 50);
        assertTrue(cache.pin("p1"));
        assertTrue(cache.pin("p2"));
        assertEquals("fast", cache.access("x", 50).tier());

        cache.reconfigureTier("fast", new CachePolicy(40, 2, Duration.ZERO));
        assertTrue(cache.lookup("x").isEmpty());
        assertTrue(cache.pin("x"));
        cache.reconfigureTier("fast", new CachePolicy(100, 2, Duration.ZERO));
        List<Runnable> tasks = new ArrayList<>(queued);
        queued.clear();
        tasks.forEach(Runnable::run);

        CacheEntry x = cache.lookup("x").orElseThrow();
        assertEquals("fast", x.tier());
        assertTrue(x.pinned());
        assertTrue(evicted.isEmpty());
        assertEquals(Set.of("p1", "p2"), ids(cache.entries("slow")));
    }
}
