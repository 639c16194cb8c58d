package de.htwsaar.tierstore.engine.cache;

import java.time.Clock;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Zähler des gestuften Caches: Treffer, Fehlzugriffe, Beförderungen, Herabstufungen,
 * Verdrängungen sowie Zugriffe im gleitenden Zeitfenster.
 *
 * <p>Die Werte liegen nur im Speicher der laufenden Instanz.</p>
 */
public class CacheMetricsService {

    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);
    private final AtomicLong promotions = new AtomicLong(0);
    private final AtomicLong demotions = new AtomicLong(0);
    private final AtomicLong evictions = new AtomicLong(0);
    private final Deque<Long> accessTimestampsMs = new ConcurrentLinkedDeque<>();
    private final Clock clock;

    /**
     * @param clock Zeitquelle
     */
    public CacheMetricsService(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void recordHit() {
        hits.incrementAndGet();
        accessTimestampsMs.addLast(clock.millis());
    }

    public void recordMiss() {
        misses.incrementAndGet();
        accessTimestampsMs.addLast(clock.millis());
    }

    public void recordPromotion() {
        promotions.incrementAndGet();
    }

    public void recordDemotion() {
        demotions.incrementAndGet();
    }

    public void recordEviction() {
        evictions.incrementAndGet();
    }

    /**
     * Liefert eine Momentaufnahme.
     *
     * @param windowSeconds Zeitfenster für die Zugriffszahl
     * @param tiers         aktuelle Belegung je Tier
     * @return Snapshot
     */
    public CacheStatsSnapshot snapshot(int windowSeconds, List<TierUsage> tiers) {
        int safeWindow = Math.max(1, windowSeconds);
        purgeOldAccesses(clock.millis(), safeWindow);

        long h = hits.get();
        long m = misses.get();
        long total = h + m;
        double hitRatio = total == 0 ? 0.0 : (double) h / total;

        return new CacheStatsSnapshot(
                h, m, hitRatio, promotions.get(), demotions.get(), evictions.get(),
                accessTimestampsMs.size(), List.copyOf(tiers));
    }

    private void purgeOldAccesses(long nowMs, int windowSeconds) {
        long threshold = nowMs - (windowSeconds * 1000L);
        while (true) {
            Long first = accessTimestampsMs.peekFirst();
            if (first == null || first >= threshold) {
                break;
            }
            accessTimestampsMs.pollFirst();
        }
    }

    /**
     * Belegung einer Tier.
     *
     * @param name          Tier-Name
     * @param capacityBytes Kapazität
     * @param usedBytes     belegte Bytes
     * @param entries       Anzahl Einträge
     */
    public record TierUsage(String name, long capacityBytes, long usedBytes, int entries) {}

    /**
     * Unveränderlicher Snapshot der Cache-Metriken.
     *
     * @param hits              Treffer seit Start
     * @param misses            Fehlzugriffe seit Start
     * @param hitRatio          Trefferquote zwischen 0 und 1
     * @param promotions        Beförderungen
     * @param demotions         Herabstufungen
     * @param evictions         Verdrängungen aus der letzten Tier
     * @param accessesPerWindow Zugriffe im Zeitfenster
     * @param tiers             Belegung je Tier, schnellste zuerst
     */
    public record CacheStatsSnapshot(
            long hits,
            long misses,
            double hitRatio,
            long promotions,
            long demotions,
            long evictions,
            long accessesPerWindow,
            List<TierUsage> tiers) {}
}
