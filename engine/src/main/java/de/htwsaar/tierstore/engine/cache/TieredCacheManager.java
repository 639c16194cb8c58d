package de.htwsaar.tierstore.engine.cache;

import de.htwsaar.tierstore.engine.cache.CacheMetricsService.CacheStatsSnapshot;
import de.htwsaar.tierstore.engine.cache.CacheMetricsService.TierUsage;
import de.htwsaar.tierstore.engine.policy.CachePolicy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gestufter Cache über geordnete Tiers (schnellste/kleinste zuerst).
 *
 * <p>Locking: ein Lock je Tier plus gestreifte Objekt-Locks. Reihenfolge ist immer
 * Objekt-Lock vor Tier-Lock; zwei Tier-Locks werden nie gleichzeitig gehalten.
 * Verdrängte Einträge einer nicht-letzten Tier wandern über {@code inTransit} in die
 * nächstlangsamere Tier; diese Herabstufung läuft nach dem Freigeben aller Locks auf dem
 * {@code demotionExecutor}. Ein Objekt liegt zu jedem Zeitpunkt in höchstens einer Tier.</p>
 */
public class TieredCacheManager {

    private static final Logger log = LoggerFactory.getLogger(TieredCacheManager.class);

    private static final int LOCK_STRIPES = 64;
    private static final int STATS_WINDOW_SECONDS = 60;

    private final List<TierSlot> slots;
    private final ReplacementStrategy strategy;
    private final Clock clock;
    private final Executor demotionExecutor;
    private final CacheMetricsService metrics;

    private final Map<String, Integer> locations = new ConcurrentHashMap<>();
    private final Map<String, PendingDemotion> inTransit = new ConcurrentHashMap<>();
    private final Object[] objectLocks = new Object[LOCK_STRIPES];
    private final List<CacheEvictionListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * @param tiers            Tiers, schnellste zuerst (mindestens eine, eindeutige Namen)
     * @param strategy         Verdrängungsreihenfolge innerhalb einer Tier
     * @param clock            Zeitquelle
     * @param demotionExecutor führt Herabstufungen und Listener-Benachrichtigungen aus
     * @param metrics          Zähler
     */
    public TieredCacheManager(
            List<CacheTier> tiers,
            ReplacementStrategy strategy,
            Clock clock,
            Executor demotionExecutor,
            CacheMetricsService metrics) {
        Objects.requireNonNull(tiers, "tiers must not be null");
        if (tiers.isEmpty()) {
            throw new IllegalArgumentException("at least one cache tier required");
        }
        Set<String> names = new HashSet<>();
        List<TierSlot> built = new ArrayList<>();
        for (CacheTier t : tiers) {
            if (!names.add(t.name())) {
                throw new IllegalArgumentException("duplicate tier name " + t.name());
            }
            built.add(new TierSlot(t));
        }
        this.slots = List.copyOf(built);
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.demotionExecutor = Objects.requireNonNull(demotionExecutor, "demotionExecutor must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        for (int i = 0; i < LOCK_STRIPES; i++) {
            objectLocks[i] = new Object();
        }
    }

    public void addEvictionListener(CacheEvictionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Registriert einen Zugriff.
     *
     * <p>Bekannte Einträge werden aktualisiert und bei Erreichen der Schwelle der
     * nächstschnelleren Tier befördert. Neue Einträge landen in der langsamsten Tier mit
     * freiem Platz; gibt es keine, wird in der langsamsten Tier verdrängt.</p>
     *
     * @param objectId  Objekt-ID
     * @param sizeBytes Größe des Objekts
     * @return Eintrag nach dem Zugriff
     * @throws TierFullException wenn nichts verdrängbar ist oder das Objekt in keine Tier passt
     */
    public CacheEntry access(String objectId, long sizeBytes) {
        requireId(objectId);
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must not be negative");
        }
        List<Runnable> followUps = new ArrayList<>();
        try {
            synchronized (lockFor(objectId)) {
                return accessLocked(objectId, sizeBytes, followUps);
            }
        } finally {
            dispatch(followUps);
        }
    }

    /**
     * Verdrängt aus einer Tier, solange sie über Kapazität liegt. Innerhalb der Kapazität
     * passiert nichts.
     *
     * @param tierName Tier
     * @return Anzahl verdrängter Einträge
     */
    public int evict(String tierName) {
        int index = indexOf(tierName);
        List<Runnable> followUps = new ArrayList<>();
        try {
            TierSlot slot = slots.get(index);
            synchronized (slot) {
                return shrinkToCapacity(index, followUps);
            }
        } finally {
            dispatch(followUps);
        }
    }

    /**
     * Wendet Leerlauf-Entscheidungen (DEMOTE/EVICT) auf alle Tiers an.
     *
     * @return Anzahl bewegter oder verdrängter Einträge
     */
    public int sweep() {
        long now = clock.millis();
        List<CacheTier> tiers = tiers();
        int moved = 0;
        for (int i = 0; i < slots.size(); i++) {
            List<CacheEntry> entries;
            TierSlot slot = slots.get(i);
            synchronized (slot) {
                entries = slot.store.snapshot(slot.tier.name());
            }
            for (CacheEntry e : entries) {
                PlacementDecision d = PlacementPolicy.decide(e, i, tiers, now);
                if ((d == PlacementDecision.DEMOTE || d == PlacementDecision.EVICT) && moveDown(e.objectId(), i)) {
                    moved++;
                }
            }
        }
        if (moved > 0) {
            log.debug("Cache sweep moved {} idle entries", moved);
        }
        return moved;
    }

    /**
     * Stuft einen Eintrag um eine Tier herab; aus der letzten Tier wird er verdrängt.
     *
     * @return {@code true} wenn der Eintrag bewegt wurde
     */
    public boolean demote(String objectId) {
        requireId(objectId);
        Integer index = locations.get(objectId);
        return index != null && moveDown(objectId, index);
    }

    /**
     * Pinnt einen Eintrag; gepinnte Einträge werden nie verdrängt.
     *
     * @return {@code false} wenn das Objekt nicht im Cache liegt
     */
    public boolean pin(String objectId) {
        return setPinned(objectId, true);
    }

    public boolean unpin(String objectId) {
        return setPinned(objectId, false);
    }

    /**
     * Entfernt ein Objekt aus dem Cache, ohne Listener zu benachrichtigen.
     *
     * @return {@code true} wenn ein Eintrag entfernt wurde
     */
    public boolean remove(String objectId) {
        requireId(objectId);
        synchronized (lockFor(objectId)) {
            boolean removed = inTransit.remove(objectId) != null;
            Integer index = locations.get(objectId);
            if (index != null) {
                TierSlot slot = slots.get(index);
                synchronized (slot) {
                    removed |= slot.store.remove(objectId) != null;
                    locations.remove(objectId);
                }
            }
            return removed;
        }
    }

    /**
     * @return Eintrag oder leer, wenn das Objekt in keiner Tier liegt
     */
    public Optional<CacheEntry> lookup(String objectId) {
        requireId(objectId);
        synchronized (lockFor(objectId)) {
            Integer index = locations.get(objectId);
            if (index == null) {
                return Optional.empty();
            }
            TierSlot slot = slots.get(index);
            synchronized (slot) {
                CacheNode node = slot.store.get(objectId);
                return node == null ? Optional.empty() : Optional.of(node.snapshot(slot.tier.name()));
            }
        }
    }

    public List<CacheEntry> entries(String tierName) {
        TierSlot slot = slots.get(indexOf(tierName));
        synchronized (slot) {
            return slot.store.snapshot(slot.tier.name());
        }
    }

    public long usedBytes(String tierName) {
        TierSlot slot = slots.get(indexOf(tierName));
        synchronized (slot) {
            return slot.store.usedBytes();
        }
    }

    /**
     * @return aktuelle Tier-Definitionen, schnellste zuerst
     */
    public List<CacheTier> tiers() {
        List<CacheTier> out = new ArrayList<>(slots.size());
        for (TierSlot slot : slots) {
            out.add(slot.tier);
        }
        return out;
    }

    public boolean hasTier(String tierName) {
        return slots.stream().anyMatch(s -> s.tier.name().equals(tierName));
    }

    /**
     * Bewertet einen Eintrag gegen die aktuellen Tiers.
     */
    public PlacementDecision decide(CacheEntry entry, long nowMs) {
        return PlacementPolicy.decide(entry, indexOf(entry.tier()), tiers(), nowMs);
    }

    /**
     * Tauscht die Grenzen einer Tier; bei Verkleinerung wird sofort verdrängt.
     *
     * @param tierName Tier
     * @param policy   neue Cache-Policy des zugehörigen Backends
     */
    public void reconfigureTier(String tierName, CachePolicy policy) {
        int index = indexOf(tierName);
        List<Runnable> followUps = new ArrayList<>();
        try {
            TierSlot slot = slots.get(index);
            synchronized (slot) {
                slot.tier = CacheTier.from(tierName, policy);
                int evicted = shrinkToCapacity(index, followUps);
                log.info("Cache tier {} reconfigured: capacity={} promoteThreshold={} demoteAfter={} (evicted {})",
                        tierName, policy.tierCapacityBytes(), policy.promoteThreshold(), policy.demoteAfter(), evicted);
            }
        } finally {
            dispatch(followUps);
        }
    }

    public CacheStatsSnapshot stats() {
        List<TierUsage> usage = new ArrayList<>(slots.size());
        for (TierSlot slot : slots) {
            synchronized (slot) {
                usage.add(new TierUsage(
                        slot.tier.name(), slot.tier.capacityBytes(), slot.store.usedBytes(), slot.store.size()));
            }
        }
        return metrics.snapshot(STATS_WINDOW_SECONDS, usage);
    }

    // ---- intern ----

    private CacheEntry accessLocked(String objectId, long sizeBytes, List<Runnable> followUps) {
        long now = clock.millis();

        while (true) {
            Integer index = locations.get(objectId);
            if (index == null) {
                break;
            }
            TierSlot slot = slots.get(index);
            CacheEntry touched = null;
            CacheNode resized = null;
            synchronized (slot) {
                CacheNode node = slot.store.get(objectId);
                if (node != null && node.sizeBytes != sizeBytes) {
                    slot.store.remove(objectId);
                    locations.remove(objectId);
                    resized = node.resizedTo(sizeBytes, now);
                } else if (node != null) {
                    node.touch(now);
                    touched = node.snapshot(slot.tier.name());
                }
            }
            if (resized != null) {
                // neue Größe: wie eine Neuplatzierung ab der bisherigen Tier behandeln
                metrics.recordHit();
                return placeFrom(index, resized, followUps)
                        .orElseThrow(() -> new TierFullException("no cache tier can hold " + objectId
                                + " at its new size of " + sizeBytes + " bytes"));
            }
            if (touched == null) {
                // gerade verdrängt; Ort neu lesen
                continue;
            }
            metrics.recordHit();
            return maybePromote(objectId, index, touched, now, followUps);
        }

        PendingDemotion pending = inTransit.remove(objectId);
        if (pending != null) {
            metrics.recordHit();
            CacheNode node = pending.node();
            if (node.sizeBytes != sizeBytes) {
                node = node.resizedTo(sizeBytes, now);
            } else {
                node.touch(now);
            }
            return placeFrom(pending.targetIndex(), node, followUps)
                    .orElseThrow(() -> new TierFullException("no cache tier can hold " + objectId));
        }

        metrics.recordMiss();
        CacheNode node = new CacheNode(objectId, sizeBytes, now);
        for (int i = slots.size() - 1; i >= 0; i--) {
            TierSlot slot = slots.get(i);
            synchronized (slot) {
                if (slot.store.usedBytes() + sizeBytes <= slot.tier.capacityBytes()) {
                    slot.store.put(node);
                    locations.put(objectId, i);
                    return node.snapshot(slot.tier.name());
                }
            }
        }
        int last = slots.size() - 1;
        if (!tryInsert(last, node, followUps)) {
            throw new TierFullException("no evictable space for " + objectId + " (" + sizeBytes + " bytes)");
        }
        return snapshotOf(last, node);
    }

    private CacheEntry maybePromote(
            String objectId, int index, CacheEntry entry, long now, List<Runnable> followUps) {
        if (PlacementPolicy.decide(entry, index, tiers(), now) != PlacementDecision.PROMOTE) {
            return entry;
        }
        TierSlot source = slots.get(index);
        CacheNode node;
        synchronized (source) {
            node = source.store.remove(objectId);
            if (node == null) {
                return entry;
            }
            locations.remove(objectId);
        }
        if (tryInsert(index - 1, node, followUps)) {
            metrics.recordPromotion();
            log.debug("Promoted {} to tier {}", objectId, slots.get(index - 1).tier.name());
            return snapshotOf(index - 1, node);
        }
        // Kein Platz in der schnelleren Tier: zurück an den alten Ort.
        return placeFrom(index, node, followUps).orElse(entry);
    }

    /**
     * Legt den Eintrag in die erste Tier ab {@code start}, die ihn aufnehmen kann. Gepinnte
     * Einträge dürfen danach auch in schnellere Tiers zurück. Passt er nirgends, gilt er als
     * verdrängt.
     */
    private Optional<CacheEntry> placeFrom(int start, CacheNode node, List<Runnable> followUps) {
        for (int i = start; i < slots.size(); i++) {
            if (tryInsert(i, node, followUps)) {
                return Optional.of(snapshotOf(i, node));
            }
        }
        if (node.pinned) {
            for (int i = Math.min(start, slots.size()) - 1; i >= 0; i--) {
                if (tryInsert(i, node, followUps)) {
                    return Optional.of(snapshotOf(i, node));
                }
            }
            log.warn("No cache tier has room for pinned {} ({} bytes)", node.objectId, node.sizeBytes);
        }
        metrics.recordEviction();
        followUps.add(() -> notifyEvicted(node.objectId, node.sizeBytes));
        return Optional.empty();
    }

    private boolean tryInsert(int index, CacheNode node, List<Runnable> followUps) {
        TierSlot slot = slots.get(index);
        synchronized (slot) {
            if (node.sizeBytes > slot.tier.capacityBytes() || !makeRoom(index, node.sizeBytes, followUps)) {
                return false;
            }
            slot.store.put(node);
            locations.put(node.objectId, index);
            return true;
        }
    }

    /**
     * Schafft Platz für {@code needed} Bytes oder verdrängt gar nichts. Aufrufer hält den Tier-Lock.
     */
    private boolean makeRoom(int index, long needed, List<Runnable> followUps) {
        TierSlot slot = slots.get(index);
        long capacity = slot.tier.capacityBytes();
        long used = slot.store.usedBytes();
        if (used + needed <= capacity) {
            return true;
        }
        if (used - slot.store.evictableBytes() + needed > capacity) {
            return false;
        }
        for (CacheNode victim : slot.store.victims(strategy.victimOrder())) {
            if (used + needed <= capacity) {
                break;
            }
            displace(index, victim, followUps);
            used -= victim.sizeBytes;
        }
        return true;
    }

    /** Aufrufer hält den Tier-Lock. */
    private int shrinkToCapacity(int index, List<Runnable> followUps) {
        TierSlot slot = slots.get(index);
        int evicted = 0;
        for (CacheNode victim : slot.store.victims(strategy.victimOrder())) {
            if (slot.store.usedBytes() <= slot.tier.capacityBytes()) {
                break;
            }
            displace(index, victim, followUps);
            evicted++;
        }
        return evicted;
    }

    /**
     * Nimmt ein Opfer aus seiner Tier. Aufrufer hält den Tier-Lock, aber nicht den Objekt-Lock
     * des Opfers; deshalb wird {@code inTransit} vor {@code locations} geschrieben.
     */
    private void displace(int index, CacheNode victim, List<Runnable> followUps) {
        slots.get(index).store.remove(victim.objectId);
        if (index < slots.size() - 1) {
            victim.accessCount = 0;
            PendingDemotion pending = new PendingDemotion(victim, index + 1);
            inTransit.put(victim.objectId, pending);
            locations.remove(victim.objectId);
            metrics.recordDemotion();
            followUps.add(() -> completeDemotion(victim.objectId, pending));
        } else {
            locations.remove(victim.objectId);
            metrics.recordEviction();
            followUps.add(() -> notifyEvicted(victim.objectId, victim.sizeBytes));
        }
    }

    private void completeDemotion(String objectId, PendingDemotion pending) {
        List<Runnable> followUps = new ArrayList<>();
        try {
            synchronized (lockFor(objectId)) {
                if (!inTransit.remove(objectId, pending)) {
                    return;
                }
                placeFrom(pending.targetIndex(), pending.node(), followUps)
                        .ifPresent(e -> log.debug("Demoted {} to tier {}", objectId, e.tier()));
            }
        } finally {
            dispatch(followUps);
        }
    }

    private boolean moveDown(String objectId, int expectedIndex) {
        List<Runnable> followUps = new ArrayList<>();
        try {
            synchronized (lockFor(objectId)) {
                Integer index = locations.get(objectId);
                if (index == null || index != expectedIndex) {
                    return false;
                }
                TierSlot slot = slots.get(index);
                CacheNode node;
                synchronized (slot) {
                    node = slot.store.get(objectId);
                    if (node == null || node.pinned) {
                        return false;
                    }
                    slot.store.remove(objectId);
                    locations.remove(objectId);
                }
                if (index == slots.size() - 1) {
                    metrics.recordEviction();
                    followUps.add(() -> notifyEvicted(objectId, node.sizeBytes));
                    return true;
                }
                node.accessCount = 0;
                metrics.recordDemotion();
                placeFrom(index + 1, node, followUps);
                return true;
            }
        } finally {
            dispatch(followUps);
        }
    }

    private boolean setPinned(String objectId, boolean pinned) {
        requireId(objectId);
        synchronized (lockFor(objectId)) {
            Integer index = locations.get(objectId);
            if (index != null) {
                TierSlot slot = slots.get(index);
                synchronized (slot) {
                    CacheNode node = slot.store.get(objectId);
                    if (node != null) {
                        node.pinned = pinned;
                        return true;
                    }
                }
            }
            PendingDemotion pending = inTransit.get(objectId);
            if (pending != null) {
                pending.node().pinned = pinned;
                return true;
            }
            return false;
        }
    }

    private CacheEntry snapshotOf(int index, CacheNode node) {
        TierSlot slot = slots.get(index);
        synchronized (slot) {
            return node.snapshot(slot.tier.name());
        }
    }

    private void notifyEvicted(String objectId, long sizeBytes) {
        log.debug("Evicted {} from last cache tier", objectId);
        for (CacheEvictionListener l : listeners) {
            try {
                l.onEvicted(objectId, sizeBytes);
            } catch (RuntimeException e) {
                log.warn("Eviction listener failed for {}: {}", objectId, e.toString());
            }
        }
    }

    private void dispatch(List<Runnable> followUps) {
        for (Runnable task : followUps) {
            try {
                demotionExecutor.execute(task);
            } catch (RejectedExecutionException e) {
                task.run();
            }
        }
    }

    private int indexOf(String tierName) {
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).tier.name().equals(tierName)) {
                return i;
            }
        }
        throw new IllegalArgumentException("unknown cache tier " + tierName);
    }

    private Object lockFor(String objectId) {
        return objectLocks[Math.floorMod(objectId.hashCode(), LOCK_STRIPES)];
    }

    private static void requireId(String objectId) {
        if (objectId == null || objectId.isBlank()) {
            throw new IllegalArgumentException("objectId must not be empty");
        }
    }

    /** Tier samt Einträgen; Monitor dieses Objekts ist der Tier-Lock. */
    private static final class TierSlot {
        volatile CacheTier tier;
        final CacheStore store = new CacheStore();

        TierSlot(CacheTier tier) {
            this.tier = tier;
        }
    }

    private record PendingDemotion(CacheNode node, int targetIndex) {}
}
