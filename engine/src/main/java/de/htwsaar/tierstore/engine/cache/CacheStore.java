package de.htwsaar.tierstore.engine.cache;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Einträge einer einzelnen Tier mit laufender Byte-Summe.
 *
 * <p>Nicht thread-sicher; der {@link TieredCacheManager} synchronisiert auf die Tier.</p>
 */
final class CacheStore {

    private final Map<String, CacheNode> map = new HashMap<>();
    private long usedBytes;

    CacheNode get(String objectId) {
        return map.get(objectId);
    }

    void put(CacheNode node) {
        CacheNode previous = map.put(node.objectId, node);
        if (previous != null) {
            usedBytes -= previous.sizeBytes;
        }
        usedBytes += node.sizeBytes;
    }

    CacheNode remove(String objectId) {
        CacheNode removed = map.remove(objectId);
        if (removed != null) {
            usedBytes -= removed.sizeBytes;
        }
        return removed;
    }

    long usedBytes() {
        return usedBytes;
    }

    int size() {
        return map.size();
    }

    long evictableBytes() {
        long sum = 0;
        for (CacheNode n : map.values()) {
            if (!n.pinned) {
                sum += n.sizeBytes;
            }
        }
        return sum;
    }

    /**
     * @return ungepinnte Einträge in Verdrängungsreihenfolge
     */
    List<CacheNode> victims(Comparator<CacheNode> order) {
        List<CacheNode> out = new ArrayList<>();
        for (CacheNode n : map.values()) {
            if (!n.pinned) {
                out.add(n);
            }
        }
        out.sort(order);
        return out;
    }

    List<CacheEntry> snapshot(String tierName) {
        List<CacheEntry> out = new ArrayList<>(map.size());
        for (CacheNode n : map.values()) {
            out.add(n.snapshot(tierName));
        }
        out.sort(Comparator.comparing(CacheEntry::objectId));
        return out;
    }
}
