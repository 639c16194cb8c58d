package de.htwsaar.tierstore.engine.cache;

import java.util.Comparator;

/**
 * Auswahl des nächsten Verdrängungsopfers innerhalb einer Tier.
 */
public enum ReplacementStrategy {

    /** Ältester Zugriff zuerst; Gleichstand: wenigste Zugriffe. */
    LRU(Comparator.comparingLong((CacheNode n) -> n.lastAccessTime)
            .thenComparingLong(n -> n.accessCount)
            .thenComparing(n -> n.objectId)),

    /** Wenigste Zugriffe zuerst; Gleichstand: ältester Zugriff. */
    LFU(Comparator.comparingLong((CacheNode n) -> n.accessCount)
            .thenComparingLong(n -> n.lastAccessTime)
            .thenComparing(n -> n.objectId));

    private final Comparator<CacheNode> victimOrder;

    ReplacementStrategy(Comparator<CacheNode> victimOrder) {
        this.victimOrder = victimOrder;
    }

    Comparator<CacheNode> victimOrder() {
        return victimOrder;
    }
}
