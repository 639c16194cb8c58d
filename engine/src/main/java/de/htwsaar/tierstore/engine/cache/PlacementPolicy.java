package de.htwsaar.tierstore.engine.cache;

import java.util.List;

/**
 * Reine Entscheidungsfunktion über Eintrag und Tier-Grenzen, ohne I/O.
 */
public final class PlacementPolicy {

    private PlacementPolicy() {}

    /**
     * Bewertet einen Eintrag.
     *
     * <ul>
     *   <li>PROMOTE: nicht in der schnellsten Tier und {@code accessCount} erreicht die
     *       Beförderungsschwelle der nächstschnelleren Tier.</li>
     *   <li>DEMOTE / EVICT: ungepinnt und länger als {@code demoteAfter} der eigenen Tier
     *       ohne Zugriff; in der letzten Tier bedeutet das Verdrängung.</li>
     *   <li>sonst KEEP.</li>
     * </ul>
     *
     * @param entry     Eintrag
     * @param tierIndex Index der Tier des Eintrags (0 = schnellste)
     * @param tiers     Tiers, schnellste zuerst
     * @param nowMs     aktuelle Zeit in ms
     * @return Entscheidung
     */
    public static PlacementDecision decide(CacheEntry entry, int tierIndex, List<CacheTier> tiers, long nowMs) {
        if (tierIndex < 0 || tierIndex >= tiers.size()) {
            throw new IllegalArgumentException("tierIndex out of range: " + tierIndex);
        }
        if (tierIndex > 0 && entry.accessCount() >= tiers.get(tierIndex - 1).promoteThreshold()) {
            return PlacementDecision.PROMOTE;
        }
        CacheTier tier = tiers.get(tierIndex);
        if (!entry.pinned() && tier.demotes() && nowMs - entry.lastAccessTime() >= tier.demoteAfter().toMillis()) {
            return tierIndex == tiers.size() - 1 ? PlacementDecision.EVICT : PlacementDecision.DEMOTE;
        }
        return PlacementDecision.KEEP;
    }
}
