package de.htwsaar.tierstore.engine.cache;

/**
 * Wird benachrichtigt, wenn ein Eintrag die letzte Tier verlässt.
 */
@FunctionalInterface
public interface CacheEvictionListener {

    /**
     * @param objectId  verdrängtes Objekt
     * @param sizeBytes Größe des Eintrags
     */
    void onEvicted(String objectId, long sizeBytes);
}
