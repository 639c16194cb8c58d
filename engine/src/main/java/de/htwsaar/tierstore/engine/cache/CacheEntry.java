package de.htwsaar.tierstore.engine.cache;

/**
 * Unveränderliche Sicht auf einen Cache-Eintrag.
 *
 * @param objectId       Objekt-ID
 * @param tier           Name der Tier
 * @param sizeBytes      Größe in Bytes
 * @param lastAccessTime letzter Zugriff in Epoch-Millisekunden
 * @param accessCount    Zugriffe seit Platzierung in dieser Tier-Linie
 * @param pinned         gepinnt, nie verdrängt
 */
public record CacheEntry(
        String objectId, String tier, long sizeBytes, long lastAccessTime, long accessCount, boolean pinned) {}
