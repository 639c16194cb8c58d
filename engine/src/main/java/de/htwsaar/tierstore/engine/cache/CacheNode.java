package de.htwsaar.tierstore.engine.cache;

/**
 * Veränderlicher Eintrag; nur unter dem Lock der besitzenden Tier oder, während einer
 * Herabstufung, unter dem Objekt-Lock verändert.
 */
final class CacheNode {

    final String objectId;
    final long sizeBytes;
    long lastAccessTime;
    long accessCount;
    boolean pinned;

    CacheNode(String objectId, long sizeBytes, long nowMs) {
        this.objectId = objectId;
        this.sizeBytes = sizeBytes;
        this.lastAccessTime = nowMs;
        this.accessCount = 1;
    }

    void touch(long nowMs) {
        lastAccessTime = Math.max(lastAccessTime, nowMs);
        accessCount++;
    }

    /**
     * Ersatzknoten nach einer Größenänderung des Objekts; Zähler und Pin bleiben erhalten.
     */
    CacheNode resizedTo(long newSize, long nowMs) {
        CacheNode next = new CacheNode(objectId, newSize, Math.max(lastAccessTime, nowMs));
        next.accessCount = accessCount + 1;
        next.pinned = pinned;
        return next;
    }

    CacheEntry snapshot(String tierName) {
        return new CacheEntry(objectId, tierName, sizeBytes, lastAccessTime, accessCount, pinned);
    }
}
