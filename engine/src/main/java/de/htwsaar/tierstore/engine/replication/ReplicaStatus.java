package de.htwsaar.tierstore.engine.replication;

/**
 * Zustand einer einzelnen Kopie.
 */
public enum ReplicaStatus {
    PENDING,
    VERIFIED,
    FAILED
}
