package de.htwsaar.tierstore.engine.policy;

/**
 * Die fünf Policy-Varianten. Pro Backend ist je Variante höchstens eine Policy aktiv.
 */
public enum PolicyKind {
    STORAGE_QUOTA,
    TRAFFIC_QUOTA,
    REPLICATION,
    RETENTION,
    CACHE
}
