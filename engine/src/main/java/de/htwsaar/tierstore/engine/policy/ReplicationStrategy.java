package de.htwsaar.tierstore.engine.policy;

/**
 * Auswahlstrategie für Replikationsziele.
 */
public enum ReplicationStrategy {
    /** Bevorzugte Backends strikt in deklarierter Reihenfolge. */
    SIMPLE,
    /** Zuerst je Region ein Backend, danach weitere in deklarierter Reihenfolge. */
    GEO_AWARE
}
