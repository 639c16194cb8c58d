package de.htwsaar.tierstore.engine.cache;

/**
 * Ergebnis der Platzierungsbewertung eines Eintrags.
 */
public enum PlacementDecision {
    KEEP,
    PROMOTE,
    DEMOTE,
    EVICT
}
