package de.htwsaar.tierstore.engine.domain;

/**
 * Kostenklasse eines Backends, von schnell/teuer bis langsam/günstig.
 */
public enum CostTier {
    HOT,
    WARM,
    COLD,
    ARCHIVE
}
