package de.htwsaar.tierstore.engine.violation;

/**
 * Schwere eines Policy-Verstoßes.
 */
public enum Severity {
    WARN,
    CRITICAL
}
