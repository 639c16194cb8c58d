package de.htwsaar.tierstore.engine.usage;

/**
 * Ausstehende Nutzung, die später übernommen oder verworfen wird.
 *
 * @param id        eindeutige ID
 * @param backendId Backend
 * @param delta     reservierte Änderung
 */
public record Reservation(long id, String backendId, UsageDelta delta) {}
