package de.htwsaar.tierstore.engine.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Katalogeintrag eines gespeicherten Objekts.
 *
 * @param objectId       Objekt-ID
 * @param sizeBytes      Größe in Bytes
 * @param primaryBackend Backend of Record
 * @param storedAt       Zeitpunkt der ersten Speicherung
 */
public record ObjectRecord(String objectId, long sizeBytes, String primaryBackend, Instant storedAt) {

    public ObjectRecord {
        Objects.requireNonNull(objectId, "objectId must not be null");
        Objects.requireNonNull(primaryBackend, "primaryBackend must not be null");
        Objects.requireNonNull(storedAt, "storedAt must not be null");
    }
}
