package de.htwsaar.tierstore.engine.domain;

import java.util.OptionalLong;

/**
 * Port zur Abstraktion eines Speicher-Backends.
 * Die Engine kennt kein Protokoll; Adapter werden vom umgebenden System pro Backend geliefert.
 * Alle Methoden signalisieren Fehler über {@link AdapterException}.
 */
public interface BackendAdapter {

    /**
     * Speichert ein Objekt.
     *
     * @param objectId Objekt-ID
     * @param content  Inhalt
     * @return gespeicherte Größe in Bytes
     */
    long put(String objectId, byte[] content);

    /**
     * Lädt ein Objekt.
     *
     * @param objectId Objekt-ID
     * @return Inhalt
     * @throws UnknownObjectException wenn das Objekt dort nicht liegt
     */
    byte[] get(String objectId);

    /**
     * Löscht ein Objekt. Nicht vorhandene Objekte gelten als gelöscht.
     *
     * @param objectId Objekt-ID
     */
    void delete(String objectId);

    /**
     * Liefert die Größe eines Objekts.
     *
     * @param objectId Objekt-ID
     * @return Größe in Bytes oder leer, wenn nicht vorhanden
     */
    OptionalLong stat(String objectId);
}
