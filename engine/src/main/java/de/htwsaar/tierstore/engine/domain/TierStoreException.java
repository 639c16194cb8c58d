package de.htwsaar.tierstore.engine.domain;

/**
 * Basis aller fachlichen Engine-Fehler.
 * Jeder Fehler ist auf Objekt, Backend oder Operation begrenzt und nie prozessfatal.
 * Der Web-Layer mappt den Statuscode direkt in die HTTP-Antwort.
 */
public class TierStoreException extends RuntimeException {

    private final int statusCode;

    /**
     * Erstellt eine neue Engine-Exception.
     *
     * @param message    Fehlerbeschreibung
     * @param statusCode gewünschter HTTP-Statuscode
     */
    public TierStoreException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * Erstellt eine neue Engine-Exception mit Ursache.
     *
     * @param message    Fehlerbeschreibung
     * @param statusCode gewünschter HTTP-Statuscode
     * @param cause      ursprünglicher Fehler
     */
    public TierStoreException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * Gibt den zugehörigen HTTP-Statuscode zurück.
     *
     * @return HTTP-Statuscode
     */
    public int getStatusCode() {
        return statusCode;
    }
}
