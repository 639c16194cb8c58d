package de.htwsaar.tierstore.engine.domain;

/**
 * Ein Backend-Aufruf über den {@link BackendAdapter}-Port ist fehlgeschlagen.
 * Replikation wiederholt solche Fehler begrenzt; Quota und Cache werten sie als
 * "Kapazität unbekannt" und zählen nichts als Nutzung.
 */
public class AdapterException extends TierStoreException {

    private final String backendId;

    public AdapterException(String backendId, String message) {
        super(message, 502);
        this.backendId = backendId;
    }

    public AdapterException(String backendId, String message, Throwable cause) {
        super(message, 502, cause);
        this.backendId = backendId;
    }

    protected AdapterException(String backendId, String message, int statusCode) {
        super(message, statusCode);
        this.backendId = backendId;
    }

    public String getBackendId() {
        return backendId;
    }
}
