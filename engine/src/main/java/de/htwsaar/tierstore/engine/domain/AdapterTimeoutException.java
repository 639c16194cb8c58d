package de.htwsaar.tierstore.engine.domain;

/**
 * Ein Backend-Aufruf hat seine Zeitschranke überschritten oder wurde abgebrochen.
 */
public class AdapterTimeoutException extends AdapterException {

    public AdapterTimeoutException(String backendId, String message) {
        super(backendId, message, 504);
    }
}
