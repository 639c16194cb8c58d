package de.htwsaar.tierstore.engine.domain;

public class UnknownBackendException extends TierStoreException {

    public UnknownBackendException(String backendId) {
        super("Unknown backend: " + backendId, 404);
    }
}
