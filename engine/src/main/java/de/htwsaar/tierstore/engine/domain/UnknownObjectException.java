package de.htwsaar.tierstore.engine.domain;

public class UnknownObjectException extends TierStoreException {

    public UnknownObjectException(String objectId) {
        super("Unknown object: " + objectId, 404);
    }
}
