package de.htwsaar.tierstore.common.serialization;

public class TierStoreSerializationException extends RuntimeException {

    public TierStoreSerializationException(String message) {
        super(message);
    }

    public TierStoreSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
