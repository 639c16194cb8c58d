package de.htwsaar.tierstore.engine.policy;

import de.htwsaar.tierstore.engine.domain.TierStoreException;

/**
 * Ungültige Konfiguration; wird vor jeder Zustandsänderung geworfen.
 */
public class InvalidPolicyException extends TierStoreException {

    public InvalidPolicyException(String message) {
        super(message, 400);
    }
}
