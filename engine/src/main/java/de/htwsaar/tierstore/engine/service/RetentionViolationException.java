package de.htwsaar.tierstore.engine.service;

import de.htwsaar.tierstore.engine.domain.TierStoreException;

/**
 * Löschen verstößt gegen die Retention-Policy (Legal Hold oder Mindestalter).
 */
public class RetentionViolationException extends TierStoreException {

    public RetentionViolationException(String message) {
        super(message, 409);
    }
}
