package de.htwsaar.tierstore.engine.cache;

import de.htwsaar.tierstore.engine.domain.TierStoreException;

/**
 * Kein Platz im Cache: nichts verdrängbar oder Objekt größer als jede Tier.
 * Aufrufer lesen dann direkt vom Backend of Record.
 */
public class TierFullException extends TierStoreException {

    public TierFullException(String message) {
        super(message, 507);
    }
}
