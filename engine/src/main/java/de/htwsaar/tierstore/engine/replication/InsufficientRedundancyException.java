package de.htwsaar.tierstore.engine.replication;

import de.htwsaar.tierstore.engine.domain.TierStoreException;

/**
 * Weniger geeignete Ziele als {@code minRedundancy}.
 */
public class InsufficientRedundancyException extends TierStoreException {

    private final int eligible;
    private final int required;

    public InsufficientRedundancyException(String objectId, int eligible, int required) {
        super("only " + eligible + " eligible replica targets for " + objectId + ", need " + required, 503);
        this.eligible = eligible;
        this.required = required;
    }

    public int getEligible() {
        return eligible;
    }

    public int getRequired() {
        return required;
    }
}
