package de.htwsaar.tierstore.engine.policy;

import java.time.Duration;

/**
 * Aufbewahrungs-Policy.
 *
 * @param minimumAgeBeforeDelete  Mindestalter, bevor gelöscht werden darf
 * @param maximumAgeBeforeArchive Alter, ab dem archiviert wird ({@link Duration#ZERO} = nie)
 * @param legalHold               sperrt jedes Löschen
 */
public record RetentionPolicy(Duration minimumAgeBeforeDelete, Duration maximumAgeBeforeArchive, boolean legalHold)
        implements Policy {

    public RetentionPolicy {
        minimumAgeBeforeDelete = minimumAgeBeforeDelete == null ? Duration.ZERO : minimumAgeBeforeDelete;
        maximumAgeBeforeArchive = maximumAgeBeforeArchive == null ? Duration.ZERO : maximumAgeBeforeArchive;
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.RETENTION;
    }

    @Override
    public void validate() {
        if (minimumAgeBeforeDelete.isNegative()) {
            throw new InvalidPolicyException("minimumAgeBeforeDelete must not be negative");
        }
        if (maximumAgeBeforeArchive.isNegative()) {
            throw new InvalidPolicyException("maximumAgeBeforeArchive must not be negative");
        }
    }

    /** @return {@code true} wenn Objekte nach {@code maximumAgeBeforeArchive} archiviert werden */
    public boolean archives() {
        return !maximumAgeBeforeArchive.isZero();
    }
}
