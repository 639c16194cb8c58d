package de.htwsaar.tierstore.engine.policy;

/**
 * Speicher-Quota eines Backends.
 *
 * @param maxBytes      harte Obergrenze belegter Bytes (größer 0)
 * @param maxFiles      harte Obergrenze der Dateianzahl (0 = unbegrenzt)
 * @param warnThreshold Warnschwelle als Anteil von {@code maxBytes}, in (0,1]
 */
public record StorageQuotaPolicy(long maxBytes, long maxFiles, double warnThreshold) implements Policy {

    @Override
    public PolicyKind kind() {
        return PolicyKind.STORAGE_QUOTA;
    }

    @Override
    public void validate() {
        if (maxBytes <= 0) {
            throw new InvalidPolicyException("maxBytes must be > 0, was " + maxBytes);
        }
        if (maxFiles < 0) {
            throw new InvalidPolicyException("maxFiles must not be negative, was " + maxFiles);
        }
        if (!(warnThreshold > 0.0 && warnThreshold <= 1.0)) {
            throw new InvalidPolicyException("warnThreshold must be in (0,1], was " + warnThreshold);
        }
    }

    /** @return {@code true} wenn eine Dateigrenze gesetzt ist */
    public boolean limitsFiles() {
        return maxFiles > 0;
    }
}
