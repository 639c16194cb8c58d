package de.htwsaar.tierstore.engine.policy;

import java.time.Duration;

/**
 * Cache-Policy des Backends, das eine Cache-Tier stellt.
 *
 * @param tierCapacityBytes Kapazität der Tier in Bytes (größer 0)
 * @param promoteThreshold  Zugriffe, ab denen ein Eintrag in diese Tier befördert wird (mindestens 1)
 * @param demoteAfter       Leerlaufzeit, nach der ein Eintrag herabgestuft wird ({@link Duration#ZERO} = nie)
 */
public record CachePolicy(long tierCapacityBytes, long promoteThreshold, Duration demoteAfter) implements Policy {

    public CachePolicy {
        demoteAfter = demoteAfter == null ? Duration.ZERO : demoteAfter;
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.CACHE;
    }

    @Override
    public void validate() {
        if (tierCapacityBytes <= 0) {
            throw new InvalidPolicyException("tierCapacityBytes must be > 0, was " + tierCapacityBytes);
        }
        if (promoteThreshold < 1) {
            throw new InvalidPolicyException("promoteThreshold must be >= 1, was " + promoteThreshold);
        }
        if (demoteAfter.isNegative()) {
            throw new InvalidPolicyException("demoteAfter must not be negative");
        }
    }
}
