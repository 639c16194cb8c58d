package de.htwsaar.tierstore.engine.cache;

import de.htwsaar.tierstore.engine.policy.CachePolicy;
import java.time.Duration;
import java.util.Objects;

/**
 * Eine Ebene der Cache-Hierarchie.
 *
 * @param name             Name der Tier (Backend-ID oder frei gewählt)
 * @param capacityBytes    Kapazität in Bytes
 * @param promoteThreshold Zugriffe, ab denen Einträge der nächstlangsameren Tier hierher befördert werden
 * @param demoteAfter      Leerlaufzeit bis zur Herabstufung ({@link Duration#ZERO} = nie)
 */
public record CacheTier(String name, long capacityBytes, long promoteThreshold, Duration demoteAfter) {

    public CacheTier {
        Objects.requireNonNull(name, "name must not be null");
        demoteAfter = demoteAfter == null ? Duration.ZERO : demoteAfter;
        if (capacityBytes <= 0) {
            throw new IllegalArgumentException("capacityBytes must be > 0");
        }
        if (promoteThreshold < 1) {
            throw new IllegalArgumentException("promoteThreshold must be >= 1");
        }
    }

    /**
     * Baut eine Tier aus der Cache-Policy des Backends, das sie stellt.
     */
    public static CacheTier from(String name, CachePolicy policy) {
        return new CacheTier(name, policy.tierCapacityBytes(), policy.promoteThreshold(), policy.demoteAfter());
    }

    public boolean demotes() {
        return !demoteAfter.isZero();
    }
}
