package de.htwsaar.tierstore.engine.policy;

import de.htwsaar.tierstore.engine.domain.CostTier;
import java.time.Duration;
import java.util.List;

/**
 * Standard-Policies je Kostenklasse für Backends ohne explizite Konfiguration.
 */
public final class PolicyTemplates {

    private static final long GB = 1024L * 1024 * 1024;
    private static final long MB = 1024L * 1024;

    private PolicyTemplates() {}

    /**
     * Liefert Speicher-, Traffic-, Retention- und Cache-Policy passend zur Kostenklasse.
     *
     * @param tier Kostenklasse des Backends
     * @return Liste der Vorgaben
     */
    public static List<Policy> forCostTier(CostTier tier) {
        return switch (tier) {
            case HOT -> List.of(
                    new StorageQuotaPolicy(100 * GB, 10_000, 0.8),
                    new TrafficQuotaPolicy(0, Duration.ofMinutes(1), 10_000),
                    new RetentionPolicy(Duration.ofDays(30), Duration.ofDays(365), false),
                    new CachePolicy(10 * GB, 3, Duration.ofHours(1)));
            case WARM -> List.of(
                    new StorageQuotaPolicy(500 * GB, 50_000, 0.85),
                    new TrafficQuotaPolicy(0, Duration.ofMinutes(1), 1_000),
                    new RetentionPolicy(Duration.ofDays(180), Duration.ofDays(1095), false),
                    new CachePolicy(5 * GB, 2, Duration.ofHours(2)));
            case COLD -> List.of(
                    new StorageQuotaPolicy(2048 * GB, 100_000, 0.9),
                    new TrafficQuotaPolicy(0, Duration.ofMinutes(1), 100),
                    new RetentionPolicy(Duration.ofDays(365), Duration.ofDays(2555), false),
                    new CachePolicy(GB, 1, Duration.ofDays(1)));
            case ARCHIVE -> List.of(
                    new StorageQuotaPolicy(10 * 1024 * GB, 1_000_000, 0.95),
                    new TrafficQuotaPolicy(0, Duration.ofMinutes(1), 10),
                    new RetentionPolicy(Duration.ofDays(2555), Duration.ofDays(7300), false),
                    new CachePolicy(100 * MB, 1, Duration.ofDays(7)));
        };
    }
}
