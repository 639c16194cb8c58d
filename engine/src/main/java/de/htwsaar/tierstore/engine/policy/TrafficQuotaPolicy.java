package de.htwsaar.tierstore.engine.policy;

import java.time.Duration;

/**
 * Traffic-Quota pro festem Zeitfenster.
 *
 * @param maxBytesPerWindow    übertragene Bytes pro Fenster (0 = unbegrenzt)
 * @param window               Fensterlänge (größer 0)
 * @param maxRequestsPerWindow Requests pro Fenster (0 = unbegrenzt)
 */
public record TrafficQuotaPolicy(long maxBytesPerWindow, Duration window, long maxRequestsPerWindow)
        implements Policy {

    @Override
    public PolicyKind kind() {
        return PolicyKind.TRAFFIC_QUOTA;
    }

    @Override
    public void validate() {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new InvalidPolicyException("window must be positive, was " + window);
        }
        if (maxBytesPerWindow < 0) {
            throw new InvalidPolicyException("maxBytesPerWindow must not be negative, was " + maxBytesPerWindow);
        }
        if (maxRequestsPerWindow < 0) {
            throw new InvalidPolicyException("maxRequestsPerWindow must not be negative, was " + maxRequestsPerWindow);
        }
        if (maxBytesPerWindow == 0 && maxRequestsPerWindow == 0) {
            throw new InvalidPolicyException("traffic quota must limit bytes or requests");
        }
    }
}
