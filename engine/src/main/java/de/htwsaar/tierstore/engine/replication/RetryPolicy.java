package de.htwsaar.tierstore.engine.replication;

import java.time.Duration;
import java.util.Objects;

/**
 * Begrenzte Wiederholung von Kopierversuchen mit exponentiellem Backoff.
 *
 * @param maxAttempts Versuche pro Ziel (mindestens 1)
 * @param baseDelay   Wartezeit nach dem ersten Fehlversuch
 * @param multiplier  Faktor je weiterem Fehlversuch (mindestens 1)
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier) {

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
    }

    /** Ein Versuch, keine Wartezeit. */
    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, 1.0);
    }

    /**
     * @param failedAttempts bisherige Fehlversuche (ab 1)
     * @return Wartezeit vor dem nächsten Versuch
     */
    public Duration delayFor(int failedAttempts) {
        if (failedAttempts < 1 || baseDelay.isZero()) {
            return Duration.ZERO;
        }
        double factor = Math.pow(multiplier, failedAttempts - 1);
        return Duration.ofMillis((long) (baseDelay.toMillis() * factor));
    }
}
