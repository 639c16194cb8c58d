package de.htwsaar.tierstore.engine.adapter;

import java.time.Duration;
import java.util.Objects;

/**
 * Vom Aufrufer vorgegebene Zeitschranke für eine Folge von Backend-Aufrufen.
 * Alle Aufrufe einer Operation teilen sich dieselbe Restzeit.
 *
 * @param expiresAtNanos Ablaufzeitpunkt auf der {@link System#nanoTime()}-Skala
 */
public record Deadline(long expiresAtNanos) {

    /**
     * Erstellt eine Deadline relativ zu jetzt.
     *
     * @param timeout maximale Dauer (darf nicht {@code null} oder negativ sein)
     * @return neue Deadline
     */
    public static Deadline in(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        return new Deadline(System.nanoTime() + timeout.toNanos());
    }

    /** @return verbleibende Zeit in ms, nie negativ */
    public long remainingMillis() {
        return Math.max(0, (expiresAtNanos - System.nanoTime()) / 1_000_000L);
    }

    public boolean isExpired() {
        return expiresAtNanos - System.nanoTime() <= 0;
    }
}
