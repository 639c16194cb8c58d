package de.htwsaar.tierstore.engine.violation;

import de.htwsaar.tierstore.engine.policy.PolicyKind;
import java.time.Instant;
import java.util.Objects;

/**
 * Eintrag im Verstoß-Log.
 *
 * @param id           fortlaufende ID (0 = noch nicht vergeben)
 * @param backendId    betroffenes Backend
 * @param policyKind   verletzte Policy-Variante
 * @param severity     Schwere
 * @param detectedAt   letzter Erkennungszeitpunkt
 * @param currentValue beobachteter Wert
 * @param limitValue   Grenzwert
 * @param message      Beschreibung
 * @param resolved     aufgelöst
 * @param resolvedAt   Zeitpunkt der Auflösung oder {@code null}
 */
public record Violation(
        long id,
        String backendId,
        PolicyKind policyKind,
        Severity severity,
        Instant detectedAt,
        long currentValue,
        long limitValue,
        String message,
        boolean resolved,
        Instant resolvedAt) {

    public Violation {
        Objects.requireNonNull(backendId, "backendId must not be null");
        Objects.requireNonNull(policyKind, "policyKind must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        message = message == null ? "" : message;
    }

    /**
     * Erstellt einen neuen, offenen Verstoß ohne ID.
     */
    public static Violation open(
            String backendId, PolicyKind kind, Severity severity, long currentValue, long limitValue, String message) {
        return new Violation(0, backendId, kind, severity, null, currentValue, limitValue, message, false, null);
    }

    public Violation withId(long newId, Instant at) {
        return new Violation(
                newId, backendId, policyKind, severity, at, currentValue, limitValue, message, resolved, resolvedAt);
    }

    public Violation withObservation(Instant at, long value, long limit, String text) {
        return new Violation(id, backendId, policyKind, severity, at, value, limit, text, resolved, resolvedAt);
    }

    public Violation resolvedAt(Instant at) {
        return new Violation(
                id, backendId, policyKind, severity, detectedAt, currentValue, limitValue, message, true, at);
    }
}
