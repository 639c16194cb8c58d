package de.htwsaar.tierstore.engine.quota;

import de.htwsaar.tierstore.engine.policy.PolicyKind;

/**
 * Ergebnis einer Quota-Prüfung.
 *
 * @param outcome   Entscheidung
 * @param kind      maßgebliche Policy-Variante oder {@code null}, wenn keine Quota gilt
 * @param dimension geprüfte Größe (bytes, files, transferBytes, requests)
 * @param current   projizierter Wert
 * @param limit     Grenzwert
 * @param reason    lesbare Begründung
 */
public record QuotaDecision(Outcome outcome, PolicyKind kind, String dimension, long current, long limit, String reason) {

    public enum Outcome {
        ALLOW,
        WARN,
        REJECT
    }

    /** Keine Quota konfiguriert. */
    public static QuotaDecision unrestricted() {
        return new QuotaDecision(Outcome.ALLOW, null, "none", 0, 0, "no quota configured");
    }

    public boolean allowed() {
        return outcome != Outcome.REJECT;
    }

    public boolean rejected() {
        return outcome == Outcome.REJECT;
    }

    /** Wählt die schwerere von zwei Entscheidungen; bei Gleichstand die erste. */
    static QuotaDecision worse(QuotaDecision a, QuotaDecision b) {
        return b.outcome.ordinal() > a.outcome.ordinal() ? b : a;
    }
}
