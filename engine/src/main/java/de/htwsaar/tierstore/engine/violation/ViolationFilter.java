package de.htwsaar.tierstore.engine.violation;

/**
 * Filter für die Verstoß-Abfrage; {@code null}-Felder filtern nicht.
 *
 * @param backendId Backend oder {@code null}
 * @param severity  Schwere oder {@code null}
 * @param resolved  Auflösungsstatus oder {@code null}
 */
public record ViolationFilter(String backendId, Severity severity, Boolean resolved) {

    public static ViolationFilter all() {
        return new ViolationFilter(null, null, null);
    }

    public boolean matches(Violation v) {
        return (backendId == null || backendId.equals(v.backendId()))
                && (severity == null || severity == v.severity())
                && (resolved == null || resolved == v.resolved());
    }
}
