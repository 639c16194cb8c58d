package de.htwsaar.tierstore.engine.violation;

import java.util.List;

/**
 * Dauerhafte Ablage des Verstoß-Logs.
 */
public interface ViolationStore {

    /**
     * Legt einen Eintrag an oder überschreibt ihn (Schlüssel: ID).
     */
    void save(Violation violation);

    /**
     * @return alle gespeicherten Einträge
     */
    List<Violation> loadAll();

    /** Ablage ohne Persistenz, z. B. für Tests. */
    ViolationStore NONE = new ViolationStore() {
        @Override
        public void save(Violation violation) {}

        @Override
        public List<Violation> loadAll() {
            return List.of();
        }
    };
}
