package de.htwsaar.tierstore.engine.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Replikations-Policy.
 *
 * @param strategy          Auswahlstrategie
 * @param minRedundancy     Mindestanzahl verifizierter Kopien (mindestens 1)
 * @param maxRedundancy     Höchstanzahl Kopien (mindestens {@code minRedundancy})
 * @param preferredBackends bevorzugte Ziele in Reihenfolge, ohne Duplikate;
 *                          leer = alle replikationsfähigen Backends
 */
public record ReplicationPolicy(
        ReplicationStrategy strategy, int minRedundancy, int maxRedundancy, List<String> preferredBackends)
        implements Policy {

    public ReplicationPolicy {
        strategy = strategy == null ? ReplicationStrategy.SIMPLE : strategy;
        preferredBackends = preferredBackends == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(preferredBackends));
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.REPLICATION;
    }

    @Override
    public void validate() {
        if (minRedundancy < 1) {
            throw new InvalidPolicyException("minRedundancy must be >= 1, was " + minRedundancy);
        }
        if (maxRedundancy < minRedundancy) {
            throw new InvalidPolicyException(
                    "maxRedundancy (" + maxRedundancy + ") must be >= minRedundancy (" + minRedundancy + ")");
        }
        Set<String> seen = new HashSet<>();
        for (String backend : preferredBackends) {
            if (backend == null || backend.isBlank()) {
                throw new InvalidPolicyException("preferredBackends must not contain blank entries");
            }
            if (!seen.add(backend)) {
                throw new InvalidPolicyException("preferredBackends contains duplicate " + backend);
            }
        }
    }
}
