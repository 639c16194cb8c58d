package de.htwsaar.tierstore.engine.replication;

import java.util.List;
import java.util.Objects;

/**
 * Alle Kopien eines Objekts in Auswahlreihenfolge.
 *
 * @param objectId     Objekt-ID
 * @param sizeBytes    Größe
 * @param ownerBackend Backend of Record, dem Verstöße zugeordnet werden
 * @param targets      Kopien
 */
public record ReplicaSet(String objectId, long sizeBytes, String ownerBackend, List<ReplicaTarget> targets) {

    public ReplicaSet {
        Objects.requireNonNull(objectId, "objectId must not be null");
        Objects.requireNonNull(ownerBackend, "ownerBackend must not be null");
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public long verifiedCount() {
        return targets.stream().filter(ReplicaTarget::isVerified).count();
    }

    public List<String> verifiedBackends() {
        return targets.stream().filter(ReplicaTarget::isVerified).map(ReplicaTarget::backendId).toList();
    }

    public boolean hasStatus(ReplicaStatus status) {
        return targets.stream().anyMatch(t -> t.status() == status);
    }

    public boolean isVerifiedOn(String backendId) {
        return targets.stream().anyMatch(t -> t.isVerified() && t.backendId().equals(backendId));
    }
}
