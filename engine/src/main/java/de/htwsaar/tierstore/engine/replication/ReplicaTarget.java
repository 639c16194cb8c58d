package de.htwsaar.tierstore.engine.replication;

import java.time.Instant;
import java.util.Objects;

/**
 * Kopie eines Objekts auf einem Backend.
 *
 * @param backendId Ziel-Backend
 * @param status    Zustand
 * @param attempts  bisherige Kopierversuche
 * @param lastError letzter Fehler oder {@code null}
 * @param updatedAt letzte Änderung
 */
public record ReplicaTarget(String backendId, ReplicaStatus status, int attempts, String lastError, Instant updatedAt) {

    public ReplicaTarget {
        Objects.requireNonNull(backendId, "backendId must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    public static ReplicaTarget pending(String backendId, int attempts, Instant at) {
        return new ReplicaTarget(backendId, ReplicaStatus.PENDING, attempts, null, at);
    }

    public static ReplicaTarget verified(String backendId, int attempts, Instant at) {
        return new ReplicaTarget(backendId, ReplicaStatus.VERIFIED, attempts, null, at);
    }

    public static ReplicaTarget failed(String backendId, int attempts, String error, Instant at) {
        return new ReplicaTarget(backendId, ReplicaStatus.FAILED, attempts, error, at);
    }

    public boolean isVerified() {
        return status == ReplicaStatus.VERIFIED;
    }
}
