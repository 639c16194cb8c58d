package de.htwsaar.tierstore.engine.policy;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Zentraler, thread-sicherer Store der aktiven Policies pro Backend.
 *
 * <p>Der Zustand ist eine unveränderliche Map hinter einer {@link AtomicReference}.
 * Jede Änderung baut eine neue Map und tauscht sie atomar; Leser sehen immer einen
 * vollständigen Stand. Der Store ruft keine anderen Komponenten auf.</p>
 */
public class PolicyStore {

    private final AtomicReference<Map<String, Map<PolicyKind, Policy>>> ref =
            new AtomicReference<>(Map.of());

    /**
     * Setzt die Policy für (Backend, Variante) und ersetzt eine vorherige.
     *
     * @param backendId Backend-ID
     * @param policy    neue Policy
     * @return vorherige Policy der gleichen Variante, falls vorhanden
     * @throws InvalidPolicyException bei ungültigen Werten; der Store bleibt unverändert
     */
    public Optional<Policy> set(String backendId, Policy policy) {
        requireBackendId(backendId);
        if (policy == null) {
            throw new InvalidPolicyException("policy must not be null");
        }
        policy.validate();

        Map<String, Map<PolicyKind, Policy>> previous = ref.getAndUpdate(cur -> {
            Map<String, Map<PolicyKind, Policy>> next = new HashMap<>(cur);
            Map<PolicyKind, Policy> kinds = new EnumMap<>(PolicyKind.class);
            kinds.putAll(cur.getOrDefault(backendId, Map.of()));
            kinds.put(policy.kind(), policy);
            next.put(backendId, Collections.unmodifiableMap(kinds));
            return Collections.unmodifiableMap(next);
        });
        return Optional.ofNullable(previous.getOrDefault(backendId, Map.of()).get(policy.kind()));
    }

    /**
     * @return aktive Policy oder leer, wenn nicht konfiguriert
     */
    public Optional<Policy> get(String backendId, PolicyKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        return Optional.ofNullable(ref.get().getOrDefault(backendId, Map.of()).get(kind));
    }

    /**
     * @return alle Policies eines Backends, sortiert nach Variante
     */
    public List<Policy> list(String backendId) {
        return List.copyOf(ref.get().getOrDefault(backendId, Map.of()).values());
    }

    /**
     * @return Backends mit mindestens einer Policy, alphabetisch
     */
    public Set<String> backends() {
        return Collections.unmodifiableSet(new TreeSet<>(ref.get().keySet()));
    }

    /**
     * Deaktiviert eine Policy. Nutzungsdaten bleiben unberührt.
     *
     * @return {@code true} wenn eine Policy entfernt wurde
     */
    public boolean remove(String backendId, PolicyKind kind) {
        requireBackendId(backendId);
        Objects.requireNonNull(kind, "kind must not be null");

        Map<String, Map<PolicyKind, Policy>> previous = ref.getAndUpdate(cur -> {
            Map<PolicyKind, Policy> kinds = cur.get(backendId);
            if (kinds == null || !kinds.containsKey(kind)) {
                return cur;
            }
            Map<String, Map<PolicyKind, Policy>> next = new HashMap<>(cur);
            Map<PolicyKind, Policy> remaining = new EnumMap<>(PolicyKind.class);
            remaining.putAll(kinds);
            remaining.remove(kind);
            if (remaining.isEmpty()) {
                next.remove(backendId);
            } else {
                next.put(backendId, Collections.unmodifiableMap(remaining));
            }
            return Collections.unmodifiableMap(next);
        });
        return previous.getOrDefault(backendId, Map.of()).containsKey(kind);
    }

    /**
     * @return unveränderlicher Gesamtstand (für Persistenz)
     */
    public Map<String, Map<PolicyKind, Policy>> snapshot() {
        return ref.get();
    }

    public Optional<StorageQuotaPolicy> storageQuota(String backendId) {
        return get(backendId, PolicyKind.STORAGE_QUOTA).map(StorageQuotaPolicy.class::cast);
    }

    public Optional<TrafficQuotaPolicy> trafficQuota(String backendId) {
        return get(backendId, PolicyKind.TRAFFIC_QUOTA).map(TrafficQuotaPolicy.class::cast);
    }

    public Optional<ReplicationPolicy> replication(String backendId) {
        return get(backendId, PolicyKind.REPLICATION).map(ReplicationPolicy.class::cast);
    }

    public Optional<RetentionPolicy> retention(String backendId) {
        return get(backendId, PolicyKind.RETENTION).map(RetentionPolicy.class::cast);
    }

    public Optional<CachePolicy> cache(String backendId) {
        return get(backendId, PolicyKind.CACHE).map(CachePolicy.class::cast);
    }

    private static void requireBackendId(String backendId) {
        if (backendId == null || backendId.isBlank()) {
            throw new InvalidPolicyException("backendId must not be empty");
        }
    }
}
