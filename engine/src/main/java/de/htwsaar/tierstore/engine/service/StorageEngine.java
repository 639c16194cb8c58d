package de.htwsaar.tierstore.engine.service;

import de.htwsaar.tierstore.engine.adapter.AdapterInvoker;
import de.htwsaar.tierstore.engine.adapter.BackendRegistry;
import de.htwsaar.tierstore.engine.adapter.Deadline;
import de.htwsaar.tierstore.engine.cache.CacheEntry;
import de.htwsaar.tierstore.engine.cache.CacheTier;
import de.htwsaar.tierstore.engine.cache.TierFullException;
import de.htwsaar.tierstore.engine.cache.TieredCacheManager;
import de.htwsaar.tierstore.engine.domain.AdapterException;
import de.htwsaar.tierstore.engine.domain.BackendAdapter;
import de.htwsaar.tierstore.engine.domain.ObjectRecord;
import de.htwsaar.tierstore.engine.domain.QuotaExceededException;
import de.htwsaar.tierstore.engine.domain.TierStoreException;
import de.htwsaar.tierstore.engine.domain.UnknownBackendException;
import de.htwsaar.tierstore.engine.domain.UnknownObjectException;
import de.htwsaar.tierstore.engine.persistence.EngineStateRepository;
import de.htwsaar.tierstore.engine.policy.CachePolicy;
import de.htwsaar.tierstore.engine.policy.Policy;
import de.htwsaar.tierstore.engine.policy.PolicyKind;
import de.htwsaar.tierstore.engine.policy.PolicyStore;
import de.htwsaar.tierstore.engine.policy.RetentionPolicy;
import de.htwsaar.tierstore.engine.quota.QuotaEnforcer;
import de.htwsaar.tierstore.engine.replication.InsufficientRedundancyException;
import de.htwsaar.tierstore.engine.replication.ReplicaSet;
import de.htwsaar.tierstore.engine.replication.ReplicationCoordinator;
import de.htwsaar.tierstore.engine.usage.Reservation;
import de.htwsaar.tierstore.engine.usage.ResourceTracker;
import de.htwsaar.tierstore.engine.usage.UsageDelta;
import de.htwsaar.tierstore.engine.violation.Severity;
import de.htwsaar.tierstore.engine.violation.Violation;
import de.htwsaar.tierstore.engine.violation.ViolationReporter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explizites Engine-Handle: Speicher-, Lese- und Löschfluss über alle Module.
 *
 * <p>store: Quota-Reservierung → Adapter-put → commit → Katalog → Cache → Replikation.
 * read: Traffic-Reservierung auf einem verifizierten Backend → get → commit → Cache.
 * delete: Retention-Prüfung → Löschen überall → Nutzung freigeben.</p>
 */
public class StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(StorageEngine.class);

    private final BackendRegistry registry;
    private final PolicyStore policies;
    private final ResourceTracker tracker;
    private final QuotaEnforcer quota;
    private final TieredCacheManager cache;
    private final ReplicationCoordinator replication;
    private final ViolationReporter violations;
    private final AdapterInvoker invoker;
    private final EngineStateRepository repository;
    private final Clock clock;

    private final Map<String, ObjectRecord> catalog = new ConcurrentHashMap<>();

    public StorageEngine(
            BackendRegistry registry,
            PolicyStore policies,
            ResourceTracker tracker,
            QuotaEnforcer quota,
            TieredCacheManager cache,
            ReplicationCoordinator replication,
            ViolationReporter violations,
            AdapterInvoker invoker,
            EngineStateRepository repository,
            Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.policies = Objects.requireNonNull(policies, "policies must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.quota = Objects.requireNonNull(quota, "quota must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.replication = Objects.requireNonNull(replication, "replication must not be null");
        this.violations = Objects.requireNonNull(violations, "violations must not be null");
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        cache.addEvictionListener((objectId, size) ->
                log.debug("{} left the cache, reads fall back to its backend of record", objectId));
    }

    /**
     * Speichert ein Objekt auf seinem Primär-Backend.
     *
     * <p>Ein erneutes Speichern derselben ID überschreibt das Objekt auf demselben Backend;
     * vorhandene Kopien gelten danach als veraltet und werden neu kopiert.</p>
     *
     * @param objectId  Objekt-ID
     * @param content   Inhalt
     * @param backendId Primär-Backend (Backend of Record)
     * @param timeout   Zeitschranke für alle Backend-Aufrufe
     * @return Katalogeintrag, Cache-Platzierung und Replikationsstand
     * @throws QuotaExceededException bei überschrittener Quota; es wird nichts gespeichert
     */
    public StoreResult store(String objectId, byte[] content, String backendId, Duration timeout) {
        requireObjectId(objectId);
        Objects.requireNonNull(content, "content must not be null");
        BackendAdapter adapter = registry.adapter(backendId);
        Deadline deadline = Deadline.in(timeout);
        long size = content.length;

        ObjectRecord existing = catalog.get(objectId);
        if (existing != null && !existing.primaryBackend().equals(backendId)) {
            throw new IllegalArgumentException(
                    objectId + " is already stored on " + existing.primaryBackend() + ", not on " + backendId);
        }
        UsageDelta delta = existing == null
                ? UsageDelta.store(size)
                : new UsageDelta(size - existing.sizeBytes(), 0, size, 1);

        Reservation reservation = quota.reserve(backendId, delta);
        try {
            if (existing != null) {
                // Kopien halten ab jetzt alten Inhalt und dürfen nicht mehr gelesen werden
                replication.invalidate(objectId, size, Duration.ofMillis(deadline.remainingMillis()));
            }
            invoker.call(backendId, "put", () -> adapter.put(objectId, content), deadline);
        } catch (TierStoreException e) {
            tracker.release(reservation);
            throw e;
        }
        tracker.commit(reservation);

        ObjectRecord record = new ObjectRecord(
                objectId, size, backendId, existing == null ? clock.instant() : existing.storedAt());
        catalog.put(objectId, record);

        CacheEntry cached = cacheAccess(objectId, size);

        ReplicaSet replicas = null;
        var replicationPolicy = policies.replication(backendId);
        if (replicationPolicy.isPresent()) {
            try {
                replicas = replication.ensure(objectId, content, backendId, replicationPolicy.get(),
                        Duration.ofMillis(deadline.remainingMillis()));
            } catch (InsufficientRedundancyException e) {
                log.warn("Stored {} on {} without required redundancy: {}", objectId, backendId, e.getMessage());
            }
        }
        repository.saveObject(record, replicas);
        log.info("Stored {} ({} bytes) on {}", objectId, size, backendId);
        return new StoreResult(record, cached, replicas);
    }

    /**
     * Liest ein Objekt vom Backend of Record oder, falls dort nicht möglich, von einer
     * verifizierten Kopie.
     *
     * @throws UnknownObjectException wenn das Objekt nicht im Katalog steht
     */
    public byte[] read(String objectId, Duration timeout) {
        ObjectRecord record = lookup(objectId);
        Deadline deadline = Deadline.in(timeout);

        List<String> sources = new ArrayList<>();
        sources.add(record.primaryBackend());
        replication.replicaSet(objectId).ifPresent(s -> s.verifiedBackends().stream()
                .filter(b -> !sources.contains(b))
                .forEach(sources::add));

        TierStoreException last = null;
        for (String backendId : sources) {
            if (!registry.contains(backendId)) {
                continue;
            }
            Reservation reservation;
            try {
                reservation = quota.reserve(backendId, UsageDelta.read(record.sizeBytes()));
            } catch (QuotaExceededException e) {
                last = e;
                continue;
            }
            try {
                BackendAdapter adapter = registry.adapter(backendId);
                byte[] body = invoker.call(backendId, "get", () -> adapter.get(objectId), deadline);
                tracker.commit(reservation);
                cacheAccess(objectId, body.length);
                return body;
            } catch (AdapterException | UnknownObjectException e) {
                tracker.release(reservation);
                last = e;
                log.warn("Reading {} from {} failed: {}", objectId, backendId, e.getMessage());
            }
        }
        throw last != null ? last : new UnknownObjectException(objectId);
    }

    /**
     * Löscht ein Objekt überall, sofern die Retention-Policy seines Backends es erlaubt.
     *
     * @throws RetentionViolationException bei Legal Hold oder zu jungem Objekt
     */
    public void delete(String objectId, Duration timeout) {
        ObjectRecord record = lookup(objectId);
        checkRetention(record);

        String primary = record.primaryBackend();
        Deadline deadline = Deadline.in(timeout);
        BackendAdapter adapter = registry.adapter(primary);
        invoker.call(primary, "delete", () -> {
            adapter.delete(objectId);
            return null;
        }, deadline);
        tracker.record(primary, UsageDelta.delete(record.sizeBytes()));

        replication.remove(objectId, Duration.ofMillis(deadline.remainingMillis()));
        cache.remove(objectId);
        catalog.remove(objectId);
        repository.deleteObject(objectId);
        log.info("Deleted {} from {}", objectId, primary);
    }

    /**
     * @return Objekte, deren Alter {@code maximumAgeBeforeArchive} ihres Backends erreicht hat
     */
    public List<ObjectRecord> archiveCandidates() {
        Instant now = clock.instant();
        List<ObjectRecord> out = new ArrayList<>();
        for (ObjectRecord r : catalog.values()) {
            Optional<RetentionPolicy> retention = policies.retention(r.primaryBackend());
            if (retention.isPresent() && retention.get().archives()
                    && Duration.between(r.storedAt(), now).compareTo(retention.get().maximumAgeBeforeArchive()) >= 0) {
                out.add(r);
            }
        }
        out.sort(Comparator.comparing(ObjectRecord::storedAt));
        return out;
    }

    /**
     * Setzt eine Policy, persistiert sie und passt bei Cache-Policies die zugehörige Tier an.
     *
     * @return vorherige Policy derselben Variante
     */
    public Optional<Policy> setPolicy(String backendId, Policy policy) {
        if (!registry.contains(backendId)) {
            throw new UnknownBackendException(backendId);
        }
        Optional<Policy> previous = policies.set(backendId, policy);
        repository.savePolicy(backendId, policy);
        if (policy instanceof CachePolicy cachePolicy && cache.hasTier(backendId)) {
            cache.reconfigureTier(backendId, cachePolicy);
        }
        log.info("Policy {} set on {}", policy.kind(), backendId);
        return previous;
    }

    /**
     * Deaktiviert eine Policy. Nutzungsdaten und Cache-Grenzen bleiben unverändert.
     */
    public boolean removePolicy(String backendId, PolicyKind kind) {
        boolean removed = policies.remove(backendId, kind);
        repository.deletePolicy(backendId, kind);
        if (removed) {
            log.info("Policy {} removed from {}", kind, backendId);
        }
        return removed;
    }

    /**
     * Repariert die Kopien eines Objekts und persistiert den neuen Stand.
     */
    public ReplicaSet repair(String objectId, Duration timeout) {
        ReplicaSet repaired = replication.repair(objectId, timeout);
        persistReplicas(repaired);
        return repaired;
    }

    /**
     * Übernimmt die Cache-Policies der Tier-Backends in die Tiers, z. B. nach dem Laden.
     */
    public void applyCachePolicies() {
        for (CacheTier tier : cache.tiers()) {
            policies.cache(tier.name()).ifPresent(p -> cache.reconfigureTier(tier.name(), p));
        }
    }

    /**
     * Schreibt die aktuellen Speicherzähler als Warmstart-Zustand.
     */
    public void checkpointUsage() {
        // Generation vor den Zählern lesen; spätere Katalogänderungen machen den Checkpoint ungültig
        long generation = repository.catalogGeneration();
        repository.saveUsage(tracker.snapshots(), generation);
    }

    public Optional<ObjectRecord> record(String objectId) {
        return Optional.ofNullable(catalog.get(objectId));
    }

    /**
     * @return Katalog, nach Objekt-ID sortiert
     */
    public List<ObjectRecord> catalog() {
        List<ObjectRecord> out = new ArrayList<>(catalog.values());
        out.sort(Comparator.comparing(ObjectRecord::objectId));
        return out;
    }

    /**
     * Übernimmt einen persistierten Katalogeintrag beim Start.
     */
    public void restore(ObjectRecord record) {
        catalog.put(record.objectId(), record);
    }

    /**
     * Schreibt den aktuellen Replikationsstand eines Objekts in den Katalog.
     */
    public void persistReplicas(ReplicaSet replicas) {
        ObjectRecord record = catalog.get(replicas.objectId());
        if (record != null) {
            repository.saveObject(record, replicas);
        }
    }

    private void checkRetention(ObjectRecord record) {
        Optional<RetentionPolicy> maybe = policies.retention(record.primaryBackend());
        if (maybe.isEmpty()) {
            violations.resolve(record.primaryBackend(), PolicyKind.RETENTION);
            return;
        }
        RetentionPolicy retention = maybe.get();
        Duration age = Duration.between(record.storedAt(), clock.instant());
        String reason = null;
        if (retention.legalHold()) {
            reason = record.objectId() + " is under legal hold on " + record.primaryBackend();
        } else if (age.compareTo(retention.minimumAgeBeforeDelete()) < 0) {
            reason = record.objectId() + " is " + age.toSeconds() + "s old, minimum before delete is "
                    + retention.minimumAgeBeforeDelete().toSeconds() + "s";
        }
        if (reason != null) {
            violations.report(Violation.open(record.primaryBackend(), PolicyKind.RETENTION, Severity.WARN,
                    age.toSeconds(), retention.minimumAgeBeforeDelete().toSeconds(), reason));
            throw new RetentionViolationException(reason);
        }
        violations.resolve(record.primaryBackend(), PolicyKind.RETENTION);
    }

    private CacheEntry cacheAccess(String objectId, long size) {
        try {
            return cache.access(objectId, size);
        } catch (TierFullException e) {
            log.debug("Not cached: {}", e.getMessage());
            return null;
        }
    }

    private ObjectRecord lookup(String objectId) {
        requireObjectId(objectId);
        ObjectRecord record = catalog.get(objectId);
        if (record == null) {
            throw new UnknownObjectException(objectId);
        }
        return record;
    }

    private static void requireObjectId(String objectId) {
        if (objectId == null || objectId.isBlank()) {
            throw new IllegalArgumentException("objectId must not be empty");
        }
    }
}
