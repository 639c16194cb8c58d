package de.htwsaar.tierstore.engine.service;

import de.htwsaar.tierstore.engine.adapter.AdapterInvoker;
import de.htwsaar.tierstore.engine.adapter.BackendRegistry;
import de.htwsaar.tierstore.engine.adapter.Deadline;
import de.htwsaar.tierstore.engine.domain.Backend;
import de.htwsaar.tierstore.engine.domain.BackendAdapter;
import de.htwsaar.tierstore.engine.domain.ObjectRecord;
import de.htwsaar.tierstore.engine.domain.TierStoreException;
import de.htwsaar.tierstore.engine.persistence.EngineStateRepository;
import de.htwsaar.tierstore.engine.persistence.EngineStateRepository.CatalogEntry;
import de.htwsaar.tierstore.engine.persistence.EngineStateRepository.StoredUsage;
import de.htwsaar.tierstore.engine.policy.InvalidPolicyException;
import de.htwsaar.tierstore.engine.policy.Policy;
import de.htwsaar.tierstore.engine.policy.PolicyStore;
import de.htwsaar.tierstore.engine.policy.PolicyTemplates;
import de.htwsaar.tierstore.engine.replication.ReplicationCoordinator;
import de.htwsaar.tierstore.engine.usage.ResourceTracker;
import de.htwsaar.tierstore.engine.violation.ViolationReporter;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stellt den Engine-Zustand beim Start wieder her.
 *
 * <p>Policies und Verstöße werden direkt geladen. Nutzungszähler werden nur übernommen, wenn
 * Zähler und Katalog die aktuelle {@code state_version} tragen; sonst werden sie per
 * {@code stat} über alle Katalogobjekte neu ermittelt.</p>
 */
public class StateRecovery {

    private static final Logger log = LoggerFactory.getLogger(StateRecovery.class);

    private final EngineStateRepository repository;
    private final PolicyStore policies;
    private final ViolationReporter violations;
    private final ResourceTracker tracker;
    private final ReplicationCoordinator replication;
    private final StorageEngine engine;
    private final BackendRegistry registry;
    private final AdapterInvoker invoker;
    private final Duration statTimeout;

    public StateRecovery(
            EngineStateRepository repository,
            PolicyStore policies,
            ViolationReporter violations,
            ResourceTracker tracker,
            ReplicationCoordinator replication,
            StorageEngine engine,
            BackendRegistry registry,
            AdapterInvoker invoker,
            Duration statTimeout) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.policies = Objects.requireNonNull(policies, "policies must not be null");
        this.violations = Objects.requireNonNull(violations, "violations must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.replication = Objects.requireNonNull(replication, "replication must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
        this.statTimeout = Objects.requireNonNull(statTimeout, "statTimeout must not be null");
    }

    /**
     * Lädt den persistierten Zustand.
     *
     * @return {@code true} wenn die Nutzungszähler neu aufgebaut wurden
     */
    public boolean recover() {
        int loadedPolicies = 0;
        for (Map.Entry<String, List<Policy>> e : repository.loadPolicies().entrySet()) {
            for (Policy p : e.getValue()) {
                try {
                    policies.set(e.getKey(), p);
                    loadedPolicies++;
                } catch (InvalidPolicyException ex) {
                    log.warn("Skipping stored {} policy of {}: {}", p.kind(), e.getKey(), ex.getMessage());
                }
            }
        }
        engine.applyCachePolicies();
        violations.load(repository.loadAll());

        List<CatalogEntry> catalog = repository.loadCatalog();
        boolean catalogCurrent = true;
        for (CatalogEntry entry : catalog) {
            engine.restore(entry.record());
            if (entry.replicas() != null) {
                replication.restore(entry.replicas());
            }
            catalogCurrent &= entry.current();
        }

        Optional<Map<String, StoredUsage>> usage = repository.loadUsage();
        boolean rebuild = usage.isEmpty() || !catalogCurrent || !repository.usageCheckpointCurrent();
        if (rebuild) {
            rebuildUsage(catalog);
        } else {
            usage.get().forEach((backend, u) -> tracker.restore(backend, u.bytesUsed(), u.fileCount()));
        }
        log.info("Recovered {} policies, {} objects, {} open violations (usage {})",
                loadedPolicies, catalog.size(), violations.openCount(), rebuild ? "rebuilt" : "restored");
        return rebuild;
    }

    /**
     * Setzt für Backends ohne jede Policy die Vorgaben ihrer Kostenklasse.
     *
     * @return Anzahl so versorgter Backends
     */
    public int seedTemplates() {
        int seeded = 0;
        for (Backend backend : registry.all()) {
            if (!policies.list(backend.id()).isEmpty()) {
                continue;
            }
            for (Policy p : PolicyTemplates.forCostTier(backend.costTier())) {
                engine.setPolicy(backend.id(), p);
            }
            seeded++;
            log.info("Seeded {} policy templates for {}", backend.costTier(), backend.id());
        }
        return seeded;
    }

    private void rebuildUsage(List<CatalogEntry> catalog) {
        Map<String, long[]> totals = new HashMap<>();
        for (CatalogEntry entry : catalog) {
            ObjectRecord record = entry.record();
            Set<String> holders = new LinkedHashSet<>();
            holders.add(record.primaryBackend());
            if (entry.replicas() != null) {
                holders.addAll(entry.replicas().verifiedBackends());
            }
            for (String backendId : holders) {
                OptionalLong size = stat(backendId, record.objectId());
                if (size.isPresent()) {
                    long[] t = totals.computeIfAbsent(backendId, k -> new long[2]);
                    t[0] += size.getAsLong();
                    t[1]++;
                }
            }
        }
        for (String backendId : registry.ids()) {
            long[] t = totals.getOrDefault(backendId, new long[2]);
            tracker.restore(backendId, t[0], t[1]);
        }
    }

    private OptionalLong stat(String backendId, String objectId) {
        if (!registry.contains(backendId)) {
            return OptionalLong.empty();
        }
        try {
            BackendAdapter adapter = registry.adapter(backendId);
            return invoker.call(backendId, "stat", () -> adapter.stat(objectId), Deadline.in(statTimeout));
        } catch (TierStoreException e) {
            log.warn("stat of {} on {} failed during usage rebuild: {}", objectId, backendId, e.getMessage());
            return OptionalLong.empty();
        }
    }
}
