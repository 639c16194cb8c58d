package de.htwsaar.tierstore.engine.service;

import de.htwsaar.tierstore.engine.cache.TieredCacheManager;
import de.htwsaar.tierstore.engine.domain.ObjectRecord;
import de.htwsaar.tierstore.engine.domain.TierStoreException;
import de.htwsaar.tierstore.engine.policy.PolicyStore;
import de.htwsaar.tierstore.engine.policy.ReplicationPolicy;
import de.htwsaar.tierstore.engine.replication.ReplicaSet;
import de.htwsaar.tierstore.engine.replication.ReplicaStatus;
import de.htwsaar.tierstore.engine.replication.ReplicationCoordinator;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodische Wartung: Cache-Sweep, Retention-Sweep, automatische Reparatur und
 * Checkpoint der Nutzungszähler.
 */
public class MaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final StorageEngine engine;
    private final TieredCacheManager cache;
    private final ReplicationCoordinator replication;
    private final PolicyStore policies;
    private final Duration repairTimeout;

    public MaintenanceScheduler(
            StorageEngine engine,
            TieredCacheManager cache,
            ReplicationCoordinator replication,
            PolicyStore policies,
            Duration repairTimeout) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.replication = Objects.requireNonNull(replication, "replication must not be null");
        this.policies = Objects.requireNonNull(policies, "policies must not be null");
        this.repairTimeout = Objects.requireNonNull(repairTimeout, "repairTimeout must not be null");
    }

    /** Stuft leerlaufende Einträge herab bzw. verdrängt sie. */
    @Scheduled(
            initialDelayString = "${tierstore.maintenance.cache-sweep-ms:30000}",
            fixedDelayString = "${tierstore.maintenance.cache-sweep-ms:30000}")
    public int sweepCache() {
        return cache.sweep();
    }

    /** Schiebt Archivkandidaten im Cache eine Tier nach unten. */
    @Scheduled(
            initialDelayString = "${tierstore.maintenance.retention-sweep-ms:60000}",
            fixedDelayString = "${tierstore.maintenance.retention-sweep-ms:60000}")
    public int sweepRetention() {
        int demoted = 0;
        for (ObjectRecord r : engine.archiveCandidates()) {
            if (cache.demote(r.objectId())) {
                demoted++;
            }
        }
        if (demoted > 0) {
            log.info("Retention sweep demoted {} archive candidates", demoted);
        }
        return demoted;
    }

    /** Repariert Objekte mit fehlgeschlagenen Kopien oder fehlender Redundanz. */
    @Scheduled(
            initialDelayString = "${tierstore.maintenance.repair-ms:60000}",
            fixedDelayString = "${tierstore.maintenance.repair-ms:60000}")
    public int repairAll() {
        int repaired = 0;
        for (ReplicaSet set : replication.all()) {
            if (!needsRepair(set)) {
                continue;
            }
            try {
                ReplicaSet after = engine.repair(set.objectId(), repairTimeout);
                if (!after.hasStatus(ReplicaStatus.FAILED)) {
                    repaired++;
                }
            } catch (TierStoreException e) {
                log.warn("Automatic repair of {} failed: {}", set.objectId(), e.getMessage());
            }
        }
        return repaired;
    }

    /** Persistiert die Speicherzähler als Warmstart-Zustand. */
    @Scheduled(
            initialDelayString = "${tierstore.maintenance.checkpoint-ms:60000}",
            fixedDelayString = "${tierstore.maintenance.checkpoint-ms:60000}")
    public void checkpoint() {
        engine.checkpointUsage();
    }

    private boolean needsRepair(ReplicaSet set) {
        if (set.hasStatus(ReplicaStatus.FAILED)) {
            return true;
        }
        Optional<ReplicationPolicy> policy = policies.replication(set.ownerBackend());
        return policy.isPresent() && set.verifiedCount() < policy.get().minRedundancy();
    }
}
