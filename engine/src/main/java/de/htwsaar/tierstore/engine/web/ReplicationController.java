package de.htwsaar.tierstore.engine.web;

import de.htwsaar.tierstore.engine.adapter.BackendRegistry;
import de.htwsaar.tierstore.engine.config.EngineProperties;
import de.htwsaar.tierstore.engine.domain.UnknownBackendException;
import de.htwsaar.tierstore.engine.domain.UnknownObjectException;
import de.htwsaar.tierstore.engine.replication.ReplicaSet;
import de.htwsaar.tierstore.engine.replication.ReplicationCoordinator;
import de.htwsaar.tierstore.engine.service.StorageEngine;
import java.time.Duration;
import java.util.List;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Replikationsstand pro Objekt und manuelle Reparatur.
 */
@RestController
@RequestMapping("/api/engine")
@Profile("engine")
public class ReplicationController {

    private final ReplicationCoordinator replication;
    private final StorageEngine engine;
    private final BackendRegistry registry;
    private final Duration timeout;

    public ReplicationController(
            ReplicationCoordinator replication, StorageEngine engine, BackendRegistry registry, EngineProperties props) {
        this.replication = replication;
        this.engine = engine;
        this.registry = registry;
        this.timeout = Duration.ofMillis(props.getOperationTimeoutMs());
    }

    @GetMapping("/replicas/{objectId}")
    public ResponseEntity<ReplicaSet> get(@PathVariable("objectId") String objectId) {
        return ResponseEntity.ok(replication.replicaSet(objectId).orElseThrow(() -> new UnknownObjectException(objectId)));
    }

    /**
     * @return IDs der Objekte, die auf dem Backend eine verifizierte Kopie haben
     */
    @GetMapping("/replicas")
    public ResponseEntity<List<String>> onBackend(@RequestParam("backend") String backend) {
        if (!registry.contains(backend)) {
            throw new UnknownBackendException(backend);
        }
        return ResponseEntity.ok(replication.exportReplicas(backend));
    }

    @PostMapping("/admin/replicas/{objectId}/repair")
    public ResponseEntity<ReplicaSet> repair(@PathVariable("objectId") String objectId) {
        return ResponseEntity.ok(engine.repair(objectId, timeout));
    }
}
