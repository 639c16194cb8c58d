package de.htwsaar.tierstore.engine.web;

import de.htwsaar.tierstore.engine.adapter.BackendRegistry;
import de.htwsaar.tierstore.engine.domain.CostTier;
import de.htwsaar.tierstore.engine.domain.UnknownBackendException;
import de.htwsaar.tierstore.engine.policy.Policy;
import de.htwsaar.tierstore.engine.policy.PolicyKind;
import de.htwsaar.tierstore.engine.policy.PolicyStore;
import de.htwsaar.tierstore.engine.policy.PolicyTemplates;
import de.htwsaar.tierstore.engine.service.StorageEngine;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Admin-API für Policies pro Backend.
 *
 * <ul>
 *   <li>GET /api/engine/admin/policies/{backend} – alle aktiven Policies</li>
 *   <li>GET/PUT/DELETE /api/engine/admin/policies/{backend}/{kind} – eine Variante</li>
 *   <li>GET /api/engine/admin/policies/templates/{costTier} – Vorgaben einer Kostenklasse</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/engine/admin/policies")
@Profile("engine")
public class PolicyAdminController {

    private final StorageEngine engine;
    private final PolicyStore policies;
    private final BackendRegistry registry;

    public PolicyAdminController(StorageEngine engine, PolicyStore policies, BackendRegistry registry) {
        this.engine = engine;
        this.policies = policies;
        this.registry = registry;
    }

    @GetMapping("/templates/{costTier}")
    public ResponseEntity<List<Policy>> template(@PathVariable("costTier") CostTier costTier) {
        return ResponseEntity.ok(PolicyTemplates.forCostTier(costTier));
    }

    @GetMapping("/{backend}")
    public ResponseEntity<List<Policy>> list(@PathVariable("backend") String backend) {
        requireBackend(backend);
        return ResponseEntity.ok(policies.list(backend));
    }

    @GetMapping("/{backend}/{kind}")
    public ResponseEntity<Policy> get(@PathVariable("backend") String backend, @PathVariable("kind") PolicyKind kind) {
        requireBackend(backend);
        return policies.get(backend, kind)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Setzt oder ersetzt eine Policy. Die Variante im Body muss zum Pfad passen.
     *
     * @return {@code 201 Created} beim ersten Setzen, sonst {@code 200 OK}
     */
    @PutMapping("/{backend}/{kind}")
    public ResponseEntity<Map<String, Object>> put(
            @PathVariable("backend") String backend,
            @PathVariable("kind") PolicyKind kind,
            @RequestBody Policy policy) {

        if (policy.kind() != kind) {
            throw new IllegalArgumentException("body has kind " + policy.kind() + " but path says " + kind);
        }
        Optional<Policy> previous = engine.setPolicy(backend, policy);
        Map<String, Object> body = new HashMap<>();
        body.put("backend", backend);
        body.put("kind", kind);
        body.put("replaced", previous.isPresent());
        return ResponseEntity.status(previous.isPresent() ? HttpStatus.OK : HttpStatus.CREATED).body(body);
    }

    @DeleteMapping("/{backend}/{kind}")
    public ResponseEntity<Map<String, String>> delete(
            @PathVariable("backend") String backend, @PathVariable("kind") PolicyKind kind) {
        requireBackend(backend);
        boolean removed = engine.removePolicy(backend, kind);
        return removed
                ? ResponseEntity.ok(Map.of("backend", backend, "kind", kind.name(), "status", "removed"))
                : ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("backend", backend, "kind", kind.name(), "status", "not set"));
    }

    private void requireBackend(String backend) {
        if (!registry.contains(backend)) {
            throw new UnknownBackendException(backend);
        }
    }
}
