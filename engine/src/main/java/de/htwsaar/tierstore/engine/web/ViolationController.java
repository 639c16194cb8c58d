package de.htwsaar.tierstore.engine.web;

import de.htwsaar.tierstore.engine.policy.PolicyKind;
import de.htwsaar.tierstore.engine.violation.Severity;
import de.htwsaar.tierstore.engine.violation.Violation;
import de.htwsaar.tierstore.engine.violation.ViolationFilter;
import de.htwsaar.tierstore.engine.violation.ViolationReporter;
import java.util.List;
import java.util.Map;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Abfrage und manuelle Auflösung des Verstoß-Logs.
 */
@RestController
@RequestMapping("/api/engine")
@Profile("engine")
public class ViolationController {

    private final ViolationReporter violations;

    public ViolationController(ViolationReporter violations) {
        this.violations = violations;
    }

    /**
     * Listet Verstöße; alle Parameter sind optional.
     */
    @GetMapping("/violations")
    public ResponseEntity<List<Violation>> list(
            @RequestParam(value = "backend", required = false) String backend,
            @RequestParam(value = "severity", required = false) Severity severity,
            @RequestParam(value = "resolved", required = false) Boolean resolved) {
        return ResponseEntity.ok(violations.list(new ViolationFilter(backend, severity, resolved)));
    }

    @PutMapping("/admin/violations/{backend}/{kind}/resolve")
    public ResponseEntity<Map<String, Object>> resolve(
            @PathVariable("backend") String backend, @PathVariable("kind") PolicyKind kind) {
        int count = violations.resolve(backend, kind);
        return ResponseEntity.ok(Map.of("backend", backend, "kind", kind.name(), "resolvedCount", count));
    }
}
