package de.htwsaar.tierstore.engine.web;

import de.htwsaar.tierstore.engine.adapter.BackendRegistry;
import de.htwsaar.tierstore.engine.domain.UnknownBackendException;
import de.htwsaar.tierstore.engine.quota.QuotaDecision;
import de.htwsaar.tierstore.engine.quota.QuotaEnforcer;
import de.htwsaar.tierstore.engine.usage.ResourceTracker;
import de.htwsaar.tierstore.engine.usage.UsageDelta;
import de.htwsaar.tierstore.engine.usage.UsageLimits;
import de.htwsaar.tierstore.engine.usage.UsageRecord;
import java.util.List;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Lesende Nutzungsabfragen, z. B. für Dashboards.
 */
@RestController
@RequestMapping("/api/engine/usage")
@Profile("engine")
public class UsageQueryController {

    private final ResourceTracker tracker;
    private final QuotaEnforcer quota;
    private final BackendRegistry registry;

    public UsageQueryController(ResourceTracker tracker, QuotaEnforcer quota, BackendRegistry registry) {
        this.tracker = tracker;
        this.quota = quota;
        this.registry = registry;
    }

    @GetMapping
    public ResponseEntity<List<UsageView>> all() {
        List<UsageView> out = registry.ids().stream()
                .map(id -> new UsageView(tracker.snapshot(id), quota.limitsFor(id)))
                .toList();
        return ResponseEntity.ok(out);
    }

    @GetMapping("/{backend}")
    public ResponseEntity<UsageView> one(@PathVariable("backend") String backend) {
        requireBackend(backend);
        return ResponseEntity.ok(new UsageView(tracker.snapshot(backend), quota.limitsFor(backend)));
    }

    /**
     * Trockenlauf der Quota-Prüfung ohne Seiteneffekte.
     *
     * @param bytes Speicherbedarf der geplanten Operation
     * @param files Dateianzahl der geplanten Operation
     */
    @GetMapping("/{backend}/check")
    public ResponseEntity<QuotaDecision> check(
            @PathVariable("backend") String backend,
            @RequestParam(value = "bytes", defaultValue = "0") long bytes,
            @RequestParam(value = "files", defaultValue = "0") long files,
            @RequestParam(value = "transferBytes", defaultValue = "0") long transferBytes,
            @RequestParam(value = "requests", defaultValue = "0") long requests) {
        requireBackend(backend);
        return ResponseEntity.ok(quota.evaluate(backend, new UsageDelta(bytes, files, transferBytes, requests)));
    }

    private void requireBackend(String backend) {
        if (!registry.contains(backend)) {
            throw new UnknownBackendException(backend);
        }
    }

    /**
     * Nutzung samt wirksamen Grenzen (0 = unbegrenzt).
     */
    public record UsageView(UsageRecord usage, UsageLimits limits) {}
}
