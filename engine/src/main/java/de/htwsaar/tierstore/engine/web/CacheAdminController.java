package de.htwsaar.tierstore.engine.web;

import de.htwsaar.tierstore.engine.cache.CacheEntry;
import de.htwsaar.tierstore.engine.cache.CacheMetricsService.CacheStatsSnapshot;
import de.htwsaar.tierstore.engine.cache.TieredCacheManager;
import de.htwsaar.tierstore.engine.domain.UnknownBackendException;
import java.util.List;
import java.util.Map;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Cache-Statistik, Tier-Inhalte und Admin-Operationen (Pinning, Verdrängung, Sweep).
 */
@RestController
@RequestMapping("/api/engine")
@Profile("engine")
public class CacheAdminController {

    private final TieredCacheManager cache;

    public CacheAdminController(TieredCacheManager cache) {
        this.cache = cache;
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStatsSnapshot> stats() {
        return ResponseEntity.ok(cache.stats());
    }

    @GetMapping("/cache/tiers/{tier}/entries")
    public ResponseEntity<List<CacheEntry>> entries(@PathVariable("tier") String tier) {
        requireTier(tier);
        return ResponseEntity.ok(cache.entries(tier));
    }

    @PutMapping("/admin/cache/pins/{objectId}")
    public ResponseEntity<Map<String, String>> pin(@PathVariable("objectId") String objectId) {
        return pinResult(objectId, cache.pin(objectId), "pinned");
    }

    @DeleteMapping("/admin/cache/pins/{objectId}")
    public ResponseEntity<Map<String, String>> unpin(@PathVariable("objectId") String objectId) {
        return pinResult(objectId, cache.unpin(objectId), "unpinned");
    }

    /**
     * Verdrängt LRU/LFU-Opfer, bis die Tier ihre Kapazität einhält.
     */
    @PostMapping("/admin/cache/tiers/{tier}/evict")
    public ResponseEntity<Map<String, Object>> evict(@PathVariable("tier") String tier) {
        requireTier(tier);
        return ResponseEntity.ok(Map.of("tier", tier, "evicted", cache.evict(tier)));
    }

    @PostMapping("/admin/cache/sweep")
    public ResponseEntity<Map<String, Object>> sweep() {
        return ResponseEntity.ok(Map.of("moved", cache.sweep()));
    }

    private ResponseEntity<Map<String, String>> pinResult(String objectId, boolean found, String status) {
        return found
                ? ResponseEntity.ok(Map.of("objectId", objectId, "status", status))
                : ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("objectId", objectId, "status", "not cached"));
    }

    private void requireTier(String tier) {
        if (!cache.hasTier(tier)) {
            throw new UnknownBackendException(tier);
        }
    }
}
