package de.htwsaar.tierstore.engine.web;

import de.htwsaar.tierstore.common.util.Sha256Util;
import de.htwsaar.tierstore.engine.config.EngineProperties;
import de.htwsaar.tierstore.engine.service.StorageEngine;
import de.htwsaar.tierstore.engine.service.StoreResult;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * HTTP-Adapter für Objekte. Kein Fachcode hier, nur Mapping auf die {@link StorageEngine}.
 *
 * <ul>
 *   <li>PUT /api/engine/objects/{id}?backend=… – speichern</li>
 *   <li>GET /api/engine/objects/{id} – lesen</li>
 *   <li>DELETE /api/engine/objects/{id} – löschen (Retention wird geprüft)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/engine/objects")
@Profile("engine")
public class ObjectController {

    private final StorageEngine engine;
    private final Duration timeout;

    public ObjectController(StorageEngine engine, EngineProperties props) {
        this.engine = engine;
        this.timeout = Duration.ofMillis(props.getOperationTimeoutMs());
    }

    @PutMapping(value = "/{objectId}", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<Map<String, Object>> store(
            @PathVariable("objectId") String objectId,
            @RequestParam("backend") String backend,
            @RequestBody byte[] body) {

        StoreResult result = engine.store(objectId, body, backend, timeout);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("objectId", objectId);
        out.put("backend", backend);
        out.put("sizeBytes", result.record().sizeBytes());
        out.put("cacheTier", result.cached() == null ? null : result.cached().tier());
        out.put("verifiedReplicas", result.replicas() == null ? 0 : result.replicas().verifiedCount());
        return ResponseEntity.ok(out);
    }

    @GetMapping("/{objectId}")
    public ResponseEntity<byte[]> read(@PathVariable("objectId") String objectId) {
        byte[] body = engine.read(objectId, timeout);
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_OCTET_STREAM);
        h.set("X-Content-SHA256", Sha256Util.sha256Hex(body));
        return ResponseEntity.ok().headers(h).body(body);
    }

    @DeleteMapping("/{objectId}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable("objectId") String objectId) {
        engine.delete(objectId, timeout);
        return ResponseEntity.ok(Map.of("objectId", objectId, "status", "deleted"));
    }
}
