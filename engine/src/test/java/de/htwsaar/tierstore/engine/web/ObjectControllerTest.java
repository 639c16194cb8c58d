package de.htwsaar.tierstore.engine.web;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import de.htwsaar.tierstore.common.util.Sha256Util;
import de.htwsaar.tierstore.engine.EngineHarness;
import de.htwsaar.tierstore.engine.config.EngineProperties;
import de.htwsaar.tierstore.engine.domain.QuotaExceededException;
import de.htwsaar.tierstore.engine.domain.TierStoreException;
import de.htwsaar.tierstore.engine.domain.UnknownObjectException;
import de.htwsaar.tierstore.engine.policy.RetentionPolicy;
import de.htwsaar.tierstore.engine.policy.StorageQuotaPolicy;
import de.htwsaar.tierstore.engine.service.RetentionViolationException;
import de.htwsaar.tierstore.engine.web.EngineExceptionHandler.ApiError;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.ResponseEntity;

/** Tests für den Objekt-Endpunkt samt Fehlerabbildung. */
class ObjectControllerTest {

    private static final byte[] BODY = "hello world".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path dir;

    private EngineHarness h;
    private ObjectController controller;
    private final EngineExceptionHandler errors = new EngineExceptionHandler();

    @BeforeEach
    void setUp() {
        h = new EngineHarness(dir);
        controller = new ObjectController(h.engine, new EngineProperties());
    }

    @AfterEach
    void tearDown() {
        h.close();
    }

    @Test
    void shouldStoreAndServeObjectWithChecksum() {
        Map<String, Object> stored = controller.store("docs/a.txt", "hot", BODY).getBody();

        assertNotNull(stored);
        assertEquals("docs/a.txt", stored.get("objectId"));
        assertEquals(11L, stored.get("sizeBytes"));
        assertEquals("warm", stored.get("cacheTier"));
        assertEquals(0L, stored.get("verifiedReplicas"));

        ResponseEntity<byte[]> read = controller.read("docs/a.txt");
        assertArrayEquals(BODY, read.getBody());
        assertEquals(Sha256Util.sha256Hex(BODY), read.getHeaders().getFirst("X-Content-SHA256"));

        assertEquals("deleted", controller.delete("docs/a.txt").getBody().get("status"));
        assertThrows(UnknownObjectException.class, () -> controller.read("docs/a.txt"));
    }

    @Test
    void shouldMapQuotaRejectionToInsufficientStorage() {
        h.engine.setPolicy("hot", new StorageQuotaPolicy(15, 0, 0.9));
        controller.store("a", "hot", BODY);

        QuotaExceededException e = assertThrows(QuotaExceededException.class,
                () -> controller.store("b", "hot", BODY));
        ResponseEntity<ApiError> response = errors.engineFailure(e);

        assertEquals(507, response.getStatusCode().value());
        assertEquals("quota_exceeded", response.getBody().code());
    }

    @Test
    void shouldMapRetentionAndUnknownObjectErrors() {
        h.engine.setPolicy("hot", new RetentionPolicy(Duration.ofDays(1), Duration.ZERO, false));
        controller.store("a", "hot", BODY);

        TierStoreException retention = assertThrows(RetentionViolationException.class, () -> controller.delete("a"));
        ResponseEntity<ApiError> conflict = errors.engineFailure(retention);
        assertEquals(409, conflict.getStatusCode().value());
        assertEquals("retention_violation", conflict.getBody().code());

        ResponseEntity<ApiError> missing = errors.engineFailure(new UnknownObjectException("x"));
        assertEquals(404, missing.getStatusCode().value());
        assertEquals("unknown_object", missing.getBody().code());
    }

    @Test
    void shouldMapInvalidInputToBadRequest() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> controller.store(" ", "hot", BODY));

        ResponseEntity<ApiError> response = errors.badRequest(e);

        assertEquals(400, response.getStatusCode().value());
        assertEquals("bad_request", response.getBody().code());
    }
}
