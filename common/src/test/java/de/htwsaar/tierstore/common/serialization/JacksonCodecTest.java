package de.htwsaar.tierstore.common.serialization;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JacksonCodecTest {

    record WindowDoc(String backend, Duration window, Instant since) {}

    @Test
    void testToJson() {
        WindowDoc doc = new WindowDoc("s3-eu", Duration.ofMinutes(5), Instant.parse("2026-01-01T00:00:00Z"));
        String json = JacksonCodec.toJson(doc);

        assertNotNull(json);
        assertTrue(json.contains("\"backend\":\"s3-eu\""));
        assertTrue(json.contains("\"window\":\"PT5M\""));
        assertTrue(json.contains("\"since\":\"2026-01-01T00:00:00Z\""));
    }

    @Test
    void testFromJson() {
        String json = "{\"backend\":\"local\",\"window\":\"PT1H\",\"since\":\"2026-02-01T10:00:00Z\",\"extra\":1}";
        WindowDoc doc = JacksonCodec.fromJson(json, WindowDoc.class);

        assertEquals("local", doc.backend());
        assertEquals(Duration.ofHours(1), doc.window());
        assertEquals(Instant.parse("2026-02-01T10:00:00Z"), doc.since());
    }

    @Test
    void testFromJson_InvalidJson_ThrowsException() {
        // Kein gültiges JSON
        String invalidJson = "{backend: kaputt}";
        assertThrows(TierStoreSerializationException.class, () -> JacksonCodec.fromJson(invalidJson, WindowDoc.class));
    }
}
