package de.htwsaar.tierstore.common.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Gemeinsamer JSON-Codec für persistierte Dokumente (Policies, Zustands-Snapshots).
 *
 * <p>Zeitwerte ({@code Duration}, {@code Instant}) werden als ISO-8601-Strings geschrieben,
 * damit die gespeicherten Dokumente lesbar bleiben.</p>
 */
public final class JacksonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static {
        MAPPER.registerModule(new JavaTimeModule());
        MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        MAPPER.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        MAPPER.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private JacksonCodec() {
        // Utility
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Object obj) {
        try {
            return MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new TierStoreSerializationException("Failed to serialize object to JSON", e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return MAPPER.readValue(json, clazz);
        } catch (JsonProcessingException e) {
            throw new TierStoreSerializationException(
                    "Failed to deserialize JSON to [" + clazz.getSimpleName() + "]", e);
        }
    }
}
