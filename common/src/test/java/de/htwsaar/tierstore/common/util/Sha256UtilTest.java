package de.htwsaar.tierstore.common.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class Sha256UtilTest {

    @Test
    void shouldHashKnownValue() {
        assertEquals(
                "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                Sha256Util.sha256Hex("abc".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void textAndBytesVariantAgree() {
        assertEquals(Sha256Util.sha256Hex("obj-1".getBytes(StandardCharsets.UTF_8)), Sha256Util.sha256Hex("obj-1"));
        assertNotEquals(Sha256Util.sha256Hex("obj-1"), Sha256Util.sha256Hex("obj-2"));
    }
}
