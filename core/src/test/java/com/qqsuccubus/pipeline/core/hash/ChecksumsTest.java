package com.qqsuccubus.pipeline.core.hash;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChecksumsTest {

    @Test
    void testCrc32c_KnownVector() {
        // RFC 3720 check value for "123456789"
        assertEquals("e3069283", Checksums.crc32c("123456789".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void testMatches_IgnoresCaseRejectsNull() {
        byte[] data = "123456789".getBytes(StandardCharsets.US_ASCII);

        assertTrue(Checksums.matches("E3069283", data));
        assertFalse(Checksums.matches(null, data));
        assertFalse(Checksums.matches("00000000", data));
    }
}
