package com.qqsuccubus.pipeline.core.idempotency;

import com.qqsuccubus.pipeline.core.model.IdempotencyKey;
import com.qqsuccubus.pipeline.core.model.Message;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdempotencyKeyResolverTest {

    private static Message message(Map<String, String> headers) {
        return Message.builder()
            .topic("payments")
            .partitionKey("2")
            .sequenceToken(41)
            .payload("{}".getBytes())
            .headers(headers)
            .build();
    }

    @Test
    void testHeaderPresent_UsesLogicalId() {
        IdempotencyKey key = IdempotencyKeyResolver.fromHeader("idempotency-key")
            .resolve(message(Map.of("idempotency-key", "pay-7")));

        assertEquals("pay-7", key.getValue());
        assertFalse(key.isCoordinateBased());
    }

    @Test
    void testHeaderMissing_FallsBackToCoordinates() {
        IdempotencyKey key = IdempotencyKeyResolver.fromHeader("idempotency-key").resolve(message(Map.of()));

        assertEquals("payments/2/41", key.getValue());
        assertTrue(key.isCoordinateBased());
    }

    @Test
    void testBlankLogicalId_FallsBackToCoordinates() {
        IdempotencyKey key = IdempotencyKeyResolver.logicalId(m -> "  ").resolve(message(Map.of()));

        assertTrue(key.isCoordinateBased());
    }
}
