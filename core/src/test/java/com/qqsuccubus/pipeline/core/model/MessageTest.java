package com.qqsuccubus.pipeline.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MessageTest {

    @Test
    void testPayloadAndHeaders_CopiedOnTheWayInAndOut() {
        byte[] payload = {1, 2, 3};
        Map<String, String> headers = new HashMap<>(Map.of("a", "1"));
        Message message = Message.builder().topic("t").partitionKey("0").payload(payload).headers(headers).build();

        payload[0] = 9;
        headers.put("b", "2");
        message.getPayload()[1] = 9;

        assertEquals(1, message.getPayload()[0]);
        assertEquals(2, message.getPayload()[1]);
        assertEquals(Map.of("a", "1"), message.getHeaders());
        assertThrows(UnsupportedOperationException.class, () -> message.getHeaders().put("c", "3"));
    }

    @Test
    void testDefaults_EmptyPayloadAndEpochTimestamp() {
        Message message = Message.builder().topic("t").partitionKey("0").build();

        assertEquals(0, message.getPayload().length);
        assertEquals(Instant.EPOCH, message.getDeliveryTimestamp());
        assertEquals("t-0@0", message.coordinates());
    }

    @Test
    void testRetryState_CountsAttemptsAndRetries() {
        RetryState state = new RetryState(Instant.EPOCH);
        assertEquals(0, state.retriesPerformed());

        state.recordFailure(new IllegalStateException("1"), Instant.parse("2024-01-01T00:00:00Z"));
        state.recordFailure(new IllegalStateException("2"), Instant.parse("2024-01-01T00:00:05Z"));

        assertEquals(2, state.getAttemptCount());
        assertEquals(1, state.retriesPerformed());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), state.getFirstFailedAt());
        assertEquals(Instant.parse("2024-01-01T00:00:05Z"), state.getLastFailedAt());
        assertEquals("2", state.getLastError().getMessage());
    }
}
