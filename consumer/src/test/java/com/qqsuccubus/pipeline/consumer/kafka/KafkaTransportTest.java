package com.qqsuccubus.pipeline.consumer.kafka;

import com.qqsuccubus.pipeline.consumer.config.ConsumerConfig;
import com.qqsuccubus.pipeline.core.dlq.DeadLetterHeaders;
import com.qqsuccubus.pipeline.core.model.DeadLetterEnvelope;
import com.qqsuccubus.pipeline.core.model.FailureReason;
import com.qqsuccubus.pipeline.core.model.Message;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.apache.kafka.common.record.TimestampType;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KafkaTransportTest {

    private static ConsumerRecord<String, byte[]> record() {
        RecordHeaders headers = new RecordHeaders();
        headers.add("idempotency-key", "pay-1".getBytes(StandardCharsets.UTF_8));
        headers.add("trace-id", "t-1".getBytes(StandardCharsets.UTF_8));
        headers.add("trace-id", "t-2".getBytes(StandardCharsets.UTF_8));
        return new ConsumerRecord<>("payments", 4, 1234L, 1_700_000_000_000L, TimestampType.CREATE_TIME,
            -1, -1, "order-1", "{\"amount\":10}".getBytes(StandardCharsets.UTF_8), headers, Optional.empty());
    }

    @Test
    void testToMessage_MapsCoordinatesAndHeaders() {
        Message message = KafkaTransport.toMessage(record());

        assertEquals("payments", message.getTopic());
        assertEquals("4", message.getPartitionKey());
        assertEquals(1234L, message.getSequenceToken());
        assertEquals("order-1", message.getKey());
        assertEquals("pay-1", message.header("idempotency-key"));
        assertEquals("t-2", message.header("trace-id"));
        assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), message.getDeliveryTimestamp());
        assertEquals("payments-4", message.lane());
    }

    @Test
    void testToProducerRecord_KeepsKeyAndAddsFailureHeaders() {
        Message original = KafkaTransport.toMessage(record());
        DeadLetterEnvelope envelope = DeadLetterEnvelope.builder()
            .originalMessage(original)
            .failureReason(FailureReason.VALIDATION_ERROR)
            .failureDetail("negative amount")
            .attemptCount(1)
            .firstFailedAt(Instant.parse("2024-01-01T00:00:00Z"))
            .lastFailedAt(Instant.parse("2024-01-01T00:00:00Z"))
            .build();

        ProducerRecord<String, byte[]> record = KafkaTransport.toProducerRecord("payments.dlq", envelope);

        assertEquals("payments.dlq", record.topic());
        assertNull(record.partition());
        assertEquals("order-1", record.key());
        assertArrayEquals(original.getPayload(), record.value());
        assertEquals("VALIDATION_ERROR", header(record, DeadLetterHeaders.FAILURE_REASON));
        assertEquals("1234", header(record, DeadLetterHeaders.ORIGINAL_SEQUENCE));
        assertEquals("4", header(record, DeadLetterHeaders.ORIGINAL_PARTITION));
        assertEquals("pay-1", header(record, "idempotency-key"));
    }

    private static String header(ProducerRecord<String, byte[]> record, String name) {
        return new String(record.headers().lastHeader(name).value(), StandardCharsets.UTF_8);
    }

    @Test
    void testPauseBeforeAssignment_RememberedUntilResumed() {
        KafkaTransport transport = new KafkaTransport(ConsumerConfig.builder()
            .nodeId("test-node")
            .kafkaBootstrap("localhost:9")
            .build());
        try {
            transport.pause("payments-4");
            assertTrue(transport.isPaused("payments-4"));
            assertFalse(transport.isPaused("payments-5"));

            transport.resume("payments-4");
            assertFalse(transport.isPaused("payments-4"));
        } finally {
            transport.close().block(Duration.ofSeconds(5));
        }
    }
}
