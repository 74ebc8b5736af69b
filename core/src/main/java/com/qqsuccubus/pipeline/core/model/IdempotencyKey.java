package com.qqsuccubus.pipeline.core.model;

import lombok.Value;

/**
 * Deterministic identifier guaranteeing at most one durable effect per key.
 * <p>
 * Either a caller-supplied logical identifier (business key such as a payment id)
 * or, when none is available, the delivery coordinates {@code topic/partitionKey/sequenceToken}.
 * </p>
 */
@Value
public class IdempotencyKey {
    String value;

    /**
     * True when the key falls back to delivery coordinates.
     */
    boolean coordinateBased;

    public static IdempotencyKey logical(String logicalId) {
        if (logicalId == null || logicalId.isBlank()) {
            throw new IllegalArgumentException("Logical id must not be blank");
        }
        return new IdempotencyKey(logicalId, false);
    }

    public static IdempotencyKey fromCoordinates(Message message) {
        return new IdempotencyKey(
            message.getTopic() + "/" + message.getPartitionKey() + "/" + message.getSequenceToken(),
            true
        );
    }

    @Override
    public String toString() {
        return value;
    }
}
