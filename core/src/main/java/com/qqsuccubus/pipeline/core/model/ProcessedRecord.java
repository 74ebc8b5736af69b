package com.qqsuccubus.pipeline.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Persisted fact that an idempotency key was durably processed.
 * Removed only by the expiration sweep.
 */
@Value
@Builder
public class ProcessedRecord {
    String idempotencyKey;
    Instant firstProcessedAt;
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
