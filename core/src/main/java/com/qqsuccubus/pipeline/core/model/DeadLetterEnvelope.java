package com.qqsuccubus.pipeline.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A permanently failed message packaged with its failure metadata.
 * Created only by the dead-letter router; never modified afterwards.
 */
@Value
@Builder
public class DeadLetterEnvelope {
    Message originalMessage;
    FailureReason failureReason;
    String failureDetail;
    int attemptCount;
    Instant firstFailedAt;
    Instant lastFailedAt;
}
