package com.qqsuccubus.pipeline.core.model;

import lombok.Getter;

import java.time.Instant;

/**
 * Mutable attempt bookkeeping for one in-flight message.
 * <p>
 * Only touched from the message's own partition lane, one attempt at a time.
 * </p>
 */
@Getter
public class RetryState {
    private final Instant firstAttemptAt;
    private int attemptCount;
    private Throwable lastError;
    private Instant firstFailedAt;
    private Instant lastFailedAt;
    private boolean handlerCompleted;

    public RetryState(Instant firstAttemptAt) {
        this.firstAttemptAt = firstAttemptAt;
    }

    /**
     * Records a failed attempt.
     *
     * @return attempt count including this one
     */
    public int recordFailure(Throwable error, Instant at) {
        attemptCount++;
        lastError = error;
        if (firstFailedAt == null) {
            firstFailedAt = at;
        }
        lastFailedAt = at;
        return attemptCount;
    }

    /**
     * Retries already performed: one less than the failed attempts.
     */
    public int retriesPerformed() {
        return Math.max(0, attemptCount - 1);
    }

    /**
     * Business logic succeeded; only the idempotency mark is outstanding.
     */
    public void markHandlerCompleted() {
        this.handlerCompleted = true;
    }
}
