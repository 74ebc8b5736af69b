package com.qqsuccubus.pipeline.core.idempotency;

import com.qqsuccubus.pipeline.core.model.IdempotencyKey;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Tracks which idempotency keys have been durably processed.
 * <p>
 * Implementations signal {@link com.qqsuccubus.pipeline.core.error.StoreUnavailableException}
 * when they cannot answer; callers must never read that as "not processed".
 * </p>
 */
public interface IdempotencyStore {
    /**
     * Checks whether the key was processed inside its retention window.
     *
     * @param key Idempotency key
     * @return Mono of true if already processed
     */
    Mono<Boolean> hasProcessed(IdempotencyKey key);

    /**
     * Atomically records the key as processed.
     * <p>
     * At most one caller succeeds per key within its retention window; the others
     * receive {@link com.qqsuccubus.pipeline.core.error.ConflictException}.
     * </p>
     *
     * @param key Idempotency key
     * @param ttl Retention window
     * @return Mono completing when the record is durable
     */
    Mono<Void> markProcessed(IdempotencyKey key, Duration ttl);

    /**
     * Removes records past their expiry. No state change when nothing expired.
     *
     * @return Mono of the number of removed records
     */
    Mono<Integer> sweepExpired();
}
