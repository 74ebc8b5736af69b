package com.qqsuccubus.pipeline.core.pipeline;

import com.qqsuccubus.pipeline.core.model.IdempotencyKey;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Per-attempt view handed to the {@link MessageHandler}.
 */
public class ProcessingContext {
    private final IdempotencyKey idempotencyKey;
    private final int attempt;
    private final Supplier<Mono<Void>> markAction;
    private final AtomicBoolean marked = new AtomicBoolean(false);

    public ProcessingContext(IdempotencyKey idempotencyKey, int attempt, Supplier<Mono<Void>> markAction) {
        this.idempotencyKey = idempotencyKey;
        this.attempt = attempt;
        this.markAction = markAction;
    }

    public IdempotencyKey getIdempotencyKey() {
        return idempotencyKey;
    }

    /**
     * 1-based attempt number.
     */
    public int getAttempt() {
        return attempt;
    }

    /**
     * Records the idempotency key as processed. Calling it again after success is a no-op.
     *
     * @return Mono completing when the record is durable, or failing with
     *     {@link com.qqsuccubus.pipeline.core.error.ConflictException} if another consumer won
     */
    public Mono<Void> markProcessed() {
        return Mono.defer(() -> marked.get()
            ? Mono.<Void>empty()
            : markAction.get().doOnSuccess(v -> marked.set(true)));
    }

    public boolean isMarked() {
        return marked.get();
    }
}
