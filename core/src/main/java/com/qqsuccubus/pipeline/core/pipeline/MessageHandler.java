package com.qqsuccubus.pipeline.core.pipeline;

import com.qqsuccubus.pipeline.core.model.Message;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Business logic invoked once per logical message attempt.
 * <p>
 * Implementations signal {@link com.qqsuccubus.pipeline.core.error.ValidationException} for
 * content that will never succeed and {@link com.qqsuccubus.pipeline.core.error.TransientException}
 * for failures worth retrying. Other errors are classified through {@link #isRetryable(Throwable)}.
 * </p>
 * <p>
 * In {@link com.qqsuccubus.pipeline.core.idempotency.IdempotencyMode#TRANSACTIONAL TRANSACTIONAL} mode
 * the handler should call {@link ProcessingContext#markProcessed()} inside the same transaction as
 * its side effect.
 * </p>
 */
public interface MessageHandler {

    Mono<Void> process(Message message, ProcessingContext context);

    /**
     * Classifies errors that are not pipeline exceptions. Defaults to retryable.
     */
    default boolean isRetryable(Throwable error) {
        return true;
    }

    /**
     * Upper bound of a single {@link #process} call; exceeding it counts as a transient failure.
     */
    default Duration callTimeout() {
        return Duration.ofSeconds(30);
    }
}
