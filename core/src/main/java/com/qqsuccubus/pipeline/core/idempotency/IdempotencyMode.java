package com.qqsuccubus.pipeline.core.idempotency;

/**
 * How the idempotency mark relates to the business side effect.
 */
public enum IdempotencyMode {
    /**
     * The handler writes the mark through {@code ProcessingContext#markProcessed()} inside the
     * transaction of its own side effect. Effect and mark commit or roll back together.
     */
    TRANSACTIONAL,

    /**
     * The pipeline writes the mark right after the handler returns. A crash between the two
     * can repeat the side effect on redelivery.
     */
    ADJACENT
}
