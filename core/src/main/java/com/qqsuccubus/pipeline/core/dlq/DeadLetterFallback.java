package com.qqsuccubus.pipeline.core.dlq;

import com.qqsuccubus.pipeline.core.model.DeadLetterEnvelope;
import reactor.core.publisher.Mono;

/**
 * Local last-resort sink for envelopes the dead-letter destination would not accept.
 */
public interface DeadLetterFallback {

    Mono<Void> persist(String destination, DeadLetterEnvelope envelope);
}
