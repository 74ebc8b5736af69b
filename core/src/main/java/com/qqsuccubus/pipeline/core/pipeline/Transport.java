package com.qqsuccubus.pipeline.core.pipeline;

import com.qqsuccubus.pipeline.core.model.DeadLetterEnvelope;
import com.qqsuccubus.pipeline.core.model.Message;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Message source and sink seen by the pipeline.
 * <p>
 * <b>Delivery contract:</b>
 * <ul>
 *   <li>{@link #receive()} emits messages of one {@link Message#lane() lane} in sequence order</li>
 *   <li>Unacknowledged messages are redelivered after a restart or rebalance</li>
 *   <li>Acknowledging a message never acknowledges an earlier unacknowledged one of the same lane</li>
 * </ul>
 * </p>
 */
public interface Transport {

    Flux<Message> receive();

    /**
     * Acknowledges a message whose processing reached a terminal outcome.
     *
     * @param message Delivered message
     * @return Mono completing when the acknowledgement is recorded
     */
    Mono<Void> ack(Message message);

    /**
     * Publishes a dead-letter envelope to the given destination.
     *
     * @param destination Dead-letter topic or queue name
     * @param envelope    Failed message and its failure metadata
     * @return Mono completing when the destination durably accepted the envelope
     */
    Mono<Void> republish(String destination, DeadLetterEnvelope envelope);

    /**
     * Stops fetching new messages for a lane until {@link #resume(String)}. Messages already
     * fetched may still be emitted. Transports without flow control ignore it.
     *
     * @param lane Lane as returned by {@link Message#lane()}
     */
    default void pause(String lane) {
    }

    default void resume(String lane) {
    }

    Mono<Void> close();
}
