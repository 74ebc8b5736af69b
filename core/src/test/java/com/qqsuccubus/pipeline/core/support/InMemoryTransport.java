package com.qqsuccubus.pipeline.core.support;

import com.qqsuccubus.pipeline.core.model.DeadLetterEnvelope;
import com.qqsuccubus.pipeline.core.model.Message;
import com.qqsuccubus.pipeline.core.pipeline.Transport;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Transport replaying a fixed list of messages and recording acks, dead letters and flow control calls.
 */
public class InMemoryTransport implements Transport {

    public static final class Published {
        public final String destination;
        public final DeadLetterEnvelope envelope;

        Published(String destination, DeadLetterEnvelope envelope) {
            this.destination = destination;
            this.envelope = envelope;
        }
    }

    private final List<Message> inbound = new ArrayList<>();
    private final List<Message> acked = new CopyOnWriteArrayList<>();
    private final List<Published> deadLetters = new CopyOnWriteArrayList<>();
    private final List<String> pauses = new CopyOnWriteArrayList<>();
    private final List<String> resumes = new CopyOnWriteArrayList<>();
    private final AtomicInteger republishFailures = new AtomicInteger();
    private final AtomicInteger republishCalls = new AtomicInteger();
    private volatile boolean republishAlwaysFails;

    public InMemoryTransport enqueue(Message... messages) {
        inbound.addAll(List.of(messages));
        return this;
    }

    public InMemoryTransport enqueue(List<Message> messages) {
        inbound.addAll(messages);
        return this;
    }

    /**
     * Fails the next {@code count} republish calls.
     */
    public void failRepublish(int count) {
        republishFailures.set(count);
    }

    public void failRepublishAlways() {
        republishAlwaysFails = true;
    }

    @Override
    public Flux<Message> receive() {
        return Flux.fromIterable(List.copyOf(inbound));
    }

    @Override
    public Mono<Void> ack(Message message) {
        return Mono.fromRunnable(() -> acked.add(message));
    }

    @Override
    public Mono<Void> republish(String destination, DeadLetterEnvelope envelope) {
        return Mono.defer(() -> {
            republishCalls.incrementAndGet();
            if (republishAlwaysFails || republishFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                return Mono.error(new IllegalStateException("broker unavailable"));
            }
            deadLetters.add(new Published(destination, envelope));
            return Mono.empty();
        });
    }

    @Override
    public void pause(String lane) {
        pauses.add(lane);
    }

    @Override
    public void resume(String lane) {
        resumes.add(lane);
    }

    @Override
    public Mono<Void> close() {
        return Mono.empty();
    }

    public List<Message> getAcked() {
        return List.copyOf(acked);
    }

    public Map<String, List<Long>> ackedByLane() {
        return acked.stream().collect(Collectors.groupingBy(
            Message::lane, Collectors.mapping(Message::getSequenceToken, Collectors.toList())));
    }

    public List<Published> getDeadLetters() {
        return List.copyOf(deadLetters);
    }

    public int getRepublishCalls() {
        return republishCalls.get();
    }

    public List<String> getPauses() {
        return List.copyOf(pauses);
    }

    public List<String> getResumes() {
        return List.copyOf(resumes);
    }
}
