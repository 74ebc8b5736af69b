package com.qqsuccubus.pipeline.core.idempotency;

import com.qqsuccubus.pipeline.core.error.ConflictException;
import com.qqsuccubus.pipeline.core.error.StoreUnavailableException;
import com.qqsuccubus.pipeline.core.model.IdempotencyKey;
import com.qqsuccubus.pipeline.core.model.ProcessedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local idempotency store, bounded by entry count and TTL.
 * <p>
 * Marking is atomic per key through {@link ConcurrentHashMap#compute}. Capacity for a new key
 * is reserved before it is inserted, so {@code maxEntries} holds under concurrent marks. A full store never
 * evicts live records: it sweeps expired ones and, if still full, reports itself unavailable
 * so the message is retried instead of risking a duplicate effect.
 * </p>
 * <p>
 * Only durable within one process. Suitable for tests and single-node deployments where the
 * business effect lives in the same memory.
 * </p>
 */
public class InMemoryIdempotencyStore implements IdempotencyStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryIdempotencyStore.class);

    private final Map<String, ProcessedRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxEntries;
    private final AtomicInteger slots = new AtomicInteger();

    private enum MarkOutcome { INSERTED, REPLACED, CONFLICT, RETRY }

    public InMemoryIdempotencyStore(Clock clock, int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.clock = clock;
        this.maxEntries = maxEntries;
    }

    public InMemoryIdempotencyStore() {
        this(Clock.systemUTC(), 1_000_000);
    }

    @Override
    public Mono<Boolean> hasProcessed(IdempotencyKey key) {
        return Mono.fromCallable(() -> {
            ProcessedRecord record = records.get(key.getValue());
            return record != null && !record.isExpired(clock.instant());
        });
    }

    @Override
    public Mono<Void> markProcessed(IdempotencyKey key, Duration ttl) {
        return Mono.fromRunnable(() -> {
            Instant now = clock.instant();
            String value = key.getValue();

            while (true) {
                boolean reserved = !records.containsKey(value);
                if (reserved) {
                    reserveSlot(now);
                }

                AtomicReference<MarkOutcome> outcome = new AtomicReference<>();
                records.compute(value, (k, existing) -> {
                    if (existing != null && !existing.isExpired(now)) {
                        outcome.set(MarkOutcome.CONFLICT);
                        return existing;
                    }
                    if (existing == null && !reserved) {
                        // Swept between the lookup and the compute: retry with a reserved slot
                        outcome.set(MarkOutcome.RETRY);
                        return null;
                    }
                    outcome.set(existing == null ? MarkOutcome.INSERTED : MarkOutcome.REPLACED);
                    return ProcessedRecord.builder()
                        .idempotencyKey(k)
                        .firstProcessedAt(now)
                        .expiresAt(now.plus(ttl))
                        .build();
                });

                if (reserved && outcome.get() != MarkOutcome.INSERTED) {
                    slots.decrementAndGet();
                }
                if (outcome.get() == MarkOutcome.CONFLICT) {
                    throw new ConflictException(value);
                }
                if (outcome.get() != MarkOutcome.RETRY) {
                    return;
                }
            }
        });
    }

    /**
     * Claims capacity for a new key, sweeping expired records once if the store is full.
     */
    private void reserveSlot(Instant now) {
        if (tryReserve()) {
            return;
        }
        int removed = sweep(now);
        if (!tryReserve()) {
            throw new StoreUnavailableException(
                "Idempotency store full (" + maxEntries + " live records, " + removed + " swept)"
            );
        }
    }

    private boolean tryReserve() {
        return slots.getAndUpdate(n -> n < maxEntries ? n + 1 : n) < maxEntries;
    }

    @Override
    public Mono<Integer> sweepExpired() {
        return Mono.fromCallable(() -> sweep(clock.instant()));
    }

    private int sweep(Instant now) {
        int removed = 0;
        for (Map.Entry<String, ProcessedRecord> entry : records.entrySet()) {
            if (entry.getValue().isExpired(now) && records.remove(entry.getKey(), entry.getValue())) {
                slots.decrementAndGet();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired idempotency records ({} remaining)", removed, records.size());
        }
        return removed;
    }

    public Optional<ProcessedRecord> find(IdempotencyKey key) {
        return Optional.ofNullable(records.get(key.getValue()));
    }

    public int size() {
        return records.size();
    }
}
