package com.qqsuccubus.pipeline.consumer.kafka;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks received and acknowledged offsets per partition.
 * <p>
 * Messages of one partition are acknowledged out of order (a parked chunk fragment stays
 * unacknowledged while later messages complete). Only the contiguous acknowledged prefix
 * may be committed, otherwise a restart would skip the parked message.
 * </p>
 *
 * @param <T> handle used to commit an offset (e.g. the record's {@code ReceiverOffset})
 */
public class OffsetTracker<T> {

    private static final class Entry<T> {
        final T handle;
        boolean acked;

        Entry(T handle) {
            this.handle = handle;
        }
    }

    private final Map<String, TreeMap<Long, Entry<T>>> partitions = new ConcurrentHashMap<>();

    /**
     * Registers a received offset. Must be called in delivery order.
     */
    public void register(String partition, long offset, T handle) {
        TreeMap<Long, Entry<T>> pending = partitions.computeIfAbsent(partition, p -> new TreeMap<>());
        synchronized (pending) {
            pending.putIfAbsent(offset, new Entry<>(handle));
        }
    }

    /**
     * Marks an offset acknowledged and advances the committable prefix.
     *
     * @return Handle of the highest offset that became committable, or empty when the prefix did not move
     */
    public Optional<T> ack(String partition, long offset) {
        TreeMap<Long, Entry<T>> pending = partitions.get(partition);
        if (pending == null) {
            return Optional.empty();
        }
        synchronized (pending) {
            Entry<T> entry = pending.get(offset);
            if (entry == null) {
                return Optional.empty();
            }
            entry.acked = true;

            T committable = null;
            while (!pending.isEmpty() && pending.firstEntry().getValue().acked) {
                committable = pending.pollFirstEntry().getValue().handle;
            }
            return Optional.ofNullable(committable);
        }
    }

    /**
     * Forgets a partition after it was revoked; its unacknowledged offsets get redelivered elsewhere.
     */
    public void revoke(String partition) {
        partitions.remove(partition);
    }

    public int pending(String partition) {
        TreeMap<Long, Entry<T>> pending = partitions.get(partition);
        if (pending == null) {
            return 0;
        }
        synchronized (pending) {
            return pending.size();
        }
    }
}
