package com.qqsuccubus.pipeline.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Unit of delivery handed over by the transport.
 * <p>
 * <b>Ordering guarantee:</b> messages sharing {@code topic} and {@code partitionKey}
 * are delivered in {@code sequenceToken} order and processed one at a time.
 * </p>
 * <p>
 * <b>At-least-once semantics:</b> the same message may be delivered more than once
 * (rebalance, restart before commit). Duplicates are absorbed through the idempotency key.
 * </p>
 * Immutable once received: payload and headers are copied on the way in and out.
 */
@Value
public class Message {
    /**
     * Source topic (or queue) name.
     */
    String topic;

    /**
     * Ordering group inside the topic (e.g. the Kafka partition number).
     */
    String partitionKey;

    /**
     * Business key of the record, nullable. Preserved when dead-lettering.
     */
    String key;

    /**
     * Monotonic position inside the partition (e.g. Kafka offset).
     */
    long sequenceToken;

    byte[] payload;

    /**
     * Ordered headers, never null.
     */
    Map<String, String> headers;

    Instant deliveryTimestamp;

    @Builder(toBuilder = true)
    public Message(String topic,
                   String partitionKey,
                   String key,
                   long sequenceToken,
                   byte[] payload,
                   Map<String, String> headers,
                   Instant deliveryTimestamp) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.partitionKey = Objects.requireNonNull(partitionKey, "partitionKey");
        this.key = key;
        this.sequenceToken = sequenceToken;
        this.payload = payload == null ? new byte[0] : payload.clone();
        this.headers = headers == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.deliveryTimestamp = deliveryTimestamp == null ? Instant.EPOCH : deliveryTimestamp;
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    /**
     * Returns a header value or {@code null} when absent.
     */
    public String header(String name) {
        return headers.get(name);
    }

    /**
     * Ordering lane of this message: {@code topic-partitionKey}.
     */
    public String lane() {
        return topic + "-" + partitionKey;
    }

    /**
     * Short human-readable coordinates for logging.
     */
    public String coordinates() {
        return lane() + "@" + sequenceToken;
    }
}
