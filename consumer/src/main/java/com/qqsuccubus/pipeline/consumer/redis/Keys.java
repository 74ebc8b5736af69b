package com.qqsuccubus.pipeline.consumer.redis;

/**
 * Redis keyspace of the consumer node.
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Idempotency record: {@code idem:{idempotencyKey}}
     * <p>
     * <b>Type:</b> String (first processing instant, ISO-8601)
     * <br>
     * <b>TTL:</b> retention window, set atomically with the value ({@code SET NX PX})
     * </p>
     *
     * @param idempotencyKey Idempotency key value
     * @return Redis key
     */
    public static String processed(String idempotencyKey) {
        return "idem:" + idempotencyKey;
    }
}
