package com.qqsuccubus.pipeline.core.pipeline;

/**
 * Lifecycle of a delivered message.
 * <p>
 * {@code RECEIVED -> (REASSEMBLING) -> CHECKING -> PROCESSING -> COMMITTED | RETRYING -> PROCESSING | DEAD_LETTERED}
 * </p>
 */
public enum ProcessingState {
    RECEIVED,

    /** Fragment parked until its logical message is complete. Not acknowledged yet. */
    REASSEMBLING,

    CHECKING,
    PROCESSING,
    RETRYING,

    /** Processed or recognized as duplicate, acknowledged. */
    COMMITTED,

    /** Routed to the dead-letter destination, acknowledged. */
    DEAD_LETTERED,

    /** Partition halted after a dead-letter routing failure. Not acknowledged. */
    HALTED,

    /** Dropped by shutdown before reaching an outcome. Not acknowledged. */
    ABANDONED;

    /**
     * Whether the delivered message gets acknowledged in this state.
     */
    public boolean isAcknowledged() {
        return this == COMMITTED || this == DEAD_LETTERED;
    }
}
