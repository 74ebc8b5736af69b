package com.qqsuccubus.pipeline.consumer.kafka;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OffsetTrackerTest {

    private OffsetTracker<String> tracker;

    @BeforeEach
    void setUp() {
        tracker = new OffsetTracker<>();
        for (long offset = 10; offset < 15; offset++) {
            tracker.register("orders-0", offset, "o" + offset);
        }
    }

    @Test
    void testInOrderAcks_CommitEachOffset() {
        assertEquals(Optional.of("o10"), tracker.ack("orders-0", 10));
        assertEquals(Optional.of("o11"), tracker.ack("orders-0", 11));
        assertEquals(3, tracker.pending("orders-0"));
    }

    @Test
    void testParkedOffset_BlocksCommitUntilAcked() {
        // 10 is a parked chunk fragment; later messages complete first
        assertEquals(Optional.empty(), tracker.ack("orders-0", 11));
        assertEquals(Optional.empty(), tracker.ack("orders-0", 12));
        assertEquals(Optional.empty(), tracker.ack("orders-0", 14));

        assertEquals(Optional.of("o12"), tracker.ack("orders-0", 10));
        assertEquals(2, tracker.pending("orders-0"));

        assertEquals(Optional.of("o14"), tracker.ack("orders-0", 13));
        assertEquals(0, tracker.pending("orders-0"));
    }

    @Test
    void testUnknownOffsetOrPartition_Ignored() {
        assertEquals(Optional.empty(), tracker.ack("orders-0", 99));
        assertEquals(Optional.empty(), tracker.ack("orders-7", 10));
    }

    @Test
    void testRevoke_ForgetsPartition() {
        tracker.revoke("orders-0");

        assertEquals(0, tracker.pending("orders-0"));
        assertEquals(Optional.empty(), tracker.ack("orders-0", 10));
    }

    @Test
    void testPartitionsAreIndependent() {
        tracker.register("orders-1", 0, "p1-0");

        assertEquals(Optional.of("p1-0"), tracker.ack("orders-1", 0));
        assertEquals(5, tracker.pending("orders-0"));
    }
}
