package com.qqsuccubus.pipeline.core.pipeline;

import com.qqsuccubus.pipeline.core.support.InMemoryTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LaneBacklogTest {

    private InMemoryTransport transport;
    private LaneBacklog backlog;

    @BeforeEach
    void setUp() {
        transport = new InMemoryTransport();
        backlog = new LaneBacklog(transport, 4);
    }

    @Test
    void testHighWatermark_PausesOnce() {
        for (int i = 0; i < 10; i++) {
            backlog.received("orders-0");
        }

        assertEquals(List.of("orders-0"), transport.getPauses());
        assertTrue(backlog.isPaused("orders-0"));
        assertEquals(10, backlog.depth("orders-0"));
    }

    @Test
    void testDrainedToHalf_Resumes() {
        for (int i = 0; i < 4; i++) {
            backlog.received("orders-0");
        }
        backlog.completed("orders-0");
        assertTrue(transport.getResumes().isEmpty());

        backlog.completed("orders-0");

        assertEquals(List.of("orders-0"), transport.getResumes());
        assertFalse(backlog.isPaused("orders-0"));
    }

    @Test
    void testOtherLanes_Unaffected() {
        for (int i = 0; i < 4; i++) {
            backlog.received("orders-0");
        }
        backlog.received("orders-1");

        assertFalse(backlog.isPaused("orders-1"));
        assertEquals(1, backlog.depth("orders-1"));
    }

    @Test
    void testPinnedLane_NeverResumed() {
        backlog.received("orders-0");
        backlog.pin("orders-0");
        backlog.pin("orders-0");
        backlog.completed("orders-0");

        assertEquals(List.of("orders-0"), transport.getPauses());
        assertTrue(transport.getResumes().isEmpty());
        assertTrue(backlog.isPaused("orders-0"));
        assertEquals(0, backlog.depth("orders-0"));
    }
}
