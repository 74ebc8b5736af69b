package com.qqsuccubus.pipeline.core.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Counts received-but-unfinished messages per lane and pauses the transport for a lane whose
 * backlog reaches the high watermark. The lane is resumed once it drains to half of it.
 * <p>
 * Pinned lanes (halted partitions) stay paused until restart.
 * </p>
 */
final class LaneBacklog {
    private static final Logger log = LoggerFactory.getLogger(LaneBacklog.class);

    private final Transport transport;
    private final int highWatermark;
    private final int lowWatermark;

    private final Map<String, Integer> depth = new HashMap<>();
    private final Set<String> paused = new HashSet<>();
    private final Set<String> pinned = new HashSet<>();

    LaneBacklog(Transport transport, int highWatermark) {
        if (highWatermark <= 0) {
            throw new IllegalArgumentException("highWatermark must be positive");
        }
        this.transport = transport;
        this.highWatermark = highWatermark;
        this.lowWatermark = highWatermark / 2;
    }

    synchronized void received(String lane) {
        int backlog = depth.merge(lane, 1, Integer::sum);
        if (backlog >= highWatermark && paused.add(lane)) {
            log.info("Pausing lane {}: {} messages waiting", lane, backlog);
            transport.pause(lane);
        }
    }

    synchronized void completed(String lane) {
        Integer current = depth.get(lane);
        if (current == null) {
            return;
        }
        int backlog = current - 1;
        if (backlog <= 0) {
            depth.remove(lane);
        } else {
            depth.put(lane, backlog);
        }
        if (backlog <= lowWatermark && !pinned.contains(lane) && paused.remove(lane)) {
            log.info("Resuming lane {}: {} messages waiting", lane, Math.max(backlog, 0));
            transport.resume(lane);
        }
    }

    /**
     * Pauses a lane until restart.
     */
    synchronized void pin(String lane) {
        if (pinned.add(lane) && paused.add(lane)) {
            transport.pause(lane);
        }
    }

    synchronized int depth(String lane) {
        return depth.getOrDefault(lane, 0);
    }

    synchronized int pausedCount() {
        return paused.size();
    }

    synchronized boolean isPaused(String lane) {
        return paused.contains(lane);
    }
}
