package com.qqsuccubus.pipeline.core.chunk;

import com.qqsuccubus.pipeline.core.model.Message;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Outcome of ingesting one fragment.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AssemblyResult {

    public enum Status {
        INCOMPLETE,
        COMPLETE,
        CHECKSUM_MISMATCH,
        MALFORMED
    }

    Status status;

    /**
     * Reassembled payload, set for {@link Status#COMPLETE} only.
     */
    byte[] payload;

    /**
     * Delivered message of fragment 0, set for {@link Status#COMPLETE} only.
     */
    Message firstFragment;

    /**
     * Delivered fragments concerned by this result: all of them on completion or whole-message
     * mismatch, the offending one for per-fragment failures, empty while incomplete.
     */
    List<Message> origins;

    String detail;

    static AssemblyResult incomplete() {
        return new AssemblyResult(Status.INCOMPLETE, null, null, List.of(), null);
    }

    static AssemblyResult complete(byte[] payload, Message firstFragment, List<Message> origins) {
        return new AssemblyResult(Status.COMPLETE, payload, firstFragment, List.copyOf(origins), null);
    }

    static AssemblyResult checksumMismatch(List<Message> origins, String detail) {
        return new AssemblyResult(Status.CHECKSUM_MISMATCH, null, null, List.copyOf(origins), detail);
    }

    static AssemblyResult malformed(List<Message> origins, String detail) {
        return new AssemblyResult(Status.MALFORMED, null, null, List.copyOf(origins), detail);
    }
}
