package com.qqsuccubus.pipeline.core.chunk;

import com.qqsuccubus.pipeline.core.model.Message;
import lombok.Getter;

import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fragments received so far for one logical message.
 * <p>
 * Mutated only under the assembler's per-id serialization.
 * </p>
 */
public class PartialAssembly {

    enum AddOutcome {
        ADDED,
        DUPLICATE,
        CONFLICTING
    }

    @Getter
    private final String logicalMessageId;
    @Getter
    private final int totalChunks;
    @Getter
    private final Instant createdAt;

    private final Map<Integer, byte[]> receivedChunks = new TreeMap<>();
    private final List<Message> origins = new ArrayList<>();
    private Message firstOrigin;
    @Getter
    private String messageChecksum;

    PartialAssembly(String logicalMessageId, int totalChunks, Instant createdAt) {
        this.logicalMessageId = logicalMessageId;
        this.totalChunks = totalChunks;
        this.createdAt = createdAt;
    }

    AddOutcome add(ChunkFragment fragment) {
        byte[] existing = receivedChunks.get(fragment.getChunkIndex());
        if (existing != null && !Arrays.equals(existing, fragment.getPayloadSlice())) {
            return AddOutcome.CONFLICTING;
        }
        if (fragment.getOrigin() != null) {
            origins.add(fragment.getOrigin());
        }
        if (existing != null) {
            return AddOutcome.DUPLICATE;
        }

        receivedChunks.put(fragment.getChunkIndex(), fragment.getPayloadSlice());
        if (fragment.getChunkIndex() == 0) {
            firstOrigin = fragment.getOrigin();
        }
        if (messageChecksum == null) {
            messageChecksum = fragment.getMessageChecksum();
        }
        return AddOutcome.ADDED;
    }

    boolean isComplete() {
        return receivedChunks.size() == totalChunks;
    }

    /**
     * Concatenates slices in chunk index order.
     */
    byte[] concatenate() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < totalChunks; i++) {
            out.writeBytes(receivedChunks.get(i));
        }
        return out.toByteArray();
    }

    Message getFirstOrigin() {
        return firstOrigin;
    }

    public int getReceivedCount() {
        return receivedChunks.size();
    }

    public List<Message> getOrigins() {
        return List.copyOf(origins);
    }
}
