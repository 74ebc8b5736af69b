package com.qqsuccubus.pipeline.core.chunk;

import com.qqsuccubus.pipeline.core.model.Message;
import lombok.Builder;
import lombok.Value;

/**
 * One ordered slice of a logical message split by the producer.
 */
@Value
@Builder(toBuilder = true)
public class ChunkFragment {
    String logicalMessageId;

    /**
     * 0-based position; always below {@code totalChunks} for a well-formed fragment.
     */
    int chunkIndex;

    int totalChunks;

    byte[] payloadSlice;

    /**
     * CRC32C of {@code payloadSlice}.
     */
    String checksum;

    /**
     * Optional CRC32C of the whole reassembled payload.
     */
    String messageChecksum;

    /**
     * The delivered message this fragment was read from. Acknowledged or dead-lettered
     * together with the logical message.
     */
    Message origin;
}
