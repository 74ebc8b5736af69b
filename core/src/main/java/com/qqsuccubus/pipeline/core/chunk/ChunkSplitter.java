package com.qqsuccubus.pipeline.core.chunk;

import com.qqsuccubus.pipeline.core.hash.Checksums;
import com.qqsuccubus.pipeline.core.model.Message;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Producer-side counterpart of {@link ChunkAssembler}: splits one payload into fragments
 * carrying the chunk header contract.
 */
public final class ChunkSplitter {
    private ChunkSplitter() {
    }

    /**
     * Splits {@code message} into fragments of at most {@code maxChunkBytes} bytes.
     * <p>
     * Fragment {@code i} gets sequence token {@code message.sequenceToken + i}; transports that
     * assign their own positions ignore it. An empty payload yields a single empty fragment.
     * </p>
     *
     * @param message          Logical message to split
     * @param logicalMessageId Id shared by all fragments
     * @param maxChunkBytes    Slice size, must be positive
     * @return Fragments in index order
     */
    public static List<Message> split(Message message, String logicalMessageId, int maxChunkBytes) {
        if (maxChunkBytes <= 0) {
            throw new IllegalArgumentException("maxChunkBytes must be positive: " + maxChunkBytes);
        }
        byte[] payload = message.getPayload();
        int total = Math.max(1, (payload.length + maxChunkBytes - 1) / maxChunkBytes);
        String messageChecksum = Checksums.crc32c(payload);

        List<Message> fragments = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            byte[] slice = Arrays.copyOfRange(
                payload, i * maxChunkBytes, Math.min(payload.length, (i + 1) * maxChunkBytes)
            );
            Map<String, String> headers = new LinkedHashMap<>(ChunkHeaders.strip(message.getHeaders()));
            headers.put(ChunkHeaders.CHUNK_ID, logicalMessageId);
            headers.put(ChunkHeaders.CHUNK_INDEX, Integer.toString(i));
            headers.put(ChunkHeaders.CHUNK_TOTAL, Integer.toString(total));
            headers.put(ChunkHeaders.CHUNK_CHECKSUM, Checksums.crc32c(slice));
            headers.put(ChunkHeaders.MESSAGE_CHECKSUM, messageChecksum);

            fragments.add(message.toBuilder()
                .sequenceToken(message.getSequenceToken() + i)
                .payload(slice)
                .headers(headers)
                .build());
        }
        return fragments;
    }
}
