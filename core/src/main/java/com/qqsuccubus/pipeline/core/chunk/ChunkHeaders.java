package com.qqsuccubus.pipeline.core.chunk;

import com.qqsuccubus.pipeline.core.error.MalformedChunkingException;
import com.qqsuccubus.pipeline.core.model.Message;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Header contract for chunked messages.
 * <p>
 * A delivered message is a fragment when it carries {@link #CHUNK_ID}. Every fragment
 * must then also carry index, total and slice checksum; the whole-message checksum is optional.
 * </p>
 */
public final class ChunkHeaders {
    public static final String CHUNK_ID = "chunk-id";
    public static final String CHUNK_INDEX = "chunk-index";
    public static final String CHUNK_TOTAL = "chunk-total";
    public static final String CHUNK_CHECKSUM = "chunk-checksum";
    public static final String MESSAGE_CHECKSUM = "chunk-message-checksum";

    private static final List<String> ALL = List.of(
        CHUNK_ID, CHUNK_INDEX, CHUNK_TOTAL, CHUNK_CHECKSUM, MESSAGE_CHECKSUM
    );

    private ChunkHeaders() {
    }

    public static boolean isFragment(Message message) {
        return message.header(CHUNK_ID) != null;
    }

    /**
     * Reads the chunk headers of a delivered fragment.
     *
     * @throws MalformedChunkingException if a required header is missing or not a number
     */
    public static ChunkFragment parse(Message message) {
        String id = required(message, CHUNK_ID);
        if (id.isBlank()) {
            throw new MalformedChunkingException("Blank " + CHUNK_ID + " on " + message.coordinates());
        }
        return ChunkFragment.builder()
            .logicalMessageId(id)
            .chunkIndex(number(message, CHUNK_INDEX))
            .totalChunks(number(message, CHUNK_TOTAL))
            .checksum(required(message, CHUNK_CHECKSUM))
            .messageChecksum(message.header(MESSAGE_CHECKSUM))
            .payloadSlice(message.getPayload())
            .origin(message)
            .build();
    }

    /**
     * Builds the logical message from fragment 0 and the reassembled payload.
     * Coordinates stay those of fragment 0; chunk headers are removed.
     */
    public static Message reconstruct(Message firstFragment, byte[] payload) {
        return firstFragment.toBuilder()
            .payload(payload)
            .headers(strip(firstFragment.getHeaders()))
            .build();
    }

    static Map<String, String> strip(Map<String, String> headers) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        ALL.forEach(copy::remove);
        return copy;
    }

    private static String required(Message message, String name) {
        String value = message.header(name);
        if (value == null) {
            throw new MalformedChunkingException(
                "Missing header " + name + " on fragment " + message.coordinates()
            );
        }
        return value;
    }

    private static int number(Message message, String name) {
        String value = required(message, name);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedChunkingException(
                "Header " + name + "=" + value + " is not a number on " + message.coordinates(), e
            );
        }
    }
}
