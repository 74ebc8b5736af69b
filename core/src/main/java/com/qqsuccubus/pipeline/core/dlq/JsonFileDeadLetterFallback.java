package com.qqsuccubus.pipeline.core.dlq;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.pipeline.core.model.DeadLetterEnvelope;
import com.qqsuccubus.pipeline.core.model.Message;
import com.qqsuccubus.pipeline.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends envelopes to a file, one JSON object per line.
 * <p>
 * Fields: destination, topic, partitionKey, key, sequenceToken, payload (base64), headers,
 * failureReason, failureDetail, attemptCount, firstFailedAt, lastFailedAt.
 * </p>
 */
public class JsonFileDeadLetterFallback implements DeadLetterFallback {
    private static final Logger log = LoggerFactory.getLogger(JsonFileDeadLetterFallback.class);

    private final Path file;
    private final Object writeLock = new Object();

    public JsonFileDeadLetterFallback(Path file) {
        this.file = file;
    }

    @Override
    public Mono<Void> persist(String destination, DeadLetterEnvelope envelope) {
        return Mono.fromCallable(() -> {
                String line = JsonUtils.writeValueAsString(toJson(destination, envelope)) + "\n";
                synchronized (writeLock) {
                    Path parent = file.toAbsolutePath().getParent();
                    if (parent != null) {
                        Files.createDirectories(parent);
                    }
                    Files.writeString(file, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.SYNC);
                }
                log.warn("Dead letter for {} written to fallback file {}",
                    envelope.getOriginalMessage().coordinates(), file);
                return line;
            })
            .onErrorMap(IOException.class, e -> new IOException("Cannot append to " + file, e))
            .subscribeOn(Schedulers.boundedElastic())
            .then();
    }

    private static ObjectNode toJson(String destination, DeadLetterEnvelope envelope) {
        Message original = envelope.getOriginalMessage();
        ObjectNode node = JsonUtils.mapper().createObjectNode();
        node.put("destination", destination);
        node.put("topic", original.getTopic());
        node.put("partitionKey", original.getPartitionKey());
        node.put("key", original.getKey());
        node.put("sequenceToken", original.getSequenceToken());
        node.put("payload", original.getPayload());
        ObjectNode headers = node.putObject("headers");
        original.getHeaders().forEach(headers::put);
        node.put("failureReason", envelope.getFailureReason().name());
        node.put("failureDetail", envelope.getFailureDetail());
        node.put("attemptCount", envelope.getAttemptCount());
        node.put("firstFailedAt", String.valueOf(envelope.getFirstFailedAt()));
        node.put("lastFailedAt", String.valueOf(envelope.getLastFailedAt()));
        return node;
    }
}
