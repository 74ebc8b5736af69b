package com.qqsuccubus.pipeline.consumer.config;

import com.qqsuccubus.pipeline.core.config.PipelineConfig;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Configuration for the consumer node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class ConsumerConfig {

    public enum StoreType {
        REDIS,
        MEMORY
    }

    String nodeId;
    int httpPort;
    String kafkaBootstrap;
    String groupId;
    List<String> topics;
    Duration commitInterval;
    int maxPollRecords;
    StoreType idempotencyStore;
    String redisUrl;
    String deadLetterFallbackFile;   // null = no local fallback, routing failures halt the partition
    Duration shutdownGrace;
    PipelineConfig pipeline;

    public static ConsumerConfig fromEnv() {
        String fallbackFile = getEnv("DEAD_LETTER_FALLBACK_FILE", "");
        return ConsumerConfig.builder()
            .nodeId(getEnv("NODE_ID", "consumer-node-1"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
            .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
            .groupId(getEnv("KAFKA_GROUP_ID", "pipeline-consumer"))
            .topics(parseTopics(getEnv("KAFKA_TOPICS", "events")))
            .commitInterval(Duration.ofMillis(Long.parseLong(getEnv("COMMIT_INTERVAL_MS", "1000"))))
            .maxPollRecords(Integer.parseInt(getEnv("MAX_POLL_RECORDS", "500")))
            .idempotencyStore(StoreType.valueOf(getEnv("IDEMPOTENCY_STORE", "REDIS")))
            .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
            .deadLetterFallbackFile(fallbackFile.isBlank() ? null : fallbackFile)
            .shutdownGrace(Duration.ofSeconds(Long.parseLong(getEnv("SHUTDOWN_GRACE_SEC", "30"))))
            .pipeline(PipelineConfig.fromEnv())
            .build();
    }

    static List<String> parseTopics(String value) {
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(topic -> !topic.isEmpty())
            .collect(Collectors.toList());
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
