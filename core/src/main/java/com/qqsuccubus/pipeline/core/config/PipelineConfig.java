package com.qqsuccubus.pipeline.core.config;

import com.qqsuccubus.pipeline.core.idempotency.IdempotencyMode;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration of the processing pipeline, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class PipelineConfig {

    // Worker pool
    @Builder.Default
    int workerPoolSize = 8;
    @Builder.Default
    int workerQueueCapacity = 10_000;
    @Builder.Default
    int laneHighWatermark = 256;     // backlog per lane at which the transport is paused for it

    // Retry
    @Builder.Default
    int maxAttempts = 3;             // retry budget after the first failure
    @Builder.Default
    Duration baseDelay = Duration.ofMillis(200);
    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(30);

    // Idempotency
    @Builder.Default
    Duration retention = Duration.ofDays(7);   // must exceed the worst redelivery/rebalance latency
    @Builder.Default
    Duration storeTimeout = Duration.ofSeconds(5);
    @Builder.Default
    IdempotencyMode idempotencyMode = IdempotencyMode.TRANSACTIONAL;
    @Builder.Default
    String idempotencyKeyHeader = "idempotency-key";

    // Chunking
    @Builder.Default
    Duration maxAssemblyAge = Duration.ofMinutes(5);
    @Builder.Default
    Duration sweepInterval = Duration.ofSeconds(30);

    // Dead letters
    @Builder.Default
    String deadLetterSuffix = ".dlq";
    @Builder.Default
    int deadLetterMaxAttempts = 0;   // 0 = retry the dead-letter publish without limit

    public static PipelineConfig fromEnv() {
        return PipelineConfig.builder()
            .workerPoolSize(Integer.parseInt(getEnv("WORKER_POOL_SIZE", "8")))
            .workerQueueCapacity(Integer.parseInt(getEnv("WORKER_QUEUE_CAPACITY", "10000")))
            .laneHighWatermark(Integer.parseInt(getEnv("LANE_HIGH_WATERMARK", "256")))
            .maxAttempts(Integer.parseInt(getEnv("MAX_ATTEMPTS", "3")))
            .baseDelay(Duration.ofMillis(Long.parseLong(getEnv("BASE_DELAY_MS", "200"))))
            .maxDelay(Duration.ofMillis(Long.parseLong(getEnv("MAX_DELAY_MS", "30000"))))
            .retention(Duration.ofSeconds(Long.parseLong(getEnv("RETENTION_SEC", "604800"))))
            .storeTimeout(Duration.ofMillis(Long.parseLong(getEnv("STORE_TIMEOUT_MS", "5000"))))
            .idempotencyMode(IdempotencyMode.valueOf(getEnv("IDEMPOTENCY_MODE", "TRANSACTIONAL")))
            .idempotencyKeyHeader(getEnv("IDEMPOTENCY_KEY_HEADER", "idempotency-key"))
            .maxAssemblyAge(Duration.ofSeconds(Long.parseLong(getEnv("MAX_ASSEMBLY_AGE_SEC", "300"))))
            .sweepInterval(Duration.ofSeconds(Long.parseLong(getEnv("SWEEP_INTERVAL_SEC", "30"))))
            .deadLetterSuffix(getEnv("DEAD_LETTER_SUFFIX", ".dlq"))
            .deadLetterMaxAttempts(Integer.parseInt(getEnv("DEAD_LETTER_MAX_ATTEMPTS", "0")))
            .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
