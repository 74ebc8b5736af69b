package com.qqsuccubus.pipeline.consumer;

import com.qqsuccubus.pipeline.consumer.config.ConsumerConfig;
import com.qqsuccubus.pipeline.consumer.http.HttpServer;
import com.qqsuccubus.pipeline.consumer.kafka.KafkaTransport;
import com.qqsuccubus.pipeline.consumer.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.pipeline.consumer.redis.RedisIdempotencyStore;
import com.qqsuccubus.pipeline.core.dlq.JsonFileDeadLetterFallback;
import com.qqsuccubus.pipeline.core.idempotency.IdempotencyStore;
import com.qqsuccubus.pipeline.core.idempotency.InMemoryIdempotencyStore;
import com.qqsuccubus.pipeline.core.metrics.PipelineMetrics;
import com.qqsuccubus.pipeline.core.pipeline.MessageHandler;
import com.qqsuccubus.pipeline.core.pipeline.ProcessingPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ServiceLoader;

/**
 * Main entry point for the consumer node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Consume the configured Kafka topics through the processing pipeline</li>
 *   <li>Deduplicate through the Redis (or in-memory) idempotency store</li>
 *   <li>Dead-letter to {@code <topic>.dlq}, optionally falling back to a local JSON file</li>
 *   <li>Expose /healthz, /readyz, /halted and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class ConsumerApp {
    private static final Logger log = LoggerFactory.getLogger(ConsumerApp.class);

    public static void main(String[] args) {
        ConsumerConfig config = ConsumerConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting consumer node: {}", config.getNodeId());
        log.info("  Kafka: {} topics={} group={}", config.getKafkaBootstrap(), config.getTopics(), config.getGroupId());
        log.info("  Idempotency store: {}", config.getIdempotencyStore());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter();
        PipelineMetrics metrics = new PipelineMetrics(metricsExporter.getRegistry(), config.getNodeId());

        MessageHandler handler = loadHandler();
        IdempotencyStore store = config.getIdempotencyStore() == ConsumerConfig.StoreType.REDIS
            ? new RedisIdempotencyStore(config.getRedisUrl())
            : new InMemoryIdempotencyStore();
        KafkaTransport transport = new KafkaTransport(config);

        ProcessingPipeline pipeline = ProcessingPipeline.builder()
            .transport(transport)
            .handler(handler)
            .store(store)
            .config(config.getPipeline())
            .deadLetterFallback(config.getDeadLetterFallbackFile() == null
                ? null
                : new JsonFileDeadLetterFallback(Path.of(config.getDeadLetterFallbackFile())))
            .metrics(metrics)
            .build();

        HttpServer httpServer = new HttpServer(config, pipeline, metricsExporter);
        httpServer.start();

        pipeline.start();
        log.info("Consumer node {} is ready (handler: {})", config.getNodeId(), handler.getClass().getName());

        handleShutdown(config, pipeline, transport, httpServer, store);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    static MessageHandler loadHandler() {
        return ServiceLoader.load(MessageHandler.class)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException(
                "No " + MessageHandler.class.getName() + " registered in META-INF/services"));
    }

    private static void handleShutdown(ConsumerConfig config,
                                       ProcessingPipeline pipeline,
                                       KafkaTransport transport,
                                       HttpServer httpServer,
                                       IdempotencyStore store) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, initiating graceful shutdown...");
            MDC.put("nodeId", config.getNodeId());

            // Finish in-flight attempts, no new retries
            pipeline.stop(config.getShutdownGrace());
            pipeline.close();

            transport.close().block(Duration.ofSeconds(10));
            httpServer.stop();

            if (store instanceof RedisIdempotencyStore redisStore) {
                redisStore.close();
            }

            log.info("Shutdown complete");
        }));
    }
}
