package com.qqsuccubus.pipeline.consumer.http;

import com.qqsuccubus.pipeline.consumer.config.ConsumerConfig;
import com.qqsuccubus.pipeline.consumer.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.pipeline.core.pipeline.ProcessingPipeline;
import com.qqsuccubus.pipeline.core.util.JsonUtils;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * HTTP server for health checks, halted partitions and metrics.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final ConsumerConfig config;
    private final ProcessingPipeline pipeline;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                // Liveness - fails while any partition is halted or blocked on dead-letter publishing
                .get("/healthz", (req, res) -> {
                    Set<String> halted = pipeline.haltedPartitions();
                    if (!halted.isEmpty()) {
                        return res.status(503).sendString(Mono.just("Halted partitions: " + halted));
                    }
                    return res.status(200).sendString(Mono.just("OK"));
                })
                .get("/readyz", (req, res) -> {
                    if (pipeline.isShutdownRequested()) {
                        return res.status(503).sendString(Mono.just("Not Ready - Shutting down"));
                    }
                    return res.status(200).sendString(Mono.just("Ready"));
                })
                .get("/halted", (req, res) -> res.status(200)
                    .header("Content-Type", "application/json")
                    .sendString(Mono.fromCallable(() -> JsonUtils.writeValueAsString(Map.of(
                        "nodeId", config.getNodeId(),
                        "halted", pipeline.haltedPartitions(),
                        "routingBlocked", pipeline.routingBlockedPartitions(),
                        "pendingAssemblies", pipeline.pendingAssemblies()
                    )))))
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
            )
            .bind()
            .doOnNext(s -> log.info("HTTP server started on port {}", s.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
