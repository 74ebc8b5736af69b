package com.qqsuccubus.pipeline.consumer.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Adds a Prometheus registry to the global composite shared with reactor-netty and
 * serves its scrape output.
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter() {
        this.registry = Metrics.REGISTRY;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
        }

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);
        log.info("Metrics exporter initialized with global registry + Prometheus");
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
