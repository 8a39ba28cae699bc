package com.consular.network.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger skippedReferences;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.skippedReferences = registry.gauge("network.analysis.skipped_references", new AtomicInteger(0));
    }

    public void recordAnalysis(String mode, Duration elapsed, int nodeCount, int clusterCount) {
        Counter.builder("network.analysis.count")
                .tag("mode", mode)
                .register(registry)
                .increment();

        Timer.builder("network.analysis.duration")
                .tag("mode", mode)
                .register(registry)
                .record(elapsed);

        DistributionSummary.builder("network.analysis.nodes")
                .tag("mode", mode)
                .register(registry)
                .record(nodeCount);

        DistributionSummary.builder("network.analysis.clusters")
                .tag("mode", mode)
                .register(registry)
                .record(clusterCount);
    }

    public void updateSkippedReferences(int count) {
        skippedReferences.set(count);
    }
}
