package com.consular.network.config;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsConfigTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MetricsConfig metricsConfig = new MetricsConfig(registry);

    @Test
    void recordAnalysis_tagsMetersByMode() {
        metricsConfig.recordAnalysis("background", Duration.ofMillis(120), 40, 3);
        metricsConfig.recordAnalysis("background", Duration.ofMillis(80), 42, 3);
        metricsConfig.recordAnalysis("on-demand", Duration.ofMillis(50), 10, 1);

        assertThat(registry.get("network.analysis.count").tag("mode", "background").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("network.analysis.duration").tag("mode", "on-demand").timer().count())
                .isEqualTo(1);
        assertThat(registry.get("network.analysis.nodes").tag("mode", "background").summary().max())
                .isEqualTo(42.0);
    }

    @Test
    void updateSkippedReferences_setsGauge() {
        metricsConfig.updateSkippedReferences(7);

        assertThat(registry.get("network.analysis.skipped_references").gauge().value()).isEqualTo(7.0);
    }
}
