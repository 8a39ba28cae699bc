package com.consular.network.service;

import com.consular.network.config.MetricsConfig;
import com.consular.network.config.NetworkAnalysisConfig;
import com.consular.network.engine.NetworkAnalysis;
import com.consular.network.engine.NetworkAnalysisEngine;
import com.consular.network.model.ClusterDetail;
import com.consular.network.model.InfluenceFilter;
import com.consular.network.model.NetworkReport;
import com.consular.network.model.NetworkSnapshot;
import com.consular.network.repository.NetworkSnapshotRepository;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for network analytics.
 *
 * {@link #computeNetwork} analyses a fresh snapshot on every call. Large record sets make
 * that expensive (cluster detection is quadratic in people), so a background refresh also
 * keeps the latest unfiltered analysis, swapped in atomically, for {@link #getLatestNetwork}
 * and cluster lookups. With background refresh off, the first of those calls computes the
 * analysis once and keeps it.
 */
@Service
public class NetworkAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(NetworkAnalysisService.class);

    private final NetworkSnapshotRepository snapshotRepository;
    private final NetworkAnalysisEngine engine;
    private final NetworkAnalysisConfig config;
    private final MetricsConfig metricsConfig;

    private volatile NetworkAnalysis latestAnalysis;
    private volatile Instant lastRefreshTime = Instant.EPOCH;

    public NetworkAnalysisService(NetworkSnapshotRepository snapshotRepository,
                                  NetworkAnalysisEngine engine,
                                  NetworkAnalysisConfig config,
                                  MetricsConfig metricsConfig) {
        this.snapshotRepository = snapshotRepository;
        this.engine = engine;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        refreshAnalysis();
    }

    /**
     * Analyse a freshly loaded snapshot and return the filtered view.
     * Store failures propagate to the caller.
     */
    @Observed(name = "network.compute", contextualName = "compute-network")
    public NetworkReport computeNetwork(String namePattern, InfluenceFilter influence) {
        NetworkAnalysis analysis = runAnalysis("on-demand");
        return analysis.toReport(namePattern, influence);
    }

    @Scheduled(fixedDelayString = "${network.background.refresh-ms:300000}",
               initialDelayString = "${network.background.refresh-ms:300000}")
    public void refreshAnalysis() {
        if (!config.getBackground().isEnabled()) {
            return;
        }
        log.info("Refreshing network analysis...");

        NetworkAnalysis analysis;
        try {
            analysis = runAnalysis("background");
        } catch (Exception e) {
            log.warn("Network analysis refresh failed, keeping previous result: {}", e.getMessage());
            return;
        }

        this.latestAnalysis = analysis;
        this.lastRefreshTime = Instant.now();
    }

    /**
     * Filtered view of the latest analysis. Computes and keeps one if none is available yet.
     */
    @Observed(name = "network.latest", contextualName = "latest-network")
    public NetworkReport getLatestNetwork(String namePattern, InfluenceFilter influence) {
        return latestOrCompute().toReport(namePattern, influence);
    }

    /**
     * Cluster ids are only meaningful within one run, so lookups go against the same
     * analysis {@link #getLatestNetwork} reports from. Returns null for an unknown id.
     */
    public ClusterDetail getClusterDetail(String clusterId) {
        return latestOrCompute().findClusterDetail(clusterId);
    }

    public boolean isAnalysisReady() {
        return latestAnalysis != null;
    }

    public Instant getLastRefreshTime() {
        return lastRefreshTime;
    }

    public Map<String, Object> getStatus() {
        NetworkAnalysis analysis = latestAnalysis;
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("isReady", analysis != null);
        status.put("backgroundEnabled", config.getBackground().isEnabled());
        status.put("lastRefreshTime", lastRefreshTime.toString());
        status.put("totalNodes", analysis != null ? analysis.getNodes().size() : 0);
        status.put("totalClusters", analysis != null ? analysis.getClusters().size() : 0);
        status.put("skippedReferences", analysis != null ? analysis.getSkippedReferences() : 0);
        return status;
    }

    private NetworkAnalysis latestOrCompute() {
        NetworkAnalysis analysis = latestAnalysis;
        if (analysis != null) {
            return analysis;
        }
        synchronized (this) {
            if (latestAnalysis == null) {
                log.debug("No analysis available yet, computing on demand");
                this.latestAnalysis = runAnalysis("on-demand");
                this.lastRefreshTime = Instant.now();
            }
            return latestAnalysis;
        }
    }

    private NetworkAnalysis runAnalysis(String mode) {
        Instant start = Instant.now();

        NetworkSnapshot snapshot = snapshotRepository.loadSnapshot();
        NetworkAnalysis analysis = engine.analyze(snapshot);

        Duration elapsed = Duration.between(start, Instant.now());
        metricsConfig.recordAnalysis(mode, elapsed, analysis.getNodes().size(), analysis.getClusters().size());
        metricsConfig.updateSkippedReferences(analysis.getSkippedReferences());

        log.info("Network analysis ({}) complete: {} people, {} organizations -> {} nodes, {} clusters, took {}ms",
                mode, snapshot.getPeople().size(), snapshot.getOrganizations().size(),
                analysis.getNodes().size(), analysis.getClusters().size(), elapsed.toMillis());
        return analysis;
    }
}
