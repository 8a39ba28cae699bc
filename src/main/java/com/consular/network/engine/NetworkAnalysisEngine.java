package com.consular.network.engine;

import com.consular.network.model.NetworkNode;
import com.consular.network.model.NetworkSnapshot;
import com.consular.network.model.NodeKind;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs one full analysis over a snapshot: membership index, nodes, then clusters.
 * Synchronous and free of shared state; every call starts from scratch.
 */
@Component
public class NetworkAnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(NetworkAnalysisEngine.class);

    private final NodeBuilder nodeBuilder;
    private final ClusterDetector clusterDetector;
    private final Tracer tracer;

    public NetworkAnalysisEngine(NodeBuilder nodeBuilder, ClusterDetector clusterDetector, Tracer tracer) {
        this.nodeBuilder = nodeBuilder;
        this.clusterDetector = clusterDetector;
        this.tracer = tracer;
    }

    public NetworkAnalysis analyze(NetworkSnapshot snapshot) {
        MembershipIndex index = traced("network.index", () -> MembershipIndex.build(snapshot));
        if (index.getSkippedReferences() > 0) {
            log.debug("Skipped {} memberships/annotations referencing unknown people or organizations",
                    index.getSkippedReferences());
        }

        List<NetworkNode> nodes = traced("network.nodes", () -> nodeBuilder.buildNodes(snapshot, index));

        Map<String, NetworkNode> personNodes = new HashMap<>();
        for (NetworkNode node : nodes) {
            if (node.getType() == NodeKind.PERSON) {
                personNodes.putIfAbsent(node.getId(), node);
            }
        }

        List<DetectedCluster> clusters = traced("network.clusters",
                () -> clusterDetector.detect(snapshot.getPeople(), index, personNodes));

        return new NetworkAnalysis(nodes, clusters, snapshot.getCapturedAt(), index.getSkippedReferences());
    }

    private <T> T traced(String stage, Supplier<T> work) {
        Span span = tracer.nextSpan().name(stage).start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            return work.get();
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
