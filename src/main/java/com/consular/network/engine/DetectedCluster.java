package com.consular.network.engine;

import com.consular.network.model.NetworkCluster;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * A finalized cluster together with the internals the public {@link NetworkCluster} view leaves out.
 */
@Getter
@Builder
public class DetectedCluster {
    private final NetworkCluster cluster;
    private final String anchorId;
    private final List<String> memberIds;  // anchor first, then snapshot order
    private final double averageInfluence;
    private final String dominantLocation;
}
