package com.consular.network.engine;

import com.consular.network.config.NetworkAnalysisConfig;
import com.consular.network.model.InfluenceTier;
import com.consular.network.model.NetworkCluster;
import com.consular.network.model.NetworkNode;
import com.consular.network.model.Person;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Greedy, single-pass grouping of people who share several organizations with an anchor.
 *
 * This is approximate clustering, not exact connected components:
 * <ul>
 *   <li>People are visited in snapshot order; the first unprocessed person with enough
 *       active organizations becomes the anchor.</li>
 *   <li>A candidate joins when it shares at least {@code minSharedOrganizations} with the
 *       anchor. Members are not checked against each other.</li>
 *   <li>Only a cluster that reaches {@code minClusterSize} marks its members processed. An
 *       anchor that falls short stays available and may join a later anchor's cluster.</li>
 * </ul>
 * A different person order can yield different clusters.
 */
@Component
public class ClusterDetector {

    private static final Logger log = LoggerFactory.getLogger(ClusterDetector.class);

    private final NetworkAnalysisConfig config;

    public ClusterDetector(NetworkAnalysisConfig config) {
        this.config = config;
    }

    /**
     * @param people      people in snapshot order
     * @param personNodes person nodes by id, supplying influence, connections and location
     * @return clusters in detection order, ids numbered from cluster-001
     */
    public List<DetectedCluster> detect(List<Person> people, MembershipIndex index,
                                        Map<String, NetworkNode> personNodes) {
        int minShared = Math.max(1, config.getMinSharedOrganizations());
        int minSize = config.getMinClusterSize();

        Set<String> processed = new HashSet<>();
        List<DetectedCluster> clusters = new ArrayList<>();

        for (Person anchor : people) {
            if (processed.contains(anchor.getPersonId())) continue;

            Set<String> anchorOrganizations = index.activeOrganizationsOf(anchor.getPersonId());
            if (anchorOrganizations.size() < minShared) continue;

            Set<String> members = collectMembers(anchor, anchorOrganizations, people, index, processed, minShared);
            if (members.size() < minSize) {
                log.debug("Anchor {} gathered {} members, below cluster size {}",
                        anchor.getPersonId(), members.size(), minSize);
                continue;
            }

            clusters.add(finalizeCluster(clusters.size() + 1, anchor.getPersonId(), members, personNodes));
            processed.addAll(members);
        }

        return clusters;
    }

    private Set<String> collectMembers(Person anchor, Set<String> anchorOrganizations, List<Person> people,
                                       MembershipIndex index, Set<String> processed, int minShared) {
        Set<String> members = new LinkedHashSet<>();
        members.add(anchor.getPersonId());

        for (Person other : people) {
            String otherId = other.getPersonId();
            if (otherId.equals(anchor.getPersonId()) || processed.contains(otherId)) continue;

            if (index.sharedOrganizationCount(anchorOrganizations, otherId) >= minShared) {
                members.add(otherId);
            }
        }
        return members;
    }

    private DetectedCluster finalizeCluster(int sequence, String anchorId, Set<String> members,
                                            Map<String, NetworkNode> personNodes) {
        long influenceSum = 0;
        long connectionSum = 0;
        // insertion order breaks ties between equally common locations
        Map<String, Integer> locationCounts = new LinkedHashMap<>();

        for (String memberId : members) {
            NetworkNode node = personNodes.get(memberId);
            if (node == null) continue;
            influenceSum += node.getInfluence();
            connectionSum += node.getConnections();
            String location = node.getLocation();
            if (location != null && !location.isBlank()) {
                locationCounts.merge(location, 1, Integer::sum);
            }
        }

        double averageInfluence = (double) influenceSum / members.size();
        String dominantLocation = mostFrequent(locationCounts);
        String name = dominantLocation != null
                ? config.getClusterLabel() + " " + dominantLocation
                : config.getClusterLabel();

        NetworkCluster cluster = NetworkCluster.builder()
                .id(String.format("cluster-%03d", sequence))
                .name(name)
                .nodes(members.size())
                .influence(InfluenceTier.fromScore(averageInfluence))
                .connections((int) (connectionSum / members.size()))
                .build();

        return DetectedCluster.builder()
                .cluster(cluster)
                .anchorId(anchorId)
                .memberIds(List.copyOf(members))
                .averageInfluence(averageInfluence)
                .dominantLocation(dominantLocation)
                .build();
    }

    private static String mostFrequent(Map<String, Integer> counts) {
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
