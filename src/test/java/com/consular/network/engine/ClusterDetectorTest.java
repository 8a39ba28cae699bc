package com.consular.network.engine;

import com.consular.network.config.NetworkAnalysisConfig;
import com.consular.network.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.consular.network.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class ClusterDetectorTest {

    private NetworkAnalysisConfig config;
    private ClusterDetector detector;

    @BeforeEach
    void setUp() {
        config = defaultConfig();
        detector = new ClusterDetector(config);
    }

    @Test
    void detect_threePeopleSharingTwoOrganizations_formOneCluster() {
        NetworkSnapshot snapshot = snapshot(3, 2, List.of(
                createMembership("P1", "O1"), createMembership("P1", "O2"),
                createMembership("P2", "O1"), createMembership("P2", "O2"),
                createMembership("P3", "O1"), createMembership("P3", "O2")));
        Map<String, NetworkNode> nodes = nodes(
                createPersonNode("P1", "A", 90, 2, "Paris"),
                createPersonNode("P2", "B", 80, 3, "Paris"),
                createPersonNode("P3", "C", 70, 3, "Lyon"));

        List<DetectedCluster> clusters = detect(snapshot, nodes);

        assertThat(clusters).hasSize(1);
        DetectedCluster detected = clusters.get(0);
        NetworkCluster cluster = detected.getCluster();
        assertThat(cluster.getId()).isEqualTo("cluster-001");
        assertThat(cluster.getName()).isEqualTo("Réseau Paris");
        assertThat(cluster.getNodes()).isEqualTo(3);
        assertThat(cluster.getInfluence()).isEqualTo(InfluenceTier.HIGH);
        // (2 + 3 + 3) / 3 floored
        assertThat(cluster.getConnections()).isEqualTo(2);
        assertThat(detected.getAnchorId()).isEqualTo("P1");
        assertThat(detected.getMemberIds()).containsExactly("P1", "P2", "P3");
        assertThat(detected.getAverageInfluence()).isEqualTo(80.0);
        assertThat(detected.getDominantLocation()).isEqualTo("Paris");
    }

    @Test
    void detect_pairBelowMinimumSize_isNeverEmitted() {
        NetworkSnapshot snapshot = snapshot(2, 2, List.of(
                createMembership("P1", "O1"), createMembership("P1", "O2"),
                createMembership("P2", "O1"), createMembership("P2", "O2")));

        assertThat(detect(snapshot, defaultNodes(snapshot))).isEmpty();
    }

    @Test
    void detect_singleSharedOrganization_isNotEnough() {
        NetworkSnapshot snapshot = snapshot(3, 2, List.of(
                createMembership("P1", "O1"), createMembership("P1", "O2"),
                createMembership("P2", "O1"), createMembership("P2", "O2"),
                createMembership("P3", "O1")));

        assertThat(detect(snapshot, defaultNodes(snapshot))).isEmpty();
    }

    @Test
    void detect_inactiveMembershipsDoNotCount() {
        NetworkSnapshot snapshot = snapshot(3, 2, List.of(
                createMembership("P1", "O1"), createMembership("P1", "O2"),
                createMembership("P2", "O1"), createMembership("P2", "O2"),
                createMembership("P3", "O1"), createMembership("P3", "O2", false, "Membre")));

        assertThat(detect(snapshot, defaultNodes(snapshot))).isEmpty();
    }

    @Test
    void detect_personBelongsToAtMostOneCluster() {
        // P3 bridges {P1, P2} via O1/O2 and {P4, P5} via O3/O4
        NetworkSnapshot snapshot = snapshot(5, 4, List.of(
                createMembership("P1", "O1"), createMembership("P1", "O2"),
                createMembership("P2", "O1"), createMembership("P2", "O2"),
                createMembership("P3", "O1"), createMembership("P3", "O2"),
                createMembership("P3", "O3"), createMembership("P3", "O4"),
                createMembership("P4", "O3"), createMembership("P4", "O4"),
                createMembership("P5", "O3"), createMembership("P5", "O4")));

        List<DetectedCluster> clusters = detect(snapshot, defaultNodes(snapshot));

        // P3 is taken by the first cluster, leaving P4 and P5 short of three members
        assertThat(clusters).hasSize(1);
        assertThat(clusters.get(0).getMemberIds()).containsExactly("P1", "P2", "P3");
    }

    @Test
    void detect_anchorFallingShortCanJoinLaterCluster() {
        // P1 only reaches P2; P2 also reaches P3 and P4 through O3/O4
        NetworkSnapshot snapshot = snapshot(4, 4, List.of(
                createMembership("P1", "O1"), createMembership("P1", "O2"),
                createMembership("P2", "O1"), createMembership("P2", "O2"),
                createMembership("P2", "O3"), createMembership("P2", "O4"),
                createMembership("P3", "O3"), createMembership("P3", "O4"),
                createMembership("P4", "O3"), createMembership("P4", "O4")));

        List<DetectedCluster> clusters = detect(snapshot, defaultNodes(snapshot));

        assertThat(clusters).hasSize(1);
        assertThat(clusters.get(0).getAnchorId()).isEqualTo("P2");
        assertThat(clusters.get(0).getMemberIds()).containsExactly("P2", "P1", "P3", "P4");
        assertThat(clusters.get(0).getCluster().getId()).isEqualTo("cluster-001");
    }

    @Test
    void detect_separateGroups_numberedInDetectionOrder() {
        NetworkSnapshot snapshot = snapshot(6, 4, List.of(
                createMembership("P1", "O1"), createMembership("P1", "O2"),
                createMembership("P2", "O1"), createMembership("P2", "O2"),
                createMembership("P3", "O1"), createMembership("P3", "O2"),
                createMembership("P4", "O3"), createMembership("P4", "O4"),
                createMembership("P5", "O3"), createMembership("P5", "O4"),
                createMembership("P6", "O3"), createMembership("P6", "O4")));

        List<DetectedCluster> clusters = detect(snapshot, defaultNodes(snapshot));

        assertThat(clusters).extracting(c -> c.getCluster().getId())
                .containsExactly("cluster-001", "cluster-002");
        assertThat(clusters.get(1).getAnchorId()).isEqualTo("P4");
    }

    @Test
    void detect_locationTie_firstEncounteredWins() {
        NetworkSnapshot snapshot = triangle();
        Map<String, NetworkNode> nodes = nodes(
                createPersonNode("P1", "A", 10, 2, "Lyon"),
                createPersonNode("P2", "B", 10, 2, "Paris"),
                createPersonNode("P3", "C", 10, 2, "Marseille"));

        DetectedCluster detected = detect(snapshot, nodes).get(0);

        assertThat(detected.getCluster().getName()).isEqualTo("Réseau Lyon");
        assertThat(detected.getCluster().getInfluence()).isEqualTo(InfluenceTier.LOW);
    }

    @Test
    void detect_noKnownLocation_usesLabelAlone() {
        NetworkSnapshot snapshot = triangle();
        Map<String, NetworkNode> nodes = nodes(
                createPersonNode("P1", "A", 60, 2, null),
                createPersonNode("P2", "B", 50, 2, " "),
                createPersonNode("P3", "C", 50, 2, null));

        DetectedCluster detected = detect(snapshot, nodes).get(0);

        assertThat(detected.getCluster().getName()).isEqualTo("Réseau");
        assertThat(detected.getDominantLocation()).isNull();
        assertThat(detected.getCluster().getInfluence()).isEqualTo(InfluenceTier.MEDIUM);
    }

    @Test
    void detect_configuredThresholds() {
        config.setMinSharedOrganizations(1);
        config.setMinClusterSize(4);
        NetworkSnapshot snapshot = snapshot(4, 1, List.of(
                createMembership("P1", "O1"), createMembership("P2", "O1"),
                createMembership("P3", "O1"), createMembership("P4", "O1")));

        List<DetectedCluster> clusters = detect(snapshot, defaultNodes(snapshot));

        assertThat(clusters).hasSize(1);
        assertThat(clusters.get(0).getCluster().getNodes()).isEqualTo(4);
    }

    @Test
    void detect_emptyInput_returnsNoClusters() {
        NetworkSnapshot snapshot = createSnapshot(List.of(), List.of(), List.of(), List.of());

        assertThat(detect(snapshot, Map.of())).isEmpty();
    }

    private List<DetectedCluster> detect(NetworkSnapshot snapshot, Map<String, NetworkNode> nodes) {
        return detector.detect(snapshot.getPeople(), MembershipIndex.build(snapshot), nodes);
    }

    private static NetworkSnapshot triangle() {
        return snapshot(3, 2, List.of(
                createMembership("P1", "O1"), createMembership("P1", "O2"),
                createMembership("P2", "O1"), createMembership("P2", "O2"),
                createMembership("P3", "O1"), createMembership("P3", "O2")));
    }

    private static NetworkSnapshot snapshot(int peopleCount, int orgCount, List<Membership> memberships) {
        List<Person> people = new ArrayList<>();
        for (int i = 1; i <= peopleCount; i++) people.add(createPerson("P" + i, "Paris"));
        List<Organization> organizations = new ArrayList<>();
        for (int i = 1; i <= orgCount; i++) organizations.add(createOrganization("O" + i));
        return createSnapshot(people, organizations, memberships, List.of());
    }

    private static Map<String, NetworkNode> defaultNodes(NetworkSnapshot snapshot) {
        Map<String, NetworkNode> nodes = new HashMap<>();
        for (Person person : snapshot.getPeople()) {
            nodes.put(person.getPersonId(), createPersonNode(person.getPersonId(), person.getDisplayName(), 20, 1, "Paris"));
        }
        return nodes;
    }

    private static Map<String, NetworkNode> nodes(NetworkNode... personNodes) {
        Map<String, NetworkNode> nodes = new HashMap<>();
        for (NetworkNode node : personNodes) nodes.put(node.getId(), node);
        return nodes;
    }
}
