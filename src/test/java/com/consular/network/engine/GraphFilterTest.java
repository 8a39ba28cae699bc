package com.consular.network.engine;

import com.consular.network.model.InfluenceFilter;
import com.consular.network.model.NetworkNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.consular.network.testutil.TestDataFactory.createPersonNode;
import static org.assertj.core.api.Assertions.assertThat;

class GraphFilterTest {

    private final List<NetworkNode> nodes = List.of(
            createPersonNode("P1", "Nguema Marie", 85, 3, "Paris"),
            createPersonNode("P2", "Mba Jean", 80, 1, "Lyon"),
            createPersonNode("P3", "Nguema Paul", 79, 2, "Paris"),
            createPersonNode("P4", "Ondo Claire", 50, 0, "Paris"),
            createPersonNode("P5", "Ella Fatou", 49, 0, "Lyon"));

    @Test
    void filter_noCriteria_keepsEverything() {
        assertThat(GraphFilter.filter(nodes, null, InfluenceFilter.ALL)).hasSize(5);
        assertThat(GraphFilter.filter(nodes, "  ", null)).hasSize(5);
    }

    @Test
    void filter_nameIsCaseInsensitiveSubstring() {
        List<NetworkNode> result = GraphFilter.filter(nodes, "NGUEMA", InfluenceFilter.ALL);

        assertThat(result).extracting(NetworkNode::getId).containsExactly("P1", "P3");
    }

    @Test
    void filter_influenceBandsUseInclusiveLowerBounds() {
        assertThat(GraphFilter.filter(nodes, null, InfluenceFilter.HIGH))
                .extracting(NetworkNode::getId).containsExactly("P1", "P2");
        assertThat(GraphFilter.filter(nodes, null, InfluenceFilter.MEDIUM))
                .extracting(NetworkNode::getId).containsExactly("P3", "P4");
        assertThat(GraphFilter.filter(nodes, null, InfluenceFilter.LOW))
                .extracting(NetworkNode::getId).containsExactly("P5");
    }

    @Test
    void filter_combinesNameAndInfluence() {
        List<NetworkNode> result = GraphFilter.filter(nodes, "nguema", InfluenceFilter.MEDIUM);

        assertThat(result).extracting(NetworkNode::getId).containsExactly("P3");
    }

    @Test
    void filter_noMatch_returnsEmptyList() {
        assertThat(GraphFilter.filter(nodes, "zzz", InfluenceFilter.ALL)).isEmpty();
        assertThat(GraphFilter.filter(List.of(), null, InfluenceFilter.HIGH)).isEmpty();
    }
}
