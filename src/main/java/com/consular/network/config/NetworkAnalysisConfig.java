package com.consular.network.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "network")
public class NetworkAnalysisConfig {

    // Substring match against the case-folded membership role label.
    private List<String> leadershipKeywords = new ArrayList<>(List.of(
            "président", "vice-président", "secrétaire", "trésorier",
            "president", "vice-president", "secretary", "treasurer"));

    // Location shown for a person without a contact city.
    private String unspecifiedLocation = "Non spécifié";

    // Prefix of every generated cluster name.
    private String clusterLabel = "Réseau";

    private int minClusterSize = 3;

    // Organizations a candidate must share with the anchor to join its cluster.
    private int minSharedOrganizations = 2;

    // Cap on organizations expanded in a person's ego network.
    private int maxEgoOrganizations = 50;

    private Background background = new Background();

    @Data
    public static class Background {
        private boolean enabled = true;
        private long refreshMs = 300000;
    }
}
