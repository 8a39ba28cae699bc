package com.consular.network.engine;

import com.consular.network.config.NetworkAnalysisConfig;
import com.consular.network.model.Annotation;
import com.consular.network.model.Membership;
import com.consular.network.model.NetworkNode;
import com.consular.network.model.NetworkSnapshot;
import com.consular.network.model.NodeKind;
import com.consular.network.model.Organization;
import com.consular.network.model.Person;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns people and organizations into uniform {@link NetworkNode}s.
 * Absent optional fields fall back to defaults instead of failing the run.
 */
@Component
public class NodeBuilder {

    private final NetworkAnalysisConfig config;

    public NodeBuilder(NetworkAnalysisConfig config) {
        this.config = config;
    }

    /**
     * People first, then organizations, each in snapshot order.
     */
    public List<NetworkNode> buildNodes(NetworkSnapshot snapshot, MembershipIndex index) {
        List<NetworkNode> nodes = new ArrayList<>(
                snapshot.getPeople().size() + snapshot.getOrganizations().size());
        for (Person person : snapshot.getPeople()) {
            nodes.add(buildPersonNode(person, index));
        }
        for (Organization organization : snapshot.getOrganizations()) {
            nodes.add(buildOrganizationNode(organization, index));
        }
        return nodes;
    }

    public NetworkNode buildPersonNode(Person person, MembershipIndex index) {
        List<Membership> memberships = index.activeMembershipsOf(person.getPersonId());
        boolean hasLeadershipRole = memberships.stream()
                .anyMatch(m -> isLeadershipRole(m.getRole()));

        List<Annotation> annotations = index.annotationsOf(person.getPersonId());
        boolean hasHighPriorityAnnotation = annotations.stream()
                .anyMatch(a -> a.getPriority() != null && a.getPriority().isHighPriority());

        return NetworkNode.builder()
                .id(person.getPersonId())
                .name(person.getDisplayName())
                .type(NodeKind.PERSON)
                .influence(InfluenceScoring.personInfluence(
                        memberships.size(), annotations.size(), hasLeadershipRole, hasHighPriorityAnnotation))
                .connections(index.coMembersOf(person.getPersonId()).size())
                .riskLevel(InfluenceScoring.personRiskLevel(annotations.size(), hasHighPriorityAnnotation))
                .location(hasText(person.getCity()) ? person.getCity() : config.getUnspecifiedLocation())
                .build();
    }

    public NetworkNode buildOrganizationNode(Organization organization, MembershipIndex index) {
        // An organization's connection count is its active membership count, not a peer set
        int activeMemberCount = index.activeMembershipsIn(organization.getOrgId()).size();

        return NetworkNode.builder()
                .id(organization.getOrgId())
                .name(organization.getName())
                .type(NodeKind.ORGANIZATION)
                .influence(InfluenceScoring.organizationInfluence(
                        activeMemberCount, organization.getRiskTier(), organization.getMonitoringState()))
                .connections(activeMemberCount)
                .riskLevel(InfluenceScoring.organizationRiskLevel(organization.getRiskTier()))
                .location(organizationLocation(organization))
                .build();
    }

    boolean isLeadershipRole(String role) {
        if (!hasText(role)) return false;
        String folded = role.toLowerCase(Locale.ROOT);
        for (String keyword : config.getLeadershipKeywords()) {
            if (hasText(keyword) && folded.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private String organizationLocation(Organization organization) {
        if (hasText(organization.getCity())) return organization.getCity();
        if (hasText(organization.getZone())) return organization.getZone();
        return config.getUnspecifiedLocation();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
