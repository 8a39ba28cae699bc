package com.consular.network.service;

import com.consular.network.config.NetworkAnalysisConfig;
import com.consular.network.engine.MembershipIndex;
import com.consular.network.model.Membership;
import com.consular.network.model.NetworkSnapshot;
import com.consular.network.model.NodeKind;
import com.consular.network.model.Organization;
import com.consular.network.model.Person;
import com.consular.network.model.PersonNetworkGraph;
import com.consular.network.repository.NetworkSnapshotRepository;
import io.micrometer.observation.annotation.Observed;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class NetworkExplorationService {

    private final NetworkSnapshotRepository snapshotRepository;
    private final NetworkAnalysisConfig config;

    public NetworkExplorationService(NetworkSnapshotRepository snapshotRepository,
                                     NetworkAnalysisConfig config) {
        this.snapshotRepository = snapshotRepository;
        this.config = config;
    }

    /**
     * Ego network centered on a person: the person, the organizations they are active in,
     * and the other active members of those organizations. Edges run from each person to
     * the organization they belong to.
     *
     * @return null if the person is not in the current records
     */
    @Observed(name = "network.person", contextualName = "person-network")
    public PersonNetworkGraph getPersonNetwork(String personId) {
        NetworkSnapshot snapshot = snapshotRepository.loadSnapshot();

        Map<String, Person> peopleById = snapshot.getPeople().stream()
                .collect(Collectors.toMap(Person::getPersonId, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        Person center = peopleById.get(personId);
        if (center == null) {
            return null;
        }
        Map<String, Organization> organizationsById = snapshot.getOrganizations().stream()
                .collect(Collectors.toMap(Organization::getOrgId, Function.identity(), (a, b) -> a));

        MembershipIndex index = MembershipIndex.build(snapshot);

        List<PersonNetworkGraph.Vertex> vertices = new ArrayList<>();
        List<PersonNetworkGraph.Edge> edges = new ArrayList<>();
        Set<String> addedPeople = new HashSet<>();
        Set<String> addedOrganizations = new HashSet<>();

        vertices.add(PersonNetworkGraph.Vertex.builder()
                .id(personId).label(center.getDisplayName()).type(NodeKind.PERSON).center(true).build());
        addedPeople.add(personId);

        // Cap organization vertices for display
        int orgLimit = Math.max(0, config.getMaxEgoOrganizations());
        int orgCount = 0;

        for (Membership membership : index.activeMembershipsOf(personId)) {
            if (orgCount >= orgLimit) break;
            String orgId = membership.getOrgId();
            if (!addedOrganizations.add(orgId)) continue;

            Organization organization = organizationsById.get(orgId);
            vertices.add(PersonNetworkGraph.Vertex.builder()
                    .id(orgId)
                    .label(organization.getName())
                    .type(NodeKind.ORGANIZATION)
                    .memberCount(index.activeMembershipsIn(orgId).size())
                    .build());
            edges.add(PersonNetworkGraph.Edge.builder()
                    .from(personId).to(orgId).role(membership.getRole()).build());

            // One edge per co-member and organization, even with repeated active rows
            Set<String> linkedMembers = new HashSet<>();
            for (Membership coMembership : index.activeMembershipsIn(orgId)) {
                String coMemberId = coMembership.getPersonId();
                if (coMemberId.equals(personId)) continue;
                if (!linkedMembers.add(coMemberId)) continue;
                if (addedPeople.add(coMemberId)) {
                    vertices.add(PersonNetworkGraph.Vertex.builder()
                            .id(coMemberId)
                            .label(peopleById.get(coMemberId).getDisplayName())
                            .type(NodeKind.PERSON)
                            .build());
                }
                edges.add(PersonNetworkGraph.Edge.builder()
                        .from(coMemberId).to(orgId).role(coMembership.getRole()).build());
            }

            orgCount++;
        }

        return PersonNetworkGraph.builder().vertices(vertices).edges(edges).build();
    }
}
