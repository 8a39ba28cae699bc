package com.consular.network.service;

import com.consular.network.config.NetworkAnalysisConfig;
import com.consular.network.model.AffiliationView;
import com.consular.network.model.MemberView;
import com.consular.network.model.Membership;
import com.consular.network.model.MonitoringState;
import com.consular.network.model.NetworkSnapshot;
import com.consular.network.model.Organization;
import com.consular.network.model.OrganizationDetail;
import com.consular.network.model.OrganizationStatistics;
import com.consular.network.model.Person;
import com.consular.network.model.RiskTier;
import com.consular.network.repository.MembershipRepository;
import com.consular.network.repository.NetworkSnapshotRepository;
import com.consular.network.repository.OrganizationRepository;
import com.consular.network.repository.PersonRepository;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Read-only organization and membership lookups around the network view.
 */
@Service
public class OrganizationService {

    private final NetworkSnapshotRepository snapshotRepository;
    private final OrganizationRepository organizationRepository;
    private final PersonRepository personRepository;
    private final MembershipRepository membershipRepository;
    private final NetworkAnalysisConfig config;

    public OrganizationService(NetworkSnapshotRepository snapshotRepository,
                               OrganizationRepository organizationRepository,
                               PersonRepository personRepository,
                               MembershipRepository membershipRepository,
                               NetworkAnalysisConfig config) {
        this.snapshotRepository = snapshotRepository;
        this.organizationRepository = organizationRepository;
        this.personRepository = personRepository;
        this.membershipRepository = membershipRepository;
        this.config = config;
    }

    /**
     * Organizations in creation order, narrowed by every filter that is set. The search text
     * matches the name or city case-insensitively; zone must match exactly.
     */
    public List<Organization> listOrganizations(String search, String zone,
                                                RiskTier riskTier, MonitoringState monitoringState) {
        String needle = search == null || search.isBlank() ? null : search.trim().toLowerCase(Locale.ROOT);
        boolean anyZone = zone == null || zone.isBlank();

        return organizationRepository.scanAll().stream()
                .filter(o -> needle == null || contains(o.getName(), needle) || contains(o.getCity(), needle))
                .filter(o -> anyZone || zone.equals(o.getZone()))
                .filter(o -> riskTier == null || o.getRiskTier() == riskTier)
                .filter(o -> monitoringState == null || o.getMonitoringState() == monitoringState)
                .sorted(Comparator.comparingLong(Organization::getCreatedAt)
                        .thenComparing(Organization::getOrgId))
                .collect(Collectors.toList());
    }

    /**
     * @return null if the organization does not exist
     */
    public OrganizationDetail getOrganization(String orgId) {
        Organization organization = organizationRepository.findById(orgId);
        if (organization == null) {
            return null;
        }

        Set<String> activeMembers = new HashSet<>();
        for (Membership membership : membershipRepository.findByOrganizationId(orgId)) {
            if (!membership.isActive() || activeMembers.contains(membership.getPersonId())) continue;
            if (personRepository.findById(membership.getPersonId()) != null) {
                activeMembers.add(membership.getPersonId());
            }
        }
        return OrganizationDetail.builder()
                .organization(organization)
                .activeMemberCount(activeMembers.size())
                .build();
    }

    public OrganizationStatistics getStatistics() {
        NetworkSnapshot snapshot = snapshotRepository.loadSnapshot();

        Map<RiskTier, Integer> byRiskTier = new EnumMap<>(RiskTier.class);
        for (RiskTier tier : RiskTier.values()) byRiskTier.put(tier, 0);
        Map<MonitoringState, Integer> byMonitoringState = new EnumMap<>(MonitoringState.class);
        for (MonitoringState state : MonitoringState.values()) byMonitoringState.put(state, 0);

        Map<String, Integer> byZone = new TreeMap<>();

        Set<String> orgIds = new HashSet<>();
        for (Organization organization : snapshot.getOrganizations()) {
            orgIds.add(organization.getOrgId());
            byRiskTier.merge(organization.getRiskTier(), 1, Integer::sum);
            byMonitoringState.merge(organization.getMonitoringState(), 1, Integer::sum);
            String zone = organization.getZone();
            byZone.merge(zone == null || zone.isBlank() ? config.getUnspecifiedLocation() : zone, 1, Integer::sum);
        }

        Set<String> personIds = new HashSet<>();
        for (Person person : snapshot.getPeople()) {
            personIds.add(person.getPersonId());
        }

        int totalActiveMembers = 0;
        for (Membership membership : snapshot.getMemberships()) {
            if (membership.isActive()
                    && orgIds.contains(membership.getOrgId())
                    && personIds.contains(membership.getPersonId())) {
                totalActiveMembers++;
            }
        }

        int total = snapshot.getOrganizations().size();
        return OrganizationStatistics.builder()
                .total(total)
                .totalActiveMembers(totalActiveMembers)
                .averageMembers(total > 0 ? (int) Math.round((double) totalActiveMembers / total) : 0)
                .byRiskTier(byRiskTier)
                .byMonitoringState(byMonitoringState)
                .byZone(byZone)
                .activeMonitoringCount(byMonitoringState.get(MonitoringState.ACTIVE))
                .highRiskCount(byRiskTier.get(RiskTier.HIGH) + byRiskTier.get(RiskTier.CRITICAL))
                .build();
    }

    /**
     * @return null if the organization does not exist
     */
    public List<MemberView> getMembers(String orgId, boolean activeOnly) {
        if (organizationRepository.findById(orgId) == null) {
            return null;
        }

        List<MemberView> members = new ArrayList<>();
        for (Membership membership : membershipRepository.findByOrganizationId(orgId)) {
            if (activeOnly && !membership.isActive()) continue;
            Person person = personRepository.findById(membership.getPersonId());
            if (person == null) continue;
            members.add(MemberView.builder()
                    .membership(membership)
                    .personId(person.getPersonId())
                    .displayName(person.getDisplayName())
                    .build());
        }
        return members;
    }

    /**
     * @return null if the person does not exist
     */
    public List<AffiliationView> getPersonOrganizations(String personId, boolean activeOnly) {
        if (personRepository.findById(personId) == null) {
            return null;
        }

        List<AffiliationView> affiliations = new ArrayList<>();
        for (Membership membership : membershipRepository.findByPersonId(personId)) {
            if (activeOnly && !membership.isActive()) continue;
            Organization organization = organizationRepository.findById(membership.getOrgId());
            if (organization == null) continue;
            affiliations.add(AffiliationView.builder()
                    .membership(membership)
                    .orgId(organization.getOrgId())
                    .organizationName(organization.getName())
                    .riskTier(organization.getRiskTier())
                    .city(organization.getCity())
                    .build());
        }
        return affiliations;
    }

    private static boolean contains(String value, String lowerNeedle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(lowerNeedle);
    }
}
