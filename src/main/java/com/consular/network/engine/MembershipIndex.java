package com.consular.network.engine;

import com.consular.network.model.Annotation;
import com.consular.network.model.Membership;
import com.consular.network.model.NetworkSnapshot;
import com.consular.network.model.Organization;
import com.consular.network.model.Person;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bipartite person/organization index over the active memberships of one snapshot.
 *
 * Memberships or annotations that reference a person or organization absent from the
 * snapshot are left out of every index and only counted in {@link #getSkippedReferences()}.
 */
public final class MembershipIndex {

    // person id -> active memberships, in snapshot order
    private final Map<String, List<Membership>> activeByPerson;

    // org id -> active memberships, in snapshot order
    private final Map<String, List<Membership>> activeByOrganization;

    // person id -> distinct org ids of active memberships
    private final Map<String, Set<String>> organizationsByPerson;

    // org id -> distinct person ids of active memberships
    private final Map<String, Set<String>> membersByOrganization;

    private final Map<String, List<Annotation>> annotationsByPerson;

    private final int skippedReferences;

    private MembershipIndex(Map<String, List<Membership>> activeByPerson,
                            Map<String, List<Membership>> activeByOrganization,
                            Map<String, Set<String>> organizationsByPerson,
                            Map<String, Set<String>> membersByOrganization,
                            Map<String, List<Annotation>> annotationsByPerson,
                            int skippedReferences) {
        this.activeByPerson = activeByPerson;
        this.activeByOrganization = activeByOrganization;
        this.organizationsByPerson = organizationsByPerson;
        this.membersByOrganization = membersByOrganization;
        this.annotationsByPerson = annotationsByPerson;
        this.skippedReferences = skippedReferences;
    }

    public static MembershipIndex build(NetworkSnapshot snapshot) {
        Set<String> personIds = new HashSet<>();
        for (Person person : snapshot.getPeople()) {
            personIds.add(person.getPersonId());
        }
        Set<String> orgIds = new HashSet<>();
        for (Organization organization : snapshot.getOrganizations()) {
            orgIds.add(organization.getOrgId());
        }

        Map<String, List<Membership>> byPerson = new HashMap<>();
        Map<String, List<Membership>> byOrganization = new HashMap<>();
        Map<String, Set<String>> orgsOfPerson = new HashMap<>();
        Map<String, Set<String>> membersOfOrg = new HashMap<>();
        int skipped = 0;

        for (Membership membership : snapshot.getMemberships()) {
            if (!personIds.contains(membership.getPersonId()) || !orgIds.contains(membership.getOrgId())) {
                skipped++;
                continue;
            }
            if (!membership.isActive()) continue;

            byPerson.computeIfAbsent(membership.getPersonId(), k -> new ArrayList<>()).add(membership);
            byOrganization.computeIfAbsent(membership.getOrgId(), k -> new ArrayList<>()).add(membership);
            orgsOfPerson.computeIfAbsent(membership.getPersonId(), k -> new LinkedHashSet<>())
                    .add(membership.getOrgId());
            membersOfOrg.computeIfAbsent(membership.getOrgId(), k -> new LinkedHashSet<>())
                    .add(membership.getPersonId());
        }

        Map<String, List<Annotation>> notes = new HashMap<>();
        for (Annotation annotation : snapshot.getAnnotations()) {
            if (!personIds.contains(annotation.getPersonId())) {
                skipped++;
                continue;
            }
            notes.computeIfAbsent(annotation.getPersonId(), k -> new ArrayList<>()).add(annotation);
        }

        return new MembershipIndex(byPerson, byOrganization, orgsOfPerson, membersOfOrg, notes, skipped);
    }

    public List<Membership> activeMembershipsOf(String personId) {
        return activeByPerson.getOrDefault(personId, Collections.emptyList());
    }

    public List<Membership> activeMembershipsIn(String orgId) {
        return activeByOrganization.getOrDefault(orgId, Collections.emptyList());
    }

    public Set<String> activeOrganizationsOf(String personId) {
        return organizationsByPerson.getOrDefault(personId, Collections.emptySet());
    }

    public Set<String> activeMembersOf(String orgId) {
        return membersByOrganization.getOrDefault(orgId, Collections.emptySet());
    }

    public List<Annotation> annotationsOf(String personId) {
        return annotationsByPerson.getOrDefault(personId, Collections.emptyList());
    }

    /**
     * Other people sharing at least one organization with this person, both sides active.
     */
    public Set<String> coMembersOf(String personId) {
        Set<String> coMembers = new LinkedHashSet<>();
        for (String orgId : activeOrganizationsOf(personId)) {
            coMembers.addAll(activeMembersOf(orgId));
        }
        coMembers.remove(personId);
        return coMembers;
    }

    /** Number of organizations both people are active members of. */
    public int sharedOrganizationCount(Set<String> organizations, String otherPersonId) {
        int shared = 0;
        for (String orgId : activeOrganizationsOf(otherPersonId)) {
            if (organizations.contains(orgId)) shared++;
        }
        return shared;
    }

    public int getSkippedReferences() {
        return skippedReferences;
    }
}
