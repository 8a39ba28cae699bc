package com.consular.network.repository;

import com.consular.network.model.Annotation;
import com.consular.network.model.Membership;
import com.consular.network.model.NetworkSnapshot;
import com.consular.network.model.Organization;
import com.consular.network.model.Person;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Reads all four record sets together into one {@link NetworkSnapshot}.
 *
 * Set scans come back in no particular order, so every list is sorted by creation
 * time then id. Cluster detection walks people in this order, which keeps its
 * output stable from one run to the next.
 */
@Repository
public class NetworkSnapshotRepository {

    private static final Logger log = LoggerFactory.getLogger(NetworkSnapshotRepository.class);

    private final PersonRepository personRepository;
    private final OrganizationRepository organizationRepository;
    private final MembershipRepository membershipRepository;
    private final AnnotationRepository annotationRepository;

    public NetworkSnapshotRepository(PersonRepository personRepository,
                                     OrganizationRepository organizationRepository,
                                     MembershipRepository membershipRepository,
                                     AnnotationRepository annotationRepository) {
        this.personRepository = personRepository;
        this.organizationRepository = organizationRepository;
        this.membershipRepository = membershipRepository;
        this.annotationRepository = annotationRepository;
    }

    public NetworkSnapshot loadSnapshot() {
        Instant start = Instant.now();

        List<Person> people = personRepository.scanAll();
        List<Organization> organizations = organizationRepository.scanAll();
        List<Membership> memberships = membershipRepository.scanAll();
        List<Annotation> annotations = annotationRepository.scanAll();

        people.sort(Comparator.comparingLong(Person::getCreatedAt)
                .thenComparing(Person::getPersonId));
        organizations.sort(Comparator.comparingLong(Organization::getCreatedAt)
                .thenComparing(Organization::getOrgId));
        memberships.sort(Comparator.comparingLong(Membership::getCreatedAt)
                .thenComparing(Membership::getMembershipId));
        annotations.sort(Comparator.comparingLong(Annotation::getCreatedAt)
                .thenComparing(Annotation::getAnnotationId));

        log.debug("Snapshot loaded: {} people, {} organizations, {} memberships, {} annotations in {}ms",
                people.size(), organizations.size(), memberships.size(), annotations.size(),
                Duration.between(start, Instant.now()).toMillis());

        NetworkSnapshot snapshot = new NetworkSnapshot(people, organizations, memberships, annotations, Instant.now());
        if (snapshot.isEmpty()) {
            log.debug("Record store holds no people or organizations");
        }
        return snapshot;
    }
}
