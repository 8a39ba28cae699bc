package com.consular.network.seeder;

import com.consular.network.model.Annotation;
import com.consular.network.model.AnnotationPriority;
import com.consular.network.model.Membership;
import com.consular.network.model.MonitoringState;
import com.consular.network.model.Organization;
import com.consular.network.model.Person;
import com.consular.network.model.RiskTier;
import com.consular.network.repository.AnnotationRepository;
import com.consular.network.repository.MembershipRepository;
import com.consular.network.repository.OrganizationRepository;
import com.consular.network.repository.PersonRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Seeds Aerospike with a small consular data set for local testing.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 *
 * Generates:
 *   - 40 people spread over a handful of cities (some without a city)
 *   - 12 organizations covering every risk tier and monitoring state
 *   - a dense group (PER-0001 to PER-0005) sharing three organizations, which forms a cluster
 *   - random memberships for everyone else, about one in six of them inactive
 *   - annotations of every priority on a subset of people
 */
@Component
@Profile("seed")
@Order(1)
public class DataSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    private static final String[] CITIES = {"Paris", "Lyon", "Marseille", "Bordeaux", "Libreville", null};
    private static final String[] FIRST_NAMES = {
            "Marie", "Jean", "Aïcha", "Paul", "Sylvie", "Ousmane", "Claire", "Didier", "Fatou", "Hervé"
    };
    private static final String[] LAST_NAMES = {
            "Nguema", "Mba", "Obiang", "Ndong", "Moussavou", "Ella", "Ondo", "Bongo", "Mintsa", "Nze"
    };
    private static final String[] ROLES = {"Membre", "Président", "Trésorier", "Secrétaire adjoint", "Bénévole", null};

    private final PersonRepository personRepository;
    private final OrganizationRepository organizationRepository;
    private final MembershipRepository membershipRepository;
    private final AnnotationRepository annotationRepository;
    private final Random random = new Random(42); // fixed seed for reproducibility

    public DataSeeder(PersonRepository personRepository,
                      OrganizationRepository organizationRepository,
                      MembershipRepository membershipRepository,
                      AnnotationRepository annotationRepository) {
        this.personRepository = personRepository;
        this.organizationRepository = organizationRepository;
        this.membershipRepository = membershipRepository;
        this.annotationRepository = annotationRepository;
    }

    @Override
    public void run(String... args) throws Exception {
        log.info("=== Starting data seeding ===");

        long base = Instant.now().minus(365, ChronoUnit.DAYS).toEpochMilli();
        List<Person> people = seedPeople(base);
        List<Organization> organizations = seedOrganizations(base);
        int memberships = seedMemberships(base, people, organizations);
        int annotations = seedAnnotations(base, people);

        log.info("=== Data seeding complete: {} people, {} organizations, {} memberships, {} annotations ===",
                people.size(), organizations.size(), memberships, annotations);
    }

    private List<Person> seedPeople(long base) {
        List<Person> people = new ArrayList<>();
        for (int i = 1; i <= 40; i++) {
            Person person = Person.builder()
                    .personId(String.format("PER-%04d", i))
                    .firstName(FIRST_NAMES[random.nextInt(FIRST_NAMES.length)])
                    .lastName(LAST_NAMES[random.nextInt(LAST_NAMES.length)])
                    // dense group lives in Paris so its cluster gets a stable name
                    .city(i <= 5 ? "Paris" : CITIES[random.nextInt(CITIES.length)])
                    .createdAt(base + i * 60_000L)
                    .build();
            personRepository.save(person);
            people.add(person);
        }
        return people;
    }

    private List<Organization> seedOrganizations(long base) {
        RiskTier[] tiers = RiskTier.values();
        MonitoringState[] states = MonitoringState.values();
        List<Organization> organizations = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            Organization organization = Organization.builder()
                    .orgId(String.format("ORG-%04d", i))
                    .name("Association " + i)
                    .riskTier(tiers[i % tiers.length])
                    .monitoringState(states[i % states.length])
                    .city(i % 4 == 0 ? null : CITIES[i % (CITIES.length - 1)])
                    .zone(i % 2 == 0 ? "Europe" : "Afrique centrale")
                    .createdAt(base + i * 60_000L)
                    .build();
            organizationRepository.save(organization);
            organizations.add(organization);
        }
        return organizations;
    }

    private int seedMemberships(long base, List<Person> people, List<Organization> organizations) {
        AtomicInteger seq = new AtomicInteger(0);

        // Dense group: PER-0001..0005 all active in ORG-0001..0003
        for (int p = 0; p < 5; p++) {
            for (int o = 0; o < 3; o++) {
                String role = (p == 0 && o == 0) ? "Président" : "Membre";
                saveMembership(seq, base, people.get(p), organizations.get(o), role, true);
            }
        }

        for (int p = 5; p < people.size(); p++) {
            int count = 1 + random.nextInt(3);
            for (int k = 0; k < count; k++) {
                Organization organization = organizations.get(3 + random.nextInt(organizations.size() - 3));
                boolean active = random.nextInt(6) != 0;
                saveMembership(seq, base, people.get(p), organization, ROLES[random.nextInt(ROLES.length)], active);
            }
        }
        return seq.get();
    }

    private void saveMembership(AtomicInteger seq, long base, Person person, Organization organization,
                                String role, boolean active) {
        int n = seq.incrementAndGet();
        long joinedAt = base + n * 3_600_000L;
        membershipRepository.save(Membership.builder()
                .membershipId(String.format("MEM-%05d", n))
                .personId(person.getPersonId())
                .orgId(organization.getOrgId())
                .active(active)
                .role(role)
                .joinedAt(joinedAt)
                .leftAt(active ? null : joinedAt + 30L * 86_400_000L)
                .createdAt(joinedAt)
                .build());
    }

    private int seedAnnotations(long base, List<Person> people) {
        AnnotationPriority[] priorities = AnnotationPriority.values();
        int n = 0;
        for (Person person : people) {
            if (random.nextInt(3) != 0) continue;
            int count = 1 + random.nextInt(12);
            for (int k = 0; k < count; k++) {
                n++;
                annotationRepository.save(Annotation.builder()
                        .annotationId(String.format("ANN-%05d", n))
                        .personId(person.getPersonId())
                        // mostly low/medium, occasionally high or critical
                        .priority(random.nextInt(10) == 0
                                ? priorities[2 + random.nextInt(2)]
                                : priorities[random.nextInt(2)])
                        .createdAt(base + n * 600_000L)
                        .build());
            }
        }
        return n;
    }
}
