package com.consular.network.model;

import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * One frozen read of the four record kinds. Every analysis run works from a single
 * snapshot so memberships and annotations are consistent with the people and
 * organizations listed alongside them.
 */
@Getter
public final class NetworkSnapshot {

    private final List<Person> people;
    private final List<Organization> organizations;
    private final List<Membership> memberships;
    private final List<Annotation> annotations;
    private final Instant capturedAt;

    public NetworkSnapshot(List<Person> people,
                           List<Organization> organizations,
                           List<Membership> memberships,
                           List<Annotation> annotations,
                           Instant capturedAt) {
        this.people = List.copyOf(people);
        this.organizations = List.copyOf(organizations);
        this.memberships = List.copyOf(memberships);
        this.annotations = List.copyOf(annotations);
        this.capturedAt = capturedAt;
    }

    public static NetworkSnapshot empty() {
        return new NetworkSnapshot(List.of(), List.of(), List.of(), List.of(), Instant.now());
    }

    public boolean isEmpty() {
        return people.isEmpty() && organizations.isEmpty();
    }
}
