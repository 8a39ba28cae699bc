package com.consular.network.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.consular.network.config.AerospikeConfig;
import com.consular.network.model.Membership;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

@Repository
public class MembershipRepository {

    private static final Logger log = LoggerFactory.getLogger(MembershipRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ScanPolicy scanPolicy;

    public MembershipRepository(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace,
                                @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                @Qualifier("defaultReadPolicy") Policy readPolicy,
                                @Qualifier("defaultScanPolicy") ScanPolicy scanPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.scanPolicy = scanPolicy;
    }

    public Membership findById(String membershipId) {
        Key key = new Key(namespace, AerospikeConfig.SET_MEMBERSHIPS, membershipId);
        Record record = client.get(readPolicy, key);
        if (record == null) {
            return null;
        }
        return mapRecord(record);
    }

    /**
     * All memberships, inactive ones included. Callers filter on the active flag.
     */
    public List<Membership> scanAll() {
        return scanWhere(record -> true);
    }

    public List<Membership> findByPersonId(String personId) {
        List<Membership> memberships = scanWhere(record -> personId.equals(record.getString("personId")));
        memberships.sort(Comparator.comparingLong(Membership::getJoinedAt));
        return memberships;
    }

    public List<Membership> findByOrganizationId(String orgId) {
        List<Membership> memberships = scanWhere(record -> orgId.equals(record.getString("orgId")));
        memberships.sort(Comparator.comparingLong(Membership::getJoinedAt));
        return memberships;
    }

    public void save(Membership membership) {
        Key key = new Key(namespace, AerospikeConfig.SET_MEMBERSHIPS, membership.getMembershipId());

        client.put(writePolicy, key,
                new Bin("membershipId", membership.getMembershipId()),
                new Bin("personId", membership.getPersonId()),
                new Bin("orgId", membership.getOrgId()),
                new Bin("isActive", membership.isActive()),
                new Bin("role", membership.getRole()),
                new Bin("joinedAt", membership.getJoinedAt()),
                new Bin("leftAt", membership.getLeftAt()),
                new Bin("createdAt", membership.getCreatedAt()));
    }

    private List<Membership> scanWhere(Predicate<Record> filter) {
        List<Membership> memberships = new ArrayList<>();
        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_MEMBERSHIPS,
                (key, record) -> {
                    try {
                        if (record.getString("membershipId") != null && filter.test(record)) {
                            Membership membership = mapRecord(record);
                            synchronized (memberships) {
                                memberships.add(membership);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize membership record: {}", e.getMessage());
                    }
                });
        return memberships;
    }

    private Membership mapRecord(Record record) {
        Object leftAt = record.getValue("leftAt");
        return Membership.builder()
                .membershipId(record.getString("membershipId"))
                .personId(record.getString("personId"))
                .orgId(record.getString("orgId"))
                .active(record.getBoolean("isActive"))
                .role(record.getString("role"))
                .joinedAt(record.getLong("joinedAt"))
                .leftAt(leftAt != null ? ((Number) leftAt).longValue() : null)
                .createdAt(record.getLong("createdAt"))
                .build();
    }
}
