package com.consular.network.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.consular.network.config.AerospikeConfig;
import com.consular.network.model.MonitoringState;
import com.consular.network.model.Organization;
import com.consular.network.model.RiskTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

@Repository
public class OrganizationRepository {

    private static final Logger log = LoggerFactory.getLogger(OrganizationRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ScanPolicy scanPolicy;

    public OrganizationRepository(AerospikeClient client,
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

    public Organization findById(String orgId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ORGANIZATIONS, orgId);
        Record record = client.get(readPolicy, key);
        if (record == null) {
            return null;
        }
        return mapRecord(record);
    }

    public List<Organization> scanAll() {
        List<Organization> organizations = new ArrayList<>();
        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ORGANIZATIONS,
                (key, record) -> {
                    try {
                        if (record.getString("orgId") != null) {
                            Organization organization = mapRecord(record);
                            synchronized (organizations) {
                                organizations.add(organization);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize organization record: {}", e.getMessage());
                    }
                });
        return organizations;
    }

    /**
     * Tiers are stored under their French source labels, as the upstream records carry them.
     */
    public void save(Organization organization) {
        Key key = new Key(namespace, AerospikeConfig.SET_ORGANIZATIONS, organization.getOrgId());

        client.put(writePolicy, key,
                new Bin("orgId", organization.getOrgId()),
                new Bin("name", organization.getName()),
                new Bin("riskLevel", organization.getRiskTier().getSourceLabel()),
                new Bin("monitoring", organization.getMonitoringState().getSourceLabel()),
                new Bin("city", organization.getCity()),
                new Bin("zone", organization.getZone()),
                new Bin("createdAt", organization.getCreatedAt()));
    }

    private Organization mapRecord(Record record) {
        return Organization.builder()
                .orgId(record.getString("orgId"))
                .name(record.getString("name"))
                .riskTier(RiskTier.fromLabel(record.getString("riskLevel")))
                .monitoringState(MonitoringState.fromLabel(record.getString("monitoring")))
                .city(record.getString("city"))
                .zone(record.getString("zone"))
                .createdAt(record.getLong("createdAt"))
                .build();
    }
}
