package com.consular.network.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.consular.network.config.AerospikeConfig;
import com.consular.network.model.Membership;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MembershipRepositoryTest {

    @Mock private AerospikeClient client;

    private final ScanPolicy scanPolicy = new AerospikeConfig().defaultScanPolicy();
    private MembershipRepository repository;

    @BeforeEach
    void setUp() {
        repository = new MembershipRepository(client, "test", new WritePolicy(), new Policy(), scanPolicy);
    }

    @Test
    void scanAll_usesConfiguredScanPolicy() {
        givenScanReturns(membershipRecord("M1", "P1", "O1", true, 1_000L, null));

        repository.scanAll();

        verify(client).scanAll(same(scanPolicy), eq("test"), eq(AerospikeConfig.SET_MEMBERSHIPS),
                any(ScanCallback.class));
        assertThat(scanPolicy.totalTimeout).isEqualTo(10000);
        assertThat(scanPolicy.socketTimeout).isEqualTo(3000);
        assertThat(scanPolicy.includeBinData).isTrue();
    }

    @Test
    void findByPersonId_filtersAndSortsByJoinDate() {
        givenScanReturns(
                membershipRecord("M1", "P1", "O1", true, 3_000L, null),
                membershipRecord("M2", "P2", "O1", true, 1_000L, null),
                membershipRecord("M3", "P1", "O2", false, 2_000L, 2_500L));

        List<Membership> memberships = repository.findByPersonId("P1");

        assertThat(memberships).extracting(Membership::getMembershipId).containsExactly("M3", "M1");
        assertThat(memberships.get(0).isActive()).isFalse();
        assertThat(memberships.get(0).getLeftAt()).isEqualTo(2_500L);
        assertThat(memberships.get(1).getLeftAt()).isNull();
    }

    @Test
    void findByOrganizationId_filtersOnOrganization() {
        givenScanReturns(
                membershipRecord("M1", "P1", "O1", true, 3_000L, null),
                membershipRecord("M2", "P2", "O1", true, 1_000L, null),
                membershipRecord("M3", "P1", "O2", true, 2_000L, null));

        List<Membership> memberships = repository.findByOrganizationId("O1");

        assertThat(memberships).extracting(Membership::getPersonId).containsExactly("P2", "P1");
    }

    @Test
    void scanAll_skipsMalformedAndForeignRecords() {
        Map<String, Object> malformed = new HashMap<>();
        malformed.put("membershipId", "M-BAD");
        malformed.put("createdAt", "yesterday");
        Map<String, Object> foreign = new HashMap<>();
        foreign.put("somethingElse", "x");

        givenScanReturns(
                membershipRecord("M1", "P1", "O1", true, 1_000L, null),
                new Record(malformed, 1, 0),
                new Record(foreign, 1, 0));

        List<Membership> memberships = repository.scanAll();

        assertThat(memberships).extracting(Membership::getMembershipId).containsExactly("M1");
    }

    private void givenScanReturns(Record... records) {
        doAnswer(invocation -> {
            ScanCallback callback = invocation.getArgument(3);
            for (Record record : records) {
                callback.scanCallback(new Key("test", AerospikeConfig.SET_MEMBERSHIPS, "k"), record);
            }
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), eq("test"), eq(AerospikeConfig.SET_MEMBERSHIPS),
                any(ScanCallback.class));
    }

    private static Record membershipRecord(String id, String personId, String orgId, boolean active,
                                           long joinedAt, Long leftAt) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("membershipId", id);
        bins.put("personId", personId);
        bins.put("orgId", orgId);
        bins.put("isActive", active ? 1L : 0L);
        bins.put("role", "Membre");
        bins.put("joinedAt", joinedAt);
        if (leftAt != null) bins.put("leftAt", leftAt);
        bins.put("createdAt", joinedAt);
        return new Record(bins, 1, 0);
    }
}
