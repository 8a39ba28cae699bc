package com.consular.network.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.consular.network.config.AerospikeConfig;
import com.consular.network.model.Person;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

@Repository
public class PersonRepository {

    private static final Logger log = LoggerFactory.getLogger(PersonRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ScanPolicy scanPolicy;

    public PersonRepository(AerospikeClient client,
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

    public Person findById(String personId) {
        Key key = new Key(namespace, AerospikeConfig.SET_PEOPLE, personId);
        Record record = client.get(readPolicy, key);
        if (record == null) {
            return null;
        }
        return mapRecord(record);
    }

    public List<Person> scanAll() {
        List<Person> people = new ArrayList<>();
        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_PEOPLE,
                (key, record) -> {
                    try {
                        if (record.getString("personId") != null) {
                            Person person = mapRecord(record);
                            synchronized (people) {
                                people.add(person);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize person record: {}", e.getMessage());
                    }
                });
        return people;
    }

    public void save(Person person) {
        Key key = new Key(namespace, AerospikeConfig.SET_PEOPLE, person.getPersonId());

        client.put(writePolicy, key,
                new Bin("personId", person.getPersonId()),
                new Bin("firstName", person.getFirstName()),
                new Bin("lastName", person.getLastName()),
                new Bin("city", person.getCity()),
                new Bin("createdAt", person.getCreatedAt()));
    }

    private Person mapRecord(Record record) {
        return Person.builder()
                .personId(record.getString("personId"))
                .firstName(record.getString("firstName"))
                .lastName(record.getString("lastName"))
                .city(record.getString("city"))
                .createdAt(record.getLong("createdAt"))
                .build();
    }
}
