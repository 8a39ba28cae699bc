package com.consular.network.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.consular.network.config.AerospikeConfig;
import com.consular.network.model.Annotation;
import com.consular.network.model.AnnotationPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Intelligence notes. Only the subject, priority and timestamp bins are read; note
 * content is never loaded.
 */
@Repository
public class AnnotationRepository {

    private static final Logger log = LoggerFactory.getLogger(AnnotationRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ScanPolicy scanPolicy;

    public AnnotationRepository(AerospikeClient client,
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

    public Annotation findById(String annotationId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANNOTATIONS, annotationId);
        Record record = client.get(readPolicy, key, "annotationId", "personId", "priority", "createdAt");
        if (record == null) {
            return null;
        }
        return mapRecord(record);
    }

    public List<Annotation> scanAll() {
        List<Annotation> annotations = new ArrayList<>();
        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANNOTATIONS,
                (key, record) -> {
                    try {
                        if (record.getString("annotationId") != null) {
                            Annotation annotation = mapRecord(record);
                            synchronized (annotations) {
                                annotations.add(annotation);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize annotation record: {}", e.getMessage());
                    }
                },
                "annotationId", "personId", "priority", "createdAt");
        return annotations;
    }

    public void save(Annotation annotation) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANNOTATIONS, annotation.getAnnotationId());

        client.put(writePolicy, key,
                new Bin("annotationId", annotation.getAnnotationId()),
                new Bin("personId", annotation.getPersonId()),
                new Bin("priority", annotation.getPriority().name().toLowerCase(Locale.ROOT)),
                new Bin("createdAt", annotation.getCreatedAt()));
    }

    private Annotation mapRecord(Record record) {
        return Annotation.builder()
                .annotationId(record.getString("annotationId"))
                .personId(record.getString("personId"))
                .priority(AnnotationPriority.fromLabel(record.getString("priority")))
                .createdAt(record.getLong("createdAt"))
                .build();
    }
}
