package com.arbitration.award.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.arbitration.award.config.AerospikeConfig;
import com.arbitration.award.model.AwardContent;
import com.arbitration.award.model.ChangeType;
import com.arbitration.award.model.DraftAwardRevision;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Revisions live under key {@code draftAwardId:version}; a counter record per draft hands out
 * versions. Allocation is an atomic add on the counter, and the revision insert is create-only,
 * so two writers can never end up with the same version.
 */
@Repository
public class AerospikeRevisionRepository implements RevisionRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;
    private final BatchPolicy batchPolicy;
    private final ObjectMapper objectMapper;

    public AerospikeRevisionRepository(AerospikeClient client,
                                       @Qualifier("aerospikeNamespace") String namespace,
                                       @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                       @Qualifier("createOnlyWritePolicy") WritePolicy createOnlyPolicy,
                                       @Qualifier("defaultReadPolicy") Policy readPolicy,
                                       @Qualifier("defaultBatchPolicy") BatchPolicy batchPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.createOnlyPolicy = createOnlyPolicy;
        this.readPolicy = readPolicy;
        this.batchPolicy = batchPolicy;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public boolean initializeCounter(String draftAwardId) {
        try {
            client.put(createOnlyPolicy, counterKey(draftAwardId), new Bin("count", 1));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public int allocateVersion(String draftAwardId) {
        Record record = client.operate(writePolicy, counterKey(draftAwardId),
                Operation.add(new Bin("count", 1)),
                Operation.get("count"));
        return (int) record.getLong("count");
    }

    @Override
    public int currentVersion(String draftAwardId) {
        Record record = client.get(readPolicy, counterKey(draftAwardId));
        if (record == null) return 0;
        return (int) record.getLong("count");
    }

    @Override
    public boolean insert(DraftAwardRevision revision) {
        Key key = revisionKey(revision.getDraftAwardId(), revision.getVersion());
        try {
            client.put(createOnlyPolicy, key,
                    new Bin("id", revision.getId()),
                    new Bin("draftAwardId", revision.getDraftAwardId()),
                    new Bin("version", revision.getVersion()),
                    new Bin("content", write(revision.getContent())),
                    new Bin("changeType", revision.getChangeType().name()),
                    new Bin("changeSummary", revision.getChangeSummary() != null ? revision.getChangeSummary() : ""),
                    new Bin("changedFields", write(revision.getChangedFields() != null
                            ? revision.getChangedFields() : Collections.emptyList())),
                    new Bin("authorId", revision.getAuthorId() != null ? revision.getAuthorId() : ""),
                    new Bin("createdAt", revision.getCreatedAt()));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public DraftAwardRevision find(String draftAwardId, int version) {
        Record record = client.get(readPolicy, revisionKey(draftAwardId, version));
        if (record == null) return null;
        return mapRecord(record);
    }

    @Override
    public List<DraftAwardRevision> findAll(String draftAwardId) {
        int max = currentVersion(draftAwardId);
        if (max == 0) return Collections.emptyList();

        Key[] keys = new Key[max];
        for (int v = 1; v <= max; v++) {
            keys[v - 1] = revisionKey(draftAwardId, v);
        }

        Record[] records = client.get(batchPolicy, keys);
        List<DraftAwardRevision> revisions = new ArrayList<>();
        for (Record record : records) {
            // a version whose insert failed after allocation leaves a hole
            if (record != null) {
                revisions.add(mapRecord(record));
            }
        }
        return revisions;
    }

    private Key counterKey(String draftAwardId) {
        return new Key(namespace, AerospikeConfig.SET_REVISION_COUNTERS, draftAwardId);
    }

    private Key revisionKey(String draftAwardId, int version) {
        return new Key(namespace, AerospikeConfig.SET_REVISIONS, draftAwardId + ":" + version);
    }

    private DraftAwardRevision mapRecord(Record record) {
        String summary = record.getString("changeSummary");
        String author = record.getString("authorId");
        try {
            return DraftAwardRevision.builder()
                    .id(record.getString("id"))
                    .draftAwardId(record.getString("draftAwardId"))
                    .version(record.getInt("version"))
                    .content(objectMapper.readValue(record.getString("content"), AwardContent.class))
                    .changeType(ChangeType.valueOf(record.getString("changeType")))
                    .changeSummary(summary != null && !summary.isEmpty() ? summary : null)
                    .changedFields(objectMapper.readValue(record.getString("changedFields"),
                            new TypeReference<List<String>>() {}))
                    .authorId(author != null && !author.isEmpty() ? author : null)
                    .createdAt(record.getLong("createdAt"))
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt revision record for draft " + record.getString("draftAwardId"), e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize revision field", e);
        }
    }
}
