package com.arbitration.award.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.arbitration.award.config.AerospikeConfig;
import com.arbitration.award.model.AwardContent;
import com.arbitration.award.model.DraftAward;
import com.arbitration.award.model.ReviewStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

@Repository
public class AerospikeDraftAwardRepository implements DraftAwardRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeDraftAwardRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AerospikeDraftAwardRepository(AerospikeClient client,
                                         @Qualifier("aerospikeNamespace") String namespace,
                                         @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                         @Qualifier("createOnlyWritePolicy") WritePolicy createOnlyPolicy,
                                         @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.createOnlyPolicy = createOnlyPolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public boolean insert(DraftAward draft) {
        try {
            client.put(createOnlyPolicy, key(draft.getCaseId()), bins(draft));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public boolean save(DraftAward draft) {
        WritePolicy policy = writePolicy;
        if (draft.getGeneration() > 0) {
            policy = new WritePolicy(writePolicy);
            policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
            policy.generation = draft.getGeneration();
        }
        try {
            client.put(policy, key(draft.getCaseId()), bins(draft));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.debug("Draft award {} changed concurrently (expected gen {})",
                        draft.getId(), draft.getGeneration());
                return false;
            }
            throw e;
        }
    }

    @Override
    public DraftAward findByCaseId(String caseId) {
        Record record = client.get(readPolicy, key(caseId));
        if (record == null) return null;
        return mapRecord(record);
    }

    private Key key(String caseId) {
        return new Key(namespace, AerospikeConfig.SET_DRAFT_AWARDS, caseId);
    }

    private Bin[] bins(DraftAward draft) {
        return new Bin[] {
                new Bin("id", draft.getId()),
                new Bin("caseId", draft.getCaseId()),
                new Bin("content", writeContent(draft.getContent())),
                new Bin("confidence", draft.getConfidence()),
                new Bin("modelUsed", nullToEmpty(draft.getModelUsed())),
                new Bin("reviewStatus", draft.getReviewStatus() != null ? draft.getReviewStatus().name() : ""),
                new Bin("reviewNotes", nullToEmpty(draft.getReviewNotes())),
                new Bin("generatedAt", draft.getGeneratedAt()),
                new Bin("reviewedAt", draft.getReviewedAt() != null ? draft.getReviewedAt() : 0L),
                new Bin("reviewedBy", nullToEmpty(draft.getReviewedBy()))
        };
    }

    private DraftAward mapRecord(Record record) {
        String status = record.getString("reviewStatus");
        long reviewedAt = record.getLong("reviewedAt");
        return DraftAward.builder()
                .id(record.getString("id"))
                .caseId(record.getString("caseId"))
                .content(readContent(record.getString("content")))
                .confidence(record.getDouble("confidence"))
                .modelUsed(emptyToNull(record.getString("modelUsed")))
                .reviewStatus(status != null && !status.isEmpty() ? ReviewStatus.valueOf(status) : null)
                .reviewNotes(emptyToNull(record.getString("reviewNotes")))
                .generatedAt(record.getLong("generatedAt"))
                .reviewedAt(reviewedAt > 0 ? reviewedAt : null)
                .reviewedBy(emptyToNull(record.getString("reviewedBy")))
                .generation(record.generation)
                .build();
    }

    private String writeContent(AwardContent content) {
        try {
            return objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize award content", e);
        }
    }

    private AwardContent readContent(String json) {
        try {
            return objectMapper.readValue(json, AwardContent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize award content", e);
        }
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }

    private static String emptyToNull(String s) {
        return s != null && !s.isEmpty() ? s : null;
    }
}
