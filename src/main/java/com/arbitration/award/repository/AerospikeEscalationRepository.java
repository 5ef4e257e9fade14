package com.arbitration.award.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.arbitration.award.config.AerospikeConfig;
import com.arbitration.award.model.AwardEscalation;
import com.arbitration.award.model.EscalationReason;
import com.arbitration.award.model.EscalationStatus;
import com.arbitration.award.model.EscalationUrgency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

@Repository
public class AerospikeEscalationRepository implements EscalationRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeEscalationRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;

    public AerospikeEscalationRepository(AerospikeClient client,
                                         @Qualifier("aerospikeNamespace") String namespace,
                                         @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                         @Qualifier("createOnlyWritePolicy") WritePolicy createOnlyPolicy,
                                         @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.createOnlyPolicy = createOnlyPolicy;
        this.readPolicy = readPolicy;
    }

    @Override
    public AwardEscalation findByDraftAwardId(String draftAwardId) {
        Record record = client.get(readPolicy, key(draftAwardId));
        if (record == null) return null;
        return mapRecord(record);
    }

    @Override
    public AwardEscalation findById(String escalationId) {
        List<AwardEscalation> matches = scan(e -> escalationId.equals(e.getString("id")));
        return matches.isEmpty() ? null : matches.get(0);
    }

    @Override
    public List<AwardEscalation> findByStatus(EscalationStatus status) {
        List<AwardEscalation> results = scan(e -> status.name().equals(e.getString("status")));
        results.sort(Comparator.comparingLong(AwardEscalation::getEscalatedAt));
        return results;
    }

    @Override
    public boolean insert(AwardEscalation escalation) {
        try {
            client.put(createOnlyPolicy, key(escalation.getDraftAwardId()), bins(escalation));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public boolean replace(AwardEscalation escalation) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.REPLACE_ONLY;
        policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        policy.generation = escalation.getGeneration();
        try {
            client.put(policy, key(escalation.getDraftAwardId()), bins(escalation));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR
                    || e.getResultCode() == ResultCode.KEY_NOT_FOUND_ERROR) {
                log.debug("Escalation {} changed concurrently (expected gen {})",
                        escalation.getId(), escalation.getGeneration());
                return false;
            }
            throw e;
        }
    }

    private List<AwardEscalation> scan(Predicate<Record> filter) {
        List<AwardEscalation> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ESCALATIONS,
                (key, record) -> {
                    try {
                        if (filter.test(record)) {
                            synchronized (results) {
                                results.add(mapRecord(record));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read escalation record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private Key key(String draftAwardId) {
        return new Key(namespace, AerospikeConfig.SET_ESCALATIONS, draftAwardId);
    }

    private Bin[] bins(AwardEscalation e) {
        return new Bin[] {
                new Bin("id", e.getId()),
                new Bin("draftAwardId", e.getDraftAwardId()),
                new Bin("caseId", e.getCaseId()),
                new Bin("reason", e.getReason().name()),
                new Bin("reasonDetails", nullToEmpty(e.getReasonDetails())),
                new Bin("urgency", e.getUrgency().name()),
                new Bin("escalatedBy", e.getEscalatedBy()),
                new Bin("escalatedAt", e.getEscalatedAt()),
                new Bin("assignedTo", nullToEmpty(e.getAssignedTo())),
                new Bin("assignedAt", e.getAssignedAt() != null ? e.getAssignedAt() : 0L),
                new Bin("status", e.getStatus().name()),
                new Bin("resolvedAt", e.getResolvedAt() != null ? e.getResolvedAt() : 0L),
                new Bin("resolution", nullToEmpty(e.getResolution()))
        };
    }

    private AwardEscalation mapRecord(Record record) {
        long assignedAt = record.getLong("assignedAt");
        long resolvedAt = record.getLong("resolvedAt");
        return AwardEscalation.builder()
                .id(record.getString("id"))
                .draftAwardId(record.getString("draftAwardId"))
                .caseId(record.getString("caseId"))
                .reason(EscalationReason.valueOf(record.getString("reason")))
                .reasonDetails(emptyToNull(record.getString("reasonDetails")))
                .urgency(EscalationUrgency.valueOf(record.getString("urgency")))
                .escalatedBy(record.getString("escalatedBy"))
                .escalatedAt(record.getLong("escalatedAt"))
                .assignedTo(emptyToNull(record.getString("assignedTo")))
                .assignedAt(assignedAt > 0 ? assignedAt : null)
                .status(EscalationStatus.valueOf(record.getString("status")))
                .resolvedAt(resolvedAt > 0 ? resolvedAt : null)
                .resolution(emptyToNull(record.getString("resolution")))
                .generation(record.generation)
                .build();
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }

    private static String emptyToNull(String s) {
        return s != null && !s.isEmpty() ? s : null;
    }
}
