package com.arbitration.award.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.arbitration.award.config.AerospikeConfig;
import com.arbitration.award.model.CaseRecord;
import com.arbitration.award.model.CaseStatus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * Case records are owned by the intake side of the platform; this subsystem reads them and
 * moves their status forward.
 */
@Repository
public class AerospikeCaseRepository implements CaseRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AerospikeCaseRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    @Override
    public CaseRecord findById(String caseId) {
        Record record = client.get(readPolicy, key(caseId));
        if (record == null) return null;

        String respondentId = record.getString("respondentId");
        String arbitratorId = record.getString("assignedArbId");
        return CaseRecord.builder()
                .caseId(record.getString("caseId"))
                .referenceNumber(record.getString("referenceNumber"))
                .status(CaseStatus.valueOf(record.getString("status")))
                .claimantId(record.getString("claimantId"))
                .respondentId(respondentId != null && !respondentId.isEmpty() ? respondentId : null)
                .assignedArbitratorId(arbitratorId != null && !arbitratorId.isEmpty() ? arbitratorId : null)
                .jurisdiction(record.getString("jurisdiction"))
                .title(record.getString("title"))
                .createdAt(record.getLong("createdAt"))
                .build();
    }

    @Override
    public void save(CaseRecord c) {
        client.put(writePolicy, key(c.getCaseId()),
                new Bin("caseId", c.getCaseId()),
                new Bin("referenceNumber", c.getReferenceNumber()),
                new Bin("status", c.getStatus().name()),
                new Bin("claimantId", c.getClaimantId()),
                new Bin("respondentId", c.getRespondentId() != null ? c.getRespondentId() : ""),
                new Bin("assignedArbId", c.getAssignedArbitratorId() != null ? c.getAssignedArbitratorId() : ""),
                new Bin("jurisdiction", c.getJurisdiction()),
                new Bin("title", c.getTitle()),
                new Bin("createdAt", c.getCreatedAt()));
    }

    @Override
    public void updateStatus(String caseId, CaseStatus status) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        client.put(policy, key(caseId), new Bin("status", status.name()));
    }

    private Key key(String caseId) {
        return new Key(namespace, AerospikeConfig.SET_CASES, caseId);
    }
}
