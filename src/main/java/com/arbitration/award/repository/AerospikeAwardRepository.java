package com.arbitration.award.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.arbitration.award.config.AerospikeConfig;
import com.arbitration.award.model.Award;
import com.arbitration.award.model.AwardContent;
import com.arbitration.award.model.PrevailingParty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

@Repository
public class AerospikeAwardRepository implements AwardRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AerospikeAwardRepository(AerospikeClient client,
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
    public boolean insert(Award award) {
        try {
            client.put(createOnlyPolicy, key(award.getCaseId()),
                    new Bin("id", award.getId()),
                    new Bin("caseId", award.getCaseId()),
                    new Bin("referenceNumber", award.getReferenceNumber()),
                    new Bin("content", writeContent(award.getContent())),
                    new Bin("arbitratorId", award.getArbitratorId()),
                    new Bin("signedAt", award.getSignedAt()),
                    new Bin("issuedAt", award.getIssuedAt()),
                    new Bin("signatureValue", award.getSignatureValue()),
                    new Bin("sigAlgorithm", award.getSignatureAlgorithm()),
                    new Bin("certFingerprint", award.getCertificateFingerprint()),
                    new Bin("signerPublicKey", award.getSignerPublicKey()),
                    new Bin("timestampToken", nullToEmpty(award.getTimestampToken())),
                    new Bin("tsGranted", award.isTimestampGranted()),
                    new Bin("timestampTime", award.getTimestampTime() != null ? award.getTimestampTime() : 0L),
                    new Bin("tsAuthority", nullToEmpty(award.getTimestampAuthority())),
                    new Bin("documentUrl", award.getDocumentUrl()),
                    new Bin("documentHash", award.getDocumentHash()),
                    new Bin("claimantNtfAt", award.getClaimantNotifiedAt() != null ? award.getClaimantNotifiedAt() : 0L),
                    new Bin("respondNtfAt", award.getRespondentNotifiedAt() != null ? award.getRespondentNotifiedAt() : 0L));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public Award findByCaseId(String caseId) {
        Record record = client.get(readPolicy, key(caseId));
        if (record == null) return null;
        return mapRecord(record);
    }

    @Override
    public void markNotified(String caseId, PrevailingParty party, long notifiedAt) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        String bin = party == PrevailingParty.CLAIMANT ? "claimantNtfAt" : "respondNtfAt";
        client.put(policy, key(caseId), new Bin(bin, notifiedAt));
    }

    @Override
    public long nextDailySequence(String day) {
        Key key = new Key(namespace, AerospikeConfig.SET_AWARD_DAY_COUNTERS, day);
        Record record = client.operate(writePolicy, key,
                Operation.add(new Bin("count", 1)),
                Operation.get("count"));
        return record.getLong("count");
    }

    private Key key(String caseId) {
        return new Key(namespace, AerospikeConfig.SET_AWARDS, caseId);
    }

    private Award mapRecord(Record record) {
        long tsTime = record.getLong("timestampTime");
        long claimantNtf = record.getLong("claimantNtfAt");
        long respondentNtf = record.getLong("respondNtfAt");
        return Award.builder()
                .id(record.getString("id"))
                .caseId(record.getString("caseId"))
                .referenceNumber(record.getString("referenceNumber"))
                .content(readContent(record.getString("content")))
                .arbitratorId(record.getString("arbitratorId"))
                .signedAt(record.getLong("signedAt"))
                .issuedAt(record.getLong("issuedAt"))
                .signatureValue(record.getString("signatureValue"))
                .signatureAlgorithm(record.getString("sigAlgorithm"))
                .certificateFingerprint(record.getString("certFingerprint"))
                .signerPublicKey(record.getString("signerPublicKey"))
                .timestampToken(emptyToNull(record.getString("timestampToken")))
                .timestampGranted(record.getBoolean("tsGranted"))
                .timestampTime(tsTime > 0 ? tsTime : null)
                .timestampAuthority(emptyToNull(record.getString("tsAuthority")))
                .documentUrl(record.getString("documentUrl"))
                .documentHash(record.getString("documentHash"))
                .claimantNotifiedAt(claimantNtf > 0 ? claimantNtf : null)
                .respondentNotifiedAt(respondentNtf > 0 ? respondentNtf : null)
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
