package com.arbitration.award.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.arbitration.award.config.AerospikeConfig;
import com.arbitration.award.model.AuditAction;
import com.arbitration.award.model.AuditLogEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Audit entries keyed by their global sequence number. Each position can be written exactly
 * once; a separate single-record hint tracks roughly where the tail is.
 */
@Repository
public class AerospikeAuditLogRepository implements AuditLogRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeAuditLogRepository.class);
    private static final String TAIL_KEY = "global";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;
    private final BatchPolicy batchPolicy;
    private final ObjectMapper objectMapper;

    public AerospikeAuditLogRepository(AerospikeClient client,
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
    public boolean insert(AuditLogEntry entry) {
        try {
            client.put(createOnlyPolicy, key(entry.getSequence()),
                    new Bin("sequence", entry.getSequence()),
                    new Bin("id", entry.getId()),
                    new Bin("action", entry.getAction().name()),
                    new Bin("actorId", nullToEmpty(entry.getActorId())),
                    new Bin("caseId", nullToEmpty(entry.getCaseId())),
                    new Bin("metadata", writeMetadata(entry.getMetadata())),
                    new Bin("ipAddress", nullToEmpty(entry.getIpAddress())),
                    new Bin("userAgent", nullToEmpty(entry.getUserAgent())),
                    new Bin("timestamp", entry.getTimestamp()),
                    new Bin("previousHash", entry.getPreviousHash()),
                    new Bin("hash", entry.getHash()));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public AuditLogEntry findBySequence(long sequence) {
        Record record = client.get(readPolicy, key(sequence));
        if (record == null) return null;
        return mapRecord(record);
    }

    @Override
    public Map<Long, AuditLogEntry> findBySequences(Collection<Long> sequences) {
        if (sequences.isEmpty()) return Collections.emptyMap();

        List<Long> ordered = new ArrayList<>(sequences);
        Key[] keys = new Key[ordered.size()];
        for (int i = 0; i < ordered.size(); i++) {
            keys[i] = key(ordered.get(i));
        }

        Record[] records = client.get(batchPolicy, keys);
        Map<Long, AuditLogEntry> result = new LinkedHashMap<>();
        for (int i = 0; i < records.length; i++) {
            if (records[i] != null) {
                result.put(ordered.get(i), mapRecord(records[i]));
            }
        }
        return result;
    }

    @Override
    public List<AuditLogEntry> findRange(long from, long to) {
        if (to < from) return Collections.emptyList();
        List<Long> sequences = new ArrayList<>();
        for (long s = from; s <= to; s++) {
            sequences.add(s);
        }
        return new ArrayList<>(findBySequences(sequences).values());
    }

    @Override
    public List<AuditLogEntry> findByCaseId(String caseId) {
        List<AuditLogEntry> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_AUDIT_LOG,
                (key, record) -> {
                    if (caseId.equals(stringBin(record, "caseId"))) {
                        AuditLogEntry entry = mapRecord(record);
                        synchronized (results) {
                            results.add(entry);
                        }
                    }
                });

        results.sort(Comparator.comparingLong(AuditLogEntry::getSequence));
        return results;
    }

    @Override
    public long readTailHint() {
        Record record = client.get(readPolicy, tailKey());
        if (record == null) return 0L;
        return record.getLong("sequence");
    }

    @Override
    public void updateTailHint(long sequence) {
        client.put(writePolicy, tailKey(), new Bin("sequence", sequence));
    }

    private Key key(long sequence) {
        return new Key(namespace, AerospikeConfig.SET_AUDIT_LOG, sequence);
    }

    private Key tailKey() {
        return new Key(namespace, AerospikeConfig.SET_AUDIT_TAIL, TAIL_KEY);
    }

    /**
     * Never throws: a record that cannot be decoded comes back with {@code readError} set and
     * only its chain fields populated, so verification reports it instead of skipping it.
     */
    private AuditLogEntry mapRecord(Record record) {
        try {
            return decode(record);
        } catch (RuntimeException e) {
            long sequence = longBin(record, "sequence");
            log.warn("Unreadable audit record at sequence {}: {}", sequence, e.getMessage());
            return AuditLogEntry.builder()
                    .sequence(sequence)
                    .id(stringBin(record, "id"))
                    .caseId(emptyToNull(stringBin(record, "caseId")))
                    .timestamp(longBin(record, "timestamp"))
                    .previousHash(stringBin(record, "previousHash"))
                    .hash(stringBin(record, "hash"))
                    .metadata(new LinkedHashMap<>())
                    .readError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }

    private AuditLogEntry decode(Record record) {
        return AuditLogEntry.builder()
                .sequence(record.getLong("sequence"))
                .id(record.getString("id"))
                .action(AuditAction.valueOf(record.getString("action")))
                .actorId(emptyToNull(record.getString("actorId")))
                .caseId(emptyToNull(record.getString("caseId")))
                .metadata(readMetadata(record.getString("metadata")))
                .ipAddress(emptyToNull(record.getString("ipAddress")))
                .userAgent(emptyToNull(record.getString("userAgent")))
                .timestamp(record.getLong("timestamp"))
                .previousHash(record.getString("previousHash"))
                .hash(record.getString("hash"))
                .build();
    }

    private String writeMetadata(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata != null ? metadata : Collections.emptyMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit metadata", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isEmpty()) return new LinkedHashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt audit metadata", e);
        }
    }

    private static String stringBin(Record record, String name) {
        Object value = record.getValue(name);
        return value instanceof String ? (String) value : null;
    }

    private static long longBin(Record record, String name) {
        Object value = record.getValue(name);
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }

    private static String emptyToNull(String s) {
        return s != null && !s.isEmpty() ? s : null;
    }
}
