package com.arbitration.award.service;

import com.arbitration.award.config.AwardConfig;
import com.arbitration.award.config.MetricsConfig;
import com.arbitration.award.exception.IntegrityException;
import com.arbitration.award.exception.StateConflictException;
import com.arbitration.award.model.AuditAction;
import com.arbitration.award.model.AuditLogEntry;
import com.arbitration.award.model.ChainVerification;
import com.arbitration.award.repository.AuditLogRepository;
import com.arbitration.award.signing.Digests;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Hash-linked, append-only audit log shared by every component.
 *
 * <p>Each entry's hash is {@code SHA-256(canonicalJson(fields) + previousHash)}. Appends are
 * serialized by the store: the entry for position n+1 is written create-only, so exactly one
 * writer wins each position and the others re-read the tail and try again.
 */
@Service
public class AuditChainService {

    private static final Logger log = LoggerFactory.getLogger(AuditChainService.class);

    public static final String GENESIS_HASH = "0".repeat(64);

    private static final int VERIFY_BATCH_SIZE = 500;

    private final AuditLogRepository auditLogRepository;
    private final MetricsConfig metricsConfig;
    private final int maxAttempts;
    private final ObjectMapper canonicalMapper;

    public AuditChainService(AuditLogRepository auditLogRepository, MetricsConfig metricsConfig,
                             AwardConfig awardConfig) {
        this.auditLogRepository = auditLogRepository;
        this.metricsConfig = metricsConfig;
        this.maxAttempts = awardConfig.getAudit().getAppendMaxAttempts();
        this.canonicalMapper = JsonMapper.builder()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .build();
    }

    public AuditLogEntry append(AuditAction action, String actorId, String caseId, Map<String, Object> metadata) {
        return append(action, actorId, caseId, metadata, null, null);
    }

    @Observed(name = "audit.append", contextualName = "audit-append")
    public AuditLogEntry append(AuditAction action, String actorId, String caseId,
                                Map<String, Object> metadata, String ipAddress, String userAgent) {
        Map<String, Object> normalized = normalize(metadata);

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long tail = findTail();
            String previousHash = hashAt(tail);

            AuditLogEntry entry = AuditLogEntry.builder()
                    .sequence(tail + 1)
                    .id(UUID.randomUUID().toString())
                    .action(action)
                    .actorId(blankToNull(actorId))
                    .caseId(blankToNull(caseId))
                    .metadata(normalized)
                    .ipAddress(blankToNull(ipAddress))
                    .userAgent(blankToNull(userAgent))
                    .timestamp(System.currentTimeMillis())
                    .previousHash(previousHash)
                    .build();
            entry.setHash(computeHash(entry));

            if (auditLogRepository.insert(entry)) {
                auditLogRepository.updateTailHint(entry.getSequence());
                metricsConfig.recordAuditAppend(action.name(), attempt);
                log.debug("Audit {} appended at seq={} case={} actor={}",
                        action, entry.getSequence(), caseId, actorId);
                return entry;
            }
            log.debug("Audit position {} taken, retrying (attempt {})", entry.getSequence(), attempt);
        }

        throw new StateConflictException(
                "Audit chain append for " + action + " abandoned after " + maxAttempts + " contended attempts");
    }

    /**
     * Recompute every hash and check each link and sequence step. Entries are taken in
     * sequence order regardless of the order passed in.
     */
    public ChainVerification verify(List<AuditLogEntry> entries) {
        List<AuditLogEntry> ordered = new ArrayList<>(entries);
        ordered.sort((a, b) -> Long.compare(a.getSequence(), b.getSequence()));

        ChainVerifier verifier = new ChainVerifier();
        for (AuditLogEntry entry : ordered) {
            verifier.accept(entry);
        }
        return verifier.result();
    }

    /**
     * Verify the whole global chain, reading it in batches, and record the check itself.
     */
    @Observed(name = "audit.verify_chain", contextualName = "verify-audit-chain")
    public ChainVerification verifyChain(String actorId) {
        long tail = findTail();
        ChainVerifier verifier = new ChainVerifier();
        for (long from = 1; from <= tail; from += VERIFY_BATCH_SIZE) {
            long to = Math.min(tail, from + VERIFY_BATCH_SIZE - 1);
            List<AuditLogEntry> batch = auditLogRepository.findRange(from, to);
            for (AuditLogEntry entry : batch) {
                verifier.accept(entry);
            }
        }
        ChainVerification result = verifier.result(tail);

        metricsConfig.recordIntegrityCheck(result.isValid(), result.invalidEntries().size());
        if (result.isValid()) {
            log.info("Audit chain verified: {} entries intact", result.totalEntries());
        } else {
            log.error("Audit chain verification FAILED: {} invalid of {} entries, contiguous={}",
                    result.invalidEntries().size(), result.totalEntries(), result.contiguous());
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("scope", "global");
        metadata.put("totalEntries", result.totalEntries());
        metadata.put("invalidEntries", result.invalidEntries().size());
        metadata.put("isValid", result.isValid());
        append(AuditAction.AUDIT_LOG_VERIFIED, actorId, null, metadata);
        return result;
    }

    /**
     * Verify a subset of the chain (e.g. one case's entries) against the global chain:
     * each entry's own hash, and its previousHash against the hash of the global entry
     * directly before it.
     */
    public ChainVerification verifyLinked(List<AuditLogEntry> entries) {
        List<ChainVerification.InvalidEntry> invalid = new ArrayList<>();
        List<Long> predecessorSeqs = entries.stream()
                .map(e -> e.getSequence() - 1)
                .filter(s -> s >= 1)
                .distinct()
                .collect(Collectors.toList());
        Map<Long, AuditLogEntry> predecessors = predecessorSeqs.isEmpty()
                ? Collections.emptyMap()
                : auditLogRepository.findBySequences(predecessorSeqs);

        boolean contiguous = true;
        for (AuditLogEntry entry : entries) {
            if (entry.getReadError() != null) {
                invalid.add(unreadable(entry));
                continue;
            }
            if (!computeHash(entry).equals(entry.getHash())) {
                invalid.add(new ChainVerification.InvalidEntry(entry.getId(), entry.getSequence(),
                        "Hash mismatch: entry content has been altered"));
                continue;
            }

            String expectedPrevious;
            if (entry.getSequence() == 1) {
                expectedPrevious = GENESIS_HASH;
            } else {
                AuditLogEntry predecessor = predecessors.get(entry.getSequence() - 1);
                if (predecessor == null) {
                    contiguous = false;
                    invalid.add(new ChainVerification.InvalidEntry(entry.getId(), entry.getSequence(),
                            "Preceding entry " + (entry.getSequence() - 1) + " is missing"));
                    continue;
                }
                expectedPrevious = predecessor.getHash();
            }
            if (!Objects.equals(expectedPrevious, entry.getPreviousHash())) {
                invalid.add(new ChainVerification.InvalidEntry(entry.getId(), entry.getSequence(),
                        "Broken link: previousHash does not match preceding entry"));
            }
        }
        return new ChainVerification(invalid.isEmpty(), entries.size(), invalid, contiguous);
    }

    /**
     * @throws IntegrityException if any audit entry of the case fails verification
     */
    public void requireIntact(String caseId) {
        List<AuditLogEntry> entries = auditLogRepository.findByCaseId(caseId);
        ChainVerification result = verifyLinked(entries);
        metricsConfig.recordIntegrityCheck(result.isValid(), result.invalidEntries().size());
        if (!result.isValid()) {
            throw new IntegrityException("Audit trail for case " + caseId + " failed integrity verification",
                    result.invalidEntries());
        }
    }

    public List<AuditLogEntry> findByCaseId(String caseId) {
        return auditLogRepository.findByCaseId(caseId);
    }

    String computeHash(AuditLogEntry entry) {
        Map<String, Object> fields = new TreeMap<>();
        fields.put("sequence", entry.getSequence());
        fields.put("action", entry.getAction() != null ? entry.getAction().name() : null);
        fields.put("actorId", entry.getActorId());
        fields.put("caseId", entry.getCaseId());
        fields.put("ipAddress", entry.getIpAddress());
        fields.put("userAgent", entry.getUserAgent());
        fields.put("metadata", entry.getMetadata() != null ? entry.getMetadata() : Collections.emptyMap());
        fields.put("timestamp", entry.getTimestamp());
        try {
            return Digests.sha256Hex(canonicalMapper.writeValueAsString(fields) + entry.getPreviousHash());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit entry is not serializable", e);
        }
    }

    /**
     * Metadata is hashed in the form it will have after a storage round trip, so that
     * re-verification sees identical JSON.
     */
    private Map<String, Object> normalize(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) return new LinkedHashMap<>();
        try {
            String json = canonicalMapper.writeValueAsString(metadata);
            return canonicalMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Audit metadata is not serializable: " + e.getMessage(), e);
        }
    }

    private static ChainVerification.InvalidEntry unreadable(AuditLogEntry entry) {
        return new ChainVerification.InvalidEntry(entry.getId(), entry.getSequence(),
                "Unreadable entry: " + entry.getReadError());
    }

    // Stored bins cannot tell null from empty, so the hashed entry must not either.
    private static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private long findTail() {
        long tail = Math.max(0L, auditLogRepository.readTailHint());
        while (auditLogRepository.findBySequence(tail + 1) != null) {
            tail++;
        }
        return tail;
    }

    private String hashAt(long sequence) {
        if (sequence == 0) return GENESIS_HASH;
        AuditLogEntry entry = auditLogRepository.findBySequence(sequence);
        if (entry == null) {
            throw new IntegrityException("Audit chain entry " + sequence + " is missing",
                    List.of(new ChainVerification.InvalidEntry(null, sequence, "Entry missing")));
        }
        return entry.getHash();
    }

    /**
     * Streaming verifier: entries must arrive in ascending sequence order.
     */
    private final class ChainVerifier {
        private final List<ChainVerification.InvalidEntry> invalid = new ArrayList<>();
        private AuditLogEntry previous;
        private long expectedSequence = -1;
        private int total;
        private boolean contiguous = true;

        void accept(AuditLogEntry entry) {
            total++;
            if (expectedSequence >= 0 && entry.getSequence() != expectedSequence) {
                contiguous = false;
            }

            if (entry.getReadError() != null) {
                invalid.add(unreadable(entry));
            } else if (!computeHash(entry).equals(entry.getHash())) {
                invalid.add(new ChainVerification.InvalidEntry(entry.getId(), entry.getSequence(),
                        "Hash mismatch: entry content has been altered"));
            } else if (previous != null && previous.getSequence() == entry.getSequence() - 1) {
                if (!Objects.equals(previous.getHash(), entry.getPreviousHash())) {
                    invalid.add(new ChainVerification.InvalidEntry(entry.getId(), entry.getSequence(),
                            "Broken link: previousHash does not match preceding entry"));
                }
            } else if (entry.getSequence() == 1 && !GENESIS_HASH.equals(entry.getPreviousHash())) {
                invalid.add(new ChainVerification.InvalidEntry(entry.getId(), entry.getSequence(),
                        "First entry does not link to the genesis hash"));
            }

            previous = entry;
            expectedSequence = entry.getSequence() + 1;
        }

        ChainVerification result() {
            return new ChainVerification(invalid.isEmpty() && contiguous, total, List.copyOf(invalid), contiguous);
        }

        ChainVerification result(long expectedTotal) {
            if (total != expectedTotal) {
                contiguous = false;
            }
            return new ChainVerification(invalid.isEmpty() && contiguous, total, List.copyOf(invalid), contiguous);
        }
    }
}
