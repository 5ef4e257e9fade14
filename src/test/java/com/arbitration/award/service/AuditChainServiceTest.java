package com.arbitration.award.service;

import com.arbitration.award.config.AwardConfig;
import com.arbitration.award.config.MetricsConfig;
import com.arbitration.award.exception.IntegrityException;
import com.arbitration.award.model.AuditAction;
import com.arbitration.award.model.AuditLogEntry;
import com.arbitration.award.model.ChainVerification;
import com.arbitration.award.testutil.InMemoryAuditLogRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuditChainServiceTest {

    private InMemoryAuditLogRepository repository;
    private AuditChainService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAuditLogRepository();
        service = new AuditChainService(repository, new MetricsConfig(new SimpleMeterRegistry()), new AwardConfig());
    }

    @Test
    void append_firstEntryLinksToGenesis() {
        AuditLogEntry entry = service.append(AuditAction.CASE_CREATED, "claimant-1", "case-1", Map.of());

        assertThat(entry.getSequence()).isEqualTo(1);
        assertThat(entry.getPreviousHash()).isEqualTo(AuditChainService.GENESIS_HASH).hasSize(64);
        assertThat(entry.getHash()).hasSize(64).isNotEqualTo(AuditChainService.GENESIS_HASH);
    }

    @Test
    void append_linksEachEntryToItsPredecessor() {
        AuditLogEntry first = service.append(AuditAction.CASE_CREATED, "claimant-1", "case-1", Map.of());
        AuditLogEntry second = service.append(AuditAction.CASE_ASSIGNED, "admin-1", "case-1",
                Map.of("arbitratorId", "arb-1"), "10.0.0.1", "JUnit");

        assertThat(second.getSequence()).isEqualTo(2);
        assertThat(second.getPreviousHash()).isEqualTo(first.getHash());
        assertThat(second.getIpAddress()).isEqualTo("10.0.0.1");
    }

    @Test
    void computeHash_isIndependentOfMetadataKeyOrder() {
        Map<String, Object> ab = new LinkedHashMap<>();
        ab.put("a", 1);
        ab.put("b", "two");
        Map<String, Object> ba = new LinkedHashMap<>();
        ba.put("b", "two");
        ba.put("a", 1);

        AuditLogEntry one = entryWith(ab);
        AuditLogEntry two = entryWith(ba);

        assertThat(service.computeHash(one)).isEqualTo(service.computeHash(two));
    }

    @Test
    void verify_intactChain_isValid() {
        appendSome(5);

        ChainVerification result = service.verify(repository.all());

        assertThat(result.isValid()).isTrue();
        assertThat(result.totalEntries()).isEqualTo(5);
        assertThat(result.invalidEntries()).isEmpty();
        assertThat(result.contiguous()).isTrue();
    }

    @Test
    void verify_detectsAlteredContent() {
        appendSome(4);
        AuditLogEntry tampered = repository.findBySequence(3);
        tampered.setMetadata(Map.of("amount", "999999"));
        repository.overwrite(tampered);

        ChainVerification result = service.verify(repository.all());

        assertThat(result.isValid()).isFalse();
        assertThat(result.invalidEntries()).hasSize(1);
        assertThat(result.invalidEntries().get(0).sequence()).isEqualTo(3);
        assertThat(result.invalidEntries().get(0).reason()).contains("Hash mismatch");
    }

    @Test
    void verify_detectsBrokenLink() {
        appendSome(3);
        AuditLogEntry relinked = repository.findBySequence(2);
        relinked.setPreviousHash("f".repeat(64));
        relinked.setHash(service.computeHash(relinked));
        repository.overwrite(relinked);

        ChainVerification result = service.verify(repository.all());

        assertThat(result.isValid()).isFalse();
        assertThat(result.invalidEntries()).singleElement()
                .satisfies(e -> assertThat(e.reason()).contains("Broken link"));
    }

    @Test
    void verify_detectsSequenceGap() {
        appendSome(4);
        repository.remove(2);

        ChainVerification result = service.verify(repository.all());

        assertThat(result.contiguous()).isFalse();
        assertThat(result.isValid()).isFalse();
    }

    @Test
    void verifyChain_recordsTheCheck() {
        appendSome(3);

        ChainVerification result = service.verifyChain("admin-1");

        assertThat(result.isValid()).isTrue();
        assertThat(result.totalEntries()).isEqualTo(3);
        AuditLogEntry last = repository.findBySequence(4);
        assertThat(last.getAction()).isEqualTo(AuditAction.AUDIT_LOG_VERIFIED);
        assertThat(last.getMetadata()).containsEntry("isValid", true);
    }

    @Test
    void verifyLinked_checksCaseEntriesAgainstGlobalPredecessors() {
        service.append(AuditAction.CASE_CREATED, "c", "case-1", Map.of());
        service.append(AuditAction.CASE_CREATED, "c", "case-2", Map.of());
        service.append(AuditAction.CASE_UPDATED, "c", "case-1", Map.of());

        assertThat(service.verifyLinked(service.findByCaseId("case-1")).isValid()).isTrue();

        AuditLogEntry other = repository.findBySequence(2);
        other.setHash("0".repeat(63) + "1");
        repository.overwrite(other);

        ChainVerification result = service.verifyLinked(service.findByCaseId("case-1"));
        assertThat(result.isValid()).isFalse();
        assertThat(result.invalidEntries()).singleElement()
                .satisfies(e -> assertThat(e.sequence()).isEqualTo(3));
    }

    @Test
    void requireIntact_throwsWhenCaseEntryTampered() {
        service.append(AuditAction.DRAFT_AWARD_APPROVED, "arb-1", "case-1", Map.of("notes", "ok"));
        AuditLogEntry tampered = repository.findBySequence(1);
        tampered.setActorId("someone-else");
        repository.overwrite(tampered);

        assertThatThrownBy(() -> service.requireIntact("case-1"))
                .isInstanceOf(IntegrityException.class)
                .hasMessageContaining("case-1");
    }

    @Test
    void append_normalizesMetadataSoStoredEntriesReverify() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("amount", new BigDecimal("5000.00"));
        metadata.put("fields", List.of("decision", "reasoning"));
        service.append(AuditAction.DRAFT_AWARD_MODIFIED, "arb-1", "case-1", metadata);

        assertThat(service.verify(repository.all()).isValid()).isTrue();
    }

    @Test
    void concurrentAppends_produceOneContiguousValidChain() throws Exception {
        AwardConfig config = new AwardConfig();
        config.getAudit().setAppendMaxAttempts(10_000);
        AuditChainService contended = new AuditChainService(repository,
                new MetricsConfig(new SimpleMeterRegistry()), config);
        int threads = 8;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            String actor = "actor-" + t;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    contended.append(AuditAction.EVIDENCE_VIEWED, actor, "case-" + (i % 3), Map.of("i", i));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        List<AuditLogEntry> all = repository.all();
        assertThat(all).hasSize(threads * perThread);
        assertThat(all).extracting(AuditLogEntry::getSequence)
                .containsExactlyElementsOf(LongStream.rangeClosed(1, threads * perThread)
                        .boxed().toList());
        assertThat(service.verify(all).isValid()).isTrue();
    }

    private void appendSome(int n) {
        for (int i = 0; i < n; i++) {
            service.append(AuditAction.EVIDENCE_UPLOADED, "claimant-1", "case-1", Map.of("file", "doc-" + i));
        }
    }

    private AuditLogEntry entryWith(Map<String, Object> metadata) {
        return AuditLogEntry.builder()
                .sequence(7)
                .id("e-7")
                .action(AuditAction.CASE_UPDATED)
                .actorId("a")
                .caseId("case-1")
                .metadata(metadata)
                .timestamp(1_700_000_000_000L)
                .previousHash(AuditChainService.GENESIS_HASH)
                .build();
    }
}
