package com.arbitration.award.service;

import com.arbitration.award.exception.ExternalServiceException;
import com.arbitration.award.exception.IntegrityException;
import com.arbitration.award.exception.NotFoundException;
import com.arbitration.award.exception.StateConflictException;
import com.arbitration.award.gateway.DocumentStorage;
import com.arbitration.award.gateway.StorageRequest;
import com.arbitration.award.gateway.StoredDocument;
import com.arbitration.award.model.*;
import com.arbitration.award.signing.Digests;
import com.arbitration.award.testutil.ServiceFixture;
import com.arbitration.award.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AwardFinalizationServiceTest {

    @TempDir
    Path storageDir;

    private ServiceFixture fx;

    @BeforeEach
    void setUp() {
        fx = newFixture(null);
    }

    @Test
    void finalize_issuesSignedAwardAndNotifiesBothParties() {
        approveDraft(fx);

        FinalizationResult result = fx.finalizationService.finalize("case-1", "arb-1", "10.0.0.7", "JUnit");

        assertThat(result.getReferenceNumber()).matches("AWD-\\d{8}-00001");
        assertThat(result.getAwardAmount()).isEqualByComparingTo("5000.00");
        assertThat(result.getPrevailingParty()).isEqualTo(PrevailingParty.CLAIMANT);
        assertThat(result.isClaimantNotified()).isTrue();
        assertThat(result.isRespondentNotified()).isTrue();
        assertThat(result.getSignatureAlgorithm()).isEqualTo("SHA256withRSA");
        assertThat(result.getCertificateFingerprint()).hasSize(64);
        assertThat(result.isTimestampGranted()).isFalse();
        assertThat(result.getTimestampTime()).isNull();
        assertThat(result.getDocumentUrl()).endsWith(result.getReferenceNumber() + ".txt");

        Award award = fx.awards.findByCaseId("case-1");
        assertThat(award.getId()).isEqualTo(result.getAwardId());
        assertThat(award.getClaimantNotifiedAt()).isNotNull();
        assertThat(award.getRespondentNotifiedAt()).isNotNull();
        assertThat(award.getTimestampToken()).isNull();
        assertThat(fx.cases.findById("case-1").getStatus()).isEqualTo(CaseStatus.DECIDED);

        assertThat(fx.notifications.sent())
                .extracting(s -> s.userId() + ":" + s.template())
                .containsExactly("claimant-1:AWARD_ISSUED", "respondent-1:AWARD_ISSUED");

        List<AuditAction> actions = fx.auditLog.all().stream().map(AuditLogEntry::getAction).toList();
        assertThat(actions).containsSubsequence(AuditAction.AWARD_SIGNED, AuditAction.AWARD_ISSUED);
        AuditLogEntry issued = fx.auditLog.all().get(actions.size() - 1);
        assertThat(issued.getIpAddress()).isEqualTo("10.0.0.7");
        assertThat(issued.getUserAgent()).isEqualTo("JUnit");
        assertThat(issued.getMetadata()).containsEntry("referenceNumber", result.getReferenceNumber());
    }

    @Test
    void finalize_documentHashMatchesStoredBytes() throws IOException {
        approveDraft(fx);

        FinalizationResult result = fx.finalizationService.finalize("case-1", "arb-1", null, null);

        try (Stream<Path> files = Files.walk(storageDir)) {
            Path stored = files.filter(Files::isRegularFile).findFirst().orElseThrow();
            byte[] bytes = Files.readAllBytes(stored);
            assertThat(Digests.sha256Hex(bytes)).isEqualTo(result.getDocumentHash());
            assertThat(new String(bytes, StandardCharsets.UTF_8))
                    .contains("FINAL ARBITRATION AWARD")
                    .contains(result.getReferenceNumber())
                    .contains("Amount Awarded: $5,000.00");
        }
    }

    @Test
    void finalize_secondCall_throwsAlreadyIssued() {
        approveDraft(fx);
        fx.finalizationService.finalize("case-1", "arb-1", null, null);

        assertThat(fx.finalizationService.canIssue("case-1"))
                .isEqualTo(IssuanceCheck.denied("Award has already been issued for this case"));
        assertThatThrownBy(() -> fx.finalizationService.finalize("case-1", "arb-1", null, null))
                .isInstanceOf(StateConflictException.class)
                .hasMessageContaining("already");
        assertThat(fx.awards.size()).isEqualTo(1);
    }

    @Test
    void finalize_referenceSequenceIncrementsPerAward() {
        approveDraft(fx);
        fx.cases.save(TestDataFactory.createCase("case-2", CaseStatus.ARBITRATOR_REVIEW));
        fx.intakeService.registerDraft("case-2", TestDataFactory.createSubmission(), "system");
        fx.reviewService.approve("case-2", "arb-1", null);

        String first = fx.finalizationService.finalize("case-1", "arb-1", null, null).getReferenceNumber();
        String second = fx.finalizationService.finalize("case-2", "arb-1", null, null).getReferenceNumber();

        assertThat(first).endsWith("-00001");
        assertThat(second).endsWith("-00002");
        assertThat(first.substring(0, 12)).isEqualTo(second.substring(0, 12));
    }

    @Test
    void finalize_storageFailure_persistsNoAward() {
        DocumentStorage failing = new DocumentStorage() {
            @Override
            public StoredDocument store(byte[] data, StorageRequest request) {
                throw new ExternalServiceException("storage", "bucket unavailable", null);
            }

            @Override
            public byte[] fetch(String url) {
                throw new NotFoundException(url);
            }
        };
        ServiceFixture broken = newFixture(failing);
        approveDraft(broken);

        assertThatThrownBy(() -> broken.finalizationService.finalize("case-1", "arb-1", null, null))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessageContaining("bucket unavailable");

        assertThat(broken.awards.size()).isZero();
        assertThat(broken.notifications.sent()).isEmpty();
        assertThat(broken.finalizationService.canIssue("case-1").canIssue()).isTrue();
        assertThat(broken.auditLog.all()).extracting(AuditLogEntry::getAction)
                .doesNotContain(AuditAction.AWARD_ISSUED);
    }

    @Test
    void finalize_storedHashMismatch_aborts() {
        DocumentStorage corrupting = new DocumentStorage() {
            @Override
            public StoredDocument store(byte[] data, StorageRequest request) {
                return new StoredDocument("mem://" + request.filename(), "0".repeat(64), data.length);
            }

            @Override
            public byte[] fetch(String url) {
                return new byte[0];
            }
        };
        ServiceFixture broken = newFixture(corrupting);
        approveDraft(broken);

        assertThatThrownBy(() -> broken.finalizationService.finalize("case-1", "arb-1", null, null))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessageContaining("does not match");
        assertThat(broken.awards.size()).isZero();
    }

    @Test
    void finalize_oneNotificationFailing_stillNotifiesTheOtherParty() {
        approveDraft(fx);
        fx.notifications.failFor("claimant-1");

        FinalizationResult result = fx.finalizationService.finalize("case-1", "arb-1", null, null);

        assertThat(result.isClaimantNotified()).isFalse();
        assertThat(result.isRespondentNotified()).isTrue();
        assertThat(fx.notifications.recipients()).containsExactly("respondent-1");

        Award award = fx.awards.findByCaseId("case-1");
        assertThat(award.getClaimantNotifiedAt()).isNull();
        assertThat(award.getRespondentNotifiedAt()).isNotNull();
    }

    @Test
    void finalize_byOtherArbitrator_throwsConflict() {
        approveDraft(fx);

        assertThatThrownBy(() -> fx.finalizationService.finalize("case-1", "arb-2", null, null))
                .isInstanceOf(StateConflictException.class)
                .hasMessage("Only the assigned arbitrator can issue the award");
        assertThat(fx.awards.size()).isZero();
    }

    @Test
    void finalize_withTamperedCaseAudit_throwsIntegrity() {
        approveDraft(fx);
        AuditLogEntry first = fx.auditLog.findBySequence(1);
        first.setActorId("intruder");
        fx.auditLog.overwrite(first);

        assertThatThrownBy(() -> fx.finalizationService.finalize("case-1", "arb-1", null, null))
                .isInstanceOf(IntegrityException.class);
        assertThat(fx.awards.size()).isZero();
    }

    @Test
    void finalize_missingDraft_throwsNotFound() {
        assertThatThrownBy(() -> fx.finalizationService.finalize("case-1", "arb-1", null, null))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Draft award not found");
    }

    @Test
    void canIssue_reportsFirstFailingPrecondition() {
        assertThat(fx.finalizationService.canIssue("case-1").reason()).isEqualTo("Draft award not found");

        fx.intakeService.registerDraft("case-1", TestDataFactory.createSubmission(), "system");
        assertThat(fx.finalizationService.canIssue("case-1").reason())
                .isEqualTo("Draft award status is pending, must be APPROVE");

        fx.reviewService.modify("case-1", "arb-1", AwardModification.builder()
                .decision("Revised").changeSummary("Reworded").build());
        assertThat(fx.finalizationService.canIssue("case-1").reason())
                .isEqualTo("Draft award status is MODIFY, must be APPROVE");

        fx.reviewService.approve("case-1", "arb-1", null);
        fx.cases.updateStatus("case-1", CaseStatus.CLOSED);
        assertThat(fx.finalizationService.canIssue("case-1").reason())
                .isEqualTo("Case status is CLOSED, must be ARBITRATOR_REVIEW");

        fx.cases.updateStatus("case-1", CaseStatus.DECIDED);
        assertThat(fx.finalizationService.canIssue("case-1")).isEqualTo(IssuanceCheck.allowed());
    }

    @Test
    void canIssue_approvedDraftWithoutCase_reportsCaseNotFound() {
        fx.drafts.insert(TestDataFactory.createDraft("orphan", ReviewStatus.APPROVE));

        assertThat(fx.finalizationService.canIssue("orphan").reason()).isEqualTo("Case not found");
        assertThatThrownBy(() -> fx.finalizationService.finalize("orphan", "arb-1", null, null))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void getDownloadUrl_recordsDownload() {
        approveDraft(fx);
        FinalizationResult result = fx.finalizationService.finalize("case-1", "arb-1", null, null);

        assertThat(fx.finalizationService.getDownloadUrl("case-1", "claimant-1")).isEqualTo(result.getDocumentUrl());
        List<AuditLogEntry> all = fx.auditLog.all();
        assertThat(all.get(all.size() - 1).getAction()).isEqualTo(AuditAction.AWARD_DOWNLOADED);
    }

    @Test
    void getIssuedAward_missing_throwsNotFound() {
        assertThatThrownBy(() -> fx.finalizationService.getIssuedAward("case-1"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void verify_issuedAward_checksHashAndSignature() {
        approveDraft(fx);
        fx.finalizationService.finalize("case-1", "arb-1", null, null);

        AwardVerification verification = fx.verificationService.verify("case-1", "admin-1");

        assertThat(verification.valid()).isTrue();
        assertThat(verification.documentHashMatches()).isTrue();
        assertThat(verification.signatureValid()).isTrue();
        List<AuditLogEntry> all = fx.auditLog.all();
        assertThat(all.get(all.size() - 1).getAction()).isEqualTo(AuditAction.AWARD_VERIFIED);
    }

    @Test
    void verify_alteredDocument_isInvalid() throws IOException {
        approveDraft(fx);
        fx.finalizationService.finalize("case-1", "arb-1", null, null);
        try (Stream<Path> files = Files.walk(storageDir)) {
            Path stored = files.filter(Files::isRegularFile).findFirst().orElseThrow();
            Files.writeString(stored, "Amount Awarded: $50,000.00", StandardCharsets.UTF_8);
        }

        AwardVerification verification = fx.verificationService.verify("case-1", "admin-1");

        assertThat(verification.valid()).isFalse();
        assertThat(verification.documentHashMatches()).isFalse();
        assertThat(verification.signatureValid()).isFalse();
    }

    private ServiceFixture newFixture(DocumentStorage storage) {
        ServiceFixture fixture = new ServiceFixture(storageDir, storage);
        fixture.cases.save(TestDataFactory.createCase("case-1", CaseStatus.ARBITRATOR_REVIEW));
        fixture.users.save(TestDataFactory.createArbitrator("arb-1", false, 3, 10));
        fixture.users.save(TestDataFactory.createUser("claimant-1", UserRole.CLAIMANT));
        fixture.users.save(TestDataFactory.createUser("respondent-1", UserRole.RESPONDENT));
        return fixture;
    }

    private static void approveDraft(ServiceFixture fixture) {
        fixture.intakeService.registerDraft("case-1", TestDataFactory.createSubmission(), "system");
        fixture.reviewService.approve("case-1", "arb-1", "Approved");
    }
}
