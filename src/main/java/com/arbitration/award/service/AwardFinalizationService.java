package com.arbitration.award.service;

import com.arbitration.award.config.AwardConfig;
import com.arbitration.award.config.MetricsConfig;
import com.arbitration.award.engine.FinalizationContext;
import com.arbitration.award.engine.FinalizationPipeline;
import com.arbitration.award.exception.NotFoundException;
import com.arbitration.award.exception.StateConflictException;
import com.arbitration.award.model.AuditAction;
import com.arbitration.award.model.Award;
import com.arbitration.award.model.CaseRecord;
import com.arbitration.award.model.DraftAward;
import com.arbitration.award.model.FinalizationResult;
import com.arbitration.award.model.IssuanceCheck;
import com.arbitration.award.model.ReviewStatus;
import com.arbitration.award.repository.AwardRepository;
import com.arbitration.award.repository.CaseRepository;
import com.arbitration.award.repository.DraftAwardRepository;
import com.arbitration.award.repository.UserRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Turns an approved draft into the case's single issued award.
 *
 * <p>The pipeline's persist stage is the commit point. Everything before it can fail without
 * leaving an award behind; everything after it (case status, notifications, audit) is best
 * effort and only reported.
 */
@Service
public class AwardFinalizationService {

    private static final Logger log = LoggerFactory.getLogger(AwardFinalizationService.class);

    static final String ALREADY_ISSUED = "Award has already been issued for this case";
    static final String DRAFT_NOT_FOUND = "Draft award not found";
    static final String CASE_NOT_FOUND = "Case not found";

    private final DraftAwardRepository draftAwardRepository;
    private final CaseRepository caseRepository;
    private final AwardRepository awardRepository;
    private final UserRepository userRepository;
    private final FinalizationPipeline pipeline;
    private final AuditChainService auditChainService;
    private final AwardConfig awardConfig;
    private final MetricsConfig metricsConfig;

    public AwardFinalizationService(DraftAwardRepository draftAwardRepository,
                                    CaseRepository caseRepository,
                                    AwardRepository awardRepository,
                                    UserRepository userRepository,
                                    FinalizationPipeline pipeline,
                                    AuditChainService auditChainService,
                                    AwardConfig awardConfig,
                                    MetricsConfig metricsConfig) {
        this.draftAwardRepository = draftAwardRepository;
        this.caseRepository = caseRepository;
        this.awardRepository = awardRepository;
        this.userRepository = userRepository;
        this.pipeline = pipeline;
        this.auditChainService = auditChainService;
        this.awardConfig = awardConfig;
        this.metricsConfig = metricsConfig;
    }

    public IssuanceCheck canIssue(String caseId) {
        if (awardRepository.findByCaseId(caseId) != null) {
            return IssuanceCheck.denied(ALREADY_ISSUED);
        }

        DraftAward draft = draftAwardRepository.findByCaseId(caseId);
        if (draft == null) {
            return IssuanceCheck.denied(DRAFT_NOT_FOUND);
        }
        if (draft.getReviewStatus() != ReviewStatus.APPROVE) {
            String status = draft.getReviewStatus() != null ? draft.getReviewStatus().name() : "pending";
            return IssuanceCheck.denied("Draft award status is " + status + ", must be APPROVE");
        }

        CaseRecord caseRecord = caseRepository.findById(caseId);
        if (caseRecord == null) {
            return IssuanceCheck.denied(CASE_NOT_FOUND);
        }
        if (!awardConfig.getIssuance().getAllowedCaseStatuses().contains(caseRecord.getStatus())) {
            return IssuanceCheck.denied("Case status is " + caseRecord.getStatus() + ", must be ARBITRATOR_REVIEW");
        }

        return IssuanceCheck.allowed();
    }

    @Observed(name = "award.finalize", contextualName = "finalize-award")
    public FinalizationResult finalize(String caseId, String arbitratorId, String ipAddress, String userAgent) {
        long start = System.currentTimeMillis();

        IssuanceCheck check = canIssue(caseId);
        if (!check.canIssue()) {
            metricsConfig.recordFinalization("rejected", System.currentTimeMillis() - start);
            log.warn("Finalization refused for case {}: {}", caseId, check.reason());
            if (DRAFT_NOT_FOUND.equals(check.reason()) || CASE_NOT_FOUND.equals(check.reason())) {
                throw new NotFoundException(check.reason());
            }
            throw new StateConflictException(check.reason());
        }

        DraftAward draft = draftAwardRepository.findByCaseId(caseId);
        CaseRecord caseRecord = caseRepository.findById(caseId);

        if (caseRecord.getAssignedArbitratorId() != null
                && !caseRecord.getAssignedArbitratorId().equals(arbitratorId)) {
            metricsConfig.recordFinalization("rejected", System.currentTimeMillis() - start);
            throw new StateConflictException("Only the assigned arbitrator can issue the award");
        }

        if (awardConfig.getAudit().isVerifyBeforeFinalize()) {
            auditChainService.requireIntact(caseId);
        }

        FinalizationContext context = new FinalizationContext(caseId, arbitratorId, ipAddress, userAgent,
                draft, caseRecord, userRepository.findById(arbitratorId), System.currentTimeMillis());

        try {
            pipeline.run(context);
        } catch (RuntimeException e) {
            metricsConfig.recordFinalization("failed", System.currentTimeMillis() - start);
            throw e;
        }

        String outcome = context.getFailedStages().isEmpty() ? "issued" : "issued_degraded";
        metricsConfig.recordFinalization(outcome, System.currentTimeMillis() - start);
        if (!context.getFailedStages().isEmpty()) {
            log.warn("Award {} issued for case {} with failed follow-up stages {}",
                    context.getReferenceNumber(), caseId, context.getFailedStages());
        }

        Award award = context.getAward();
        return FinalizationResult.builder()
                .awardId(award.getId())
                .referenceNumber(award.getReferenceNumber())
                .documentUrl(award.getDocumentUrl())
                .documentHash(award.getDocumentHash())
                .awardAmount(award.getContent().getAwardAmount())
                .prevailingParty(award.getContent().getPrevailingParty())
                .issuedAt(award.getIssuedAt())
                .claimantNotified(context.isClaimantNotified())
                .respondentNotified(context.isRespondentNotified())
                .signatureAlgorithm(award.getSignatureAlgorithm())
                .certificateFingerprint(award.getCertificateFingerprint())
                .timestampGranted(award.isTimestampGranted())
                .timestampTime(award.getTimestampTime())
                .build();
    }

    public Award getIssuedAward(String caseId) {
        Award award = awardRepository.findByCaseId(caseId);
        if (award == null) {
            throw new NotFoundException("Award not found for case " + caseId);
        }
        return award;
    }

    public String getDownloadUrl(String caseId, String userId) {
        Award award = getIssuedAward(caseId);
        auditChainService.append(AuditAction.AWARD_DOWNLOADED, userId, caseId,
                Map.of("awardId", award.getId(), "referenceNumber", award.getReferenceNumber()));
        return award.getDocumentUrl();
    }
}
