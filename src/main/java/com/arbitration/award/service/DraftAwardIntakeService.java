package com.arbitration.award.service;

import com.arbitration.award.exception.NotFoundException;
import com.arbitration.award.exception.StateConflictException;
import com.arbitration.award.exception.ValidationException;
import com.arbitration.award.model.AuditAction;
import com.arbitration.award.model.AwardContent;
import com.arbitration.award.model.CaseRecord;
import com.arbitration.award.model.DraftAward;
import com.arbitration.award.model.DraftAwardSubmission;
import com.arbitration.award.model.ReviewStatus;
import com.arbitration.award.repository.AwardRepository;
import com.arbitration.award.repository.CaseRepository;
import com.arbitration.award.repository.DraftAwardRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for drafts produced by the generation step. A case holds one draft; a rejected
 * draft is replaced by the regenerated one, which starts a fresh revision history.
 */
@Service
public class DraftAwardIntakeService {

    private static final Logger log = LoggerFactory.getLogger(DraftAwardIntakeService.class);

    private final DraftAwardRepository draftAwardRepository;
    private final CaseRepository caseRepository;
    private final AwardRepository awardRepository;
    private final RevisionLedgerService revisionLedger;
    private final AuditChainService auditChainService;

    public DraftAwardIntakeService(DraftAwardRepository draftAwardRepository,
                                   CaseRepository caseRepository,
                                   AwardRepository awardRepository,
                                   RevisionLedgerService revisionLedger,
                                   AuditChainService auditChainService) {
        this.draftAwardRepository = draftAwardRepository;
        this.caseRepository = caseRepository;
        this.awardRepository = awardRepository;
        this.revisionLedger = revisionLedger;
        this.auditChainService = auditChainService;
    }

    public DraftAward registerDraft(String caseId, DraftAwardSubmission submission, String actorId) {
        validate(submission);

        CaseRecord caseRecord = caseRepository.findById(caseId);
        if (caseRecord == null) {
            throw new NotFoundException("Case not found");
        }
        if (awardRepository.findByCaseId(caseId) != null) {
            throw new StateConflictException("Award has already been issued for this case");
        }

        DraftAward draft = DraftAward.builder()
                .id(UUID.randomUUID().toString())
                .caseId(caseId)
                .content(AwardContent.builder()
                        .findingsOfFact(submission.getFindingsOfFact() != null
                                ? submission.getFindingsOfFact() : new ArrayList<>())
                        .conclusionsOfLaw(submission.getConclusionsOfLaw() != null
                                ? submission.getConclusionsOfLaw() : new ArrayList<>())
                        .decision(submission.getDecision())
                        .awardAmount(submission.getAwardAmount())
                        .prevailingParty(submission.getPrevailingParty())
                        .reasoning(submission.getReasoning())
                        .build())
                .confidence(submission.getConfidence())
                .modelUsed(submission.getModelUsed())
                .generatedAt(System.currentTimeMillis())
                .build();

        if (!draftAwardRepository.insert(draft)) {
            DraftAward existing = draftAwardRepository.findByCaseId(caseId);
            if (existing != null && existing.getReviewStatus() != ReviewStatus.REJECT) {
                throw new StateConflictException("A draft award is already under review for this case");
            }
            log.info("Replacing rejected draft {} for case {}", existing != null ? existing.getId() : null, caseId);
            draft.setGeneration(existing != null ? existing.getGeneration() : 0);
            if (!draftAwardRepository.save(draft)) {
                throw new StateConflictException("Draft award was modified concurrently, reload and retry");
            }
        }

        revisionLedger.createInitialRevision(draft, actorId);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("draftAwardId", draft.getId());
        metadata.put("confidence", draft.getConfidence());
        if (draft.getModelUsed() != null) {
            metadata.put("modelUsed", draft.getModelUsed());
        }
        auditChainService.append(AuditAction.DRAFT_AWARD_GENERATED, actorId, caseId, metadata);

        log.info("Draft award {} registered for case {} (confidence={})",
                draft.getId(), caseId, draft.getConfidence());
        return draft;
    }

    private void validate(DraftAwardSubmission submission) {
        if (submission == null) {
            throw new ValidationException("Draft award content is required");
        }
        if (submission.getDecision() == null || submission.getDecision().isBlank()) {
            throw new ValidationException("Decision is required");
        }
        if (submission.getConfidence() < 0 || submission.getConfidence() > 1) {
            throw new ValidationException("Confidence must be between 0 and 1");
        }
        if (submission.getAwardAmount() != null && submission.getAwardAmount().signum() < 0) {
            throw new ValidationException("Award amount cannot be negative");
        }
    }
}
