package com.arbitration.award.service;

import com.arbitration.award.config.MetricsConfig;
import com.arbitration.award.exception.NotFoundException;
import com.arbitration.award.exception.StateConflictException;
import com.arbitration.award.exception.ValidationException;
import com.arbitration.award.model.AuditAction;
import com.arbitration.award.model.AwardContent;
import com.arbitration.award.model.AwardEscalation;
import com.arbitration.award.model.AwardModification;
import com.arbitration.award.model.CaseRecord;
import com.arbitration.award.model.CaseStatus;
import com.arbitration.award.model.ChangeType;
import com.arbitration.award.model.DraftAward;
import com.arbitration.award.model.DraftAwardRevision;
import com.arbitration.award.model.EscalationRequest;
import com.arbitration.award.model.EscalationResult;
import com.arbitration.award.model.EscalationStatus;
import com.arbitration.award.model.ModificationResult;
import com.arbitration.award.model.RejectionFeedback;
import com.arbitration.award.model.ReviewOutcome;
import com.arbitration.award.model.ReviewStatus;
import com.arbitration.award.repository.AwardRepository;
import com.arbitration.award.repository.CaseRepository;
import com.arbitration.award.repository.DraftAwardRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Human review of AI-generated draft awards.
 *
 * <p>A draft starts unreviewed ({@code reviewStatus == null}). Each operation below moves it to
 * APPROVE, MODIFY, REJECT or ESCALATE; none of them is idempotent, so repeating a call records
 * a second transition. Only APPROVE allows finalization, and a modified draft can still be
 * approved afterwards. Once the case's award has been issued the draft is frozen and every
 * operation fails with a state conflict.
 */
@Service
public class ReviewDecisionService {

    private static final Logger log = LoggerFactory.getLogger(ReviewDecisionService.class);

    static final String APPROVAL_SUMMARY = "Award approved by arbitrator";
    static final String CONCURRENT_CHANGE = "Draft award was modified concurrently, reload and retry";

    private final DraftAwardRepository draftAwardRepository;
    private final CaseRepository caseRepository;
    private final AwardRepository awardRepository;
    private final RevisionLedgerService revisionLedger;
    private final EscalationService escalationService;
    private final AuditChainService auditChainService;
    private final MetricsConfig metricsConfig;

    public ReviewDecisionService(DraftAwardRepository draftAwardRepository,
                                 CaseRepository caseRepository,
                                 AwardRepository awardRepository,
                                 RevisionLedgerService revisionLedger,
                                 EscalationService escalationService,
                                 AuditChainService auditChainService,
                                 MetricsConfig metricsConfig) {
        this.draftAwardRepository = draftAwardRepository;
        this.caseRepository = caseRepository;
        this.awardRepository = awardRepository;
        this.revisionLedger = revisionLedger;
        this.escalationService = escalationService;
        this.auditChainService = auditChainService;
        this.metricsConfig = metricsConfig;
    }

    public DraftAward getDraft(String caseId) {
        return requireDraft(caseId);
    }

    @Observed(name = "review.approve", contextualName = "approve-draft-award")
    public ReviewOutcome approve(String caseId, String userId, String notes) {
        DraftAward draft = requireOpenDraft(caseId);
        long now = System.currentTimeMillis();

        draft.setReviewStatus(ReviewStatus.APPROVE);
        draft.setReviewedAt(now);
        draft.setReviewedBy(userId);
        draft.setReviewNotes(notes);
        saveDraft(draft);

        caseRepository.updateStatus(caseId, CaseStatus.DECIDED);

        if (revisionLedger.hasRevisions(draft.getId())) {
            revisionLedger.appendRevision(draft.getId(), draft.getContent(), ChangeType.ARBITRATOR_EDIT,
                    APPROVAL_SUMMARY, List.of("reviewStatus"), userId);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("draftAwardId", draft.getId());
        if (notes != null) {
            metadata.put("notes", notes);
        }
        auditChainService.append(AuditAction.DRAFT_AWARD_APPROVED, userId, caseId, metadata);

        metricsConfig.recordReviewAction(ReviewStatus.APPROVE.name());
        log.info("Draft award {} approved for case {} by {}", draft.getId(), caseId, userId);
        return new ReviewOutcome(draft.getId(), ReviewStatus.APPROVE,
                "Draft award approved successfully", "Ready for final issuance");
    }

    /**
     * Apply a partial edit and record the full resulting content as a new revision.
     * Changed fields are reported in the order findingsOfFact, conclusionsOfLaw, decision,
     * awardAmount, prevailingParty, reasoning.
     */
    @Observed(name = "review.modify", contextualName = "modify-draft-award")
    public ModificationResult modify(String caseId, String userId, AwardModification modification) {
        DraftAward draft = requireOpenDraft(caseId);

        AwardContent.AwardContentBuilder updated = draft.getContent().toBuilder();
        List<String> changedFields = new ArrayList<>();

        if (modification.getFindingsOfFact() != null) {
            changedFields.add("findingsOfFact");
            updated.findingsOfFact(modification.getFindingsOfFact());
        }
        if (modification.getConclusionsOfLaw() != null) {
            changedFields.add("conclusionsOfLaw");
            updated.conclusionsOfLaw(modification.getConclusionsOfLaw());
        }
        if (modification.getDecision() != null) {
            changedFields.add("decision");
            updated.decision(modification.getDecision());
        }
        if (modification.getAwardAmount() != null) {
            if (modification.getAwardAmount().signum() < 0) {
                throw new ValidationException("Award amount cannot be negative");
            }
            changedFields.add("awardAmount");
            updated.awardAmount(modification.getAwardAmount());
        }
        if (modification.getPrevailingParty() != null) {
            changedFields.add("prevailingParty");
            updated.prevailingParty(modification.getPrevailingParty());
        }
        if (modification.getReasoning() != null) {
            changedFields.add("reasoning");
            updated.reasoning(modification.getReasoning());
        }

        if (changedFields.isEmpty()) {
            throw new ValidationException("No modifications provided");
        }
        String summary = modification.getChangeSummary();
        if (summary == null || summary.isBlank()) {
            throw new ValidationException("Change summary is required");
        }

        AwardContent snapshot = updated.build();
        draft.setContent(snapshot);
        draft.setReviewStatus(ReviewStatus.MODIFY);
        draft.setReviewedAt(System.currentTimeMillis());
        draft.setReviewedBy(userId);
        saveDraft(draft);

        DraftAwardRevision revision = revisionLedger.appendRevision(draft.getId(), snapshot,
                ChangeType.ARBITRATOR_EDIT, summary, changedFields, userId);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("draftAwardId", draft.getId());
        metadata.put("version", revision.getVersion());
        metadata.put("changedFields", changedFields);
        metadata.put("changeSummary", summary);
        auditChainService.append(AuditAction.DRAFT_AWARD_MODIFIED, userId, caseId, metadata);

        metricsConfig.recordReviewAction(ReviewStatus.MODIFY.name());
        log.info("Draft award {} modified to v{} by {}: {}", draft.getId(), revision.getVersion(), userId, changedFields);
        return new ModificationResult(draft.getId(), revision.getVersion(), List.copyOf(changedFields),
                summary, revision.getCreatedAt());
    }

    /**
     * Reject with structured feedback. The case goes back to analysis so a new draft can be
     * generated.
     */
    @Observed(name = "review.reject", contextualName = "reject-draft-award")
    public ReviewOutcome reject(String caseId, String userId, RejectionFeedback feedback) {
        validate(feedback);
        DraftAward draft = requireOpenDraft(caseId);

        draft.setReviewStatus(ReviewStatus.REJECT);
        draft.setReviewNotes(formatRejectionNotes(feedback));
        draft.setReviewedAt(System.currentTimeMillis());
        draft.setReviewedBy(userId);
        saveDraft(draft);

        caseRepository.updateStatus(caseId, CaseStatus.ANALYSIS_IN_PROGRESS);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("draftAwardId", draft.getId());
        metadata.put("category", feedback.getCategory().name());
        metadata.put("severity", feedback.getSeverity().name());
        metadata.put("affectedSections", feedback.getAffectedSections());
        auditChainService.append(AuditAction.DRAFT_AWARD_REJECTED, userId, caseId, metadata);

        metricsConfig.recordReviewAction(ReviewStatus.REJECT.name());
        log.info("Draft award {} rejected for case {} by {} ({}, {})",
                draft.getId(), caseId, userId, feedback.getCategory(), feedback.getSeverity());
        return new ReviewOutcome(draft.getId(), ReviewStatus.REJECT,
                "Draft award rejected. The case will be re-analyzed based on your feedback.",
                "Awaiting regenerated draft");
    }

    @Observed(name = "review.escalate", contextualName = "escalate-draft-award")
    public EscalationResult escalate(String caseId, String userId, EscalationRequest request) {
        DraftAward draft = requireOpenDraft(caseId);
        CaseRecord caseRecord = caseRepository.findById(caseId);
        if (caseRecord == null) {
            throw new NotFoundException("Case not found");
        }

        AwardEscalation escalation = escalationService.openEscalation(draft, caseRecord, userId, request);

        draft.setReviewStatus(ReviewStatus.ESCALATE);
        draft.setReviewedAt(escalation.getEscalatedAt());
        draft.setReviewedBy(userId);
        saveDraft(draft);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("draftAwardId", draft.getId());
        metadata.put("escalationId", escalation.getId());
        metadata.put("reason", escalation.getReason().name());
        metadata.put("urgency", escalation.getUrgency().name());
        metadata.put("status", escalation.getStatus().name());
        auditChainService.append(AuditAction.DRAFT_AWARD_ESCALATED, userId, caseId, metadata);

        if (escalation.getStatus() == EscalationStatus.ASSIGNED) {
            escalationService.announceAssignment(escalation, caseRecord);
        }

        metricsConfig.recordReviewAction(ReviewStatus.ESCALATE.name());
        return new EscalationResult(escalation.getId(), escalation.getStatus(), escalation.getAssignedTo());
    }

    static String formatRejectionNotes(RejectionFeedback feedback) {
        List<String> lines = new ArrayList<>();
        lines.add("**Rejection Category:** " + feedback.getCategory().name().toLowerCase().replace('_', ' '));
        lines.add("**Severity:** " + feedback.getSeverity().name().toLowerCase());
        lines.add("");
        lines.add("**Description:**");
        lines.add(feedback.getDescription());
        lines.add("");
        lines.add("**Affected Sections:** " + String.join(", ", feedback.getAffectedSections()));

        if (feedback.getSuggestedCorrections() != null && !feedback.getSuggestedCorrections().isBlank()) {
            lines.add("");
            lines.add("**Suggested Corrections:**");
            lines.add(feedback.getSuggestedCorrections());
        }
        return String.join("\n", lines);
    }

    private void validate(RejectionFeedback feedback) {
        if (feedback == null) {
            throw new ValidationException("Rejection feedback is required");
        }
        if (feedback.getCategory() == null) {
            throw new ValidationException("Rejection category is required");
        }
        if (feedback.getSeverity() == null) {
            throw new ValidationException("Rejection severity is required");
        }
        if (feedback.getDescription() == null || feedback.getDescription().isBlank()) {
            throw new ValidationException("Rejection description is required");
        }
        if (feedback.getAffectedSections() == null || feedback.getAffectedSections().isEmpty()) {
            throw new ValidationException("At least one affected section is required");
        }
    }

    private void saveDraft(DraftAward draft) {
        if (!draftAwardRepository.save(draft)) {
            throw new StateConflictException(CONCURRENT_CHANGE);
        }
    }

    private DraftAward requireOpenDraft(String caseId) {
        DraftAward draft = requireDraft(caseId);
        if (awardRepository.findByCaseId(caseId) != null) {
            throw new StateConflictException("Award has already been issued for this case");
        }
        return draft;
    }

    private DraftAward requireDraft(String caseId) {
        DraftAward draft = draftAwardRepository.findByCaseId(caseId);
        if (draft == null) {
            throw new NotFoundException("Draft award not found");
        }
        return draft;
    }
}
