package com.arbitration.award.service;

import com.arbitration.award.config.MetricsConfig;
import com.arbitration.award.exception.NotFoundException;
import com.arbitration.award.exception.StateConflictException;
import com.arbitration.award.exception.ValidationException;
import com.arbitration.award.gateway.NotificationGateway;
import com.arbitration.award.model.AuditAction;
import com.arbitration.award.model.AwardEscalation;
import com.arbitration.award.model.CaseRecord;
import com.arbitration.award.model.DraftAward;
import com.arbitration.award.model.EscalationRequest;
import com.arbitration.award.model.EscalationStatus;
import com.arbitration.award.model.EscalationUrgency;
import com.arbitration.award.model.NotificationTemplate;
import com.arbitration.award.model.UserAccount;
import com.arbitration.award.repository.CaseRepository;
import com.arbitration.award.repository.DraftAwardRepository;
import com.arbitration.award.repository.EscalationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Escalation records: one per draft, upserted on re-escalation, moved through
 * PENDING / ASSIGNED / RESOLVED / RETURNED.
 */
@Service
public class EscalationService {

    private static final Logger log = LoggerFactory.getLogger(EscalationService.class);

    static final String ALREADY_ESCALATED = "This award is already escalated and pending review";

    private final EscalationRepository escalationRepository;
    private final DraftAwardRepository draftAwardRepository;
    private final CaseRepository caseRepository;
    private final EscalationAssignor assignor;
    private final NotificationGateway notificationGateway;
    private final AuditChainService auditChainService;
    private final MetricsConfig metricsConfig;

    public EscalationService(EscalationRepository escalationRepository,
                             DraftAwardRepository draftAwardRepository,
                             CaseRepository caseRepository,
                             EscalationAssignor assignor,
                             NotificationGateway notificationGateway,
                             AuditChainService auditChainService,
                             MetricsConfig metricsConfig) {
        this.escalationRepository = escalationRepository;
        this.draftAwardRepository = draftAwardRepository;
        this.caseRepository = caseRepository;
        this.assignor = assignor;
        this.notificationGateway = notificationGateway;
        this.auditChainService = auditChainService;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Create the draft's escalation, or reactivate a RESOLVED/RETURNED one under the same id.
     * Only writes the record; the caller announces an assignment once its own state is recorded.
     *
     * @throws StateConflictException if an escalation is already PENDING or ASSIGNED, or another
     *                                writer got there first
     */
    public AwardEscalation openEscalation(DraftAward draft, CaseRecord caseRecord, String userId,
                                          EscalationRequest request) {
        if (request == null || request.getReason() == null) {
            throw new ValidationException("Escalation reason is required");
        }

        AwardEscalation existing = escalationRepository.findByDraftAwardId(draft.getId());
        if (existing != null && existing.getStatus().isActive()) {
            throw new StateConflictException(ALREADY_ESCALATED);
        }

        Optional<UserAccount> reviewer = assignor.selectReviewer(caseRecord, userId);
        long now = System.currentTimeMillis();

        AwardEscalation escalation = AwardEscalation.builder()
                .id(existing != null ? existing.getId() : UUID.randomUUID().toString())
                .draftAwardId(draft.getId())
                .caseId(caseRecord.getCaseId())
                .reason(request.getReason())
                .reasonDetails(request.getReasonDetails())
                .urgency(request.getUrgency() != null ? request.getUrgency() : EscalationUrgency.NORMAL)
                .escalatedBy(userId)
                .escalatedAt(now)
                .assignedTo(reviewer.map(UserAccount::getUserId).orElse(null))
                .assignedAt(reviewer.isPresent() ? now : null)
                .status(reviewer.isPresent() ? EscalationStatus.ASSIGNED : EscalationStatus.PENDING)
                .generation(existing != null ? existing.getGeneration() : 0)
                .build();

        boolean written = existing == null
                ? escalationRepository.insert(escalation)
                : escalationRepository.replace(escalation);
        if (!written) {
            throw new StateConflictException(ALREADY_ESCALATED);
        }

        metricsConfig.recordEscalation(escalation.getStatus().name());
        log.info("Draft {} escalated by {} reason={} urgency={} -> {} {}",
                draft.getId(), userId, escalation.getReason(), escalation.getUrgency(),
                escalation.getStatus(), escalation.getAssignedTo() != null ? escalation.getAssignedTo() : "");
        return escalation;
    }

    /**
     * Retry assignment of a PENDING escalation. Returns the updated record, or the unchanged
     * one when nobody qualifies or the record moved on in the meantime.
     */
    public AwardEscalation tryAssign(AwardEscalation pending) {
        if (pending.getStatus() != EscalationStatus.PENDING) {
            return pending;
        }
        CaseRecord caseRecord = caseRepository.findById(pending.getCaseId());
        if (caseRecord == null) {
            log.warn("Escalation {} refers to missing case {}", pending.getId(), pending.getCaseId());
            return pending;
        }

        Optional<UserAccount> reviewer = assignor.selectReviewer(caseRecord, pending.getEscalatedBy());
        if (reviewer.isEmpty()) {
            return pending;
        }

        AwardEscalation assigned = pending.toBuilder()
                .assignedTo(reviewer.get().getUserId())
                .assignedAt(System.currentTimeMillis())
                .status(EscalationStatus.ASSIGNED)
                .build();
        if (!escalationRepository.replace(assigned)) {
            log.info("Escalation {} changed during sweep, skipping", pending.getId());
            return pending;
        }

        metricsConfig.recordEscalation(EscalationStatus.ASSIGNED.name());
        announceAssignment(assigned, caseRecord);
        return assigned;
    }

    public AwardEscalation resolve(String escalationId, String userId, String resolution) {
        return close(escalationId, userId, resolution, EscalationStatus.RESOLVED);
    }

    public AwardEscalation returnToArbitrator(String escalationId, String userId, String resolution) {
        return close(escalationId, userId, resolution, EscalationStatus.RETURNED);
    }

    public AwardEscalation getEscalation(String caseId) {
        DraftAward draft = draftAwardRepository.findByCaseId(caseId);
        if (draft == null) {
            throw new NotFoundException("Draft award not found");
        }
        AwardEscalation escalation = escalationRepository.findByDraftAwardId(draft.getId());
        if (escalation == null) {
            throw new NotFoundException("No escalation for case " + caseId);
        }
        return escalation;
    }

    private AwardEscalation close(String escalationId, String userId, String resolution, EscalationStatus target) {
        AwardEscalation escalation = escalationRepository.findById(escalationId);
        if (escalation == null) {
            throw new NotFoundException("Escalation not found");
        }
        if (escalation.getStatus() != EscalationStatus.ASSIGNED) {
            throw new StateConflictException("Escalation is " + escalation.getStatus() + ", must be ASSIGNED");
        }
        if (!userId.equals(escalation.getAssignedTo())) {
            throw new StateConflictException("Only the assigned arbitrator can resolve this escalation");
        }
        if (resolution == null || resolution.isBlank()) {
            throw new ValidationException("Resolution is required");
        }

        AwardEscalation closed = escalation.toBuilder()
                .status(target)
                .resolvedAt(System.currentTimeMillis())
                .resolution(resolution)
                .build();
        if (!escalationRepository.replace(closed)) {
            throw new StateConflictException("Escalation was modified concurrently, reload and retry");
        }
        metricsConfig.recordEscalation(target.name());

        AuditAction action = target == EscalationStatus.RESOLVED
                ? AuditAction.ESCALATION_RESOLVED
                : AuditAction.ESCALATION_RETURNED;
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("escalationId", escalationId);
        metadata.put("draftAwardId", escalation.getDraftAwardId());
        metadata.put("resolution", resolution);
        auditChainService.append(action, userId, escalation.getCaseId(), metadata);

        CaseRecord caseRecord = caseRepository.findById(escalation.getCaseId());
        String caseRef = caseRecord != null ? caseRecord.getReferenceNumber() : escalation.getCaseId();
        notifyQuietly(escalation.getEscalatedBy(), NotificationTemplate.ESCALATION_RESOLVED,
                "Escalation " + (target == EscalationStatus.RESOLVED ? "Resolved" : "Returned"),
                "The escalation for case " + caseRef + " has been "
                        + (target == EscalationStatus.RESOLVED ? "resolved" : "returned to you") + ".",
                Map.of("caseId", escalation.getCaseId(), "escalationId", escalationId));

        log.info("Escalation {} {} by {}", escalationId, target, userId);
        return closed;
    }

    /**
     * Audit the assignment and notify the assignee. Notification is best effort.
     */
    public void announceAssignment(AwardEscalation escalation, CaseRecord caseRecord) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("escalationId", escalation.getId());
        metadata.put("draftAwardId", escalation.getDraftAwardId());
        metadata.put("assignedTo", escalation.getAssignedTo());
        auditChainService.append(AuditAction.ESCALATION_ASSIGNED, null, caseRecord.getCaseId(), metadata);

        notifyQuietly(escalation.getAssignedTo(), NotificationTemplate.ESCALATION_ASSIGNED,
                "Award Escalation: Senior Review Required",
                "Case " + caseRecord.getReferenceNumber() + " has been escalated for senior review. "
                        + "Reason: " + escalation.getReason().label()
                        + ". Urgency: " + escalation.getUrgency() + ".",
                Map.of("caseId", caseRecord.getCaseId(), "escalationId", escalation.getId()));
    }

    private void notifyQuietly(String userId, NotificationTemplate template, String subject, String body,
                               Map<String, Object> metadata) {
        try {
            notificationGateway.send(userId, template, subject, body, metadata);
        } catch (Exception e) {
            log.warn("Notification {} to {} failed: {}", template, userId, e.getMessage());
        }
    }
}
