package com.arbitration.award.controller;

import com.arbitration.award.model.AwardEscalation;
import com.arbitration.award.model.AwardModification;
import com.arbitration.award.model.DraftAward;
import com.arbitration.award.model.DraftAwardRevision;
import com.arbitration.award.model.DraftAwardSubmission;
import com.arbitration.award.model.EscalationRequest;
import com.arbitration.award.model.EscalationResult;
import com.arbitration.award.model.ModificationResult;
import com.arbitration.award.model.RejectionFeedback;
import com.arbitration.award.model.ReviewOutcome;
import com.arbitration.award.model.RevisionInfo;
import com.arbitration.award.service.DraftAwardIntakeService;
import com.arbitration.award.service.EscalationService;
import com.arbitration.award.service.ReviewDecisionService;
import com.arbitration.award.service.RevisionLedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/cases/{caseId}/draft-award")
@Tag(name = "Draft Award Review", description = "Arbitrator review of AI-generated draft awards with revision history")
public class DraftAwardController {

    static final String USER_HEADER = "X-User-Id";

    private final ReviewDecisionService reviewDecisionService;
    private final DraftAwardIntakeService intakeService;
    private final RevisionLedgerService revisionLedger;
    private final EscalationService escalationService;

    public DraftAwardController(ReviewDecisionService reviewDecisionService,
                                DraftAwardIntakeService intakeService,
                                RevisionLedgerService revisionLedger,
                                EscalationService escalationService) {
        this.reviewDecisionService = reviewDecisionService;
        this.intakeService = intakeService;
        this.revisionLedger = revisionLedger;
        this.escalationService = escalationService;
    }

    @PostMapping
    @Operation(summary = "Register a generated draft award",
               description = "Stores the output of draft generation as a new draft with revision 1")
    public ResponseEntity<DraftAward> registerDraft(@PathVariable String caseId,
                                                    @RequestHeader(USER_HEADER) String userId,
                                                    @RequestBody DraftAwardSubmission submission) {
        return ResponseEntity.status(HttpStatus.CREATED).body(intakeService.registerDraft(caseId, submission, userId));
    }

    @GetMapping
    @Operation(summary = "Get the draft award for a case")
    public ResponseEntity<DraftAward> getDraft(@PathVariable String caseId) {
        return ResponseEntity.ok(reviewDecisionService.getDraft(caseId));
    }

    @PostMapping("/approve")
    @Operation(summary = "Approve the draft award",
               description = "Marks the draft APPROVE and advances the case to DECIDED. Body may carry optional notes.")
    public ResponseEntity<ReviewOutcome> approve(@PathVariable String caseId,
                                                 @RequestHeader(USER_HEADER) String userId,
                                                 @RequestBody(required = false) Map<String, String> body) {
        String notes = body != null ? body.get("notes") : null;
        return ResponseEntity.ok(reviewDecisionService.approve(caseId, userId, notes));
    }

    @PostMapping("/modify")
    @Operation(summary = "Modify the draft award",
               description = "Applies a partial edit and records the resulting content as a new revision")
    public ResponseEntity<ModificationResult> modify(@PathVariable String caseId,
                                                     @RequestHeader(USER_HEADER) String userId,
                                                     @RequestBody AwardModification modification) {
        return ResponseEntity.ok(reviewDecisionService.modify(caseId, userId, modification));
    }

    @PostMapping("/reject")
    @Operation(summary = "Reject the draft award",
               description = "Records structured feedback and sends the case back for re-analysis")
    public ResponseEntity<ReviewOutcome> reject(@PathVariable String caseId,
                                                @RequestHeader(USER_HEADER) String userId,
                                                @RequestBody RejectionFeedback feedback) {
        return ResponseEntity.ok(reviewDecisionService.reject(caseId, userId, feedback));
    }

    @PostMapping("/escalate")
    @Operation(summary = "Escalate the draft award for senior review",
               description = "Assigns an eligible senior arbitrator when one is available, otherwise leaves the escalation PENDING")
    public ResponseEntity<EscalationResult> escalate(@PathVariable String caseId,
                                                     @RequestHeader(USER_HEADER) String userId,
                                                     @RequestBody EscalationRequest request) {
        return ResponseEntity.ok(reviewDecisionService.escalate(caseId, userId, request));
    }

    @GetMapping("/escalation")
    @Operation(summary = "Get the escalation for the case's draft award")
    public ResponseEntity<AwardEscalation> getEscalation(@PathVariable String caseId) {
        return ResponseEntity.ok(escalationService.getEscalation(caseId));
    }

    @GetMapping("/revisions")
    @Operation(summary = "List draft revisions", description = "Revision metadata, newest first")
    public ResponseEntity<List<RevisionInfo>> getRevisions(@PathVariable String caseId) {
        DraftAward draft = reviewDecisionService.getDraft(caseId);
        return ResponseEntity.ok(revisionLedger.getHistory(draft.getId()).stream()
                .map(RevisionInfo::of)
                .toList());
    }

    @GetMapping("/revisions/{version}")
    @Operation(summary = "Get one revision with its full content snapshot")
    public ResponseEntity<DraftAwardRevision> getRevision(@PathVariable String caseId, @PathVariable int version) {
        DraftAward draft = reviewDecisionService.getDraft(caseId);
        return ResponseEntity.ok(revisionLedger.getRevision(draft.getId(), version));
    }
}
