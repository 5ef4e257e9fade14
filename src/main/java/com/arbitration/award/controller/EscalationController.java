package com.arbitration.award.controller;

import com.arbitration.award.model.AwardEscalation;
import com.arbitration.award.service.EscalationService;
import com.arbitration.award.service.EscalationSweepService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/escalations")
@Tag(name = "Escalations", description = "Senior review of escalated draft awards")
public class EscalationController {

    private final EscalationService escalationService;
    private final EscalationSweepService sweepService;

    public EscalationController(EscalationService escalationService, EscalationSweepService sweepService) {
        this.escalationService = escalationService;
        this.sweepService = sweepService;
    }

    @PostMapping("/{escalationId}/resolve")
    @Operation(summary = "Resolve an escalation", description = "Only the assigned senior arbitrator may resolve")
    public ResponseEntity<AwardEscalation> resolve(@PathVariable String escalationId,
                                                   @RequestHeader(DraftAwardController.USER_HEADER) String userId,
                                                   @RequestBody Map<String, String> body) {
        return ResponseEntity.ok(escalationService.resolve(escalationId, userId, body.get("resolution")));
    }

    @PostMapping("/{escalationId}/return")
    @Operation(summary = "Return an escalation to the reviewing arbitrator")
    public ResponseEntity<AwardEscalation> returnEscalation(@PathVariable String escalationId,
                                                            @RequestHeader(DraftAwardController.USER_HEADER) String userId,
                                                            @RequestBody Map<String, String> body) {
        return ResponseEntity.ok(escalationService.returnToArbitrator(escalationId, userId, body.get("resolution")));
    }

    @PostMapping("/assign-pending")
    @Operation(summary = "Retry assignment of PENDING escalations",
               description = "Runs the same pass as the scheduled sweep and returns how many were assigned")
    public ResponseEntity<Map<String, Integer>> assignPending() {
        return ResponseEntity.ok(Map.of("assigned", sweepService.assignPending()));
    }
}
