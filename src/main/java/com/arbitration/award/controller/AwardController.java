package com.arbitration.award.controller;

import com.arbitration.award.model.Award;
import com.arbitration.award.model.AwardVerification;
import com.arbitration.award.model.FinalizationResult;
import com.arbitration.award.model.IssuanceCheck;
import com.arbitration.award.service.AwardFinalizationService;
import com.arbitration.award.service.AwardVerificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/cases/{caseId}/award")
@Tag(name = "Awards", description = "Finalization, signing and verification of issued awards")
public class AwardController {

    private final AwardFinalizationService finalizationService;
    private final AwardVerificationService verificationService;

    public AwardController(AwardFinalizationService finalizationService,
                           AwardVerificationService verificationService) {
        this.finalizationService = finalizationService;
        this.verificationService = verificationService;
    }

    @GetMapping("/can-issue")
    @Operation(summary = "Check whether the award can be issued",
               description = "Returns canIssue and, when false, the first failing precondition")
    public ResponseEntity<IssuanceCheck> canIssue(@PathVariable String caseId) {
        return ResponseEntity.ok(finalizationService.canIssue(caseId));
    }

    @PostMapping
    @Operation(summary = "Finalize and issue the award",
               description = "Renders, signs, timestamps and stores the award document, then notifies both parties")
    public ResponseEntity<FinalizationResult> finalizeAward(@PathVariable String caseId,
                                                            @RequestHeader(DraftAwardController.USER_HEADER) String userId,
                                                            HttpServletRequest request) {
        FinalizationResult result = finalizationService.finalize(caseId, userId,
                clientIp(request), request.getHeader(HttpHeaders.USER_AGENT));
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping
    @Operation(summary = "Get the issued award")
    public ResponseEntity<Award> getAward(@PathVariable String caseId) {
        return ResponseEntity.ok(finalizationService.getIssuedAward(caseId));
    }

    @GetMapping("/download")
    @Operation(summary = "Get the award document URL", description = "Records the download in the audit chain")
    public ResponseEntity<Map<String, String>> download(@PathVariable String caseId,
                                                        @RequestHeader(DraftAwardController.USER_HEADER) String userId) {
        return ResponseEntity.ok(Map.of("documentUrl", finalizationService.getDownloadUrl(caseId, userId)));
    }

    @GetMapping("/verify")
    @Operation(summary = "Verify the issued award",
               description = "Recomputes the stored document hash and checks the signature against the signer key")
    public ResponseEntity<AwardVerification> verify(@PathVariable String caseId,
                                                    @RequestHeader(DraftAwardController.USER_HEADER) String userId) {
        return ResponseEntity.ok(verificationService.verify(caseId, userId));
    }

    static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
