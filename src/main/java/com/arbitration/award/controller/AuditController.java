package com.arbitration.award.controller;

import com.arbitration.award.exception.ValidationException;
import com.arbitration.award.model.AuditExport;
import com.arbitration.award.model.CaseAuditOverview;
import com.arbitration.award.model.CaseAuditTrail;
import com.arbitration.award.model.ChainVerification;
import com.arbitration.award.model.ExportFormat;
import com.arbitration.award.service.AuditChainService;
import com.arbitration.award.service.AuditTrailService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/audit")
@Tag(name = "Audit", description = "Tamper-evident audit chain, case timelines and exports")
public class AuditController {

    private final AuditTrailService auditTrailService;
    private final AuditChainService auditChainService;

    public AuditController(AuditTrailService auditTrailService, AuditChainService auditChainService) {
        this.auditTrailService = auditTrailService;
        this.auditChainService = auditChainService;
    }

    @GetMapping("/cases/{caseId}/trail")
    @Operation(summary = "Get the audit timeline of a case",
               description = "Entries in chain order with actor names, summary and integrity status")
    public ResponseEntity<CaseAuditTrail> getTrail(@PathVariable String caseId) {
        return ResponseEntity.ok(auditTrailService.getCaseTimeline(caseId));
    }

    @GetMapping("/cases/{caseId}/trail/export")
    @Operation(summary = "Export the audit timeline of a case", description = "format = json | csv | print")
    public ResponseEntity<?> export(@PathVariable String caseId,
                                    @RequestParam(defaultValue = "json") String format,
                                    @RequestHeader(DraftAwardController.USER_HEADER) String userId) {
        ExportFormat exportFormat;
        try {
            exportFormat = ExportFormat.valueOf(format.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unsupported export format: " + format);
        }

        AuditExport export = auditTrailService.exportTimeline(caseId, exportFormat, userId);
        if (exportFormat == ExportFormat.PRINT) {
            return ResponseEntity.ok(export.trail());
        }
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(export.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + export.filename() + "\"")
                .body(export.content());
    }

    @GetMapping("/cases/summary")
    @Operation(summary = "Summarize audit activity for several cases")
    public ResponseEntity<List<CaseAuditOverview>> summarize(@RequestParam List<String> caseIds) {
        return ResponseEntity.ok(auditTrailService.summarizeCases(caseIds));
    }

    @GetMapping("/verify")
    @Operation(summary = "Verify the whole audit chain",
               description = "Recomputes every hash and link; the check itself is recorded in the chain")
    public ResponseEntity<ChainVerification> verifyChain(
            @RequestHeader(value = DraftAwardController.USER_HEADER, required = false) String userId) {
        return ResponseEntity.ok(auditChainService.verifyChain(userId));
    }
}
