package com.arbitration.award.controller;

import com.arbitration.award.exception.NotFoundException;
import com.arbitration.award.model.*;
import com.arbitration.award.service.AuditChainService;
import com.arbitration.award.service.AuditTrailService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AuditController.class)
class AuditControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AuditTrailService auditTrailService;

    @MockBean
    private AuditChainService auditChainService;

    @Test
    void getTrail_success() throws Exception {
        when(auditTrailService.getCaseTimeline("case-1")).thenReturn(trail());

        mockMvc.perform(get("/api/v1/audit/cases/case-1/trail"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.caseId").value("case-1"))
                .andExpect(jsonPath("$.integrityStatus").value("INTACT"))
                .andExpect(jsonPath("$.entries[0].action").value("CASE_CREATED"));
    }

    @Test
    void getTrail_unknownCase() throws Exception {
        when(auditTrailService.getCaseTimeline("nope")).thenThrow(new NotFoundException("Case not found"));

        mockMvc.perform(get("/api/v1/audit/cases/nope/trail"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Case not found"));
    }

    @Test
    void export_csvAsAttachment() throws Exception {
        when(auditTrailService.exportTimeline("case-1", ExportFormat.CSV, "arb-1")).thenReturn(new AuditExport(
                ExportFormat.CSV, "text/csv", "audit-trail-ARB-case-1.csv",
                "Timestamp,Action,Description,Category,User,Role,IP Address,Hash\n", trail()));

        mockMvc.perform(get("/api/v1/audit/cases/case-1/trail/export?format=csv").header("X-User-Id", "arb-1"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition",
                        "attachment; filename=\"audit-trail-ARB-case-1.csv\""))
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().string(org.hamcrest.Matchers.startsWith("Timestamp,Action")));
    }

    @Test
    void export_printReturnsTrail() throws Exception {
        when(auditTrailService.exportTimeline("case-1", ExportFormat.PRINT, "arb-1"))
                .thenReturn(new AuditExport(ExportFormat.PRINT, "application/json", "audit-trail-ARB-case-1.json",
                        null, trail()));

        mockMvc.perform(get("/api/v1/audit/cases/case-1/trail/export?format=print").header("X-User-Id", "arb-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.caseReference").value("ARB-case-1"));
    }

    @Test
    void export_unsupportedFormat_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/audit/cases/case-1/trail/export?format=xml").header("X-User-Id", "arb-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unsupported export format: xml"));

        verify(auditTrailService, never()).exportTimeline(any(), any(), any());
    }

    @Test
    void summarize_multipleCases() throws Exception {
        when(auditTrailService.summarizeCases(List.of("case-1", "case-2"))).thenReturn(List.of(
                new CaseAuditOverview("case-1", "ARB-case-1", 4, 1_700_000_000_000L, false),
                new CaseAuditOverview("case-2", "ARB-case-2", 0, null, false)));

        mockMvc.perform(get("/api/v1/audit/cases/summary?caseIds=case-1,case-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].eventCount").value(4));
    }

    @Test
    void verifyChain_reportsInvalidEntries() throws Exception {
        when(auditChainService.verifyChain(null)).thenReturn(new ChainVerification(false, 3,
                List.of(new ChainVerification.InvalidEntry("e-2", 2, "Hash mismatch: entry content has been altered")),
                true));

        mockMvc.perform(get("/api/v1/audit/verify"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalEntries").value(3))
                .andExpect(jsonPath("$.invalidEntries[0].sequence").value(2));
    }

    private static CaseAuditTrail trail() {
        AuditTrailEntry entry = AuditTrailEntry.builder()
                .id("e-1")
                .sequence(1)
                .timestamp(1_700_000_000_000L)
                .action(AuditAction.CASE_CREATED)
                .actionDescription(AuditAction.CASE_CREATED.getDescription())
                .category(AuditCategory.CASE_LIFECYCLE)
                .hash("ab".repeat(32))
                .build();
        return CaseAuditTrail.builder()
                .caseId("case-1")
                .caseReference("ARB-case-1")
                .caseStatus(CaseStatus.ARBITRATOR_REVIEW)
                .entries(List.of(entry))
                .integrityStatus(IntegrityStatus.INTACT)
                .integrityFailures(List.of())
                .generatedAt(1_700_000_000_000L)
                .build();
    }
}
