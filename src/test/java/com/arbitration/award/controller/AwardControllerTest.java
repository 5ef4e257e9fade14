package com.arbitration.award.controller;

import com.arbitration.award.exception.ExternalServiceException;
import com.arbitration.award.exception.IntegrityException;
import com.arbitration.award.exception.NotFoundException;
import com.arbitration.award.exception.StateConflictException;
import com.arbitration.award.model.*;
import com.arbitration.award.service.AwardFinalizationService;
import com.arbitration.award.service.AwardVerificationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AwardController.class)
class AwardControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AwardFinalizationService finalizationService;

    @MockBean
    private AwardVerificationService verificationService;

    @Test
    void canIssue_denied() throws Exception {
        when(finalizationService.canIssue("case-1"))
                .thenReturn(IssuanceCheck.denied("Draft award status is pending, must be APPROVE"));

        mockMvc.perform(get("/api/v1/cases/case-1/award/can-issue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.canIssue").value(false))
                .andExpect(jsonPath("$.reason").value("Draft award status is pending, must be APPROVE"));
    }

    @Test
    void finalize_created() throws Exception {
        FinalizationResult result = FinalizationResult.builder()
                .awardId("award-1")
                .referenceNumber("AWD-20260115-00001")
                .documentUrl("https://awards.example.com/awards/AWD-20260115-00001.txt")
                .documentHash("ab".repeat(32))
                .awardAmount(new BigDecimal("5000.00"))
                .prevailingParty(PrevailingParty.CLAIMANT)
                .issuedAt(1_700_000_000_000L)
                .claimantNotified(true)
                .respondentNotified(false)
                .signatureAlgorithm("SHA256withRSA")
                .build();
        when(finalizationService.finalize(eq("case-1"), eq("arb-1"), anyString(), any())).thenReturn(result);

        mockMvc.perform(post("/api/v1/cases/case-1/award").header("X-User-Id", "arb-1"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.referenceNumber").value("AWD-20260115-00001"))
                .andExpect(jsonPath("$.claimantNotified").value(true))
                .andExpect(jsonPath("$.respondentNotified").value(false));
    }

    @Test
    void finalize_usesForwardedClientAddress() throws Exception {
        when(finalizationService.finalize(any(), any(), any(), any()))
                .thenReturn(FinalizationResult.builder().awardId("award-1").build());

        mockMvc.perform(post("/api/v1/cases/case-1/award")
                        .header("X-User-Id", "arb-1")
                        .header("X-Forwarded-For", "203.0.113.7, 10.0.0.1")
                        .header("User-Agent", "award-portal/2.1"))
                .andExpect(status().isCreated());

        verify(finalizationService).finalize("case-1", "arb-1", "203.0.113.7", "award-portal/2.1");
    }

    @Test
    void finalize_alreadyIssued_conflict() throws Exception {
        when(finalizationService.finalize(eq("case-1"), eq("arb-1"), any(), any()))
                .thenThrow(new StateConflictException("Award has already been issued for this case"));

        mockMvc.perform(post("/api/v1/cases/case-1/award").header("X-User-Id", "arb-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value(409));
    }

    @Test
    void finalize_stageFailure_badGateway() throws Exception {
        when(finalizationService.finalize(eq("case-1"), eq("arb-1"), any(), any()))
                .thenThrow(new ExternalServiceException("store-document",
                        "Award finalization failed at store-document: disk full", null));

        mockMvc.perform(post("/api/v1/cases/case-1/award").header("X-User-Id", "arb-1"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("Award finalization failed at store-document: disk full"));
    }

    @Test
    void finalize_brokenAuditTrail_serverError() throws Exception {
        when(finalizationService.finalize(eq("case-1"), eq("arb-1"), any(), any()))
                .thenThrow(new IntegrityException("Audit trail for case case-1 failed integrity verification",
                        List.of(new ChainVerification.InvalidEntry("e-1", 3, "Hash mismatch"))));

        mockMvc.perform(post("/api/v1/cases/case-1/award").header("X-User-Id", "arb-1"))
                .andExpect(status().isInternalServerError());
    }

    @Test
    void getAward_notFound() throws Exception {
        when(finalizationService.getIssuedAward("case-9")).thenThrow(new NotFoundException("Award not found for case case-9"));

        mockMvc.perform(get("/api/v1/cases/case-9/award"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Award not found for case case-9"));
    }

    @Test
    void download_returnsUrl() throws Exception {
        when(finalizationService.getDownloadUrl("case-1", "claimant-1")).thenReturn("https://awards.example.com/a.txt");

        mockMvc.perform(get("/api/v1/cases/case-1/award/download").header("X-User-Id", "claimant-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documentUrl").value("https://awards.example.com/a.txt"));
    }

    @Test
    void verify_reportsMismatch() throws Exception {
        when(verificationService.verify("case-1", "claimant-1")).thenReturn(new AwardVerification(
                "award-1", "AWD-20260115-00001", false, false, true, "aa", "bb", false, null));

        mockMvc.perform(get("/api/v1/cases/case-1/award/verify").header("X-User-Id", "claimant-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.documentHashMatches").value(false))
                .andExpect(jsonPath("$.signatureValid").value(true));
    }
}
