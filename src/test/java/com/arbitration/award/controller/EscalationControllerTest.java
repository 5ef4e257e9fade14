package com.arbitration.award.controller;

import com.arbitration.award.exception.StateConflictException;
import com.arbitration.award.model.AwardEscalation;
import com.arbitration.award.model.EscalationReason;
import com.arbitration.award.model.EscalationStatus;
import com.arbitration.award.model.EscalationUrgency;
import com.arbitration.award.service.EscalationService;
import com.arbitration.award.service.EscalationSweepService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EscalationController.class)
class EscalationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private EscalationService escalationService;

    @MockBean
    private EscalationSweepService sweepService;

    @Test
    void resolve_success() throws Exception {
        when(escalationService.resolve("esc-1", "senior-1", "Award amount confirmed"))
                .thenReturn(escalation(EscalationStatus.RESOLVED, "Award amount confirmed"));

        mockMvc.perform(post("/api/v1/escalations/esc-1/resolve")
                        .header("X-User-Id", "senior-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("resolution", "Award amount confirmed"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RESOLVED"))
                .andExpect(jsonPath("$.resolution").value("Award amount confirmed"));
    }

    @Test
    void resolve_notAssignee_conflict() throws Exception {
        when(escalationService.resolve("esc-1", "arb-2", "ok"))
                .thenThrow(new StateConflictException("Only the assigned senior arbitrator can resolve this escalation"));

        mockMvc.perform(post("/api/v1/escalations/esc-1/resolve")
                        .header("X-User-Id", "arb-2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resolution\":\"ok\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void return_success() throws Exception {
        when(escalationService.returnToArbitrator("esc-1", "senior-1", "Recalculate interest"))
                .thenReturn(escalation(EscalationStatus.RETURNED, "Recalculate interest"));

        mockMvc.perform(post("/api/v1/escalations/esc-1/return")
                        .header("X-User-Id", "senior-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resolution\":\"Recalculate interest\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RETURNED"));
    }

    @Test
    void assignPending_returnsCount() throws Exception {
        when(sweepService.assignPending()).thenReturn(3);

        mockMvc.perform(post("/api/v1/escalations/assign-pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assigned").value(3));
    }

    private static AwardEscalation escalation(EscalationStatus status, String resolution) {
        return AwardEscalation.builder()
                .id("esc-1")
                .draftAwardId("d-1")
                .caseId("case-1")
                .reason(EscalationReason.HIGH_VALUE_CLAIM)
                .urgency(EscalationUrgency.HIGH)
                .escalatedBy("arb-1")
                .escalatedAt(1_700_000_000_000L)
                .assignedTo("senior-1")
                .status(status)
                .resolution(resolution)
                .resolvedAt(1_700_000_100_000L)
                .build();
    }
}
