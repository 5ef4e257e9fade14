package com.arbitration.award.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Senior-review escalation of a draft award. At most one per draft.")
public class AwardEscalation {
    private String id;
    private String draftAwardId;
    private String caseId;
    private EscalationReason reason;
    private String reasonDetails;
    private EscalationUrgency urgency;
    private String escalatedBy;
    private long escalatedAt;
    private String assignedTo;
    private Long assignedAt;
    private EscalationStatus status;
    private Long resolvedAt;
    private String resolution;

    // Record generation at read time; 0 for a record not yet written.
    @JsonIgnore
    private int generation;
}
