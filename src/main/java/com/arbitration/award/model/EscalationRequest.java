package com.arbitration.award.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to escalate a draft award for senior review")
public class EscalationRequest {
    private EscalationReason reason;
    private String reasonDetails;

    @Schema(description = "Defaults to NORMAL")
    private EscalationUrgency urgency;
}
