package com.arbitration.award.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Structured reviewer feedback sent back with a rejected draft")
public class RejectionFeedback {
    private RejectionCategory category;
    private RejectionSeverity severity;
    private String description;

    @Schema(example = "[\"findingsOfFact\", \"awardAmount\"]")
    private List<String> affectedSections;

    private String suggestedCorrections;
}
