package com.arbitration.award.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Output of the draft-generation step, registered as version 1 of a new draft award")
public class DraftAwardSubmission {
    private List<FindingOfFact> findingsOfFact;
    private List<ConclusionOfLaw> conclusionsOfLaw;
    private String decision;
    private BigDecimal awardAmount;
    private PrevailingParty prevailingParty;
    private String reasoning;

    @Schema(description = "Generator confidence between 0 and 1", example = "0.82")
    private double confidence;

    @Schema(example = "claude-sonnet")
    private String modelUsed;
}
