package com.arbitration.award.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Partial edit of a draft award. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Fields to change on a draft award; omitted fields are kept")
public class AwardModification {
    private List<FindingOfFact> findingsOfFact;
    private List<ConclusionOfLaw> conclusionsOfLaw;
    private String decision;
    private BigDecimal awardAmount;
    private PrevailingParty prevailingParty;
    private String reasoning;

    @Schema(description = "Required description of the edit", example = "Corrected damages calculation")
    private String changeSummary;
}
