package com.arbitration.award.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * The substantive body of an award. Drafts, revisions and issued awards all carry a full copy.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Findings, conclusions and decision of an award")
public class AwardContent {

    @Builder.Default
    private List<FindingOfFact> findingsOfFact = new ArrayList<>();

    @Builder.Default
    private List<ConclusionOfLaw> conclusionsOfLaw = new ArrayList<>();

    @Schema(description = "Operative decision text")
    private String decision;

    @Schema(description = "Monetary award, null when none is ordered", example = "5000.00")
    private BigDecimal awardAmount;

    private PrevailingParty prevailingParty;

    private String reasoning;
}
