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
@Schema(description = "AI-generated draft award under human review. One per case.")
public class DraftAward {
    private String id;
    private String caseId;
    private AwardContent content;
    private double confidence;              // 0..1, as reported by the generator
    private String modelUsed;
    private ReviewStatus reviewStatus;      // null until the first review decision
    private String reviewNotes;
    private long generatedAt;
    private Long reviewedAt;
    private String reviewedBy;

    // Record generation at read time; 0 for a record not yet written.
    @JsonIgnore
    private int generation;
}
