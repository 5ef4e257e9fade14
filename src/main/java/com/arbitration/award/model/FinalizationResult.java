package com.arbitration.award.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of a successful award finalization")
public class FinalizationResult {
    private String awardId;

    @Schema(example = "AWD-20260115-00001")
    private String referenceNumber;

    private String documentUrl;
    private String documentHash;
    private BigDecimal awardAmount;
    private PrevailingParty prevailingParty;
    private long issuedAt;
    private boolean claimantNotified;
    private boolean respondentNotified;
    private String signatureAlgorithm;
    private String certificateFingerprint;
    private boolean timestampGranted;
    private Long timestampTime;
}
