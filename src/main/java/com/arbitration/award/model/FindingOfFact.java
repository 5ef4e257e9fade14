package com.arbitration.award.model;

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
public class FindingOfFact {
    private String id;
    private int number;
    private String finding;
    private FindingBasis basis;
    private List<String> supportingEvidence;    // evidence ids
    private String credibilityNote;
    private String date;                        // ISO date as stated in the finding, if any
    private BigDecimal amount;
}
