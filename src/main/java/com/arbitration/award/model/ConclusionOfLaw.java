package com.arbitration.award.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConclusionOfLaw {
    private String id;
    private int number;
    private String issue;
    private String conclusion;
    private List<String> legalBasis;            // statute / case citations
    private List<Integer> supportingFindings;   // finding numbers
}
