package com.arbitration.award.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CaseRecord {
    private String caseId;
    private String referenceNumber;
    private CaseStatus status;
    private String claimantId;
    private String respondentId;
    private String assignedArbitratorId;
    private String jurisdiction;
    private String title;
    private long createdAt;
}
