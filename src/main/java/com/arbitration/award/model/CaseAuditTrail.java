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
@Schema(description = "Chronological audit timeline of a case with its chain integrity status")
public class CaseAuditTrail {
    private String caseId;
    private String caseReference;
    private CaseStatus caseStatus;
    private List<AuditTrailEntry> entries;
    private AuditSummary summary;
    private IntegrityStatus integrityStatus;
    private List<ChainVerification.InvalidEntry> integrityFailures;
    private long generatedAt;
}
