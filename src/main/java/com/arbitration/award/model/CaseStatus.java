package com.arbitration.award.model;

public enum CaseStatus {
    DRAFT,
    PENDING_RESPONDENT,
    PENDING_AGREEMENT,
    EVIDENCE_SUBMISSION,
    ANALYSIS_PENDING,
    ANALYSIS_IN_PROGRESS,
    ARBITRATOR_REVIEW,
    DECIDED,
    CLOSED
}
