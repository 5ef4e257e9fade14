package com.arbitration.award.model;

/**
 * Reviewer decision on a draft award. A draft with no decision yet carries {@code null}.
 */
public enum ReviewStatus {
    APPROVE,
    MODIFY,
    REJECT,
    ESCALATE
}
