package com.arbitration.award.model;

public enum AuditCategory {
    CASE_LIFECYCLE,
    EVIDENCE,
    STATEMENTS,
    AGREEMENT,
    ANALYSIS,
    ARBITRATION,
    AWARD,
    PAYMENT,
    USER
}
