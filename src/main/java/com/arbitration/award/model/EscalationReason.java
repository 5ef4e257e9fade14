package com.arbitration.award.model;

public enum EscalationReason {
    COMPLEX_LEGAL_ISSUES,
    CONFLICTING_EVIDENCE,
    HIGH_VALUE_CLAIM,
    NOVEL_LEGAL_QUESTION,
    CREDIBILITY_CONCERNS,
    PROCEDURAL_ISSUES,
    AI_CONFIDENCE_LOW,
    OTHER;

    public String label() {
        return name().replace('_', ' ');
    }
}
