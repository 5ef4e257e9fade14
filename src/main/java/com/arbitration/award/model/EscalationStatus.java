package com.arbitration.award.model;

public enum EscalationStatus {
    PENDING,
    ASSIGNED,
    RESOLVED,
    RETURNED;

    /**
     * PENDING and ASSIGNED escalations block a new escalation of the same draft.
     */
    public boolean isActive() {
        return this == PENDING || this == ASSIGNED;
    }
}
