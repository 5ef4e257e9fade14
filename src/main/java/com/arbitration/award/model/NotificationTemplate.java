package com.arbitration.award.model;

public enum NotificationTemplate {
    AWARD_ISSUED,
    ESCALATION_ASSIGNED,
    ESCALATION_RESOLVED
}
