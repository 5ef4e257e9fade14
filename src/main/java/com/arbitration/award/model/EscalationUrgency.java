package com.arbitration.award.model;

public enum EscalationUrgency {
    LOW,
    NORMAL,
    HIGH,
    URGENT
}
