package com.arbitration.award.model;

public enum RejectionSeverity {
    MINOR,
    MODERATE,
    MAJOR
}
