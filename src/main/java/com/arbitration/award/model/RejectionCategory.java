package com.arbitration.award.model;

public enum RejectionCategory {
    LEGAL_ERROR,
    FACTUAL_ERROR,
    PROCEDURAL_ERROR,
    CALCULATION_ERROR,
    OTHER
}
