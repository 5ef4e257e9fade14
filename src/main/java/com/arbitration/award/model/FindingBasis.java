package com.arbitration.award.model;

public enum FindingBasis {
    UNDISPUTED,
    PROVEN,
    CREDIBILITY
}
