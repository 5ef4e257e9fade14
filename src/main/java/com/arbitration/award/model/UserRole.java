package com.arbitration.award.model;

public enum UserRole {
    CLAIMANT,
    RESPONDENT,
    ARBITRATOR,
    ADMIN
}
