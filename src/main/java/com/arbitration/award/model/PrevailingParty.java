package com.arbitration.award.model;

public enum PrevailingParty {
    CLAIMANT,
    RESPONDENT,
    SPLIT
}
