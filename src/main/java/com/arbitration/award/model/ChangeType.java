package com.arbitration.award.model;

public enum ChangeType {
    INITIAL,
    ARBITRATOR_EDIT
}
