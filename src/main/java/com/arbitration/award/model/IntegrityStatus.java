package com.arbitration.award.model;

public enum IntegrityStatus {
    INTACT,
    BROKEN
}
