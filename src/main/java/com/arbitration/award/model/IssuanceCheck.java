package com.arbitration.award.model;

public record IssuanceCheck(boolean canIssue, String reason) {

    public static IssuanceCheck allowed() {
        return new IssuanceCheck(true, null);
    }

    public static IssuanceCheck denied(String reason) {
        return new IssuanceCheck(false, reason);
    }
}
