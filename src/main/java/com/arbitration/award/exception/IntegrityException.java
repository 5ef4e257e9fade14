package com.arbitration.award.exception;

import com.arbitration.award.model.ChainVerification;

import java.util.List;

public class IntegrityException extends AwardServiceException {

    private final List<ChainVerification.InvalidEntry> invalidEntries;

    public IntegrityException(String message, List<ChainVerification.InvalidEntry> invalidEntries) {
        super(message);
        this.invalidEntries = invalidEntries;
    }

    public List<ChainVerification.InvalidEntry> getInvalidEntries() {
        return invalidEntries;
    }
}
