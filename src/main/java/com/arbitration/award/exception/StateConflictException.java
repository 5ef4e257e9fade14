package com.arbitration.award.exception;

public class StateConflictException extends AwardServiceException {

    public StateConflictException(String message) {
        super(message);
    }
}
