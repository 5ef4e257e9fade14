package com.arbitration.award.exception;

public class ValidationException extends AwardServiceException {

    public ValidationException(String message) {
        super(message);
    }
}
