package com.arbitration.award.exception;

public class NotFoundException extends AwardServiceException {

    public NotFoundException(String message) {
        super(message);
    }
}
