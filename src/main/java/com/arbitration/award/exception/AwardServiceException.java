package com.arbitration.award.exception;

/**
 * Base of the error taxonomy surfaced by review, finalization and audit operations.
 */
public abstract class AwardServiceException extends RuntimeException {

    protected AwardServiceException(String message) {
        super(message);
    }

    protected AwardServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
