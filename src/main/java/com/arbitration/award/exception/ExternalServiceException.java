package com.arbitration.award.exception;

/**
 * A collaborator (signing, storage, rendering, persistence) failed during an operation that
 * cannot complete without it.
 */
public class ExternalServiceException extends AwardServiceException {

    private final String service;

    public ExternalServiceException(String service, String message, Throwable cause) {
        super(message, cause);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
