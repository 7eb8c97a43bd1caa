package com.leasedesk.showing.common.exception;

import lombok.Getter;

/**
 * An external collaborator could not be reached or answered with an error.
 */
@Getter
public class UpstreamServiceException extends RuntimeException {

    private final String service;

    public UpstreamServiceException(String service, String message) {
        super(service + ": " + message);
        this.service = service;
    }

    public UpstreamServiceException(String service, String message, Throwable cause) {
        super(service + ": " + message, cause);
        this.service = service;
    }
}
