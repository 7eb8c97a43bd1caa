package com.leasedesk.showing.common.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.leasedesk.showing.common.logging.RequestIdFilter;
import lombok.Getter;
import org.slf4j.MDC;

import java.time.Instant;

/**
 * Body of every 4xx/5xx response. Carries the request id of the failed call so the
 * caller can quote it when asking about the matching log lines.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final String errorCode;
    private final String message;
    private final String requestId;
    private final Instant timestamp;

    public ErrorResponse(String errorCode, String message) {
        this.errorCode = errorCode;
        this.message = message;
        this.requestId = MDC.get(RequestIdFilter.MDC_KEY);
        this.timestamp = Instant.now();
    }
}
