package com.infomedia.abacox.callorchestrator.component.callactivities;

import lombok.Getter;

/**
 * Retryable failure of the remote activity service: transport errors and 5xx-class responses.
 */
@Getter
public class ActivityServiceException extends RuntimeException {
    private final String activityName;
    private final int statusCode;

    public ActivityServiceException(String activityName, int statusCode, String message, Throwable cause) {
        super(String.format("Activity service call %s failed (status %d): %s", activityName, statusCode, message), cause);
        this.activityName = activityName;
        this.statusCode = statusCode;
    }
}
