package com.infomedia.abacox.callorchestrator.component.activity;

public class ActivityValidationException extends NonRetryableActivityException {
    public ActivityValidationException(String message) {
        super(message);
    }

    public ActivityValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
