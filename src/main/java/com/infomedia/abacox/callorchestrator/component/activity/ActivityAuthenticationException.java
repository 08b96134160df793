package com.infomedia.abacox.callorchestrator.component.activity;

public class ActivityAuthenticationException extends NonRetryableActivityException {
    public ActivityAuthenticationException(String message) {
        super(message);
    }

    public ActivityAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
