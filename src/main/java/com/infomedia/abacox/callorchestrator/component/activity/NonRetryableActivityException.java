package com.infomedia.abacox.callorchestrator.component.activity;

/**
 * Failure raised by an activity body that must surface on the first attempt.
 */
public abstract class NonRetryableActivityException extends RuntimeException {
    protected NonRetryableActivityException(String message) {
        super(message);
    }

    protected NonRetryableActivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
