package com.infomedia.abacox.callorchestrator.component.activity;

import lombok.Getter;

/**
 * Final outcome of an activity that did not complete, after the retry policy gave up.
 */
@Getter
public class ActivityFailureException extends RuntimeException {

    private final String activityName;
    private final String failureType;
    private final int attempts;
    private final boolean nonRetryable;

    public ActivityFailureException(String activityName, Throwable cause, int attempts, boolean nonRetryable) {
        super(String.format("Activity %s failed after %d attempt(s): %s", activityName, attempts,
                cause.getMessage()), cause);
        this.activityName = activityName;
        this.failureType = cause.getClass().getSimpleName();
        this.attempts = attempts;
        this.nonRetryable = nonRetryable;
    }

    /**
     * Rebuilds a failure from its journaled form.
     */
    public ActivityFailureException(String activityName, String failureType, String message, int attempts,
                                    boolean nonRetryable) {
        super(message);
        this.activityName = activityName;
        this.failureType = failureType;
        this.attempts = attempts;
        this.nonRetryable = nonRetryable;
    }
}
