package com.infomedia.abacox.callorchestrator.component.activity;

import lombok.Getter;

/**
 * An attempt exceeded its start-to-close or heartbeat timeout. Retryable.
 */
@Getter
public class ActivityTimeoutException extends RuntimeException {

    public enum Kind {START_TO_CLOSE, HEARTBEAT}

    private final Kind kind;

    public ActivityTimeoutException(String activityName, Kind kind, long elapsedMillis) {
        super(String.format("Activity %s exceeded its %s timeout after %d ms",
                activityName, kind.name().toLowerCase().replace('_', '-'), elapsedMillis));
        this.kind = kind;
    }
}
