package com.infomedia.abacox.callorchestrator.component.activity;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Duration;
import java.util.Set;

@Getter
@Builder(toBuilder = true)
public class RetryPolicy {

    @Builder.Default
    private final Duration initialInterval = Duration.ofSeconds(1);
    @Builder.Default
    private final double backoffCoefficient = 2.0;
    @Builder.Default
    private final Duration maximumInterval = Duration.ofSeconds(30);
    @Builder.Default
    private final int maximumAttempts = 5;
    @Singular
    private final Set<Class<? extends Throwable>> nonRetryableTypes;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public boolean isRetryable(Throwable failure) {
        if (failure instanceof NonRetryableActivityException) {
            return false;
        }
        for (Class<? extends Throwable> type : nonRetryableTypes) {
            if (type.isInstance(failure)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Delay to wait after the given failed attempt (1-based) before the next one.
     */
    public Duration backoffAfter(int failedAttempt) {
        double millis = initialInterval.toMillis() * Math.pow(backoffCoefficient, Math.max(0, failedAttempt - 1));
        long capped = (long) Math.min(millis, maximumInterval.toMillis());
        return Duration.ofMillis(Math.max(0, capped));
    }

    public boolean hasAttemptsLeft(int attemptsMade) {
        return maximumAttempts <= 0 || attemptsMade < maximumAttempts;
    }
}
