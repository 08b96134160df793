package com.infomedia.abacox.callorchestrator.component.postcall;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * When a failed post-call job runs again. With the defaults a job is retried every
 * {@code retryDelay}, forever.
 */
@Getter
@Builder
@ToString
public class PostCallRetryPolicy {

    @Builder.Default
    private final Duration retryDelay = Duration.ofMinutes(5);
    /**
     * Failed runs after which a job needs manual review; 0 retries without limit.
     */
    @Builder.Default
    private final int maxAttempts = 0;
    @Builder.Default
    private final double backoffMultiplier = 1.0;
    @Builder.Default
    private final Duration maxDelay = Duration.ofHours(6);

    /**
     * Delay before the next run of a job that has failed {@code failedAttempts} times.
     */
    public Duration delayAfter(int failedAttempts) {
        if (backoffMultiplier <= 1.0 || failedAttempts <= 1) {
            return retryDelay;
        }
        double millis = retryDelay.toMillis() * Math.pow(backoffMultiplier, failedAttempts - 1);
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }

    public boolean isExhausted(int failedAttempts) {
        return maxAttempts > 0 && failedAttempts >= maxAttempts;
    }
}
