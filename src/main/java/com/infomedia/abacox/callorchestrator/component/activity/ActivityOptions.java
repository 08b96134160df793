package com.infomedia.abacox.callorchestrator.component.activity;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

@Getter
@Builder(toBuilder = true)
public class ActivityOptions {

    @Builder.Default
    private final Duration startToCloseTimeout = Duration.ofMinutes(5);
    @Builder.Default
    private final Duration heartbeatTimeout = Duration.ofSeconds(30);
    @Builder.Default
    private final RetryPolicy retryPolicy = RetryPolicy.defaults();
}
