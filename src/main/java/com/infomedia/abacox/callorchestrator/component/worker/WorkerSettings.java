package com.infomedia.abacox.callorchestrator.component.worker;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Identity and operational ceilings of this worker process.
 */
@Getter
@Builder
@ToString
public class WorkerSettings {

    @Builder.Default
    private final String namespace = "default";
    @Builder.Default
    private final String taskQueue = "voice-processing";
    @Builder.Default
    private final int maxConcurrentWorkflows = 100;
    @Builder.Default
    private final int maxConcurrentActivities = 50;
    @Builder.Default
    private final int maxCachedWorkflows = 100;
    @Builder.Default
    private final Duration shutdownGracePeriod = Duration.ofSeconds(30);
}
