package com.infomedia.abacox.callorchestrator.component.durable;

/**
 * Point-in-time counters of the durable executor.
 */
public record ExecutorStats(int cachedWorkflows,
                            int runningWorkflows,
                            int busyWorkflows,
                            long workflowsStarted,
                            long workflowsCompleted,
                            long workflowsFailed,
                            long signalsDelivered,
                            long evictions) {
}
