package com.infomedia.abacox.callorchestrator.dto.worker;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class WorkerHealth {
    private boolean connected;
    private boolean acceptingWork;
    private String namespace;
    private String taskQueue;
    private Set<String> registeredWorkflowTypes;
    private int runningWorkflows;
    private int busyWorkflows;
    private int cachedWorkflows;
    private int maxConcurrentWorkflows;
    private int maxCachedWorkflows;
    private int activeActivities;
    private int maxConcurrentActivities;
    private long pendingPostCallJobs;
}
