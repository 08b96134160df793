package com.infomedia.abacox.callorchestrator.component.worker;

import com.infomedia.abacox.callorchestrator.component.durable.EventSourcedDurableExecutor;
import com.infomedia.abacox.callorchestrator.component.durable.ExecutorStats;
import com.infomedia.abacox.callorchestrator.component.durable.WorkflowEventStore;
import com.infomedia.abacox.callorchestrator.component.durable.WorkflowRegistration;
import com.infomedia.abacox.callorchestrator.component.postcall.PostCallExecutor;
import com.infomedia.abacox.callorchestrator.component.postcall.PostCallJobService;
import com.infomedia.abacox.callorchestrator.dto.worker.WorkerHealth;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lifecycle of the worker: registers the workflows, resumes running executions on start,
 * drains on shutdown and reports health.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class WorkerHost {

    private final WorkerSettings settings;
    private final WorkerPools pools;
    private final EventSourcedDurableExecutor durableExecutor;
    private final WorkflowEventStore eventStore;
    private final List<WorkflowRegistration<?, ?>> registrations;
    private final PostCallJobService postCallJobService;
    private final PostCallExecutor postCallExecutor;

    private final AtomicBoolean started = new AtomicBoolean();

    @EventListener(ContextRefreshedEvent.class)
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        if (!eventStore.isAvailable()) {
            log.warn("Event store is not reachable; running workflows will be resumed on the next signal or query");
        }
        registrations.forEach(durableExecutor::register);
        durableExecutor.startAccepting();
        log.info("Worker started on {}/{} with {}", settings.getNamespace(), settings.getTaskQueue(), settings);
        try {
            durableExecutor.recover();
        } catch (RuntimeException e) {
            log.error("Could not resume running workflows", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Worker shutting down; waiting up to {} for in-flight workflows",
                settings.getShutdownGracePeriod());
        durableExecutor.stopAccepting();
        if (!durableExecutor.awaitQuiescence(settings.getShutdownGracePeriod())) {
            log.warn("Grace period elapsed with workflows still busy; they stay RUNNING and resume on the next start");
        }
        durableExecutor.shutdownTimers();
        pools.shutdownNow();
        log.info("Worker shut down");
    }

    public WorkerHealth health() {
        ExecutorStats stats = durableExecutor.stats();
        long pendingJobs;
        boolean connected = eventStore.isAvailable();
        try {
            pendingJobs = connected ? postCallJobService.countPending() : -1;
        } catch (RuntimeException e) {
            log.warn("Could not count pending post-call jobs: {}", e.getMessage());
            pendingJobs = -1;
        }
        return WorkerHealth.builder()
                .connected(connected)
                .acceptingWork(durableExecutor.isAccepting())
                .namespace(settings.getNamespace())
                .taskQueue(settings.getTaskQueue())
                .registeredWorkflowTypes(durableExecutor.getRegisteredTypes())
                .runningWorkflows(stats.runningWorkflows())
                .busyWorkflows(stats.busyWorkflows())
                .cachedWorkflows(stats.cachedWorkflows())
                .maxConcurrentWorkflows(settings.getMaxConcurrentWorkflows())
                .maxCachedWorkflows(settings.getMaxCachedWorkflows())
                .activeActivities(pools.getActivityPool().getActiveCount())
                .maxConcurrentActivities(settings.getMaxConcurrentActivities())
                .pendingPostCallJobs(pendingJobs)
                .build();
    }

    @Scheduled(fixedDelayString = "${worker.metrics.log-interval-ms:60000}",
            initialDelayString = "${worker.metrics.log-interval-ms:60000}")
    public void logMetrics() {
        ExecutorStats stats = durableExecutor.stats();
        log.info("Worker metrics: cached={} running={} busy={} started={} completed={} failed={} signals={} "
                        + "evictions={} activeActivities={} postCallJobsRunning={}",
                stats.cachedWorkflows(), stats.runningWorkflows(), stats.busyWorkflows(), stats.workflowsStarted(),
                stats.workflowsCompleted(), stats.workflowsFailed(), stats.signalsDelivered(), stats.evictions(),
                pools.getActivityPool().getActiveCount(), postCallExecutor.getActiveCount());
    }
}
