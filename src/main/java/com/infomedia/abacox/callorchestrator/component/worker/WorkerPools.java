package com.infomedia.abacox.callorchestrator.component.worker;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * The two thread pools of the worker. Workflow actors hold a workflow thread for as long as
 * they are cached and running; activity attempts hold an activity thread for their duration.
 */
@Log4j2
@Getter
public class WorkerPools {

    private final ThreadPoolExecutor workflowPool;
    private final ThreadPoolExecutor activityPool;

    public WorkerPools(WorkerSettings settings) {
        this.workflowPool = newPool(settings.getMaxConcurrentWorkflows(), "workflow-");
        this.activityPool = newPool(settings.getMaxConcurrentActivities(), "activity-");
    }

    private static ThreadPoolExecutor newPool(int size, String threadPrefix) {
        return new ThreadPoolExecutor(
                size,
                size,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new CustomizableThreadFactory(threadPrefix)
        );
    }

    public int getAvailableActivitySlots() {
        if (!activityPool.getQueue().isEmpty()) {
            return 0;
        }
        return Math.max(0, activityPool.getMaximumPoolSize() - activityPool.getActiveCount());
    }

    /**
     * Interrupts whatever still runs and waits briefly for the threads to exit.
     */
    public void shutdownNow() {
        shutdown(workflowPool, "Workflow");
        shutdown(activityPool, "Activity");
    }

    private void shutdown(ThreadPoolExecutor pool, String name) {
        log.debug("Shutting down {} pool...", name);
        List<Runnable> dropped = pool.shutdownNow();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("{} pool did not terminate in the specified time.", name);
            }
        } catch (InterruptedException e) {
            log.debug("{} pool shutdown interrupted.", name, e);
            Thread.currentThread().interrupt();
        }
        log.debug("{} pool shut down. {} queued tasks were dropped.", name, dropped.size());
    }
}
