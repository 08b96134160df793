package com.infomedia.abacox.callorchestrator.component.postcall;

import jakarta.annotation.PreDestroy;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Bounded pool running post-call jobs. The poller asks for free slots before claiming jobs.
 */
@Service
@Log4j2
public class PostCallExecutor {

    private final int maxThreads;
    private final ThreadPoolExecutor taskExecutor;

    public PostCallExecutor(@Value("${postcall.max-concurrent-jobs:4}") int maxThreads) {
        this.maxThreads = maxThreads;
        this.taskExecutor = new ThreadPoolExecutor(maxThreads, maxThreads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new CustomizableThreadFactory("post-call-"));
    }

    public int getAvailableSlots() {
        if (!taskExecutor.getQueue().isEmpty()) {
            return 0;
        }
        return Math.max(0, maxThreads - taskExecutor.getActiveCount());
    }

    public int getActiveCount() {
        return taskExecutor.getActiveCount();
    }

    public void submitTask(Runnable task) {
        taskExecutor.submit(task);
    }

    @PreDestroy
    public void shutdownExecutor() {
        log.debug("Shutting down post-call executor...");
        taskExecutor.shutdown();
        try {
            if (!taskExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                List<Runnable> droppedTasks = taskExecutor.shutdownNow();
                log.debug("Post-call executor was forcefully shut down. {} tasks were dropped.", droppedTasks.size());
            }
        } catch (InterruptedException e) {
            log.debug("Post-call executor shutdown interrupted.", e);
            taskExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("Post-call executor shut down.");
    }
}
