package com.infomedia.abacox.callorchestrator.component.postcall;

import com.infomedia.abacox.callorchestrator.db.entity.PostCallJob;
import com.infomedia.abacox.callorchestrator.multitenancy.TenantContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Polls for due post-call jobs and runs them. A failed run is rescheduled by the retry policy.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class PostCallRecoveryWorker {

    private final PostCallJobService postCallJobService;
    private final PostCallProcessor postCallProcessor;
    private final PostCallExecutor postCallExecutor;
    private final PostCallRetryPolicy retryPolicy;

    @Scheduled(fixedDelayString = "${postcall.poll-interval-ms:5000}", initialDelay = 5000)
    public void processDueJobs() {
        int availableSlots = postCallExecutor.getAvailableSlots();
        if (availableSlots <= 0) {
            log.trace("Post-call pool is full. Skipping this cycle.");
            return;
        }

        List<PostCallJob> jobs = postCallJobService.findAndLockDueJobs(availableSlots);
        if (jobs.isEmpty()) {
            return;
        }

        log.info("Fetched {} due post-call jobs", jobs.size());
        for (PostCallJob job : jobs) {
            postCallExecutor.submitTask(() -> runJob(job));
        }
    }

    void runJob(PostCallJob job) {
        TenantContext.set(job.getTenantId(), job.getCallId());
        try {
            postCallProcessor.process(job);
            postCallJobService.markCompleted(job.getId());
        } catch (Exception e) {
            PostCallJob.Status status = postCallJobService.markFailed(job.getId(), e.getMessage(), retryPolicy);
            if (status == PostCallJob.Status.NEEDS_MANUAL_REVIEW) {
                log.error("Post-call job {} for call {} failed for the last time; it needs manual review",
                        job.getId(), job.getCallId(), e);
            } else {
                log.error("Post-call job {} for call {} failed; retrying in {}", job.getId(), job.getCallId(),
                        retryPolicy.delayAfter(job.getAttempts() + 1), e);
            }
        } finally {
            TenantContext.clear();
        }
    }

    @Component
    @RequiredArgsConstructor
    public static class StartupRecoveryService {
        private final PostCallJobService postCallJobService;

        @EventListener(ContextRefreshedEvent.class)
        public void onApplicationEvent() {
            log.info("Application started. Recovering stalled post-call jobs...");
            postCallJobService.resetInProgressToPending();
        }
    }
}
