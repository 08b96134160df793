package com.infomedia.abacox.callorchestrator.component.postcall;

import com.infomedia.abacox.callorchestrator.db.entity.PostCallJob;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.NoResultException;
import jakarta.persistence.PersistenceContext;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

@Service
@Log4j2
public class PostCallJobService implements PostCallJobScheduler {

    private static final int MAX_ERROR_LENGTH = 2000;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Long enqueue(String callId, String leadId, String tenantId) {
        PostCallJob existing = findByCallIdInternal(callId);
        if (existing != null) {
            log.debug("Post-call job for call {} already exists with ID {}", callId, existing.getId());
            return existing.getId();
        }
        Instant now = Instant.now();
        PostCallJob job = PostCallJob.builder()
                .callId(callId)
                .leadId(leadId)
                .tenantId(tenantId)
                .status(PostCallJob.Status.PENDING)
                .attempts(0)
                .nextAttemptAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build();
        entityManager.persist(job);
        entityManager.flush();
        log.info("Enqueued post-call job {} for call {} (lead {})", job.getId(), callId, leadId);
        return job.getId();
    }

    private PostCallJob findByCallIdInternal(String callId) {
        try {
            return entityManager.createQuery("SELECT j FROM PostCallJob j WHERE j.callId = :callId", PostCallJob.class)
                    .setParameter("callId", callId)
                    .getSingleResult();
        } catch (NoResultException e) {
            return null;
        }
    }

    /**
     * Locks and claims up to {@code limit} due jobs. Lock timeout 0 is NOWAIT on PostgreSQL: if
     * another worker holds any of the selected rows the whole claim fails, this poll claims
     * nothing, and the next poll tries again.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<PostCallJob> findAndLockDueJobs(int limit) {
        Instant now = Instant.now();
        try {
            List<PostCallJob> jobs = entityManager.createQuery(
                            "SELECT j FROM PostCallJob j WHERE j.status = :status AND j.nextAttemptAt <= :now " +
                                    "ORDER BY j.nextAttemptAt ASC", PostCallJob.class)
                    .setParameter("status", PostCallJob.Status.PENDING)
                    .setParameter("now", now)
                    .setMaxResults(limit)
                    .setLockMode(LockModeType.PESSIMISTIC_WRITE)
                    .setHint("jakarta.persistence.lock.timeout", 0)
                    .getResultList();

            for (PostCallJob job : jobs) {
                job.setStatus(PostCallJob.Status.IN_PROGRESS);
                job.setUpdatedAt(now);
                entityManager.merge(job);
            }
            return jobs;
        } catch (Exception e) {
            log.error("Error locking due post-call jobs", e);
            return Collections.emptyList();
        }
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markCompleted(Long jobId) {
        PostCallJob job = entityManager.find(PostCallJob.class, jobId);
        if (job == null) {
            return;
        }
        job.setStatus(PostCallJob.Status.COMPLETED);
        job.setLastError(null);
        job.setUpdatedAt(Instant.now());
        entityManager.merge(job);
    }

    /**
     * Records a failed run and schedules the next one, or parks the job for manual review once
     * the policy gives up.
     *
     * @return the updated status
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public PostCallJob.Status markFailed(Long jobId, String error, PostCallRetryPolicy retryPolicy) {
        PostCallJob job = entityManager.find(PostCallJob.class, jobId);
        if (job == null) {
            return null;
        }
        Instant now = Instant.now();
        int attempts = job.getAttempts() + 1;
        job.setAttempts(attempts);
        job.setLastError(truncate(error));
        job.setUpdatedAt(now);
        if (retryPolicy.isExhausted(attempts)) {
            job.setStatus(PostCallJob.Status.NEEDS_MANUAL_REVIEW);
        } else {
            job.setStatus(PostCallJob.Status.PENDING);
            job.setNextAttemptAt(now.plus(retryPolicy.delayAfter(attempts)));
        }
        entityManager.merge(job);
        return job.getStatus();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int resetInProgressToPending() {
        int updatedCount = entityManager.createQuery(
                        "UPDATE PostCallJob j SET j.status = :pendingStatus WHERE j.status = :inProgressStatus")
                .setParameter("pendingStatus", PostCallJob.Status.PENDING)
                .setParameter("inProgressStatus", PostCallJob.Status.IN_PROGRESS)
                .executeUpdate();
        if (updatedCount > 0) {
            log.info("Reset {} post-call jobs from IN_PROGRESS to PENDING status on startup.", updatedCount);
        }
        return updatedCount;
    }

    /**
     * Puts a job that needs manual review back in the queue, due now, with a fresh attempt count.
     *
     * @throws IllegalStateException if the job is not waiting for review
     */
    @Transactional
    public PostCallJob requeue(Long jobId) {
        PostCallJob job = entityManager.find(PostCallJob.class, jobId);
        if (job == null) {
            throw new PostCallJobNotFoundException(jobId);
        }
        if (job.getStatus() != PostCallJob.Status.NEEDS_MANUAL_REVIEW) {
            throw new IllegalStateException("Post-call job " + jobId + " is " + job.getStatus()
                    + "; only jobs that need manual review can be requeued");
        }
        Instant now = Instant.now();
        job.setStatus(PostCallJob.Status.PENDING);
        job.setAttempts(0);
        job.setNextAttemptAt(now);
        job.setUpdatedAt(now);
        log.info("Requeued post-call job {} for call {}", jobId, job.getCallId());
        return entityManager.merge(job);
    }

    @Transactional(readOnly = true)
    public List<PostCallJob> findJobs(PostCallJob.Status status) {
        if (status == null) {
            return entityManager.createQuery("SELECT j FROM PostCallJob j ORDER BY j.createdAt DESC", PostCallJob.class)
                    .getResultList();
        }
        return entityManager.createQuery(
                        "SELECT j FROM PostCallJob j WHERE j.status = :status ORDER BY j.createdAt DESC", PostCallJob.class)
                .setParameter("status", status)
                .getResultList();
    }

    @Transactional(readOnly = true)
    public long countPending() {
        return entityManager.createQuery("SELECT COUNT(j) FROM PostCallJob j WHERE j.status = :status", Long.class)
                .setParameter("status", PostCallJob.Status.PENDING)
                .getSingleResult();
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
