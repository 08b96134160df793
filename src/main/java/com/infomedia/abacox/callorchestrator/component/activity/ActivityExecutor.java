package com.infomedia.abacox.callorchestrator.component.activity;

import com.infomedia.abacox.callorchestrator.multitenancy.TenantAwareTaskDecorator;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.task.TaskDecorator;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs activity bodies on the activity pool under a timeout and retry policy. The calling
 * thread blocks until the activity completes or the policy gives up.
 */
@Log4j2
public class ActivityExecutor {

    // Granularity of the timeout checks while waiting on an attempt
    private static final long WAIT_SLICE_MILLIS = 200;

    private final Executor activityPool;
    @Getter
    private final ActivityOptions defaultOptions;
    private final TaskDecorator taskDecorator = new TenantAwareTaskDecorator();

    public ActivityExecutor(Executor activityPool, ActivityOptions defaultOptions) {
        this.activityPool = activityPool;
        this.defaultOptions = defaultOptions;
    }

    public <T> T execute(String activityName, Callable<T> body) {
        return execute(activityName, body, defaultOptions);
    }

    public <T> T execute(String activityName, Callable<T> body, ActivityOptions options) {
        RetryPolicy retryPolicy = options.getRetryPolicy();
        int attempt = 0;
        while (true) {
            attempt++;
            Throwable failure;
            try {
                return runAttempt(activityName, attempt, body, options);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ActivityFailureException(activityName, e, attempt, true);
            } catch (ActivityFailureException e) {
                throw e;
            } catch (Throwable t) {
                failure = t;
            }

            boolean retryable = retryPolicy.isRetryable(failure);
            if (!retryable || !retryPolicy.hasAttemptsLeft(attempt)) {
                log.warn("Activity {} failed on attempt {} ({}), giving up: {}",
                        activityName, attempt, retryable ? "attempts exhausted" : "non-retryable", failure.getMessage());
                throw new ActivityFailureException(activityName, failure, attempt, !retryable);
            }

            Duration backoff = retryPolicy.backoffAfter(attempt);
            log.info("Activity {} failed on attempt {}: {}. Retrying in {} ms",
                    activityName, attempt, failure.getMessage(), backoff.toMillis());
            try {
                Thread.sleep(backoff.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ActivityFailureException(activityName, e, attempt, true);
            }
        }
    }

    private <T> T runAttempt(String activityName, int attempt, Callable<T> body, ActivityOptions options)
            throws Throwable {
        ActivityContext context = new ActivityContext(activityName, attempt);
        FutureTask<T> task = new FutureTask<>(() -> {
            ActivityContext.set(context);
            try {
                return body.call();
            } finally {
                ActivityContext.clear();
            }
        });

        try {
            activityPool.execute(taskDecorator.decorate(task));
        } catch (RejectedExecutionException e) {
            throw new ActivityFailureException(activityName, e, attempt, true);
        }

        long startNanos = System.nanoTime();
        long startToCloseNanos = options.getStartToCloseTimeout().toNanos();
        long heartbeatNanos = options.getHeartbeatTimeout().toNanos();
        while (true) {
            try {
                return task.get(WAIT_SLICE_MILLIS, TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                throw e.getCause();
            } catch (CancellationException e) {
                throw new ActivityFailureException(activityName, e, attempt, true);
            } catch (InterruptedException e) {
                task.cancel(true);
                throw e;
            } catch (TimeoutException e) {
                long elapsed = System.nanoTime() - startNanos;
                if (elapsed > startToCloseNanos) {
                    task.cancel(true);
                    throw new ActivityTimeoutException(activityName, ActivityTimeoutException.Kind.START_TO_CLOSE,
                            TimeUnit.NANOSECONDS.toMillis(elapsed));
                }
                if (context.nanosSinceHeartbeat() > heartbeatNanos) {
                    task.cancel(true);
                    throw new ActivityTimeoutException(activityName, ActivityTimeoutException.Kind.HEARTBEAT,
                            TimeUnit.NANOSECONDS.toMillis(elapsed));
                }
            }
        }
    }
}
