package com.infomedia.abacox.callorchestrator.component.activity;

import com.infomedia.abacox.callorchestrator.component.callactivities.ActivityServiceException;
import com.infomedia.abacox.callorchestrator.multitenancy.TenantContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActivityExecutorTest {

    private ExecutorService pool;
    private ActivityExecutor executor;
    private ActivityOptions options;

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool();
        options = ActivityOptions.builder()
                .startToCloseTimeout(Duration.ofSeconds(10))
                .heartbeatTimeout(Duration.ofSeconds(10))
                .retryPolicy(RetryPolicy.builder()
                        .initialInterval(Duration.ofMillis(10))
                        .maximumInterval(Duration.ofMillis(50))
                        .maximumAttempts(3)
                        .build())
                .build();
        executor = new ActivityExecutor(pool, options);
    }

    @AfterEach
    void tearDown() {
        TenantContext.clear();
        pool.shutdownNow();
    }

    @Test
    void retriesTransientFailuresUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("generateCallSummary", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new ActivityServiceException("generateCallSummary", 503, "unavailable", null);
            }
            return "summary";
        });

        assertThat(result).isEqualTo("summary");
        assertThat(calls).hasValue(3);
    }

    @Test
    void givesUpWhenAttemptsAreExhausted() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("storeAnalytics", () -> {
            calls.incrementAndGet();
            throw new ActivityServiceException("storeAnalytics", 500, "boom", null);
        }))
                .isInstanceOfSatisfying(ActivityFailureException.class, e -> {
                    assertThat(e.getAttempts()).isEqualTo(3);
                    assertThat(e.isNonRetryable()).isFalse();
                    assertThat(e.getFailureType()).isEqualTo("ActivityServiceException");
                });
        assertThat(calls).hasValue(3);
    }

    @Test
    void doesNotRetryValidationFailures() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("sendSms", () -> {
            calls.incrementAndGet();
            throw new ActivityValidationException("invalid phone number");
        }))
                .isInstanceOfSatisfying(ActivityFailureException.class, e -> {
                    assertThat(e.getAttempts()).isEqualTo(1);
                    assertThat(e.isNonRetryable()).isTrue();
                    assertThat(e.getCause()).isInstanceOf(ActivityValidationException.class);
                });
        assertThat(calls).hasValue(1);
    }

    @Test
    void cancelsAttemptsThatExceedStartToCloseTimeout() {
        ActivityOptions tight = options.toBuilder()
                .startToCloseTimeout(Duration.ofMillis(300))
                .retryPolicy(RetryPolicy.builder().maximumAttempts(1).build())
                .build();

        assertThatThrownBy(() -> executor.execute("processCallTranscript", () -> {
            Thread.sleep(5_000);
            return "late";
        }, tight))
                .isInstanceOf(ActivityFailureException.class)
                .cause()
                .isInstanceOfSatisfying(ActivityTimeoutException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ActivityTimeoutException.Kind.START_TO_CLOSE));
    }

    @Test
    void cancelsAttemptsThatStopHeartbeating() {
        ActivityOptions tight = options.toBuilder()
                .heartbeatTimeout(Duration.ofMillis(300))
                .retryPolicy(RetryPolicy.builder().maximumAttempts(1).build())
                .build();

        assertThatThrownBy(() -> executor.execute("generateCallSummary", () -> {
            Thread.sleep(5_000);
            return "late";
        }, tight))
                .isInstanceOf(ActivityFailureException.class)
                .cause()
                .isInstanceOfSatisfying(ActivityTimeoutException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ActivityTimeoutException.Kind.HEARTBEAT));
    }

    @Test
    void heartbeatsKeepLongActivitiesAlive() {
        ActivityOptions tight = options.toBuilder()
                .heartbeatTimeout(Duration.ofMillis(400))
                .build();

        String result = executor.execute("generateCallSummary", () -> {
            for (int i = 0; i < 8; i++) {
                Thread.sleep(100);
                ActivityContext.heartbeat(i);
            }
            return "done";
        }, tight);

        assertThat(result).isEqualTo("done");
    }

    @Test
    void exposesAttemptAndTenantToTheActivityBody() {
        TenantContext.set("acme", "call-7");
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("updateLeadScore", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("first attempt fails");
            }
            return TenantContext.getTenant() + "/" + TenantContext.getCallId() + "#" + ActivityContext.current().getAttempt();
        });

        assertThat(result).isEqualTo("acme/call-7#2");
    }
}
