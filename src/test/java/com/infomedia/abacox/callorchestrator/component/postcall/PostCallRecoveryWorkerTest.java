package com.infomedia.abacox.callorchestrator.component.postcall;

import com.infomedia.abacox.callorchestrator.db.entity.PostCallJob;
import com.infomedia.abacox.callorchestrator.multitenancy.TenantContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PostCallRecoveryWorkerTest {

    @Mock
    private PostCallJobService postCallJobService;
    @Mock
    private PostCallProcessor postCallProcessor;
    @Mock
    private PostCallExecutor postCallExecutor;

    private final PostCallRetryPolicy retryPolicy = PostCallRetryPolicy.builder().maxAttempts(3).build();
    private PostCallRecoveryWorker worker;

    @BeforeEach
    void setUp() {
        worker = new PostCallRecoveryWorker(postCallJobService, postCallProcessor, postCallExecutor, retryPolicy);
    }

    @Test
    void successfulRunMarksTheJobCompleted() {
        PostCallJob job = job(7L, 0);
        AtomicReference<String> tenantDuringRun = new AtomicReference<>();
        doAnswer(invocation -> {
            tenantDuringRun.set(TenantContext.getTenant());
            return null;
        }).when(postCallProcessor).process(job);

        worker.runJob(job);

        verify(postCallJobService).markCompleted(7L);
        verify(postCallJobService, never()).markFailed(any(), any(), any());
        assertThat(tenantDuringRun.get()).isEqualTo("acme");
        assertThat(TenantContext.getTenant()).isNull();
    }

    @Test
    void failedRunIsRescheduledThroughTheRetryPolicy() {
        PostCallJob job = job(8L, 1);
        doThrow(new IllegalStateException("crm unavailable")).when(postCallProcessor).process(job);
        when(postCallJobService.markFailed(8L, "crm unavailable", retryPolicy)).thenReturn(PostCallJob.Status.PENDING);

        worker.runJob(job);

        verify(postCallJobService).markFailed(8L, "crm unavailable", retryPolicy);
        verify(postCallJobService, never()).markCompleted(any());
    }

    @Test
    void skipsPollingWhenThePoolIsFull() {
        when(postCallExecutor.getAvailableSlots()).thenReturn(0);

        worker.processDueJobs();

        verify(postCallJobService, never()).findAndLockDueJobs(anyInt());
    }

    @Test
    void claimsNoMoreJobsThanFreeSlotsAndSubmitsEach() {
        PostCallJob first = job(1L, 0);
        PostCallJob second = job(2L, 0);
        when(postCallExecutor.getAvailableSlots()).thenReturn(2);
        when(postCallJobService.findAndLockDueJobs(2)).thenReturn(List.of(first, second));
        doAnswer(invocation -> {
            invocation.<Runnable>getArgument(0).run();
            return null;
        }).when(postCallExecutor).submitTask(any());

        worker.processDueJobs();

        verify(postCallExecutor, times(2)).submitTask(any());
        verify(postCallProcessor).process(first);
        verify(postCallProcessor).process(second);
        verify(postCallJobService).markCompleted(1L);
        verify(postCallJobService).markCompleted(2L);
    }

    @Test
    void startupRecoveryReleasesJobsLeftInProgress() {
        new PostCallRecoveryWorker.StartupRecoveryService(postCallJobService).onApplicationEvent();

        verify(postCallJobService).resetInProgressToPending();
    }

    @Test
    void lastFailureParksTheJob() {
        PostCallJob job = job(9L, 2);
        doThrow(new IllegalStateException("still failing")).when(postCallProcessor).process(job);
        when(postCallJobService.markFailed(eq(9L), any(), eq(retryPolicy)))
                .thenReturn(PostCallJob.Status.NEEDS_MANUAL_REVIEW);

        worker.runJob(job);

        verify(postCallJobService).markFailed(9L, "still failing", retryPolicy);
    }

    private static PostCallJob job(Long id, int attempts) {
        return PostCallJob.builder()
                .id(id)
                .callId("call-" + id)
                .leadId("call-" + id + "_lead")
                .tenantId("acme")
                .attempts(attempts)
                .build();
    }
}
