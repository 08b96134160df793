package com.infomedia.abacox.callorchestrator.component.postcall;

import com.infomedia.abacox.callorchestrator.component.activity.ActivityExecutor;
import com.infomedia.abacox.callorchestrator.component.activity.ActivityFailureException;
import com.infomedia.abacox.callorchestrator.component.activity.ActivityOptions;
import com.infomedia.abacox.callorchestrator.component.activity.RetryPolicy;
import com.infomedia.abacox.callorchestrator.component.callactivities.ActivityServiceException;
import com.infomedia.abacox.callorchestrator.component.callactivities.CallActivityGateway;
import com.infomedia.abacox.callorchestrator.component.callactivities.RecordingCallActivities;
import com.infomedia.abacox.callorchestrator.db.entity.PostCallJob;
import com.infomedia.abacox.callorchestrator.dto.activity.AutomationTriggerRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.CrmUpdateRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.FollowUpRecommendation;
import com.infomedia.abacox.callorchestrator.dto.activity.FollowUpRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.LeadScoreRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.NotificationInstruction;
import com.infomedia.abacox.callorchestrator.dto.activity.NotificationRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.QualityCheckResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PostCallProcessorTest {

    private RecordingCallActivities activities;
    private ExecutorService activityPool;
    private PostCallProcessor processor;

    @BeforeEach
    void setUp() {
        activities = new RecordingCallActivities();
        activityPool = Executors.newCachedThreadPool();
        ActivityExecutor activityExecutor = new ActivityExecutor(activityPool, ActivityOptions.builder()
                .retryPolicy(RetryPolicy.builder()
                        .initialInterval(Duration.ofMillis(5))
                        .maximumAttempts(2)
                        .build())
                .build());
        processor = new PostCallProcessor(new CallActivityGateway(activities, activityExecutor,
                (callId, leadId, tenantId) -> 1L));
    }

    @AfterEach
    void tearDown() {
        activityPool.shutdownNow();
    }

    @Test
    void runsEveryStepTheQualityCheckAsksFor() {
        Instant followUpAt = Instant.parse("2026-06-01T12:00:00Z");
        activities.setQualityCheck(QualityCheckResult.builder()
                .qualityScore(0.8)
                .scoreAdjustment(1.5)
                .recommendedFollowUp(FollowUpRecommendation.builder()
                        .type("call")
                        .scheduledFor(followUpAt)
                        .message("Check in about the quote")
                        .build())
                .notifications(List.of(
                        NotificationInstruction.builder().userId("agent-1").type("hot_lead").message("Call back").build(),
                        NotificationInstruction.builder().userId("manager-1").type("summary").message("FYI").build()))
                .marketingTriggers(List.of("pricing_nurture"))
                .build());

        processor.process(job("call-9"));

        assertThat(activities.names()).containsExactly(
                "performQualityCheck",
                "updateLeadScore",
                "scheduleFollowUp",
                "sendNotification",
                "sendNotification",
                "updateCrm",
                "triggerAutomations");

        LeadScoreRequest score = activities.requests("updateLeadScore", LeadScoreRequest.class).get(0);
        assertThat(score.getAdjustment()).isEqualTo(1.5);
        assertThat(score.getReason()).isEqualTo("post_call_quality_analysis");
        assertThat(score.getIdempotencyKey()).isEqualTo("post-call:call-9:score");

        FollowUpRequest followUp = activities.requests("scheduleFollowUp", FollowUpRequest.class).get(0);
        assertThat(followUp.getScheduledFor()).isEqualTo(followUpAt);
        assertThat(followUp.getIdempotencyKey()).isEqualTo("post-call:call-9:follow-up");

        assertThat(activities.requests("sendNotification", NotificationRequest.class))
                .extracting(NotificationRequest::getUserId, NotificationRequest::getIdempotencyKey)
                .containsExactly(
                        tuple("agent-1", "post-call:call-9:notification:0"),
                        tuple("manager-1", "post-call:call-9:notification:1"));

        CrmUpdateRequest crm = activities.requests("updateCrm", CrmUpdateRequest.class).get(0);
        assertThat(crm.getLeadId()).isEqualTo("call-9_lead");
        assertThat(crm.getIdempotencyKey()).isEqualTo("post-call:call-9:crm");

        AutomationTriggerRequest automations = activities.requests("triggerAutomations", AutomationTriggerRequest.class).get(0);
        assertThat(automations.getTriggers()).containsExactly("pricing_nurture");
    }

    @Test
    void emptyQualityCheckStillUpdatesTheCrm() {
        activities.setQualityCheck(null);

        processor.process(job("call-10"));

        assertThat(activities.names()).containsExactly("performQualityCheck", "updateCrm");
    }

    @Test
    void zeroScoreAdjustmentSkipsTheScoreUpdate() {
        activities.setQualityCheck(QualityCheckResult.builder().scoreAdjustment(0.0).build());

        processor.process(job("call-11"));

        assertThat(activities.count("updateLeadScore")).isZero();
    }

    @Test
    void failingStepFailsTheRun() {
        activities.failWith("updateCrm", new ActivityServiceException("updateCrm", 502, "bad gateway", null));

        assertThatThrownBy(() -> processor.process(job("call-12")))
                .isInstanceOf(ActivityFailureException.class)
                .hasMessageContaining("updateCrm");
        assertThat(activities.count("updateCrm")).isEqualTo(2);
        assertThat(activities.count("triggerAutomations")).isZero();
    }

    @Test
    void rescheduledRunCompletesWithTheSameNotificationKeys() {
        activities.setQualityCheck(QualityCheckResult.builder()
                .notifications(List.of(
                        NotificationInstruction.builder().userId("agent-1").type("hot_lead").message("Call back").build(),
                        NotificationInstruction.builder().userId("agent-2").type("hot_lead").message("Backup").build()))
                .build());
        activities.failWith("updateCrm", new ActivityServiceException("updateCrm", 503, "unavailable", null));
        PostCallJobService jobService = mock(PostCallJobService.class);
        PostCallRetryPolicy retryPolicy = PostCallRetryPolicy.builder().maxAttempts(3).build();
        when(jobService.markFailed(eq(1L), any(), eq(retryPolicy))).thenReturn(PostCallJob.Status.PENDING);
        PostCallRecoveryWorker worker = new PostCallRecoveryWorker(jobService, processor,
                mock(PostCallExecutor.class), retryPolicy);

        worker.runJob(job("call-13"));

        verify(jobService).markFailed(eq(1L), any(), eq(retryPolicy));
        verify(jobService, never()).markCompleted(any());
        List<String> firstRunKeys = activities.requests("sendNotification", NotificationRequest.class).stream()
                .map(NotificationRequest::getIdempotencyKey)
                .toList();

        activities.recover("updateCrm");
        PostCallJob rescheduled = job("call-13");
        rescheduled.setAttempts(1);
        worker.runJob(rescheduled);

        verify(jobService).markCompleted(1L);
        List<String> allKeys = activities.requests("sendNotification", NotificationRequest.class).stream()
                .map(NotificationRequest::getIdempotencyKey)
                .toList();
        assertThat(firstRunKeys).containsExactly("post-call:call-13:notification:0", "post-call:call-13:notification:1");
        assertThat(allKeys).hasSize(4);
        assertThat(allKeys.subList(2, 4)).isEqualTo(firstRunKeys);
    }

    private static PostCallJob job(String callId) {
        return PostCallJob.builder()
                .id(1L)
                .callId(callId)
                .leadId(callId + "_lead")
                .tenantId("acme")
                .attempts(0)
                .build();
    }
}
