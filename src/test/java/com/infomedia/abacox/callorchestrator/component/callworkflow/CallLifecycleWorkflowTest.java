package com.infomedia.abacox.callorchestrator.component.callworkflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infomedia.abacox.callorchestrator.component.activity.ActivityExecutor;
import com.infomedia.abacox.callorchestrator.component.activity.ActivityOptions;
import com.infomedia.abacox.callorchestrator.component.activity.ActivityValidationException;
import com.infomedia.abacox.callorchestrator.component.activity.RetryPolicy;
import com.infomedia.abacox.callorchestrator.component.callactivities.CallActivityGateway;
import com.infomedia.abacox.callorchestrator.component.callactivities.RecordingCallActivities;
import com.infomedia.abacox.callorchestrator.component.durable.EventSourcedDurableExecutor;
import com.infomedia.abacox.callorchestrator.component.durable.InMemoryWorkflowEventStore;
import com.infomedia.abacox.callorchestrator.component.durable.WorkflowFailedException;
import com.infomedia.abacox.callorchestrator.config.WorkflowRegistrationConfiguration;
import com.infomedia.abacox.callorchestrator.dto.activity.AnalyticsRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.CallTransferRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.LeadScoreRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.NotificationRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.SmsRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.TranscriptAnalysisRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.TranscriptAnalysisResult;
import com.infomedia.abacox.callorchestrator.dto.activity.UpdateCallRecordRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.UrgentAction;
import com.infomedia.abacox.callorchestrator.dto.call.CallContext;
import com.infomedia.abacox.callorchestrator.dto.call.CallEndEvent;
import com.infomedia.abacox.callorchestrator.dto.call.CallMetrics;
import com.infomedia.abacox.callorchestrator.dto.call.CallProvider;
import com.infomedia.abacox.callorchestrator.dto.call.CallResult;
import com.infomedia.abacox.callorchestrator.dto.call.CallStage;
import com.infomedia.abacox.callorchestrator.dto.call.CallStatus;
import com.infomedia.abacox.callorchestrator.dto.call.FunctionCallEvent;
import com.infomedia.abacox.callorchestrator.dto.call.QualificationStatus;
import com.infomedia.abacox.callorchestrator.dto.call.TranscriptEvent;
import com.infomedia.abacox.callorchestrator.dto.call.TransferRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.infomedia.abacox.callorchestrator.support.Eventually.eventually;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CallLifecycleWorkflowTest {

    private static final String TENANT = "acme";
    private static final Duration RESULT_TIMEOUT = Duration.ofSeconds(10);

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private final List<String> enqueuedJobs = new CopyOnWriteArrayList<>();

    private InMemoryWorkflowEventStore store;
    private RecordingCallActivities activities;
    private ExecutorService activityPool;
    private ExecutorService workflowPool;
    private EventSourcedDurableExecutor executor;
    private CallWorkflowService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryWorkflowEventStore();
        activities = new RecordingCallActivities();
        activityPool = Executors.newCachedThreadPool();
        startWorker(Duration.ofMinutes(5));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownTimers();
        workflowPool.shutdownNow();
        activityPool.shutdownNow();
    }

    @Test
    void scoresTheConversationAndFinalizesOnCallEnd() {
        activities.setTranscriptAnalysis(request -> TranscriptAnalysisResult.builder()
                .leadScore(6.5)
                .qualification(QualificationStatus.builder().budget(7.0).need(8.0).build())
                .build());

        service.startCall(call("call-a"));
        service.signal("call-a", "transcript", transcript("user", "We need pricing for ten seats", Instant.now()));
        service.signal("call-a", "function-call", function("update_qualification_score",
                Map.of("score", 8, "reasoning", "budget confirmed")));
        service.signal("call-a", "call-end", CallEndEvent.builder().status("completed").build());

        CallStatus result = awaitCall("call-a");

        assertThat(result.getStage()).isEqualTo(CallStage.COMPLETED);
        assertThat(result.getProgress()).isEqualTo(100);
        assertThat(result.getLeadScore()).isEqualTo(8.0);
        assertThat(result.getQualificationStatus().getBudget()).isEqualTo(7.0);
        assertThat(result.getQualificationStatus().getAuthority()).isEqualTo(0.0);
        assertThat(result.getErrorCount()).isZero();
        assertThat(activities.names()).containsExactly(
                "createCallRecord",
                "processCallTranscript",
                "updateLeadScore",
                "generateCallSummary",
                "updateCallRecord",
                "storeAnalytics",
                "triggerIntegrations");

        LeadScoreRequest scoreUpdate = activities.requests("updateLeadScore", LeadScoreRequest.class).get(0);
        assertThat(scoreUpdate.getLeadId()).isEqualTo("call-a_lead");
        assertThat(scoreUpdate.getAdjustment()).isEqualTo(8.0);
        assertThat(scoreUpdate.getIdempotencyKey()).isEqualTo("call:call-a:function:1");

        UpdateCallRecordRequest record = activities.requests("updateCallRecord", UpdateCallRecordRequest.class).get(0);
        assertThat(record.getStatus()).isEqualTo("completed");
        assertThat(record.getSummary()).isEqualTo("Caller asked about pricing.");
        assertThat(record.getTranscriptCount()).isEqualTo(1);
        assertThat(record.getFunctionCallCount()).isEqualTo(1);

        assertThat(enqueuedJobs).containsExactly("call-a|call-a_lead|" + TENANT);
    }

    @Test
    void transferToHumanWithoutTranscriptsEndsTheCallAsTransferred() {
        service.startCall(call("call-b"));
        service.signal("call-b", "function-call", function("transfer_to_human",
                Map.of("reason", "customer asked for a person", "priority", "high")));

        CallStatus result = awaitCall("call-b");

        assertThat(result.getStage()).isEqualTo(CallStage.COMPLETED);
        assertThat(result.getNextActions()).containsExactly("transferred_to_human");
        CallTransferRequest transfer = activities.requests("handleCallTransfer", CallTransferRequest.class).get(0);
        assertThat(transfer.getReason()).isEqualTo("customer asked for a person");
        assertThat(transfer.getCurrentContext().getTranscripts()).isEmpty();
        assertThat(activities.requests("updateCallRecord", UpdateCallRecordRequest.class).get(0).getStatus())
                .isEqualTo("transferred");
    }

    @Test
    void transferRequestSignalHandsOffWithRecentTranscripts() {
        service.startCall(call("call-t"));
        for (int i = 0; i < 12; i++) {
            service.signal("call-t", "transcript", transcript(i % 2 == 0 ? "user" : "assistant", "line " + i, Instant.now()));
        }
        service.signal("call-t", "transfer-request", TransferRequest.builder().reason("escalation").priority("high").build());

        CallStatus result = awaitCall("call-t");

        CallTransferRequest transfer = activities.requests("handleCallTransfer", CallTransferRequest.class).get(0);
        assertThat(transfer.getCurrentContext().getTranscripts()).hasSize(10);
        assertThat(transfer.getCurrentContext().getTranscripts().get(0).getText()).isEqualTo("line 2");
        assertThat(result.getNextActions()).contains("transferred_to_human");
    }

    @Test
    void rejectedFollowUpSmsCountsAsErrorAndIsNotRetried() {
        activities.failWith("sendSms", new ActivityValidationException("invalid phone number"));

        service.startCall(call("call-c"));
        service.signal("call-c", "function-call", function("send_follow_up_sms",
                Map.of("phoneNumber", "123", "message", "Here is the brochure")));
        service.signal("call-c", "call-end", CallEndEvent.builder().status("completed").build());

        CallStatus result = awaitCall("call-c");

        assertThat(result.getStage()).isEqualTo(CallStage.COMPLETED);
        assertThat(result.getErrorCount()).isEqualTo(1);
        assertThat(result.getNextActions()).doesNotContain("follow_up_sms_scheduled");
        assertThat(activities.count("sendSms")).isEqualTo(1);
        assertThat(activities.requests("sendSms", SmsRequest.class).get(0).getIdempotencyKey())
                .isEqualTo("call:call-c:function:1");
    }

    @Test
    void unknownFunctionCountsAsErrorWithoutStoppingTheCall() {
        service.startCall(call("call-u"));
        service.signal("call-u", "function-call", function("order_pizza", Map.of()));
        service.signal("call-u", "call-end", CallEndEvent.builder().status("completed").build());

        CallStatus result = awaitCall("call-u");

        assertThat(result.getStage()).isEqualTo(CallStage.COMPLETED);
        assertThat(result.getErrorCount()).isEqualTo(1);
    }

    @Test
    void urgentActionsFromTranscriptAnalysisAreDispatched() {
        activities.setTranscriptAnalysis(request -> TranscriptAnalysisResult.builder()
                .leadScore(4.0)
                .urgentActions(List.of(
                        UrgentAction.builder().type("alert_manager").managerId("manager-1").reason("angry caller").build(),
                        UrgentAction.builder().type("escalate_pricing").build(),
                        UrgentAction.builder().type("something_new").build()))
                .build());

        service.startCall(call("call-d"));
        service.signal("call-d", "transcript", transcript("user", "This is too expensive", Instant.now()));
        service.signal("call-d", "call-end", CallEndEvent.builder().status("completed").build());

        CallStatus result = awaitCall("call-d");

        NotificationRequest alert = activities.requests("sendNotification", NotificationRequest.class).get(0);
        assertThat(alert.getType()).isEqualTo("urgent_call_alert");
        assertThat(alert.getUserId()).isEqualTo("manager-1");
        assertThat(alert.getIdempotencyKey()).isEqualTo("call:call-d:transcript:1:urgent:0");
        assertThat(result.getNextActions()).containsExactly("escalate_pricing");
        assertThat(result.getLeadScore()).isEqualTo(4.0);
    }

    @Test
    void progressGrowsWithTranscriptsAndStaysBelowFinalization() {
        activities.setTranscriptAnalysis(request -> TranscriptAnalysisResult.builder().build());
        service.startCall(call("call-p"));
        for (int i = 0; i < 3; i++) {
            service.signal("call-p", "transcript", transcript("user", "hello " + i, Instant.now()));
        }
        eventually(() -> service.getStatus("call-p").getProgress() == 16);

        for (int i = 0; i < 45; i++) {
            service.signal("call-p", "transcript", transcript("user", "more " + i, Instant.now()));
        }
        eventually(() -> service.getStatus("call-p").getProgress() == 95, RESULT_TIMEOUT);
        eventually(() -> activities.count("processCallTranscript") == 48, RESULT_TIMEOUT);
        CallStatus active = service.getStatus("call-p");
        assertThat(active.getStage()).isEqualTo(CallStage.ACTIVE);
        assertThat(active.getProgress()).isEqualTo(95);

        service.signal("call-p", "call-end", CallEndEvent.builder().status("completed").build());
        assertThat(awaitCall("call-p").getProgress()).isEqualTo(100);
    }

    @Test
    void transcriptFailuresOnlyIncreaseTheErrorCount() {
        activities.failWith("processCallTranscript", new ActivityValidationException("empty transcript"));

        service.startCall(call("call-e"));
        service.signal("call-e", "transcript", transcript("user", "", Instant.now()));
        service.signal("call-e", "transcript", transcript("user", "", Instant.now()));
        service.signal("call-e", "call-end", CallEndEvent.builder().status("completed").build());

        CallStatus result = awaitCall("call-e");

        assertThat(result.getStage()).isEqualTo(CallStage.COMPLETED);
        assertThat(result.getErrorCount()).isEqualTo(2);
        assertThat(result.getProgress()).isEqualTo(100);
    }

    @Test
    void reportsMetricsAndLeadScoreWhileActive() {
        activities.setTranscriptAnalysis(request -> TranscriptAnalysisResult.builder().leadScore(3.0).build());
        Instant t0 = Instant.parse("2026-01-01T10:00:00Z");

        service.startCall(call("call-m"));
        service.signal("call-m", "transcript", transcript("assistant", "Hello, how can I help?", t0));
        service.signal("call-m", "transcript", transcript("user", "Pricing please", t0.plusMillis(1500)));
        eventually(() -> activities.count("processCallTranscript") == 2);
        eventually(() -> service.getLeadScore("call-m") == 3.0);

        CallMetrics metrics = service.getMetrics("call-m");

        assertThat(metrics.getTranscriptLength()).isEqualTo("Hello, how can I help?".length() + "Pricing please".length());
        assertThat(metrics.getAverageResponse()).isEqualTo(1500.0);
        assertThat(metrics.getEngagementLevel()).isCloseTo(0.4, within(1e-9));
        assertThat(metrics.getSentimentScore()).isEqualTo(0.5);
        assertThat(metrics.getFunctionCalls()).isZero();
        assertThat(metrics.getQualificationScore()).isEqualTo(3.0);

        CallResult running = service.getResult("call-m");
        assertThat(running.isCompleted()).isFalse();
        assertThat(running.getStatus().getStage()).isEqualTo(CallStage.ACTIVE);
    }

    @Test
    void completesWhenTheMaximumDurationElapses() {
        tearDown();
        activityPool = Executors.newCachedThreadPool();
        startWorker(Duration.ofMillis(300));

        service.startCall(call("call-x"));

        CallStatus result = awaitCall("call-x");

        assertThat(result.getStage()).isEqualTo(CallStage.COMPLETED);
        assertThat(activities.requests("updateCallRecord", UpdateCallRecordRequest.class).get(0).getStatus())
                .isEqualTo("completed");
    }

    @Test
    void failedFinalizationFailsTheCallAndStoresFailureAnalytics() {
        activities.failWith("generateCallSummary", new ActivityValidationException("summary model rejected input"));

        service.startCall(call("call-f"));
        service.signal("call-f", "call-end", CallEndEvent.builder().status("completed").build());

        assertThatThrownBy(() -> executor.awaitResult(CallChannels.workflowId("call-f"), CallStatus.class, RESULT_TIMEOUT))
                .isInstanceOf(WorkflowFailedException.class)
                .hasMessageContaining("generateCallSummary");
        assertThatThrownBy(() -> service.getResult("call-f")).isInstanceOf(WorkflowFailedException.class);

        AnalyticsRequest analytics = activities.requests("storeAnalytics", AnalyticsRequest.class).get(0);
        assertThat(analytics.getError()).contains("summary model rejected input");
        assertThat(analytics.getMetrics()).containsKeys("duration", "transcriptLength", "leadScore", "errorCount");
        assertThat(enqueuedJobs).isEmpty();

        CallStatus status = service.getStatus("call-f");
        assertThat(status.getStage()).isEqualTo(CallStage.FAILED);
        assertThat(status.getErrorCount()).isEqualTo(1);
    }

    @Test
    void resumesAfterWorkerRestartWithoutRepeatingActivities() throws InterruptedException {
        activities.setTranscriptAnalysis(request -> TranscriptAnalysisResult.builder().leadScore(7.0).build());
        service.startCall(call("call-r"));
        service.signal("call-r", "transcript", transcript("user", "Interested", Instant.now()));
        eventually(() -> service.getLeadScore("call-r") == 7.0);

        executor.stopAccepting();
        executor.shutdownTimers();
        workflowPool.shutdownNow();
        assertThat(workflowPool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        startWorker(Duration.ofMinutes(5));
        assertThat(executor.recover()).isEqualTo(1);
        assertThat(service.getLeadScore("call-r")).isEqualTo(7.0);

        service.signal("call-r", "call-end", CallEndEvent.builder().status("completed").build());
        CallStatus result = awaitCall("call-r");

        assertThat(result.getLeadScore()).isEqualTo(7.0);
        assertThat(activities.count("createCallRecord")).isEqualTo(1);
        assertThat(activities.count("processCallTranscript")).isEqualTo(1);
        assertThat(enqueuedJobs).hasSize(1);
    }

    @Test
    void transcriptAnalysisSeesPreviousTranscripts() {
        service.startCall(call("call-w"));
        for (int i = 0; i < 7; i++) {
            service.signal("call-w", "transcript", transcript("user", "t" + i, Instant.now()));
        }
        eventually(() -> activities.count("processCallTranscript") == 7);

        TranscriptAnalysisRequest last = activities.requests("processCallTranscript", TranscriptAnalysisRequest.class).get(6);
        assertThat(last.getTranscript()).isEqualTo("t6");
        assertThat(last.getContext().getPreviousTranscripts()).extracting(TranscriptEvent::getText)
                .containsExactly("t2", "t3", "t4", "t5", "t6");
    }

    private void startWorker(Duration maxCallDuration) {
        ActivityExecutor activityExecutor = new ActivityExecutor(activityPool, ActivityOptions.builder()
                .startToCloseTimeout(Duration.ofSeconds(5))
                .heartbeatTimeout(Duration.ofSeconds(5))
                .retryPolicy(RetryPolicy.builder()
                        .initialInterval(Duration.ofMillis(5))
                        .maximumInterval(Duration.ofMillis(20))
                        .maximumAttempts(2)
                        .build())
                .build());
        CallActivityGateway gateway = new CallActivityGateway(activities, activityExecutor, (callId, leadId, tenantId) -> {
            enqueuedJobs.add(callId + "|" + leadId + "|" + tenantId);
            return (long) enqueuedJobs.size();
        });
        WorkflowRegistrationConfiguration registrations = new WorkflowRegistrationConfiguration();
        ReflectionTestUtils.setField(registrations, "maxCallDuration", maxCallDuration);

        workflowPool = Executors.newCachedThreadPool();
        executor = new EventSourcedDurableExecutor(store, mapper, workflowPool, "default", "voice-calls", 100);
        executor.register(registrations.callLifecycleRegistration(gateway));
        executor.startAccepting();
        service = new CallWorkflowService(executor);
    }

    private CallStatus awaitCall(String callId) {
        return executor.awaitResult(CallChannels.workflowId(callId), CallStatus.class, RESULT_TIMEOUT)
                .orElseThrow(() -> new AssertionError("Call " + callId + " did not complete"));
    }

    private static CallContext call(String callId) {
        return CallContext.builder()
                .callId(callId)
                .tenantId(TENANT)
                .phoneNumber("+15550100")
                .provider(CallProvider.VAPI)
                .build();
    }

    private static TranscriptEvent transcript(String speaker, String text, Instant timestamp) {
        return TranscriptEvent.builder()
                .speaker(speaker)
                .text(text)
                .timestamp(timestamp)
                .confidence(0.9)
                .build();
    }

    private static FunctionCallEvent function(String name, Map<String, Object> parameters) {
        return FunctionCallEvent.builder()
                .functionName(name)
                .parameters(parameters)
                .timestamp(Instant.now())
                .build();
    }
}
