package com.infomedia.abacox.callorchestrator.component.callworkflow;

import com.infomedia.abacox.callorchestrator.component.callactivities.CallActivityGateway;
import com.infomedia.abacox.callorchestrator.component.durable.WorkflowContext;
import com.infomedia.abacox.callorchestrator.component.durable.WorkflowDefinition;
import com.infomedia.abacox.callorchestrator.dto.activity.AnalyticsRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.CallSummaryRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.CallTransferRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.CreateCallRecordRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.IntegrationTriggerRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.TranscriptAnalysisContext;
import com.infomedia.abacox.callorchestrator.dto.activity.TranscriptAnalysisRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.TranscriptAnalysisResult;
import com.infomedia.abacox.callorchestrator.dto.activity.UpdateCallRecordRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.UrgentAction;
import com.infomedia.abacox.callorchestrator.dto.call.CallContext;
import com.infomedia.abacox.callorchestrator.dto.call.CallEndEvent;
import com.infomedia.abacox.callorchestrator.dto.call.CallStage;
import com.infomedia.abacox.callorchestrator.dto.call.CallStatus;
import com.infomedia.abacox.callorchestrator.dto.call.FunctionCallEvent;
import com.infomedia.abacox.callorchestrator.dto.call.TranscriptEvent;
import com.infomedia.abacox.callorchestrator.dto.call.TransferRequest;
import com.infomedia.abacox.callorchestrator.multitenancy.TenantContext;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lifecycle of one voice call: creates the call record, scores the conversation while it
 * runs, waits for the call to end (or for a transfer, or for the maximum duration) and
 * finalizes the record.
 * <p>
 * Failures while handling a single transcript, function call or transfer request only
 * increase the error count. A failure during finalization fails the workflow.
 */
@Log4j2
public class CallLifecycleWorkflow implements WorkflowDefinition<CallContext, CallStatus> {

    static final int ANALYSIS_TRANSCRIPT_WINDOW = 5;
    static final int TRANSFER_TRANSCRIPT_WINDOW = 10;

    private final CallActivityGateway activities;
    private final Duration maxCallDuration;

    private final CallWorkflowState state = new CallWorkflowState();
    private WorkflowContext context;
    private CallContext call;

    public CallLifecycleWorkflow(CallActivityGateway activities, Duration maxCallDuration) {
        this.activities = activities;
        this.maxCallDuration = maxCallDuration;
    }

    @Override
    public CallStatus run(WorkflowContext context, CallContext call) {
        this.context = context;
        this.call = call;
        TenantContext.set(call.getTenantId(), call.getCallId());

        FunctionCallDispatcher functionCalls = new FunctionCallDispatcher(context, activities, call, state);
        UrgentActionDispatcher urgentActions = new UrgentActionDispatcher(context, activities, call, state);

        context.onSignal(CallChannels.TRANSCRIPT, event -> onTranscript(event, urgentActions));
        context.onSignal(CallChannels.FUNCTION_CALL, event -> onFunctionCall(event, functionCalls));
        context.onSignal(CallChannels.CALL_END, this::onCallEnd);
        context.onSignal(CallChannels.TRANSFER_REQUEST, this::onTransferRequest);
        context.onQuery(CallChannels.CALL_STATUS, state::snapshot);
        context.onQuery(CallChannels.CALL_METRICS, () -> state.metrics(callStart(), Instant.now()));
        context.onQuery(CallChannels.LEAD_SCORE, state::leadScore);

        try {
            state.enter(CallStage.STARTING, "creating_call_record", 0);
            context.execute(activities.createCallRecord(CreateCallRecordRequest.builder()
                    .callId(call.getCallId())
                    .tenantId(call.getTenantId())
                    .phoneNumber(call.getPhoneNumber())
                    .provider(call.getProvider())
                    .startTime(callStart())
                    .metadata(call.getMetadata())
                    .build()));

            state.enter(CallStage.ACTIVE, "monitoring_call", CallWorkflowState.ACTIVE_PROGRESS);
            Instant deadline = context.getStartedAt().plus(maxCallDuration);
            if (!context.awaitUntil(deadline, state::isFinished) && !context.isReplaying()) {
                log.info("Call {} reached the maximum duration of {} without an end signal", call.getCallId(),
                        maxCallDuration);
            }
            state.enter(CallStage.COMPLETING, "completing_call", CallWorkflowState.CALL_END_PROGRESS);

            finalizeCall();
        } catch (RuntimeException e) {
            state.fail();
            log.error("Call workflow {} failed", call.getCallId(), e);
            storeFailureAnalytics(e);
            throw e;
        }
        return state.snapshot();
    }

    private void finalizeCall() {
        state.enter(CallStage.PROCESSING, "final_processing", CallWorkflowState.MAX_PROGRESS_BEFORE_FINALIZATION);

        List<TranscriptEvent> transcripts = state.transcripts();
        List<FunctionCallEvent> functionCalls = state.functionCalls();
        CallStatus current = state.snapshot();

        String summary = context.execute(activities.generateCallSummary(CallSummaryRequest.builder()
                .callId(call.getCallId())
                .tenantId(call.getTenantId())
                .transcripts(transcripts)
                .functionCalls(functionCalls)
                .qualification(current.getQualificationStatus())
                .leadScore(current.getLeadScore())
                .duration(elapsedSeconds())
                .build()));

        context.execute(activities.updateCallRecord(UpdateCallRecordRequest.builder()
                .callId(call.getCallId())
                .tenantId(call.getTenantId())
                .endTime(Instant.now())
                .status(state.isTransferRequested() ? "transferred" : "completed")
                .summary(summary)
                .leadScore(current.getLeadScore())
                .qualification(current.getQualificationStatus())
                .transcriptCount(transcripts.size())
                .functionCallCount(functionCalls.size())
                .build()));

        Map<String, Object> metrics = baseMetrics();
        metrics.put("qualificationData", current.getQualificationStatus());
        metrics.put("functionCalls", functionCalls.size());
        context.execute(activities.storeAnalytics(AnalyticsRequest.builder()
                .callId(call.getCallId())
                .tenantId(call.getTenantId())
                .provider(call.getProvider())
                .metrics(metrics)
                .build()));

        context.execute(activities.triggerIntegrations(IntegrationTriggerRequest.builder()
                .callId(call.getCallId())
                .tenantId(call.getTenantId())
                .leadScore(current.getLeadScore())
                .nextActions(current.getNextActions())
                .build()));

        context.execute(activities.enqueuePostCallJob(call.getCallId(), CallChannels.leadId(call.getCallId()),
                call.getTenantId()));

        state.enter(CallStage.COMPLETED, "completed", 100);
        if (!context.isReplaying()) {
            log.info("Call workflow {} completed with lead score {} after {} transcripts", call.getCallId(),
                    current.getLeadScore(), transcripts.size());
        }
    }

    private void onTranscript(TranscriptEvent event, UrgentActionDispatcher urgentActions) {
        int sequence = state.appendTranscript(event);
        log.debug("Transcript {} from {} on call {}", sequence, event.getSpeaker(), call.getCallId());
        try {
            TranscriptAnalysisResult analysis = context.execute(activities.processCallTranscript(
                    TranscriptAnalysisRequest.builder()
                            .callId(call.getCallId())
                            .tenantId(call.getTenantId())
                            .transcript(event.getText())
                            .speaker(event.getSpeaker())
                            .timestamp(event.getTimestamp())
                            .context(TranscriptAnalysisContext.builder()
                                    .previousTranscripts(state.recentTranscripts(ANALYSIS_TRANSCRIPT_WINDOW))
                                    .currentScore(state.leadScore())
                                    .callMetadata(call.getMetadata())
                                    .build())
                            .build()));
            if (analysis == null) {
                return;
            }
            state.applyTranscriptAnalysis(analysis);

            List<UrgentAction> urgent = analysis.getUrgentActions();
            if (urgent != null) {
                for (int i = 0; i < urgent.size(); i++) {
                    urgentActions.dispatch(urgent.get(i),
                            "call:" + call.getCallId() + ":transcript:" + sequence + ":urgent:" + i);
                }
            }
        } catch (RuntimeException e) {
            log.error("Transcript processing failed on call {}", call.getCallId(), e);
            state.recordError();
        }
    }

    private void onFunctionCall(FunctionCallEvent event, FunctionCallDispatcher dispatcher) {
        int sequence = state.appendFunctionCall(event);
        log.info("Function call {} on call {}", event.getFunctionName(), call.getCallId());
        try {
            dispatcher.dispatch(event, sequence);
        } catch (RuntimeException e) {
            log.error("Function call {} failed on call {}", event.getFunctionName(), call.getCallId(), e);
            state.recordError();
        }
    }

    private void onCallEnd(CallEndEvent event) {
        log.info("Call {} ended with status {}", call.getCallId(), event.getStatus());
        state.endCall();
    }

    private void onTransferRequest(TransferRequest request) {
        log.info("Transfer requested on call {}: {}", call.getCallId(), request.getReason());
        state.requestTransfer();
        try {
            context.execute(activities.handleCallTransfer(CallTransferRequest.builder()
                    .callId(call.getCallId())
                    .tenantId(call.getTenantId())
                    .reason(request.getReason())
                    .priority(request.getPriority())
                    .notes(request.getNotes())
                    .agentType(request.getAgentType())
                    .currentContext(state.transferContext(TRANSFER_TRANSCRIPT_WINDOW))
                    .build()));
            state.addNextAction("transferred_to_human");
        } catch (RuntimeException e) {
            log.error("Transfer handling failed on call {}", call.getCallId(), e);
            state.recordError();
        }
    }

    private void storeFailureAnalytics(RuntimeException failure) {
        try {
            context.execute(activities.storeAnalytics(AnalyticsRequest.builder()
                    .callId(call.getCallId())
                    .tenantId(call.getTenantId())
                    .provider(call.getProvider())
                    .error(failure.getMessage())
                    .metrics(baseMetrics())
                    .build()));
        } catch (RuntimeException e) {
            log.warn("Could not store failure analytics for call {}: {}", call.getCallId(), e.getMessage());
        }
    }

    private Map<String, Object> baseMetrics() {
        CallStatus current = state.snapshot();
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("duration", elapsedSeconds());
        metrics.put("transcriptLength", CallMetricsCalculator.transcriptLength(state.transcripts()));
        metrics.put("leadScore", current.getLeadScore());
        metrics.put("errorCount", current.getErrorCount());
        return metrics;
    }

    private long elapsedSeconds() {
        return Math.max(0, Duration.between(callStart(), Instant.now()).getSeconds());
    }

    private Instant callStart() {
        return call.getStartTime() != null ? call.getStartTime() : context.getStartedAt();
    }
}
