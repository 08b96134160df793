package com.infomedia.abacox.callorchestrator.component.callworkflow;

import com.infomedia.abacox.callorchestrator.dto.activity.TranscriptAnalysisResult;
import com.infomedia.abacox.callorchestrator.dto.activity.TransferContext;
import com.infomedia.abacox.callorchestrator.dto.call.CallMetrics;
import com.infomedia.abacox.callorchestrator.dto.call.CallStage;
import com.infomedia.abacox.callorchestrator.dto.call.CallStatus;
import com.infomedia.abacox.callorchestrator.dto.call.FunctionCallEvent;
import com.infomedia.abacox.callorchestrator.dto.call.TranscriptEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulated state of one call. Written by the workflow thread, read by query threads.
 * Every mutation happens inside one synchronized method, so a snapshot never mixes two updates.
 */
class CallWorkflowState {

    static final int MAX_PROGRESS_BEFORE_FINALIZATION = 95;
    static final int TRANSCRIPT_PROGRESS_STEP = 2;
    static final int ACTIVE_PROGRESS = 10;
    static final int CALL_END_PROGRESS = 90;

    private final CallStatus status = CallStatus.initial();
    private final List<TranscriptEvent> transcripts = new ArrayList<>();
    private final List<FunctionCallEvent> functionCalls = new ArrayList<>();
    private boolean callEnded;
    private boolean transferRequested;

    synchronized int appendTranscript(TranscriptEvent event) {
        transcripts.add(event);
        return transcripts.size();
    }

    synchronized int appendFunctionCall(FunctionCallEvent event) {
        functionCalls.add(event);
        return functionCalls.size();
    }

    /**
     * The last {@code count} transcripts, oldest first.
     */
    synchronized List<TranscriptEvent> recentTranscripts(int count) {
        int from = Math.max(0, transcripts.size() - count);
        return new ArrayList<>(transcripts.subList(from, transcripts.size()));
    }

    synchronized List<TranscriptEvent> transcripts() {
        return new ArrayList<>(transcripts);
    }

    synchronized List<FunctionCallEvent> functionCalls() {
        return new ArrayList<>(functionCalls);
    }

    synchronized double leadScore() {
        return status.getLeadScore();
    }

    /**
     * Merges the qualification of a transcript analysis and takes its score as the new lead score.
     */
    synchronized void applyTranscriptAnalysis(TranscriptAnalysisResult analysis) {
        status.getQualificationStatus().mergeFrom(analysis.getQualification());
        if (analysis.getLeadScore() != null) {
            status.setLeadScore(analysis.getLeadScore());
        }
        status.setProgress(Math.min(MAX_PROGRESS_BEFORE_FINALIZATION, status.getProgress() + TRANSCRIPT_PROGRESS_STEP));
    }

    synchronized void raiseLeadScore(double score) {
        status.setLeadScore(Math.max(status.getLeadScore(), score));
    }

    synchronized void addNextAction(String action) {
        status.getNextActions().add(action);
    }

    synchronized void recordError() {
        status.setErrorCount(status.getErrorCount() + 1);
    }

    synchronized void requestTransfer() {
        transferRequested = true;
    }

    synchronized boolean isTransferRequested() {
        return transferRequested;
    }

    synchronized void endCall() {
        callEnded = true;
        status.setStage(CallStage.COMPLETING);
        status.setProgress(Math.max(status.getProgress(), CALL_END_PROGRESS));
    }

    synchronized boolean isFinished() {
        return callEnded || transferRequested;
    }

    /**
     * Moves to a stage. Progress never goes down.
     */
    synchronized void enter(CallStage stage, String currentActivity, int progress) {
        status.setStage(stage);
        status.setCurrentActivity(currentActivity);
        status.setProgress(Math.max(status.getProgress(), progress));
    }

    synchronized void fail() {
        status.setStage(CallStage.FAILED);
        status.setErrorCount(status.getErrorCount() + 1);
    }

    synchronized CallStatus snapshot() {
        return status.copy();
    }

    synchronized TransferContext transferContext(int transcriptWindow) {
        return TransferContext.builder()
                .leadScore(status.getLeadScore())
                .qualification(status.getQualificationStatus().copy())
                .transcripts(recentTranscripts(transcriptWindow))
                .build();
    }

    synchronized CallMetrics metrics(Instant callStart, Instant now) {
        return CallMetrics.builder()
                .duration(Math.max(0, Duration.between(callStart, now).getSeconds()))
                .transcriptLength(CallMetricsCalculator.transcriptLength(transcripts))
                .averageResponse(CallMetricsCalculator.averageResponse(transcripts))
                .sentimentScore(CallMetricsCalculator.sentimentScore(transcripts))
                .engagementLevel(CallMetricsCalculator.engagementLevel(transcripts, functionCalls))
                .qualificationScore(status.getLeadScore())
                .functionCalls(functionCalls.size())
                .transfers(transferRequested ? 1 : 0)
                .build();
    }
}
