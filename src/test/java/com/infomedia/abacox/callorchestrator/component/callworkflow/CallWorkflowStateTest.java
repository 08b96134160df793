package com.infomedia.abacox.callorchestrator.component.callworkflow;

import com.infomedia.abacox.callorchestrator.dto.activity.TranscriptAnalysisResult;
import com.infomedia.abacox.callorchestrator.dto.call.CallStage;
import com.infomedia.abacox.callorchestrator.dto.call.CallStatus;
import com.infomedia.abacox.callorchestrator.dto.call.QualificationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class CallWorkflowStateTest {

    private CallWorkflowState state;

    @BeforeEach
    void setUp() {
        state = new CallWorkflowState();
    }

    @Test
    void startsUnqualified() {
        CallStatus status = state.snapshot();

        assertThat(status.getStage()).isEqualTo(CallStage.STARTING);
        assertThat(status.getProgress()).isZero();
        assertThat(status.getLeadScore()).isZero();
        assertThat(status.getQualificationStatus()).isEqualTo(QualificationStatus.unknown());
        assertThat(status.getNextActions()).isEmpty();
    }

    @Test
    void analysisReplacesScoreWhileFunctionCallsOnlyRaiseIt() {
        state.applyTranscriptAnalysis(analysis(9.0));
        state.raiseLeadScore(4.0);
        assertThat(state.leadScore()).isEqualTo(9.0);

        state.applyTranscriptAnalysis(analysis(3.0));
        assertThat(state.leadScore()).isEqualTo(3.0);

        state.applyTranscriptAnalysis(TranscriptAnalysisResult.builder().build());
        assertThat(state.leadScore()).isEqualTo(3.0);
    }

    @Test
    void progressNeverDecreases() {
        state.enter(CallStage.ACTIVE, "monitoring_call", CallWorkflowState.ACTIVE_PROGRESS);
        for (int i = 0; i < 50; i++) {
            state.applyTranscriptAnalysis(analysis(1.0));
        }
        assertThat(state.snapshot().getProgress()).isEqualTo(95);

        state.endCall();
        state.enter(CallStage.COMPLETING, "completing_call", CallWorkflowState.CALL_END_PROGRESS);

        assertThat(state.snapshot().getProgress()).isEqualTo(95);
        assertThat(state.snapshot().getStage()).isEqualTo(CallStage.COMPLETING);
    }

    @Test
    void snapshotsAreDetachedCopies() {
        CallStatus before = state.snapshot();
        state.addNextAction("escalate_pricing");
        state.applyTranscriptAnalysis(TranscriptAnalysisResult.builder()
                .qualification(QualificationStatus.builder().budget(6.0).build())
                .build());

        assertThat(before.getNextActions()).isEmpty();
        assertThat(before.getQualificationStatus().getBudget()).isZero();
        assertThat(state.snapshot().getQualificationStatus().getBudget()).isEqualTo(6.0);
    }

    @Test
    void concurrentSnapshotsNeverMixTwoUpdates() throws InterruptedException {
        List<String> torn = new CopyOnWriteArrayList<>();
        AtomicBoolean writing = new AtomicBoolean(true);
        Thread reader = new Thread(() -> {
            while (writing.get()) {
                CallStatus status = state.snapshot();
                Double budget = status.getQualificationStatus().getBudget();
                if (budget != status.getLeadScore()) {
                    torn.add(budget + " vs " + status.getLeadScore());
                }
            }
        });
        reader.start();

        for (int i = 1; i <= 5_000; i++) {
            state.applyTranscriptAnalysis(TranscriptAnalysisResult.builder()
                    .leadScore((double) i)
                    .qualification(QualificationStatus.builder().budget((double) i).build())
                    .build());
        }
        writing.set(false);
        reader.join();

        assertThat(torn).isEmpty();
    }

    @Test
    void transferEndsTheWaitEvenWithoutCallEnd() {
        assertThat(state.isFinished()).isFalse();

        state.requestTransfer();

        assertThat(state.isFinished()).isTrue();
        assertThat(state.isTransferRequested()).isTrue();
        assertThat(state.transferContext(10).getTranscripts()).isEmpty();
    }

    private static TranscriptAnalysisResult analysis(double score) {
        return TranscriptAnalysisResult.builder().leadScore(score).build();
    }
}
