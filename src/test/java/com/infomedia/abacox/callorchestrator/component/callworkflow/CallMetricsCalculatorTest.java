package com.infomedia.abacox.callorchestrator.component.callworkflow;

import com.infomedia.abacox.callorchestrator.dto.call.EmotionData;
import com.infomedia.abacox.callorchestrator.dto.call.FunctionCallEvent;
import com.infomedia.abacox.callorchestrator.dto.call.TranscriptEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CallMetricsCalculatorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    @Test
    void transcriptLengthSumsCharacters() {
        List<TranscriptEvent> transcripts = List.of(
                transcript("user", "Hi", 0, null),
                transcript("assistant", "Hello there", 1000, null));

        assertThat(CallMetricsCalculator.transcriptLength(transcripts)).isEqualTo(13);
        assertThat(CallMetricsCalculator.transcriptLength(List.of())).isZero();
    }

    @Test
    void averageResponseOnlyCountsSpeakerChanges() {
        List<TranscriptEvent> transcripts = List.of(
                transcript("assistant", "a", 0, null),
                transcript("user", "b", 2000, null),
                transcript("user", "c", 2500, null),
                transcript("assistant", "d", 3500, null));

        assertThat(CallMetricsCalculator.averageResponse(transcripts)).isEqualTo(1500.0);
        assertThat(CallMetricsCalculator.averageResponse(transcripts.subList(0, 1))).isZero();
    }

    @Test
    void sentimentWeighsPositiveEmotionsOverAllEmotions() {
        List<TranscriptEvent> transcripts = List.of(
                transcript("user", "great", 0, List.of(emotion("happy", 0.8, 0.5), emotion("angry", 0.9, 0.9))),
                transcript("user", "ok", 1000, List.of(emotion("Satisfied", 1.0, 1.0))));

        assertThat(CallMetricsCalculator.sentimentScore(transcripts)).isCloseTo((0.4 + 1.0) / 3, within(1e-9));
    }

    @Test
    void sentimentDefaults() {
        assertThat(CallMetricsCalculator.sentimentScore(List.of())).isZero();
        assertThat(CallMetricsCalculator.sentimentScore(List.of(transcript("user", "x", 0, null)))).isEqualTo(0.5);
    }

    @Test
    void engagementIsCappedAtOne() {
        List<TranscriptEvent> transcripts = List.of(
                transcript("assistant", "a", 0, null),
                transcript("user", "b", 1000, null));
        List<FunctionCallEvent> calls = List.of(FunctionCallEvent.builder().functionName("schedule_appointment").build());

        assertThat(CallMetricsCalculator.engagementLevel(transcripts, calls)).isCloseTo(0.7, within(1e-9));
        assertThat(CallMetricsCalculator.engagementLevel(transcripts, List.of(calls.get(0), calls.get(0), calls.get(0))))
                .isEqualTo(1.0);
    }

    private static TranscriptEvent transcript(String speaker, String text, long offsetMillis, List<EmotionData> emotions) {
        return TranscriptEvent.builder()
                .speaker(speaker)
                .text(text)
                .timestamp(T0.plusMillis(offsetMillis))
                .emotions(emotions)
                .build();
    }

    private static EmotionData emotion(String name, double intensity, double confidence) {
        return EmotionData.builder().emotion(name).intensity(intensity).confidence(confidence).build();
    }
}
