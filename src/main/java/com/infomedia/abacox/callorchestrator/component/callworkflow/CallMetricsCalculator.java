package com.infomedia.abacox.callorchestrator.component.callworkflow;

import com.infomedia.abacox.callorchestrator.dto.call.EmotionData;
import com.infomedia.abacox.callorchestrator.dto.call.FunctionCallEvent;
import com.infomedia.abacox.callorchestrator.dto.call.TranscriptEvent;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Derived call metrics. All methods are pure functions of the event logs.
 */
public final class CallMetricsCalculator {

    private static final Set<String> POSITIVE_EMOTIONS = Set.of("happy", "excited", "satisfied", "confident");

    private CallMetricsCalculator() {
    }

    public static long transcriptLength(List<TranscriptEvent> transcripts) {
        return transcripts.stream()
                .map(TranscriptEvent::getText)
                .filter(Objects::nonNull)
                .mapToLong(String::length)
                .sum();
    }

    /**
     * Mean time in milliseconds between consecutive transcripts spoken by different speakers,
     * or 0 when there is no speaker change.
     */
    public static double averageResponse(List<TranscriptEvent> transcripts) {
        if (transcripts.size() < 2) {
            return 0;
        }
        long total = 0;
        int changes = 0;
        for (int i = 1; i < transcripts.size(); i++) {
            TranscriptEvent previous = transcripts.get(i - 1);
            TranscriptEvent current = transcripts.get(i);
            if (speakerChanged(previous, current) && previous.getTimestamp() != null && current.getTimestamp() != null) {
                total += Duration.between(previous.getTimestamp(), current.getTimestamp()).toMillis();
                changes++;
            }
        }
        return changes > 0 ? (double) total / changes : 0;
    }

    /**
     * Weighted share of positive emotions, in [0, 1]. 0 without transcripts, 0.5 when no
     * transcript carries emotion data.
     */
    public static double sentimentScore(List<TranscriptEvent> transcripts) {
        if (transcripts.isEmpty()) {
            return 0;
        }
        List<EmotionData> emotions = transcripts.stream()
                .filter(t -> t.getEmotions() != null)
                .flatMap(t -> t.getEmotions().stream())
                .toList();
        if (emotions.isEmpty()) {
            return 0.5;
        }
        double positive = emotions.stream()
                .filter(e -> e.getEmotion() != null && POSITIVE_EMOTIONS.contains(e.getEmotion().toLowerCase()))
                .mapToDouble(e -> e.getIntensity() * e.getConfidence())
                .sum();
        return Math.min(1, positive / emotions.size());
    }

    public static double engagementLevel(List<TranscriptEvent> transcripts, List<FunctionCallEvent> functionCalls) {
        int speakerChanges = 0;
        for (int i = 1; i < transcripts.size(); i++) {
            if (speakerChanged(transcripts.get(i - 1), transcripts.get(i))) {
                speakerChanges++;
            }
        }
        double engagement = transcripts.size() * 0.1 + functionCalls.size() * 0.3 + speakerChanges * 0.2;
        return Math.min(1, engagement);
    }

    private static boolean speakerChanged(TranscriptEvent previous, TranscriptEvent current) {
        return !Objects.equals(previous.getSpeaker(), current.getSpeaker());
    }
}
