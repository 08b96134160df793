package com.infomedia.abacox.callorchestrator.dto.call;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CallMetrics {
    /**
     * Seconds since the call started.
     */
    private long duration;
    private long transcriptLength;
    /**
     * Mean milliseconds between consecutive transcripts of different speakers.
     */
    private double averageResponse;
    private double sentimentScore;
    private double engagementLevel;
    private double qualificationScore;
    private int functionCalls;
    private int transfers;
}
