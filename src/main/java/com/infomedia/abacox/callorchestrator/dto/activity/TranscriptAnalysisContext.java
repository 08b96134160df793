package com.infomedia.abacox.callorchestrator.dto.activity;

import com.infomedia.abacox.callorchestrator.dto.call.TranscriptEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TranscriptAnalysisContext {
    private List<TranscriptEvent> previousTranscripts;
    private double currentScore;
    private Map<String, Object> callMetadata;
}
