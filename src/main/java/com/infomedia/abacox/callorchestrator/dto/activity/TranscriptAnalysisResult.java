package com.infomedia.abacox.callorchestrator.dto.activity;

import com.infomedia.abacox.callorchestrator.dto.call.QualificationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TranscriptAnalysisResult {
    private Double leadScore;
    private QualificationStatus qualification;
    private List<UrgentAction> urgentActions;
    private SentimentSummary sentiment;
    private List<String> keywords;
    private List<String> nextRecommendations;
}
