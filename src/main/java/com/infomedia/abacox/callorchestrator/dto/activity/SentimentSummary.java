package com.infomedia.abacox.callorchestrator.dto.activity;

import com.infomedia.abacox.callorchestrator.dto.call.EmotionData;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class SentimentSummary {
    private double score;
    private List<EmotionData> emotions;
}
