package com.infomedia.abacox.callorchestrator.dto.activity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Sentiment and intent of a call, as returned by the sentiment analysis activity.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CallAnalysis {
    private Double sentimentScore;
    private String intent;
    private String serviceNeeded;
    private Boolean paymentInterest;
    private Double proposedAmount;
    private List<String> keywords;
}
