package com.infomedia.abacox.callorchestrator.dto.activity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of the post-call quality check; drives the remaining post-call steps.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class QualityCheckResult {
    private Double qualityScore;
    private Double completeness;
    private Double scoreAdjustment;
    private FollowUpRecommendation recommendedFollowUp;
    private List<NotificationInstruction> notifications;
    private List<String> marketingTriggers;
}
