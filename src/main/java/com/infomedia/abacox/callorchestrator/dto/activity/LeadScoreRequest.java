package com.infomedia.abacox.callorchestrator.dto.activity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class LeadScoreRequest {
    private String leadId;
    private String tenantId;
    private String phoneNumber;
    /**
     * Relative change to apply; null when scoring from an analysis.
     */
    private Double adjustment;
    private String reason;
    private CallAnalysis analysis;
    private String industry;
    private String goal;
    private String priority;
    private String idempotencyKey;
}
