package com.infomedia.abacox.callorchestrator.dto.activity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class MetricsRequest {
    private String callId;
    private String tenantId;
    private String industry;
    private String goal;
    private double leadScore;
    private int actions;
    private long processingTimeMs;
}
