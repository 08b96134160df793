package com.infomedia.abacox.callorchestrator.dto.activity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CallAnalysisRequest {
    private String callId;
    private String tenantId;
    private String industry;
    private String goal;
    private CustomerInfo customerContext;
}
