package com.infomedia.abacox.callorchestrator.dto.activity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class IntegrationTriggerRequest {
    private String callId;
    private String tenantId;
    private double leadScore;
    private List<String> nextActions;
}
