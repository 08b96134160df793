package com.infomedia.abacox.callorchestrator.dto.activity;

import com.infomedia.abacox.callorchestrator.dto.call.CallProvider;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class AnalyticsRequest {
    private String callId;
    private String tenantId;
    private CallProvider provider;
    private String error;
    private Map<String, Object> metrics;
}
