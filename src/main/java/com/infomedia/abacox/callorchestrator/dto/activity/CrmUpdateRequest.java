package com.infomedia.abacox.callorchestrator.dto.activity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CrmUpdateRequest {
    private String leadId;
    private String tenantId;
    private String callId;
    private QualityCheckResult qualityData;
    private String idempotencyKey;
}
