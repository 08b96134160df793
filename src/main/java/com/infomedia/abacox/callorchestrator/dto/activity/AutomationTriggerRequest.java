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
public class AutomationTriggerRequest {
    private String leadId;
    private String tenantId;
    private List<String> triggers;
    private String idempotencyKey;
}
