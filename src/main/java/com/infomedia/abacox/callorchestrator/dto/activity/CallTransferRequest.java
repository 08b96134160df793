package com.infomedia.abacox.callorchestrator.dto.activity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CallTransferRequest {
    private String callId;
    private String tenantId;
    private String reason;
    private String priority;
    private String notes;
    private String agentType;
    private TransferContext currentContext;
}
