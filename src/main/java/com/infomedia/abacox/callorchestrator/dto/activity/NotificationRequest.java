package com.infomedia.abacox.callorchestrator.dto.activity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class NotificationRequest {
    private String tenantId;
    private String userId;
    private String type;
    private String message;
    private String callId;
    private String leadId;
    private String idempotencyKey;
}
