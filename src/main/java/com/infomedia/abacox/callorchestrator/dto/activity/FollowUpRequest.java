package com.infomedia.abacox.callorchestrator.dto.activity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class FollowUpRequest {
    private String leadId;
    private String tenantId;
    private String type;
    private Instant scheduledFor;
    private String message;
    private String idempotencyKey;
}
