package com.infomedia.abacox.callorchestrator.dto.activity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class AppointmentRequest {
    private String leadId;
    private String tenantId;
    private String serviceType;
    private String preferredDate;
    private String preferredTime;
    private String urgency;
    private String idempotencyKey;
}
