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
public class SmsRequest {
    private String phoneNumber;
    private String tenantId;
    private String message;
    private Instant scheduleFor;
    private String idempotencyKey;
}
