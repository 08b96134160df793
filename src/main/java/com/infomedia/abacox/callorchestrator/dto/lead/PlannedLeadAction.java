package com.infomedia.abacox.callorchestrator.dto.lead;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class PlannedLeadAction {
    private Type type;
    private String serviceType;
    private String urgency;
    private String message;
    private Instant scheduleFor;
    private Double amount;
    private String paymentMethod;

    public enum Type {
        SCHEDULE_APPOINTMENT,
        SEND_FOLLOWUP_SMS,
        PROCESS_PAYMENT
    }
}
