package com.infomedia.abacox.callorchestrator.dto.lead;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Input of the voice lead workflow.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class VoiceLeadInput {
    @NotBlank
    @Size(max = 100)
    private String callId;
    @NotBlank
    private String phoneNumber;
    @NotBlank
    @Size(max = 100)
    private String tenantId;
    private String industry;
    @NotNull
    private LeadGoal goal;
    @Builder.Default
    private LeadPriority priority = LeadPriority.MEDIUM;
    private Map<String, Object> customerData;
    private Instant startTime;
}
