package com.infomedia.abacox.callorchestrator.dto.call;

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
 * Identity of one call. Input of the call workflow; never changed after start.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CallContext {
    @NotBlank
    @Size(max = 100)
    private String callId;
    @NotBlank
    @Size(max = 100)
    private String tenantId;
    @NotBlank
    private String phoneNumber;
    @NotNull
    private CallProvider provider;
    private Instant startTime;
    private Map<String, Object> metadata;
}
