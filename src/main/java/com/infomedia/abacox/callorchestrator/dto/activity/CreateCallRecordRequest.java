package com.infomedia.abacox.callorchestrator.dto.activity;

import com.infomedia.abacox.callorchestrator.dto.call.CallProvider;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CreateCallRecordRequest {
    private String callId;
    private String tenantId;
    private String phoneNumber;
    private CallProvider provider;
    private Instant startTime;
    private Map<String, Object> metadata;
}
