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
public class TranscriptAnalysisRequest {
    private String callId;
    private String tenantId;
    private String transcript;
    private String speaker;
    private Instant timestamp;
    private TranscriptAnalysisContext context;
}
