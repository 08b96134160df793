package com.infomedia.abacox.callorchestrator.dto.activity;

import com.infomedia.abacox.callorchestrator.dto.call.FunctionCallEvent;
import com.infomedia.abacox.callorchestrator.dto.call.QualificationStatus;
import com.infomedia.abacox.callorchestrator.dto.call.TranscriptEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CallSummaryRequest {
    private String callId;
    private String tenantId;
    private List<TranscriptEvent> transcripts;
    private List<FunctionCallEvent> functionCalls;
    private QualificationStatus qualification;
    private double leadScore;
    private long duration;
}
