package com.infomedia.abacox.callorchestrator.dto.activity;

import com.infomedia.abacox.callorchestrator.dto.call.QualificationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class UpdateCallRecordRequest {
    private String callId;
    private String tenantId;
    private Instant endTime;
    /**
     * {@code transferred} or {@code completed}.
     */
    private String status;
    private String summary;
    private double leadScore;
    private QualificationStatus qualification;
    private int transcriptCount;
    private int functionCallCount;
}
