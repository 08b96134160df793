package com.infomedia.abacox.callorchestrator.dto.activity;

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
public class TransferContext {
    private double leadScore;
    private QualificationStatus qualification;
    private List<TranscriptEvent> transcripts;
}
