package com.infomedia.abacox.callorchestrator.dto.call;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Progress and qualification state of a call, as returned by the status query and as the
 * workflow result.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CallStatus {
    private CallStage stage;
    private int progress;
    private String currentActivity;
    private double leadScore;
    private QualificationStatus qualificationStatus;
    @Builder.Default
    private List<String> nextActions = new ArrayList<>();
    private int errorCount;

    public static CallStatus initial() {
        return CallStatus.builder()
                .stage(CallStage.STARTING)
                .qualificationStatus(QualificationStatus.unknown())
                .build();
    }

    public CallStatus copy() {
        return CallStatus.builder()
                .stage(stage)
                .progress(progress)
                .currentActivity(currentActivity)
                .leadScore(leadScore)
                .qualificationStatus(qualificationStatus == null ? null : qualificationStatus.copy())
                .nextActions(new ArrayList<>(nextActions))
                .errorCount(errorCount)
                .build();
    }
}
