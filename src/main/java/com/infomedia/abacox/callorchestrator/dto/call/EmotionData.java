package com.infomedia.abacox.callorchestrator.dto.call;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class EmotionData {
    private String emotion;
    private double intensity;
    private double confidence;
}
