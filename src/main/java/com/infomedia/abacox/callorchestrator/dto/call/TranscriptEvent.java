package com.infomedia.abacox.callorchestrator.dto.call;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TranscriptEvent {
    private Instant timestamp;
    /**
     * {@code user} or {@code assistant}.
     */
    @NotBlank
    private String speaker;
    @NotNull
    private String text;
    private Double confidence;
    private List<EmotionData> emotions;
    private List<String> keywords;
}
