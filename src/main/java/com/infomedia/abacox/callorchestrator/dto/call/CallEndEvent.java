package com.infomedia.abacox.callorchestrator.dto.call;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CallEndEvent {
    private Instant endTime;
    /**
     * Seconds.
     */
    private Long duration;
    /**
     * {@code completed}, {@code failed} or {@code cancelled}.
     */
    private String status;
    private String reason;
    private String summary;
}
