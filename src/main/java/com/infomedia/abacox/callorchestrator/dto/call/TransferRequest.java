package com.infomedia.abacox.callorchestrator.dto.call;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TransferRequest {
    private String reason;
    /**
     * {@code low}, {@code medium} or {@code high}.
     */
    private String priority;
    private String notes;
    private String agentType;
}
