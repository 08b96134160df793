package com.infomedia.abacox.callorchestrator.dto.call;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response of the call result endpoint.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CallResult {
    private String callId;
    private String workflowId;
    private boolean completed;
    private CallStatus status;
}
