package com.infomedia.abacox.callorchestrator.component.callworkflow;

import com.infomedia.abacox.callorchestrator.component.durable.DurableExecutor;
import com.infomedia.abacox.callorchestrator.component.durable.WorkflowDescription;
import com.infomedia.abacox.callorchestrator.dto.call.CallContext;
import com.infomedia.abacox.callorchestrator.dto.call.CallMetrics;
import com.infomedia.abacox.callorchestrator.dto.call.CallResult;
import com.infomedia.abacox.callorchestrator.dto.call.CallStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Call-level operations on top of the durable executor: start, signal, query, result.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class CallWorkflowService {

    private final DurableExecutor durableExecutor;

    public WorkflowDescription startCall(CallContext call) {
        if (call.getStartTime() == null) {
            call.setStartTime(Instant.now());
        }
        WorkflowDescription description = durableExecutor.start(CallChannels.WORKFLOW_TYPE,
                CallChannels.workflowId(call.getCallId()), call);
        log.info("Started call workflow {} for tenant {}", description.getWorkflowId(), call.getTenantId());
        return description;
    }

    public void signal(String callId, String channel, Object payload) {
        durableExecutor.signal(CallChannels.workflowId(callId), channel, payload);
    }

    public CallStatus getStatus(String callId) {
        return durableExecutor.query(CallChannels.workflowId(callId), CallChannels.CALL_STATUS);
    }

    public CallMetrics getMetrics(String callId) {
        return durableExecutor.query(CallChannels.workflowId(callId), CallChannels.CALL_METRICS);
    }

    public Double getLeadScore(String callId) {
        return durableExecutor.query(CallChannels.workflowId(callId), CallChannels.LEAD_SCORE);
    }

    /**
     * Final status once the workflow completed, otherwise the current status.
     *
     * @throws com.infomedia.abacox.callorchestrator.component.durable.WorkflowFailedException if the call failed
     */
    public CallResult getResult(String callId) {
        String workflowId = CallChannels.workflowId(callId);
        Optional<CallStatus> result = durableExecutor.awaitResult(workflowId, CallStatus.class, Duration.ZERO);
        return CallResult.builder()
                .callId(callId)
                .workflowId(workflowId)
                .completed(result.isPresent())
                .status(result.orElseGet(() -> getStatus(callId)))
                .build();
    }

    public WorkflowDescription describe(String callId) {
        return durableExecutor.describe(CallChannels.workflowId(callId));
    }
}
