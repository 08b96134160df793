package com.infomedia.abacox.callorchestrator.component.voicelead;

import com.infomedia.abacox.callorchestrator.component.durable.DurableExecutor;
import com.infomedia.abacox.callorchestrator.component.durable.WorkflowDescription;
import com.infomedia.abacox.callorchestrator.dto.lead.VoiceLeadInput;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Service
@Log4j2
@RequiredArgsConstructor
public class VoiceLeadService {

    private final DurableExecutor durableExecutor;

    public WorkflowDescription startLead(VoiceLeadInput input) {
        if (input.getStartTime() == null) {
            input.setStartTime(Instant.now());
        }
        WorkflowDescription description = durableExecutor.start(VoiceLeadWorkflow.WORKFLOW_TYPE,
                VoiceLeadWorkflow.workflowId(input.getCallId()), input);
        log.info("Started voice lead workflow {}", description.getWorkflowId());
        return description;
    }

    /**
     * @return the lead id once the workflow completed
     */
    public Optional<String> getLeadId(String callId) {
        return durableExecutor.awaitResult(VoiceLeadWorkflow.workflowId(callId), String.class, Duration.ZERO);
    }

    public WorkflowDescription describe(String callId) {
        return durableExecutor.describe(VoiceLeadWorkflow.workflowId(callId));
    }
}
