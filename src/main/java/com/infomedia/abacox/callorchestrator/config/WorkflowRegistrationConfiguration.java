package com.infomedia.abacox.callorchestrator.config;

import com.infomedia.abacox.callorchestrator.component.callactivities.CallActivityGateway;
import com.infomedia.abacox.callorchestrator.component.callworkflow.CallChannels;
import com.infomedia.abacox.callorchestrator.component.callworkflow.CallLifecycleWorkflow;
import com.infomedia.abacox.callorchestrator.component.durable.WorkflowRegistration;
import com.infomedia.abacox.callorchestrator.component.voicelead.VoiceLeadWorkflow;
import com.infomedia.abacox.callorchestrator.dto.call.CallContext;
import com.infomedia.abacox.callorchestrator.dto.call.CallStatus;
import com.infomedia.abacox.callorchestrator.dto.lead.VoiceLeadInput;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Workflow types hosted by this worker.
 */
@Configuration
public class WorkflowRegistrationConfiguration {

    @Value("${call.max-duration:1h}")
    private Duration maxCallDuration;

    @Bean
    public WorkflowRegistration<CallContext, CallStatus> callLifecycleRegistration(CallActivityGateway gateway) {
        return WorkflowRegistration.<CallContext, CallStatus>builder()
                .type(CallChannels.WORKFLOW_TYPE)
                .inputType(CallContext.class)
                .resultType(CallStatus.class)
                .signalChannel(CallChannels.TRANSCRIPT)
                .signalChannel(CallChannels.FUNCTION_CALL)
                .signalChannel(CallChannels.CALL_END)
                .signalChannel(CallChannels.TRANSFER_REQUEST)
                .queryChannel(CallChannels.CALL_STATUS)
                .queryChannel(CallChannels.CALL_METRICS)
                .queryChannel(CallChannels.LEAD_SCORE)
                .factory(() -> new CallLifecycleWorkflow(gateway, maxCallDuration))
                .build();
    }

    @Bean
    public WorkflowRegistration<VoiceLeadInput, String> voiceLeadRegistration(CallActivityGateway gateway) {
        return WorkflowRegistration.<VoiceLeadInput, String>builder()
                .type(VoiceLeadWorkflow.WORKFLOW_TYPE)
                .inputType(VoiceLeadInput.class)
                .resultType(String.class)
                .factory(() -> new VoiceLeadWorkflow(gateway))
                .build();
    }
}
