package com.infomedia.abacox.callorchestrator.component.callworkflow;

import com.infomedia.abacox.callorchestrator.component.durable.QueryChannel;
import com.infomedia.abacox.callorchestrator.component.durable.SignalChannel;
import com.infomedia.abacox.callorchestrator.dto.call.CallEndEvent;
import com.infomedia.abacox.callorchestrator.dto.call.CallMetrics;
import com.infomedia.abacox.callorchestrator.dto.call.CallStatus;
import com.infomedia.abacox.callorchestrator.dto.call.FunctionCallEvent;
import com.infomedia.abacox.callorchestrator.dto.call.TranscriptEvent;
import com.infomedia.abacox.callorchestrator.dto.call.TransferRequest;

/**
 * Names and payload types of the channels of the call lifecycle workflow.
 */
public final class CallChannels {

    public static final String WORKFLOW_TYPE = "enhancedVoiceCallWorkflow";
    public static final String WORKFLOW_ID_PREFIX = "voice-call-";

    public static final SignalChannel<TranscriptEvent> TRANSCRIPT = SignalChannel.of("transcript", TranscriptEvent.class);
    public static final SignalChannel<FunctionCallEvent> FUNCTION_CALL = SignalChannel.of("function-call", FunctionCallEvent.class);
    public static final SignalChannel<CallEndEvent> CALL_END = SignalChannel.of("call-end", CallEndEvent.class);
    public static final SignalChannel<TransferRequest> TRANSFER_REQUEST = SignalChannel.of("transfer-request", TransferRequest.class);

    public static final QueryChannel<CallStatus> CALL_STATUS = QueryChannel.of("call-status", CallStatus.class);
    public static final QueryChannel<CallMetrics> CALL_METRICS = QueryChannel.of("call-metrics", CallMetrics.class);
    public static final QueryChannel<Double> LEAD_SCORE = QueryChannel.of("lead-score", Double.class);

    private CallChannels() {
    }

    public static String workflowId(String callId) {
        return WORKFLOW_ID_PREFIX + callId;
    }

    public static String leadId(String callId) {
        return callId + "_lead";
    }
}
