package com.infomedia.abacox.callorchestrator.component.callworkflow;

import com.infomedia.abacox.callorchestrator.component.callactivities.CallActivityGateway;
import com.infomedia.abacox.callorchestrator.component.durable.WorkflowContext;
import com.infomedia.abacox.callorchestrator.dto.activity.NotificationRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.UrgentAction;
import com.infomedia.abacox.callorchestrator.dto.call.CallContext;
import lombok.extern.log4j.Log4j2;

/**
 * Reacts to urgent actions flagged by a transcript analysis.
 */
@Log4j2
class UrgentActionDispatcher {

    private final WorkflowContext context;
    private final CallActivityGateway activities;
    private final CallContext call;
    private final CallWorkflowState state;

    UrgentActionDispatcher(WorkflowContext context, CallActivityGateway activities, CallContext call,
                           CallWorkflowState state) {
        this.context = context;
        this.activities = activities;
        this.call = call;
        this.state = state;
    }

    void dispatch(UrgentAction action, String idempotencyKey) {
        String type = action.getType() == null ? "" : action.getType();
        switch (type) {
            case "alert_manager" -> context.execute(activities.sendNotification(NotificationRequest.builder()
                    .tenantId(call.getTenantId())
                    .userId(action.getManagerId())
                    .type("urgent_call_alert")
                    .message("Urgent attention needed on call " + call.getCallId() + ": " + action.getReason())
                    .callId(call.getCallId())
                    .idempotencyKey(idempotencyKey)
                    .build()));
            case "escalate_pricing", "offer_discount" -> state.addNextAction(type);
            case "transfer_call" -> state.requestTransfer();
            default -> log.warn("Ignoring unknown urgent action '{}' on call {}", type, call.getCallId());
        }
    }
}
