package com.infomedia.abacox.callorchestrator.component.callworkflow;

import com.infomedia.abacox.callorchestrator.component.callactivities.CallActivityGateway;
import com.infomedia.abacox.callorchestrator.component.durable.WorkflowContext;
import com.infomedia.abacox.callorchestrator.dto.activity.AppointmentRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.CallTransferRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.LeadScoreRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.SmsRequest;
import com.infomedia.abacox.callorchestrator.dto.call.CallContext;
import com.infomedia.abacox.callorchestrator.dto.call.FunctionCallEvent;

import java.time.Instant;

/**
 * Command table for the function calls the voice assistant makes during a call.
 */
class FunctionCallDispatcher {

    static final String UPDATE_QUALIFICATION_SCORE = "update_qualification_score";
    static final String SCHEDULE_APPOINTMENT = "schedule_appointment";
    static final String TRANSFER_TO_HUMAN = "transfer_to_human";
    static final String SEND_FOLLOW_UP_SMS = "send_follow_up_sms";

    private final WorkflowContext context;
    private final CallActivityGateway activities;
    private final CallContext call;
    private final CallWorkflowState state;

    FunctionCallDispatcher(WorkflowContext context, CallActivityGateway activities, CallContext call,
                           CallWorkflowState state) {
        this.context = context;
        this.activities = activities;
        this.call = call;
        this.state = state;
    }

    /**
     * @param sequence position of the event in the function call log, used for idempotency keys
     * @throws UnknownFunctionException if the function name has no command
     */
    void dispatch(FunctionCallEvent event, int sequence) {
        String functionName = event.getFunctionName();
        if (functionName == null) {
            throw new UnknownFunctionException(null);
        }
        switch (functionName) {
            case UPDATE_QUALIFICATION_SCORE -> updateQualificationScore(event, sequence);
            case SCHEDULE_APPOINTMENT -> scheduleAppointment(event, sequence);
            case TRANSFER_TO_HUMAN -> transferToHuman(event);
            case SEND_FOLLOW_UP_SMS -> sendFollowUpSms(event, sequence);
            default -> throw new UnknownFunctionException(functionName);
        }
    }

    private void updateQualificationScore(FunctionCallEvent event, int sequence) {
        double score = asDouble(event.parameter("score"));
        String reasoning = asString(event.parameter("reasoning"));
        context.execute(activities.updateLeadScore(LeadScoreRequest.builder()
                .leadId(CallChannels.leadId(call.getCallId()))
                .tenantId(call.getTenantId())
                .adjustment(score)
                .reason(reasoning != null ? reasoning : "real_time_qualification")
                .idempotencyKey(idempotencyKey(sequence))
                .build()));
        state.raiseLeadScore(score);
    }

    private void scheduleAppointment(FunctionCallEvent event, int sequence) {
        context.execute(activities.scheduleAppointment(AppointmentRequest.builder()
                .leadId(CallChannels.leadId(call.getCallId()))
                .tenantId(call.getTenantId())
                .serviceType(asString(event.parameter("serviceType")))
                .preferredDate(asString(event.parameter("preferredDate")))
                .preferredTime(asString(event.parameter("preferredTime")))
                .urgency(asString(event.parameter("urgency")))
                .idempotencyKey(idempotencyKey(sequence))
                .build()));
        state.addNextAction("appointment_scheduled");
    }

    private void transferToHuman(FunctionCallEvent event) {
        // The flag holds even if the hand-off below fails
        state.requestTransfer();
        context.execute(activities.handleCallTransfer(CallTransferRequest.builder()
                .callId(call.getCallId())
                .tenantId(call.getTenantId())
                .reason(asString(event.parameter("reason")))
                .priority(asString(event.parameter("priority")))
                .notes(asString(event.parameter("notes")))
                .agentType(asString(event.parameter("agentType")))
                .currentContext(state.transferContext(CallLifecycleWorkflow.TRANSFER_TRANSCRIPT_WINDOW))
                .build()));
        state.addNextAction("transferred_to_human");
    }

    private void sendFollowUpSms(FunctionCallEvent event, int sequence) {
        String phoneNumber = asString(event.parameter("phoneNumber"));
        context.execute(activities.sendSms(SmsRequest.builder()
                .phoneNumber(phoneNumber != null ? phoneNumber : call.getPhoneNumber())
                .tenantId(call.getTenantId())
                .message(asString(event.parameter("message")))
                .scheduleFor(asInstant(event.parameter("scheduleFor")))
                .idempotencyKey(idempotencyKey(sequence))
                .build()));
        state.addNextAction("follow_up_sms_scheduled");
    }

    private String idempotencyKey(int sequence) {
        return "call:" + call.getCallId() + ":function:" + sequence;
    }

    static double asDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a number: " + text, e);
            }
        }
        return 0;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static Instant asInstant(Object value) {
        return value == null ? null : Instant.parse(value.toString());
    }
}
