package com.infomedia.abacox.callorchestrator.component.voicelead;

import com.infomedia.abacox.callorchestrator.component.callactivities.CallActivityGateway;
import com.infomedia.abacox.callorchestrator.component.callworkflow.CallChannels;
import com.infomedia.abacox.callorchestrator.component.durable.WorkflowContext;
import com.infomedia.abacox.callorchestrator.component.durable.WorkflowDefinition;
import com.infomedia.abacox.callorchestrator.dto.activity.AppointmentRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.CallAnalysis;
import com.infomedia.abacox.callorchestrator.dto.activity.CallAnalysisRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.CustomerInfo;
import com.infomedia.abacox.callorchestrator.dto.activity.CustomerInfoRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.LeadScoreRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.MetricsRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.PaymentRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.SmsRequest;
import com.infomedia.abacox.callorchestrator.dto.lead.PlannedLeadAction;
import com.infomedia.abacox.callorchestrator.dto.lead.VoiceLeadInput;
import com.infomedia.abacox.callorchestrator.multitenancy.TenantContext;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Industry-aware processing of the lead produced by a call: enrich the customer, analyze
 * the call, score the lead and act on the score. Returns the lead id.
 */
@Log4j2
public class VoiceLeadWorkflow implements WorkflowDefinition<VoiceLeadInput, String> {

    public static final String WORKFLOW_TYPE = "enhancedVoiceLeadWorkflow";
    public static final String WORKFLOW_ID_PREFIX = "voice-lead-";

    private final CallActivityGateway activities;

    public VoiceLeadWorkflow(CallActivityGateway activities) {
        this.activities = activities;
    }

    public static String workflowId(String callId) {
        return WORKFLOW_ID_PREFIX + callId;
    }

    @Override
    public String run(WorkflowContext context, VoiceLeadInput input) {
        TenantContext.set(input.getTenantId(), input.getCallId());
        String leadId = CallChannels.leadId(input.getCallId());
        String goal = input.getGoal().name().toLowerCase();
        String priority = input.getPriority() == null ? null : input.getPriority().name().toLowerCase();
        if (!context.isReplaying()) {
            log.info("Starting voice lead workflow for call {} ({}, goal {})", input.getCallId(), input.getIndustry(),
                    goal);
        }

        CustomerInfo customer = context.execute(activities.extractCustomerInfo(CustomerInfoRequest.builder()
                .phoneNumber(input.getPhoneNumber())
                .tenantId(input.getTenantId())
                .industry(input.getIndustry())
                .existingData(input.getCustomerData())
                .build()));

        CallAnalysis analysis = context.execute(activities.analyzeCallSentiment(CallAnalysisRequest.builder()
                .callId(input.getCallId())
                .tenantId(input.getTenantId())
                .industry(input.getIndustry())
                .goal(goal)
                .customerContext(customer)
                .build()));

        Double score = context.execute(activities.updateLeadScore(LeadScoreRequest.builder()
                .leadId(leadId)
                .tenantId(input.getTenantId())
                .phoneNumber(input.getPhoneNumber())
                .analysis(analysis)
                .industry(input.getIndustry())
                .goal(goal)
                .priority(priority)
                .idempotencyKey("lead:" + leadId + ":score")
                .build()));
        double leadScore = score == null ? 0 : score;

        List<PlannedLeadAction> actions = LeadActionPlanner.plan(analysis, leadScore, input.getGoal(),
                context.getStartedAt());
        for (int i = 0; i < actions.size(); i++) {
            execute(context, input, leadId, actions.get(i), "lead:" + leadId + ":action:" + i);
        }

        Instant start = input.getStartTime() != null ? input.getStartTime() : context.getStartedAt();
        context.execute(activities.calculateMetrics(MetricsRequest.builder()
                .callId(input.getCallId())
                .tenantId(input.getTenantId())
                .industry(input.getIndustry())
                .goal(goal)
                .leadScore(leadScore)
                .actions(actions.size())
                .processingTimeMs(Math.max(0, Duration.between(start, Instant.now()).toMillis()))
                .build()));

        if (!context.isReplaying()) {
            log.info("Voice lead workflow for call {} finished with score {} and {} actions", input.getCallId(),
                    leadScore, actions.size());
        }
        return leadId;
    }

    private void execute(WorkflowContext context, VoiceLeadInput input, String leadId, PlannedLeadAction action,
                         String idempotencyKey) {
        switch (action.getType()) {
            case SCHEDULE_APPOINTMENT -> context.execute(activities.scheduleAppointment(AppointmentRequest.builder()
                    .leadId(leadId)
                    .tenantId(input.getTenantId())
                    .serviceType(action.getServiceType())
                    .urgency(action.getUrgency())
                    .idempotencyKey(idempotencyKey)
                    .build()));
            case SEND_FOLLOWUP_SMS -> context.execute(activities.sendSms(SmsRequest.builder()
                    .phoneNumber(input.getPhoneNumber())
                    .tenantId(input.getTenantId())
                    .message(action.getMessage())
                    .scheduleFor(action.getScheduleFor())
                    .idempotencyKey(idempotencyKey)
                    .build()));
            case PROCESS_PAYMENT -> context.execute(activities.processPayment(PaymentRequest.builder()
                    .leadId(leadId)
                    .tenantId(input.getTenantId())
                    .amount(action.getAmount())
                    .paymentMethod(action.getPaymentMethod())
                    .idempotencyKey(idempotencyKey)
                    .build()));
        }
    }
}
