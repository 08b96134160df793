package com.infomedia.abacox.callorchestrator.component.postcall;

import com.infomedia.abacox.callorchestrator.component.callactivities.CallActivityGateway;
import com.infomedia.abacox.callorchestrator.db.entity.PostCallJob;
import com.infomedia.abacox.callorchestrator.dto.activity.AutomationTriggerRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.CrmUpdateRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.FollowUpRecommendation;
import com.infomedia.abacox.callorchestrator.dto.activity.FollowUpRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.LeadScoreRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.NotificationInstruction;
import com.infomedia.abacox.callorchestrator.dto.activity.NotificationRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.QualityCheckRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.QualityCheckResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * One run of a post-call job. Every run starts from the quality check; side effects carry
 * idempotency keys derived from the call id so a repeated run does not repeat them downstream.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class PostCallProcessor {

    private final CallActivityGateway activities;

    public void process(PostCallJob job) {
        String callId = job.getCallId();
        String leadId = job.getLeadId();
        String tenantId = job.getTenantId();
        log.info("Starting post-call processing for call {} (lead {}), attempt {}", callId, leadId,
                job.getAttempts() + 1);

        QualityCheckResult quality = activities.performQualityCheck(QualityCheckRequest.builder()
                .callId(callId)
                .tenantId(tenantId)
                .leadId(leadId)
                .build()).invoke();
        if (quality == null) {
            quality = new QualityCheckResult();
        }

        if (quality.getScoreAdjustment() != null && quality.getScoreAdjustment() != 0) {
            activities.updateLeadScore(LeadScoreRequest.builder()
                    .leadId(leadId)
                    .tenantId(tenantId)
                    .adjustment(quality.getScoreAdjustment())
                    .reason("post_call_quality_analysis")
                    .idempotencyKey(key(callId, "score"))
                    .build()).invoke();
        }

        FollowUpRecommendation followUp = quality.getRecommendedFollowUp();
        if (followUp != null) {
            activities.scheduleFollowUp(FollowUpRequest.builder()
                    .leadId(leadId)
                    .tenantId(tenantId)
                    .type(followUp.getType())
                    .scheduledFor(followUp.getScheduledFor())
                    .message(followUp.getMessage())
                    .idempotencyKey(key(callId, "follow-up"))
                    .build()).invoke();
        }

        List<NotificationInstruction> notifications = quality.getNotifications();
        if (notifications != null) {
            for (int i = 0; i < notifications.size(); i++) {
                NotificationInstruction notification = notifications.get(i);
                activities.sendNotification(NotificationRequest.builder()
                        .tenantId(tenantId)
                        .userId(notification.getUserId())
                        .type(notification.getType())
                        .message(notification.getMessage())
                        .callId(callId)
                        .leadId(leadId)
                        .idempotencyKey(key(callId, "notification:" + i))
                        .build()).invoke();
            }
        }

        activities.updateCrm(CrmUpdateRequest.builder()
                .leadId(leadId)
                .tenantId(tenantId)
                .callId(callId)
                .qualityData(quality)
                .idempotencyKey(key(callId, "crm"))
                .build()).invoke();

        List<String> triggers = quality.getMarketingTriggers();
        if (triggers != null && !triggers.isEmpty()) {
            activities.triggerAutomations(AutomationTriggerRequest.builder()
                    .leadId(leadId)
                    .tenantId(tenantId)
                    .triggers(triggers)
                    .idempotencyKey(key(callId, "automations"))
                    .build()).invoke();
        }

        log.info("Post-call processing completed for call {} (lead {})", callId, leadId);
    }

    static String key(String callId, String step) {
        return "post-call:" + callId + ":" + step;
    }
}
