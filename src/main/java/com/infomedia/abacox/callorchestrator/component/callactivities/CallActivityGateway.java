package com.infomedia.abacox.callorchestrator.component.callactivities;

import com.infomedia.abacox.callorchestrator.component.activity.ActivityCall;
import com.infomedia.abacox.callorchestrator.component.activity.ActivityExecutor;
import com.infomedia.abacox.callorchestrator.component.postcall.PostCallJobScheduler;
import com.infomedia.abacox.callorchestrator.dto.activity.AnalyticsRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.AppointmentRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.AutomationTriggerRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.CallAnalysis;
import com.infomedia.abacox.callorchestrator.dto.activity.CallAnalysisRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.CallSummaryRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.CallTransferRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.CreateCallRecordRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.CrmUpdateRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.CustomerInfo;
import com.infomedia.abacox.callorchestrator.dto.activity.CustomerInfoRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.FollowUpRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.IntegrationTriggerRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.LeadScoreRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.MetricsRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.NotificationRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.PaymentRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.QualityCheckRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.QualityCheckResult;
import com.infomedia.abacox.callorchestrator.dto.activity.SmsRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.TranscriptAnalysisRequest;
import com.infomedia.abacox.callorchestrator.dto.activity.TranscriptAnalysisResult;
import com.infomedia.abacox.callorchestrator.dto.activity.UpdateCallRecordRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;

/**
 * Builds {@link ActivityCall}s for every call activity. Running a call goes through the
 * {@link ActivityExecutor}, so each one carries the configured timeout and retry policy.
 * Workflows pass the calls to their context; other callers use {@link ActivityCall#invoke()}.
 */
@Component
@RequiredArgsConstructor
public class CallActivityGateway {

    private final CallActivities activities;
    private final ActivityExecutor activityExecutor;
    private final PostCallJobScheduler postCallJobScheduler;

    public ActivityCall<TranscriptAnalysisResult> processCallTranscript(TranscriptAnalysisRequest request) {
        return call("processCallTranscript", TranscriptAnalysisResult.class, () -> activities.processCallTranscript(request));
    }

    public ActivityCall<CallAnalysis> analyzeCallSentiment(CallAnalysisRequest request) {
        return call("analyzeCallSentiment", CallAnalysis.class, () -> activities.analyzeCallSentiment(request));
    }

    public ActivityCall<CustomerInfo> extractCustomerInfo(CustomerInfoRequest request) {
        return call("extractCustomerInfo", CustomerInfo.class, () -> activities.extractCustomerInfo(request));
    }

    public ActivityCall<Double> updateLeadScore(LeadScoreRequest request) {
        return call("updateLeadScore", Double.class, () -> activities.updateLeadScore(request));
    }

    public ActivityCall<Void> scheduleFollowUp(FollowUpRequest request) {
        return call("scheduleFollowUp", Void.class, () -> {
            activities.scheduleFollowUp(request);
            return null;
        });
    }

    public ActivityCall<Void> sendNotification(NotificationRequest request) {
        return call("sendNotification", Void.class, () -> {
            activities.sendNotification(request);
            return null;
        });
    }

    public ActivityCall<Void> createCallRecord(CreateCallRecordRequest request) {
        return call("createCallRecord", Void.class, () -> {
            activities.createCallRecord(request);
            return null;
        });
    }

    public ActivityCall<Void> updateCallRecord(UpdateCallRecordRequest request) {
        return call("updateCallRecord", Void.class, () -> {
            activities.updateCallRecord(request);
            return null;
        });
    }

    public ActivityCall<String> generateCallSummary(CallSummaryRequest request) {
        return call("generateCallSummary", String.class, () -> activities.generateCallSummary(request));
    }

    public ActivityCall<QualityCheckResult> performQualityCheck(QualityCheckRequest request) {
        return call("performQualityCheck", QualityCheckResult.class, () -> activities.performQualityCheck(request));
    }

    public ActivityCall<Void> triggerIntegrations(IntegrationTriggerRequest request) {
        return call("triggerIntegrations", Void.class, () -> {
            activities.triggerIntegrations(request);
            return null;
        });
    }

    public ActivityCall<Void> calculateMetrics(MetricsRequest request) {
        return call("calculateMetrics", Void.class, () -> {
            activities.calculateMetrics(request);
            return null;
        });
    }

    public ActivityCall<Void> storeAnalytics(AnalyticsRequest request) {
        return call("storeAnalytics", Void.class, () -> {
            activities.storeAnalytics(request);
            return null;
        });
    }

    public ActivityCall<Void> handleCallTransfer(CallTransferRequest request) {
        return call("handleCallTransfer", Void.class, () -> {
            activities.handleCallTransfer(request);
            return null;
        });
    }

    public ActivityCall<Void> processPayment(PaymentRequest request) {
        return call("processPayment", Void.class, () -> {
            activities.processPayment(request);
            return null;
        });
    }

    public ActivityCall<Void> scheduleAppointment(AppointmentRequest request) {
        return call("scheduleAppointment", Void.class, () -> {
            activities.scheduleAppointment(request);
            return null;
        });
    }

    public ActivityCall<Void> sendSms(SmsRequest request) {
        return call("sendSms", Void.class, () -> {
            activities.sendSms(request);
            return null;
        });
    }

    public ActivityCall<Void> updateCrm(CrmUpdateRequest request) {
        return call("updateCrm", Void.class, () -> {
            activities.updateCrm(request);
            return null;
        });
    }

    public ActivityCall<Void> triggerAutomations(AutomationTriggerRequest request) {
        return call("triggerAutomations", Void.class, () -> {
            activities.triggerAutomations(request);
            return null;
        });
    }

    /**
     * Hands the finished call to the post-call recovery loop. Idempotent on the call id.
     */
    public ActivityCall<Long> enqueuePostCallJob(String callId, String leadId, String tenantId) {
        return call("enqueuePostCallJob", Long.class, () -> postCallJobScheduler.enqueue(callId, leadId, tenantId));
    }

    private <T> ActivityCall<T> call(String name, Class<T> resultType, Callable<T> body) {
        return new ActivityCall<>(name, resultType, () -> activityExecutor.execute(name, body));
    }
}
