package com.infomedia.abacox.callorchestrator.component.callactivities;

import com.infomedia.abacox.callorchestrator.component.activity.ActivityContext;
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

/**
 * {@link CallActivities} served by the remote activity service. Each operation reports a
 * heartbeat before the blocking HTTP call.
 */
@RequiredArgsConstructor
public class HttpCallActivities implements CallActivities {

    private final ActivityServiceClient client;

    @Override
    public TranscriptAnalysisResult processCallTranscript(TranscriptAnalysisRequest request) {
        ActivityContext.heartbeat("Processing transcript");
        return client.invoke("processCallTranscript", request, TranscriptAnalysisResult.class);
    }

    @Override
    public CallAnalysis analyzeCallSentiment(CallAnalysisRequest request) {
        ActivityContext.heartbeat("Analyzing call sentiment");
        return client.invoke("analyzeCallSentiment", request, CallAnalysis.class);
    }

    @Override
    public CustomerInfo extractCustomerInfo(CustomerInfoRequest request) {
        ActivityContext.heartbeat("Extracting customer info");
        return client.invoke("extractCustomerInfo", request, CustomerInfo.class);
    }

    @Override
    public Double updateLeadScore(LeadScoreRequest request) {
        ActivityContext.heartbeat("Updating lead score");
        return client.invoke("updateLeadScore", request, Double.class, request.getIdempotencyKey());
    }

    @Override
    public void scheduleFollowUp(FollowUpRequest request) {
        ActivityContext.heartbeat("Scheduling follow-up");
        client.invoke("scheduleFollowUp", request, Void.class, request.getIdempotencyKey());
    }

    @Override
    public void sendNotification(NotificationRequest request) {
        ActivityContext.heartbeat("Sending notification");
        client.invoke("sendNotification", request, Void.class, request.getIdempotencyKey());
    }

    @Override
    public void createCallRecord(CreateCallRecordRequest request) {
        ActivityContext.heartbeat("Creating call record");
        client.invoke("createCallRecord", request, Void.class);
    }

    @Override
    public void updateCallRecord(UpdateCallRecordRequest request) {
        ActivityContext.heartbeat("Updating call record");
        client.invoke("updateCallRecord", request, Void.class);
    }

    @Override
    public String generateCallSummary(CallSummaryRequest request) {
        ActivityContext.heartbeat("Generating call summary");
        return client.invoke("generateCallSummary", request, String.class);
    }

    @Override
    public QualityCheckResult performQualityCheck(QualityCheckRequest request) {
        ActivityContext.heartbeat("Performing quality check");
        return client.invoke("performQualityCheck", request, QualityCheckResult.class);
    }

    @Override
    public void triggerIntegrations(IntegrationTriggerRequest request) {
        ActivityContext.heartbeat("Triggering integrations");
        client.invoke("triggerIntegrations", request, Void.class);
    }

    @Override
    public void calculateMetrics(MetricsRequest request) {
        ActivityContext.heartbeat("Calculating metrics");
        client.invoke("calculateMetrics", request, Void.class);
    }

    @Override
    public void storeAnalytics(AnalyticsRequest request) {
        ActivityContext.heartbeat("Storing analytics");
        client.invoke("storeAnalytics", request, Void.class);
    }

    @Override
    public void handleCallTransfer(CallTransferRequest request) {
        ActivityContext.heartbeat("Handling call transfer");
        client.invoke("handleCallTransfer", request, Void.class);
    }

    @Override
    public void processPayment(PaymentRequest request) {
        ActivityContext.heartbeat("Processing payment");
        client.invoke("processPayment", request, Void.class, request.getIdempotencyKey());
    }

    @Override
    public void scheduleAppointment(AppointmentRequest request) {
        ActivityContext.heartbeat("Scheduling appointment");
        client.invoke("scheduleAppointment", request, Void.class, request.getIdempotencyKey());
    }

    @Override
    public void sendSms(SmsRequest request) {
        ActivityContext.heartbeat("Sending SMS");
        client.invoke("sendSMS", request, Void.class, request.getIdempotencyKey());
    }

    @Override
    public void updateCrm(CrmUpdateRequest request) {
        ActivityContext.heartbeat("Updating CRM");
        client.invoke("updateCRM", request, Void.class, request.getIdempotencyKey());
    }

    @Override
    public void triggerAutomations(AutomationTriggerRequest request) {
        ActivityContext.heartbeat("Triggering automations");
        client.invoke("triggerAutomations", request, Void.class, request.getIdempotencyKey());
    }
}
