package com.infomedia.abacox.callorchestrator.component.callactivities;

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

/**
 * External operations used by the call and lead workflows and by the post-call loop.
 * Implementations throw {@link com.infomedia.abacox.callorchestrator.component.activity.ActivityValidationException}
 * or {@link com.infomedia.abacox.callorchestrator.component.activity.ActivityAuthenticationException}
 * for failures that must not be retried; any other exception is retried.
 */
public interface CallActivities {

    TranscriptAnalysisResult processCallTranscript(TranscriptAnalysisRequest request);

    CallAnalysis analyzeCallSentiment(CallAnalysisRequest request);

    CustomerInfo extractCustomerInfo(CustomerInfoRequest request);

    /**
     * @return the lead score after the update
     */
    Double updateLeadScore(LeadScoreRequest request);

    void scheduleFollowUp(FollowUpRequest request);

    void sendNotification(NotificationRequest request);

    void createCallRecord(CreateCallRecordRequest request);

    void updateCallRecord(UpdateCallRecordRequest request);

    String generateCallSummary(CallSummaryRequest request);

    QualityCheckResult performQualityCheck(QualityCheckRequest request);

    void triggerIntegrations(IntegrationTriggerRequest request);

    void calculateMetrics(MetricsRequest request);

    void storeAnalytics(AnalyticsRequest request);

    void handleCallTransfer(CallTransferRequest request);

    void processPayment(PaymentRequest request);

    void scheduleAppointment(AppointmentRequest request);

    void sendSms(SmsRequest request);

    void updateCrm(CrmUpdateRequest request);

    void triggerAutomations(AutomationTriggerRequest request);
}
