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
import lombok.Setter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Records every activity invocation with its request and answers with canned results.
 * Activities configured through {@link #failWith(String, RuntimeException)} throw on every attempt.
 */
public class RecordingCallActivities implements CallActivities {

    public record Invocation(String activity, Object request) {
    }

    private final List<Invocation> invocations = new CopyOnWriteArrayList<>();
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();

    @Setter
    private volatile Function<TranscriptAnalysisRequest, TranscriptAnalysisResult> transcriptAnalysis = request -> null;
    @Setter
    private volatile CallAnalysis callAnalysis;
    @Setter
    private volatile CustomerInfo customerInfo;
    @Setter
    private volatile Double leadScore = 5.0;
    @Setter
    private volatile String summary = "Caller asked about pricing.";
    @Setter
    private volatile QualityCheckResult qualityCheck = QualityCheckResult.builder().build();

    public void failWith(String activity, RuntimeException failure) {
        failures.put(activity, failure);
    }

    public void recover(String activity) {
        failures.remove(activity);
    }

    public List<Invocation> invocations() {
        return List.copyOf(invocations);
    }

    public List<String> names() {
        return invocations.stream().map(Invocation::activity).toList();
    }

    public int count(String activity) {
        return (int) invocations.stream().filter(i -> i.activity().equals(activity)).count();
    }

    public <T> List<T> requests(String activity, Class<T> type) {
        return invocations.stream()
                .filter(i -> i.activity().equals(activity))
                .map(i -> type.cast(i.request()))
                .toList();
    }

    @Override
    public TranscriptAnalysisResult processCallTranscript(TranscriptAnalysisRequest request) {
        return record("processCallTranscript", request, () -> transcriptAnalysis.apply(request));
    }

    @Override
    public CallAnalysis analyzeCallSentiment(CallAnalysisRequest request) {
        return record("analyzeCallSentiment", request, () -> callAnalysis);
    }

    @Override
    public CustomerInfo extractCustomerInfo(CustomerInfoRequest request) {
        return record("extractCustomerInfo", request, () -> customerInfo);
    }

    @Override
    public Double updateLeadScore(LeadScoreRequest request) {
        return record("updateLeadScore", request, () -> leadScore);
    }

    @Override
    public void scheduleFollowUp(FollowUpRequest request) {
        record("scheduleFollowUp", request, () -> null);
    }

    @Override
    public void sendNotification(NotificationRequest request) {
        record("sendNotification", request, () -> null);
    }

    @Override
    public void createCallRecord(CreateCallRecordRequest request) {
        record("createCallRecord", request, () -> null);
    }

    @Override
    public void updateCallRecord(UpdateCallRecordRequest request) {
        record("updateCallRecord", request, () -> null);
    }

    @Override
    public String generateCallSummary(CallSummaryRequest request) {
        return record("generateCallSummary", request, () -> summary);
    }

    @Override
    public QualityCheckResult performQualityCheck(QualityCheckRequest request) {
        return record("performQualityCheck", request, () -> qualityCheck);
    }

    @Override
    public void triggerIntegrations(IntegrationTriggerRequest request) {
        record("triggerIntegrations", request, () -> null);
    }

    @Override
    public void calculateMetrics(MetricsRequest request) {
        record("calculateMetrics", request, () -> null);
    }

    @Override
    public void storeAnalytics(AnalyticsRequest request) {
        record("storeAnalytics", request, () -> null);
    }

    @Override
    public void handleCallTransfer(CallTransferRequest request) {
        record("handleCallTransfer", request, () -> null);
    }

    @Override
    public void processPayment(PaymentRequest request) {
        record("processPayment", request, () -> null);
    }

    @Override
    public void scheduleAppointment(AppointmentRequest request) {
        record("scheduleAppointment", request, () -> null);
    }

    @Override
    public void sendSms(SmsRequest request) {
        record("sendSms", request, () -> null);
    }

    @Override
    public void updateCrm(CrmUpdateRequest request) {
        record("updateCrm", request, () -> null);
    }

    @Override
    public void triggerAutomations(AutomationTriggerRequest request) {
        record("triggerAutomations", request, () -> null);
    }

    private <T> T record(String activity, Object request, Supplier<T> result) {
        invocations.add(new Invocation(activity, request));
        RuntimeException failure = failures.get(activity);
        if (failure != null) {
            throw failure;
        }
        return result.get();
    }
}
