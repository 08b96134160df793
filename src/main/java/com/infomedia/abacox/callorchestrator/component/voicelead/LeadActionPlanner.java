package com.infomedia.abacox.callorchestrator.component.voicelead;

import com.infomedia.abacox.callorchestrator.dto.activity.CallAnalysis;
import com.infomedia.abacox.callorchestrator.dto.lead.LeadGoal;
import com.infomedia.abacox.callorchestrator.dto.lead.PlannedLeadAction;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides what to do with a scored lead.
 */
public final class LeadActionPlanner {

    static final double APPOINTMENT_THRESHOLD = 8;
    static final double FOLLOW_UP_THRESHOLD = 6;
    static final double PAYMENT_THRESHOLD = 7;
    static final Duration FOLLOW_UP_DELAY = Duration.ofMinutes(10);
    static final String FOLLOW_UP_MESSAGE = "Thanks for your time today! I'll send you the information we discussed.";

    private LeadActionPlanner() {
    }

    public static List<PlannedLeadAction> plan(CallAnalysis analysis, double leadScore, LeadGoal goal, Instant now) {
        List<PlannedLeadAction> actions = new ArrayList<>();

        if (leadScore >= APPOINTMENT_THRESHOLD && goal == LeadGoal.APPOINTMENT) {
            String service = analysis != null && analysis.getServiceNeeded() != null
                    ? analysis.getServiceNeeded() : "consultation";
            actions.add(PlannedLeadAction.builder()
                    .type(PlannedLeadAction.Type.SCHEDULE_APPOINTMENT)
                    .urgency("high")
                    .serviceType(service)
                    .build());
        }

        if (leadScore >= FOLLOW_UP_THRESHOLD && leadScore < APPOINTMENT_THRESHOLD) {
            actions.add(PlannedLeadAction.builder()
                    .type(PlannedLeadAction.Type.SEND_FOLLOWUP_SMS)
                    .message(FOLLOW_UP_MESSAGE)
                    .scheduleFor(now.plus(FOLLOW_UP_DELAY))
                    .build());
        }

        if (analysis != null && Boolean.TRUE.equals(analysis.getPaymentInterest()) && leadScore >= PAYMENT_THRESHOLD) {
            actions.add(PlannedLeadAction.builder()
                    .type(PlannedLeadAction.Type.PROCESS_PAYMENT)
                    .amount(analysis.getProposedAmount())
                    .paymentMethod("card")
                    .build());
        }
        return actions;
    }
}
