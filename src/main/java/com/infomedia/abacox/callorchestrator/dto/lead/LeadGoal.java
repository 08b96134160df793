package com.infomedia.abacox.callorchestrator.dto.lead;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum LeadGoal {
    QUALIFICATION,
    APPOINTMENT,
    FOLLOW_UP;

    @JsonCreator
    public static LeadGoal fromValue(String value) {
        return value == null ? null : LeadGoal.valueOf(value.trim().toUpperCase());
    }
}
