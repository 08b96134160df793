package com.infomedia.abacox.callorchestrator.dto.lead;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum LeadPriority {
    LOW,
    MEDIUM,
    HIGH;

    @JsonCreator
    public static LeadPriority fromValue(String value) {
        return value == null ? null : LeadPriority.valueOf(value.trim().toUpperCase());
    }
}
