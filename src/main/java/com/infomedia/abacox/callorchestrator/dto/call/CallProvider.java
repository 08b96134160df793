package com.infomedia.abacox.callorchestrator.dto.call;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum CallProvider {
    VAPI,
    TWILIO;

    @JsonCreator
    public static CallProvider fromValue(String value) {
        return value == null ? null : CallProvider.valueOf(value.trim().toUpperCase());
    }
}
