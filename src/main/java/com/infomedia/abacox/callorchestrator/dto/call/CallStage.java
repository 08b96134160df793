package com.infomedia.abacox.callorchestrator.dto.call;

public enum CallStage {
    STARTING,
    ACTIVE,
    PROCESSING,
    COMPLETING,
    COMPLETED,
    FAILED
}
