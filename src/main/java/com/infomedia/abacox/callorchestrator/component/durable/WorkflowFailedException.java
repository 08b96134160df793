package com.infomedia.abacox.callorchestrator.component.durable;

import lombok.Getter;

@Getter
public class WorkflowFailedException extends RuntimeException {
    private final String workflowId;

    public WorkflowFailedException(String workflowId, String failure) {
        super("Workflow " + workflowId + " failed: " + failure);
        this.workflowId = workflowId;
    }
}
