package com.infomedia.abacox.callorchestrator.component.durable;

public class WorkflowAlreadyStartedException extends RuntimeException {
    public WorkflowAlreadyStartedException(String workflowId) {
        super("Workflow " + workflowId + " has already been started");
    }
}
