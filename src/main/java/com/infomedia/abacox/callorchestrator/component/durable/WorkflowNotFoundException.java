package com.infomedia.abacox.callorchestrator.component.durable;

public class WorkflowNotFoundException extends RuntimeException {
    public WorkflowNotFoundException(String workflowId) {
        super("No workflow execution found with id " + workflowId);
    }
}
