package com.infomedia.abacox.callorchestrator.component.durable;

public class UnknownWorkflowTypeException extends RuntimeException {
    public UnknownWorkflowTypeException(String workflowType) {
        super("No workflow registered for type '" + workflowType + "'");
    }
}
