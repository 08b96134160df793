package com.infomedia.abacox.callorchestrator.component.durable;

/**
 * A query reached a workflow that has not registered its handlers yet.
 */
public class WorkflowNotReadyException extends RuntimeException {
    public WorkflowNotReadyException(String workflowId, String channel) {
        super(String.format("Workflow %s cannot answer '%s' yet", workflowId, channel));
    }
}
