package com.infomedia.abacox.callorchestrator.component.durable;

/**
 * Replayed workflow code diverged from its journal. Thrown on the actor thread only; the
 * execution is left RUNNING for an operator to inspect.
 */
public class NonDeterministicWorkflowException extends Error {
    public NonDeterministicWorkflowException(String workflowId, String message) {
        super("Workflow " + workflowId + " diverged from its journal: " + message);
    }
}
