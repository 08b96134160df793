package com.infomedia.abacox.callorchestrator.component.durable;

/**
 * Unwinds an actor thread whose instance was dropped from the cache or stopped at shutdown.
 * Never journaled. An {@link Error} so that workflow code catching {@code Exception} cannot
 * swallow it.
 */
class WorkflowEvictedException extends Error {
    WorkflowEvictedException(String workflowId) {
        super("Workflow " + workflowId + " was released by the worker", null, false, false);
    }
}
