package com.infomedia.abacox.callorchestrator.component.durable;

import com.infomedia.abacox.callorchestrator.db.entity.WorkflowEvent;
import com.infomedia.abacox.callorchestrator.db.entity.WorkflowExecution;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of workflow runs and their journals.
 * <p>
 * Appends for one workflow are serialized by the caller; implementations only have to keep
 * the sequence gap-free for a single writer.
 */
public interface WorkflowEventStore {

    /**
     * @throws WorkflowAlreadyStartedException if a run with the same id exists
     */
    void createExecution(WorkflowExecution execution);

    Optional<WorkflowExecution> findExecution(String workflowId);

    WorkflowEvent append(String workflowId, WorkflowEvent.Type type, String name, int ordinal, String payload);

    List<WorkflowEvent> loadEvents(String workflowId);

    void closeExecution(String workflowId, WorkflowExecution.Status status, String result, String failure);

    List<String> findRunningWorkflowIds(String namespace, String taskQueue);

    /**
     * Connectivity check used by the worker health indicator.
     */
    boolean isAvailable();
}
