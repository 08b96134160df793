package com.infomedia.abacox.callorchestrator.component.durable;

import com.infomedia.abacox.callorchestrator.db.entity.WorkflowEvent;
import com.infomedia.abacox.callorchestrator.db.entity.WorkflowExecution;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Heap-backed store shared by executors in tests; a second executor over the same store
 * behaves like a restarted worker.
 */
public class InMemoryWorkflowEventStore implements WorkflowEventStore {

    private final Map<String, WorkflowExecution> executions = new ConcurrentHashMap<>();
    private final Map<String, List<WorkflowEvent>> journals = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private volatile boolean available = true;

    @Override
    public void createExecution(WorkflowExecution execution) {
        if (executions.putIfAbsent(execution.getWorkflowId(), execution.toBuilder().build()) != null) {
            throw new WorkflowAlreadyStartedException(execution.getWorkflowId());
        }
        journals.put(execution.getWorkflowId(), new ArrayList<>());
    }

    @Override
    public Optional<WorkflowExecution> findExecution(String workflowId) {
        return Optional.ofNullable(executions.get(workflowId)).map(e -> e.toBuilder().build());
    }

    @Override
    public WorkflowEvent append(String workflowId, WorkflowEvent.Type type, String name, int ordinal, String payload) {
        List<WorkflowEvent> journal = journals.get(workflowId);
        if (journal == null) {
            throw new WorkflowNotFoundException(workflowId);
        }
        synchronized (journal) {
            WorkflowEvent event = WorkflowEvent.builder()
                    .id(ids.incrementAndGet())
                    .workflowId(workflowId)
                    .sequence((long) journal.size() + 1)
                    .type(type)
                    .name(name)
                    .ordinal(ordinal)
                    .payload(payload)
                    .recordedAt(Instant.now())
                    .build();
            journal.add(event);
            return event;
        }
    }

    @Override
    public List<WorkflowEvent> loadEvents(String workflowId) {
        List<WorkflowEvent> journal = journals.getOrDefault(workflowId, List.of());
        synchronized (journal) {
            return new ArrayList<>(journal);
        }
    }

    @Override
    public void closeExecution(String workflowId, WorkflowExecution.Status status, String result, String failure) {
        WorkflowExecution execution = executions.get(workflowId);
        if (execution == null) {
            throw new WorkflowNotFoundException(workflowId);
        }
        executions.put(workflowId, execution.toBuilder()
                .status(status)
                .result(result)
                .failure(failure)
                .closedAt(Instant.now())
                .build());
    }

    @Override
    public List<String> findRunningWorkflowIds(String namespace, String taskQueue) {
        return executions.values().stream()
                .filter(e -> e.getStatus() == WorkflowExecution.Status.RUNNING)
                .filter(e -> e.getNamespace().equals(namespace) && e.getTaskQueue().equals(taskQueue))
                .map(WorkflowExecution::getWorkflowId)
                .sorted()
                .toList();
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public List<WorkflowEvent> events(String workflowId, WorkflowEvent.Type type) {
        return loadEvents(workflowId).stream().filter(e -> e.getType() == type).toList();
    }
}
