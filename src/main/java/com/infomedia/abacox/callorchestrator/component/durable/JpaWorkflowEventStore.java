package com.infomedia.abacox.callorchestrator.component.durable;

import com.infomedia.abacox.callorchestrator.db.entity.WorkflowEvent;
import com.infomedia.abacox.callorchestrator.db.entity.WorkflowExecution;
import com.infomedia.abacox.callorchestrator.db.repository.WorkflowEventRepository;
import com.infomedia.abacox.callorchestrator.db.repository.WorkflowExecutionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@Log4j2
@RequiredArgsConstructor
public class JpaWorkflowEventStore implements WorkflowEventStore {

    private final WorkflowExecutionRepository executionRepository;
    private final WorkflowEventRepository eventRepository;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void createExecution(WorkflowExecution execution) {
        if (executionRepository.existsById(execution.getWorkflowId())) {
            throw new WorkflowAlreadyStartedException(execution.getWorkflowId());
        }
        executionRepository.save(execution);
        log.debug("Created workflow execution {} of type {}", execution.getWorkflowId(), execution.getWorkflowType());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WorkflowExecution> findExecution(String workflowId) {
        return executionRepository.findById(workflowId);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public WorkflowEvent append(String workflowId, WorkflowEvent.Type type, String name, int ordinal, String payload) {
        // the execution row lock makes read-max-then-insert atomic per workflow
        executionRepository.findByIdForUpdate(workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
        long next = eventRepository.findLastSequence(workflowId) + 1;
        WorkflowEvent event = WorkflowEvent.builder()
                .workflowId(workflowId)
                .sequence(next)
                .type(type)
                .name(name)
                .ordinal(ordinal)
                .payload(payload)
                .recordedAt(Instant.now())
                .build();
        return eventRepository.save(event);
    }

    @Override
    @Transactional(readOnly = true)
    public List<WorkflowEvent> loadEvents(String workflowId) {
        return eventRepository.findByWorkflowIdOrderBySequenceAsc(workflowId);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void closeExecution(String workflowId, WorkflowExecution.Status status, String result, String failure) {
        WorkflowExecution execution = executionRepository.findById(workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
        execution.setStatus(status);
        execution.setResult(result);
        execution.setFailure(failure != null && failure.length() > 2000 ? failure.substring(0, 2000) : failure);
        execution.setClosedAt(Instant.now());
        executionRepository.save(execution);
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findRunningWorkflowIds(String namespace, String taskQueue) {
        return executionRepository.findWorkflowIds(namespace, taskQueue, WorkflowExecution.Status.RUNNING);
    }

    @Override
    public boolean isAvailable() {
        try {
            executionRepository.count();
            return true;
        } catch (Exception e) {
            log.warn("Workflow event store is not reachable: {}", e.getMessage());
            return false;
        }
    }
}
