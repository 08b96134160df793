package com.infomedia.abacox.callorchestrator.db.repository;

import com.infomedia.abacox.callorchestrator.db.entity.WorkflowExecution;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface WorkflowExecutionRepository extends JpaRepository<WorkflowExecution, String> {

    @Query("SELECT we.workflowId FROM WorkflowExecution we " +
            "WHERE we.namespace = :namespace AND we.taskQueue = :taskQueue AND we.status = :status " +
            "ORDER BY we.startedAt ASC")
    List<String> findWorkflowIds(@Param("namespace") String namespace,
                                 @Param("taskQueue") String taskQueue,
                                 @Param("status") WorkflowExecution.Status status);

    /**
     * Row lock held until the surrounding transaction ends; serializes writers of one journal.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT we FROM WorkflowExecution we WHERE we.workflowId = :workflowId")
    Optional<WorkflowExecution> findByIdForUpdate(@Param("workflowId") String workflowId);
}
