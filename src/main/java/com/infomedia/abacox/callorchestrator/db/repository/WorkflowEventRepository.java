package com.infomedia.abacox.callorchestrator.db.repository;

import com.infomedia.abacox.callorchestrator.db.entity.WorkflowEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface WorkflowEventRepository extends JpaRepository<WorkflowEvent, Long> {

    List<WorkflowEvent> findByWorkflowIdOrderBySequenceAsc(String workflowId);

    @Query("SELECT COALESCE(MAX(e.sequence), 0) FROM WorkflowEvent e WHERE e.workflowId = :workflowId")
    long findLastSequence(@Param("workflowId") String workflowId);
}
