package com.infomedia.abacox.callorchestrator.component.durable;

import com.infomedia.abacox.callorchestrator.db.entity.WorkflowExecution;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class WorkflowDescription {
    private String workflowId;
    private String workflowType;
    private String namespace;
    private String taskQueue;
    private WorkflowExecution.Status status;
    private Instant startedAt;
    private Instant closedAt;
    private String failure;
    private boolean cached;
}
