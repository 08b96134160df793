package com.infomedia.abacox.callorchestrator.db.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

/**
 * One durable workflow run. The journal of a run lives in {@link WorkflowEvent}.
 */
@Entity
@Table(name = "workflow_execution", indexes = {
        @Index(name = "idx_workflow_execution_status", columnList = "namespace, task_queue, status")
})
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class WorkflowExecution {

    @Id
    @Column(name = "workflow_id", length = 200, nullable = false)
    private String workflowId;

    @Column(name = "workflow_type", length = 100, nullable = false)
    private String workflowType;

    @Column(name = "namespace", length = 100, nullable = false)
    private String namespace;

    @Column(name = "task_queue", length = 100, nullable = false)
    private String taskQueue;

    @Column(name = "input", length = 1048576)
    private String input;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.RUNNING;

    @Column(name = "result", length = 1048576)
    private String result;

    @Column(name = "failure", length = 2000)
    private String failure;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    public boolean isClosed() {
        return status != Status.RUNNING;
    }

    public enum Status {
        RUNNING,
        COMPLETED,
        FAILED
    }
}
