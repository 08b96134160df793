package com.infomedia.abacox.callorchestrator.db.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

/**
 * Journal entry of a workflow run.
 * <p>
 * {@code ordinal} depends on the type: 0 for signals, call index for
 * activity outcomes and await index for timeouts.
 */
@Entity
@Table(name = "workflow_event",
        uniqueConstraints = @UniqueConstraint(name = "uk_workflow_event_sequence", columnNames = {"workflow_id", "event_sequence"}))
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class WorkflowEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "workflow_event_id_seq")
    @SequenceGenerator(
            name = "workflow_event_id_seq",
            sequenceName = "workflow_event_id_seq",
            allocationSize = 50
    )
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "workflow_id", length = 200, nullable = false)
    private String workflowId;

    @Column(name = "event_sequence", nullable = false)
    private Long sequence;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 30)
    private Type type;

    /**
     * Signal channel or activity name.
     */
    @Column(name = "name", length = 100, nullable = false)
    private String name;

    @Column(name = "ordinal", nullable = false)
    private Integer ordinal;

    @Column(name = "payload", length = 1048576)
    private String payload;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    public enum Type {
        SIGNAL_RECEIVED,
        ACTIVITY_COMPLETED,
        ACTIVITY_FAILED,
        AWAIT_TIMED_OUT
    }
}
