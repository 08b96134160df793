package com.infomedia.abacox.callorchestrator.db.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

/**
 * Follow-up work for a finished call. A failed run puts the job back to PENDING with a later
 * {@code nextAttemptAt}.
 */
@Entity
@Table(name = "post_call_job", indexes = {
        @Index(name = "idx_post_call_job_due", columnList = "status, next_attempt_at")
})
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class PostCallJob {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "post_call_job_id_seq")
    @SequenceGenerator(
            name = "post_call_job_id_seq",
            sequenceName = "post_call_job_id_seq",
            allocationSize = 1
    )
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "call_id", length = 100, nullable = false, unique = true)
    private String callId;

    @Column(name = "lead_id", length = 120, nullable = false)
    private String leadId;

    @Column(name = "tenant_id", length = 100, nullable = false)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    @Builder.Default
    private Status status = Status.PENDING;

    @Column(name = "attempts", nullable = false)
    @Builder.Default
    private Integer attempts = 0;

    @Column(name = "next_attempt_at", nullable = false)
    private Instant nextAttemptAt;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public enum Status {
        PENDING,
        IN_PROGRESS,
        COMPLETED,
        NEEDS_MANUAL_REVIEW
    }
}
