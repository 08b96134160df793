package com.infomedia.abacox.callorchestrator.dto.postcall;

import com.infomedia.abacox.callorchestrator.db.entity.PostCallJob;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for {@link PostCallJob}
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class PostCallJobDto {
    private Long id;
    private String callId;
    private String leadId;
    private String tenantId;
    private PostCallJob.Status status;
    private int attempts;
    private Instant nextAttemptAt;
    private String lastError;
    private Instant createdAt;
    private Instant updatedAt;

    public static PostCallJobDto from(PostCallJob job) {
        return PostCallJobDto.builder()
                .id(job.getId())
                .callId(job.getCallId())
                .leadId(job.getLeadId())
                .tenantId(job.getTenantId())
                .status(job.getStatus())
                .attempts(job.getAttempts())
                .nextAttemptAt(job.getNextAttemptAt())
                .lastError(job.getLastError())
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .build();
    }
}
