package com.whereq.kiln.dto;

import com.whereq.kiln.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response for job cancellation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCancellationResponse {
    private UUID jobId;

    /**
     * Status after the request; unchanged when the job could not be withdrawn
     */
    private JobStatus status;

    private Instant cancelledAt;

    private String message;
}
