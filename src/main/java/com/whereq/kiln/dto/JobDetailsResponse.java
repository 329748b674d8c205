package com.whereq.kiln.dto;

import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildResult;
import com.whereq.kiln.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A stored job with its current status and, once finished, its result
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobDetailsResponse {
    private BuildJob job;

    private JobStatus status;

    /**
     * Null until a worker records the outcome
     */
    private BuildResult result;
}
