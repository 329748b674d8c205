package com.whereq.kiln.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Terminal outcome of a build job, produced exactly once per job.
 *
 * {@code imageUri} is filled as soon as the destination tag is known, so a failed result
 * may still name an image that was pushed. SBOM and signature fields are only present
 * when those optional stages ran and succeeded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BuildResult {

    private UUID jobId;

    private UUID releaseId;

    private boolean success;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String errorMessage;

    private double durationSecs;

    private String imageUri;

    private String imageDigest;

    private String sbom;

    private String sbomFormat;

    private String imageSignature;

    /**
     * Failure result for a job that never reached the executor's own bookkeeping
     */
    public static BuildResult failure(BuildJob job, String message, double durationSecs) {
        return BuildResult.builder()
            .jobId(job.getId())
            .releaseId(job.getReleaseId())
            .success(false)
            .errorMessage(message)
            .durationSecs(durationSecs)
            .build();
    }
}
