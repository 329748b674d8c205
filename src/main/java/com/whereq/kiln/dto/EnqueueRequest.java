package com.whereq.kiln.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.whereq.kiln.model.BuildConfig;
import com.whereq.kiln.model.BuildJob;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Request to queue a build of one commit
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EnqueueRequest {
    private UUID releaseId;

    private UUID serviceId;

    private UUID projectId;

    private String serviceName;

    private String gitRepo;

    private String gitSha;

    private String gitBranch;

    private BuildConfig buildConfig;

    private String callbackUrl;

    private int priority;

    /**
     * Reject requests that cannot produce a build
     *
     * @throws IllegalArgumentException naming the first missing field
     */
    public void validate() {
        if (serviceId == null) {
            throw new IllegalArgumentException("service_id is required");
        }
        if (releaseId == null) {
            throw new IllegalArgumentException("release_id is required");
        }
        if (gitRepo == null || gitRepo.isBlank()) {
            throw new IllegalArgumentException("git_repo is required");
        }
        if (gitSha == null || gitSha.isBlank()) {
            throw new IllegalArgumentException("git_sha is required");
        }
        if (priority < 0) {
            throw new IllegalArgumentException("priority must not be negative");
        }
    }

    public BuildJob toJob() {
        return BuildJob.builder()
            .releaseId(releaseId)
            .serviceId(serviceId)
            .projectId(projectId)
            .serviceName(serviceName)
            .gitRepo(gitRepo)
            .gitSha(gitSha)
            .gitBranch(gitBranch)
            .buildConfig(buildConfig != null ? buildConfig : new BuildConfig())
            .callbackUrl(callbackUrl)
            .priority(priority)
            .build();
    }
}
