package com.whereq.kiln.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A request to build one commit into a container image.
 *
 * Identity fields are owned by the API that creates the job and are treated here as
 * opaque correlation keys. Source coordinates never change once the job is enqueued.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BuildJob {

    private UUID id;

    private UUID serviceId;

    private UUID projectId;

    private UUID releaseId;

    /**
     * Human readable service name used as the image repository name.
     * Falls back to the project and service id prefixes when absent.
     */
    private String serviceName;

    private String gitRepo;

    private String gitSha;

    private String gitBranch;

    @Builder.Default
    private BuildConfig buildConfig = new BuildConfig();

    /**
     * Webhook notified with the final result, optional
     */
    private String callbackUrl;

    private Instant createdAt;

    /**
     * Higher is more urgent; anything above zero goes to the priority lane
     */
    private int priority;

    /**
     * First eight characters of the commit SHA (or the whole SHA when shorter)
     */
    public String shortSha() {
        if (gitSha == null) {
            return "";
        }
        return gitSha.length() > 8 ? gitSha.substring(0, 8) : gitSha;
    }
}
