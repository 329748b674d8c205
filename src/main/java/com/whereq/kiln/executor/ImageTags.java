package com.whereq.kiln.executor;

import com.whereq.kiln.model.BuildJob;

/**
 * Destination tags for built images.
 *
 * Tags depend only on the registry, the service name and the commit, so rebuilding a
 * commit pushes to the same tags.
 */
public final class ImageTags {

    public static final String LATEST = "latest";

    private ImageTags() {
    }

    /**
     * {registry}/{service-name}:{short-sha}
     */
    public static String primaryTag(String registry, BuildJob job) {
        return repository(registry, job) + ":" + job.shortSha();
    }

    /**
     * {registry}/{service-name}:latest
     */
    public static String latestTag(String registry, BuildJob job) {
        return repository(registry, job) + ":" + LATEST;
    }

    /**
     * Where cosign stores the signature for an image tag
     */
    public static String signatureReference(String imageTag) {
        return imageTag + ".sig";
    }

    /**
     * Pin an image tag to a digest, e.g. ghcr.io/acme/api@sha256:...
     */
    public static String digestReference(String imageTag, String digest) {
        return ImageReference.parse(imageTag).withDigest(digest);
    }

    static String repository(String registry, BuildJob job) {
        String trimmedRegistry = registry.endsWith("/") ? registry.substring(0, registry.length() - 1) : registry;
        return trimmedRegistry + "/" + serviceName(job);
    }

    /**
     * The job's service name, or {project-id-prefix}/{service-id-prefix} when it has none
     */
    static String serviceName(BuildJob job) {
        if (job.getServiceName() != null && !job.getServiceName().isBlank()) {
            return job.getServiceName().trim().toLowerCase();
        }
        return job.getProjectId().toString().substring(0, 8) + "/" + job.getServiceId().toString().substring(0, 8);
    }
}
