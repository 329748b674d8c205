package com.whereq.kiln.executor;

/**
 * The three sequential pipeline stages, each run as its own cluster job
 */
public enum BuildStage {
    BUILD("build", "kaniko", "kaniko-build", "build"),
    SBOM("sbom", "syft", "syft-sbom", "SBOM generation"),
    SIGN("sign", "cosign", "cosign-sign", "image signing");

    private final String jobNamePrefix;
    private final String containerName;
    private final String component;
    private final String displayName;

    BuildStage(String jobNamePrefix, String containerName, String component, String displayName) {
        this.jobNamePrefix = jobNamePrefix;
        this.containerName = containerName;
        this.component = component;
        this.displayName = displayName;
    }

    public String getJobNamePrefix() {
        return jobNamePrefix;
    }

    /**
     * Container whose log carries the stage output
     */
    public String getContainerName() {
        return containerName;
    }

    /**
     * Value of the app.kubernetes.io/component label
     */
    public String getComponent() {
        return component;
    }

    public String getDisplayName() {
        return displayName;
    }
}
