package com.whereq.kiln.executor;

import com.whereq.kiln.config.KilnProperties;
import com.whereq.kiln.exception.BuildStageException;
import com.whereq.kiln.exception.ClusterJobException;
import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildResult;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.helpers.MessageFormatter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Runs the build pipeline as a sequence of Kubernetes Jobs on the calling thread.
 *
 * <ol>
 *   <li>Image build with Kaniko. Mandatory: any failure fails the result.</li>
 *   <li>SBOM generation with Syft. Optional: failures are logged and skipped.</li>
 *   <li>Image signing with Cosign. Optional: failures are logged and skipped.</li>
 * </ol>
 *
 * The image URI is recorded as soon as the destination tag is computed, so it is
 * present on failed results too.
 */
@Slf4j
@Service
public class ClusterBuildExecutor implements BuildExecutor {

    @Autowired
    private ClusterJobClient clusterJobClient;

    @Autowired
    private BuildJobSpecFactory specFactory;

    @Autowired
    private RegistryDigestResolver digestResolver;

    @Autowired
    private KilnProperties properties;

    @Override
    public BuildResult execute(BuildJob job, BuildDeadline deadline, BuildLogSink logSink) {
        long startNanos = System.nanoTime();

        String registry = properties.getRegistry().getUrl();
        String imageTag = ImageTags.primaryTag(registry, job);
        String latestTag = ImageTags.latestTag(registry, job);

        BuildResult result = BuildResult.builder()
            .jobId(job.getId())
            .releaseId(job.getReleaseId())
            .imageUri(imageTag)
            .build();

        progress(job, logSink, "Building {} at {} ({})", job.getGitRepo(), job.getGitSha(), imageTag);

        try {
            buildImage(job, deadline, logSink, imageTag, latestTag);
        } catch (BuildStageException e) {
            log.error("Build {} failed in stage {}: {}", job.getId(), e.getStage(), e.getMessage());
            logSink.append(e.getMessage());
            return fail(result, e.getMessage(), startNanos);
        }

        progress(job, logSink, "Image pushed to {}", imageTag);

        String digest = resolveDigest(job, imageTag);
        result.setImageDigest(digest);
        String signTarget = digest != null ? ImageTags.digestReference(imageTag, digest) : imageTag;

        if (properties.getSbom().isEnabled()) {
            String sbom = generateSbom(job, deadline, logSink, signTarget);
            if (sbom != null) {
                result.setSbom(sbom);
                result.setSbomFormat(properties.getSbom().getFormat());
            }
        }

        if (properties.isSigningConfigured()) {
            if (signImage(job, deadline, logSink, signTarget)) {
                result.setImageSignature(ImageTags.signatureReference(imageTag));
            }
        }

        result.setSuccess(true);
        result.setDurationSecs(elapsedSecs(startNanos));
        progress(job, logSink, "Build finished in {}s", String.format("%.1f", result.getDurationSecs()));
        return result;
    }

    private void buildImage(BuildJob job, BuildDeadline deadline, BuildLogSink logSink,
                            String imageTag, String latestTag) {
        if (deadline.isExpired()) {
            throw new BuildStageException(BuildStage.BUILD, BuildStageException.Outcome.TIMED_OUT,
                "image build timed out before it started");
        }

        Job spec = specFactory.imageBuildJob(job, imageTag, latestTag);
        String jobName = submit(BuildStage.BUILD, spec);
        progress(job, logSink, "Submitted build job {}", jobName);

        try {
            await(BuildStage.BUILD, jobName, deadline.remaining());
        } catch (BuildStageException e) {
            if (e.getOutcome() != BuildStageException.Outcome.CANCELLED) {
                forwardLogs(job, jobName, logSink);
            }
            throw e;
        }
        forwardLogs(job, jobName, logSink);
    }

    /**
     * @return the SBOM document, or null when the stage was skipped or failed
     */
    private String generateSbom(BuildJob job, BuildDeadline deadline, BuildLogSink logSink, String imageRef) {
        if (!canRunOptionalStage(job, deadline, BuildStage.SBOM)) {
            return null;
        }

        progress(job, logSink, "Generating SBOM ({})", properties.getSbom().getFormat());
        try {
            String jobName = submit(BuildStage.SBOM, specFactory.sbomJob(job, imageRef));
            await(BuildStage.SBOM, jobName, deadline.cap(properties.getSbom().getDeadline()));

            String sbom = clusterJobClient.readLogs(jobName, BuildStage.SBOM.getContainerName());
            if (sbom == null || sbom.isBlank()) {
                log.warn("SBOM job {} for build {} produced no output", jobName, job.getId());
                return null;
            }
            progress(job, logSink, "SBOM generated");
            return sbom.trim();
        } catch (RuntimeException e) {
            log.warn("Continuing build {} without SBOM: {}", job.getId(), e.getMessage());
            logSink.append("SBOM generation skipped: " + e.getMessage());
            return null;
        }
    }

    private boolean signImage(BuildJob job, BuildDeadline deadline, BuildLogSink logSink, String imageRef) {
        if (!canRunOptionalStage(job, deadline, BuildStage.SIGN)) {
            return false;
        }

        progress(job, logSink, "Signing {}", imageRef);
        try {
            String jobName = submit(BuildStage.SIGN, specFactory.signingJob(job, imageRef));
            await(BuildStage.SIGN, jobName, deadline.cap(properties.getSigning().getDeadline()));
            progress(job, logSink, "Image signed");
            return true;
        } catch (RuntimeException e) {
            log.warn("Continuing build {} without signature: {}", job.getId(), e.getMessage());
            logSink.append("Image signing skipped: " + e.getMessage());
            return false;
        }
    }

    private boolean canRunOptionalStage(BuildJob job, BuildDeadline deadline, BuildStage stage) {
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Skipping {} for build {}: worker is shutting down", stage.getDisplayName(), job.getId());
            return false;
        }
        if (deadline.isExpired()) {
            log.warn("Skipping {} for build {}: build deadline reached", stage.getDisplayName(), job.getId());
            return false;
        }
        return true;
    }

    private String submit(BuildStage stage, Job spec) {
        try {
            return clusterJobClient.submit(spec);
        } catch (ClusterJobException e) {
            throw new BuildStageException(stage, BuildStageException.Outcome.FAILED,
                stage.getDisplayName() + " job submission failed: " + e.getMessage(), e);
        }
    }

    private void await(BuildStage stage, String jobName, Duration timeout) {
        try {
            clusterJobClient.awaitCompletion(jobName, timeout);
        } catch (TimeoutException e) {
            throw new BuildStageException(stage, BuildStageException.Outcome.TIMED_OUT,
                stage.getDisplayName() + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BuildStageException(stage, BuildStageException.Outcome.CANCELLED,
                stage.getDisplayName() + " cancelled", e);
        } catch (ClusterJobException e) {
            throw new BuildStageException(stage, BuildStageException.Outcome.FAILED,
                stage.getDisplayName() + " failed: " + e.getMessage(), e);
        }
    }

    private void forwardLogs(BuildJob job, String jobName, BuildLogSink logSink) {
        try {
            clusterJobClient.streamLogs(jobName, BuildStage.BUILD.getContainerName(), logSink::append);
        } catch (ClusterJobException e) {
            log.warn("Could not read logs of {} for build {}: {}", jobName, job.getId(), e.getMessage());
        }
    }

    /**
     * Digest lookup is best effort; the result is still valid without one
     */
    private String resolveDigest(BuildJob job, String imageTag) {
        if (Thread.currentThread().isInterrupted()) {
            return null;
        }
        try {
            return digestResolver.resolve(imageTag)
                .block(properties.getRegistry().getDigestTimeout().plusSeconds(1));
        } catch (RuntimeException e) {
            log.warn("Could not resolve digest of {} for build {}: {}", imageTag, job.getId(), e.getMessage());
            return null;
        }
    }

    private void progress(BuildJob job, BuildLogSink logSink, String format, Object... args) {
        String message = MessageFormatter.arrayFormat(format, args).getMessage();
        log.info("[{}] {}", job.getId(), message);
        logSink.append(message);
    }

    private static BuildResult fail(BuildResult result, String message, long startNanos) {
        result.setSuccess(false);
        result.setErrorMessage(message);
        result.setDurationSecs(elapsedSecs(startNanos));
        return result;
    }

    private static double elapsedSecs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
