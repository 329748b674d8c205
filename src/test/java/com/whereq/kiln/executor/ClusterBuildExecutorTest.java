package com.whereq.kiln.executor;

import com.whereq.kiln.config.KilnProperties;
import com.whereq.kiln.exception.ClusterJobException;
import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildResult;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClusterBuildExecutorTest {

    private static final String IMAGE_TAG = "ghcr.io/acme/api:abc123de";
    private static final String LATEST_TAG = "ghcr.io/acme/api:latest";
    private static final String DIGEST = "sha256:5f3c9a";
    private static final String SBOM = "{\"spdxVersion\":\"SPDX-2.3\",\"name\":\"api\"}";

    @Mock
    private ClusterJobClient clusterJobClient;

    @Mock
    private BuildJobSpecFactory specFactory;

    @Mock
    private RegistryDigestResolver digestResolver;

    @InjectMocks
    private ClusterBuildExecutor executor;

    private KilnProperties properties;
    private BuildJob job;
    private final List<String> logLines = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new KilnProperties();
        properties.getRegistry().setUrl("ghcr.io/acme");
        properties.getSigning().setKeySecret("cosign-keys");
        ReflectionTestUtils.setField(executor, "properties", properties);

        job = BuildJob.builder()
            .id(UUID.randomUUID())
            .serviceId(UUID.randomUUID())
            .projectId(UUID.randomUUID())
            .releaseId(UUID.randomUUID())
            .serviceName("api")
            .gitRepo("https://github.com/acme/api")
            .gitSha("abc123def456")
            .gitBranch("main")
            .build();

        lenient().when(specFactory.imageBuildJob(job, IMAGE_TAG, LATEST_TAG)).thenReturn(named("build-1"));
        lenient().when(specFactory.sbomJob(eq(job), anyString())).thenReturn(named("sbom-1"));
        lenient().when(specFactory.signingJob(eq(job), anyString())).thenReturn(named("sign-1"));
        lenient().when(clusterJobClient.submit(any(Job.class)))
            .thenAnswer(invocation -> invocation.<Job>getArgument(0).getMetadata().getName());
        lenient().when(clusterJobClient.readLogs("sbom-1", "syft")).thenReturn(SBOM + "\n");
        lenient().when(digestResolver.resolve(IMAGE_TAG)).thenReturn(Mono.just(DIGEST));
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void fullPipelineProducesImageSbomAndSignature() {
        doAnswer(invocation -> {
            Consumer<String> lines = invocation.getArgument(2);
            lines.accept("INFO[0042] Pushing image to " + IMAGE_TAG);
            return null;
        }).when(clusterJobClient).streamLogs(eq("build-1"), eq("kaniko"), any());

        BuildResult result = executor.execute(job, BuildDeadline.after(Duration.ofMinutes(30)), logLines::add);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getErrorMessage()).isNull();
        assertThat(result.getJobId()).isEqualTo(job.getId());
        assertThat(result.getReleaseId()).isEqualTo(job.getReleaseId());
        assertThat(result.getImageUri()).isEqualTo(IMAGE_TAG);
        assertThat(result.getImageDigest()).isEqualTo(DIGEST);
        assertThat(result.getSbom()).isEqualTo(SBOM);
        assertThat(result.getSbomFormat()).isEqualTo("spdx-json");
        assertThat(result.getImageSignature()).isEqualTo(IMAGE_TAG + ".sig");
        assertThat(result.getDurationSecs()).isPositive();
        assertThat(logLines).contains("INFO[0042] Pushing image to " + IMAGE_TAG);

        verify(specFactory).sbomJob(job, "ghcr.io/acme/api@" + DIGEST);
        verify(specFactory).signingJob(job, "ghcr.io/acme/api@" + DIGEST);
    }

    @Test
    void rejectedBuildSubmissionFailsWithoutOptionalStages() {
        doThrow(new ClusterJobException("admission webhook denied the request"))
            .when(clusterJobClient).submit(any(Job.class));

        BuildResult result = executor.execute(job, BuildDeadline.after(Duration.ofMinutes(30)), logLines::add);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage())
            .contains("build job submission failed")
            .contains("admission webhook denied the request");
        assertThat(result.getDurationSecs()).isPositive();
        assertThat(result.getImageUri()).isEqualTo(IMAGE_TAG);
        assertThat(result.getSbom()).isNull();
        assertThat(result.getImageSignature()).isNull();
        verify(specFactory, never()).sbomJob(any(), anyString());
        verify(specFactory, never()).signingJob(any(), anyString());
        verify(digestResolver, never()).resolve(anyString());
    }

    @Test
    void failedBuildForwardsLogsAndFails() throws Exception {
        doThrow(new ClusterJobException("job failed: BackoffLimitExceeded"))
            .when(clusterJobClient).awaitCompletion(eq("build-1"), any(Duration.class));
        doAnswer(invocation -> {
            Consumer<String> lines = invocation.getArgument(2);
            lines.accept("error building image: failed to get filesystem from image");
            return null;
        }).when(clusterJobClient).streamLogs(eq("build-1"), eq("kaniko"), any());

        BuildResult result = executor.execute(job, BuildDeadline.after(Duration.ofMinutes(30)), logLines::add);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).isEqualTo("build failed: job failed: BackoffLimitExceeded");
        assertThat(logLines).contains("error building image: failed to get filesystem from image");
    }

    @Test
    void buildTimeoutFailsTheResult() throws Exception {
        doThrow(new TimeoutException())
            .when(clusterJobClient).awaitCompletion(eq("build-1"), any(Duration.class));

        BuildResult result = executor.execute(job, BuildDeadline.after(Duration.ofMinutes(30)), logLines::add);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("build timed out");
    }

    @Test
    void expiredDeadlineNeverSubmits() {
        BuildResult result = executor.execute(job, BuildDeadline.after(Duration.ZERO), logLines::add);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("timed out");
        verify(clusterJobClient, never()).submit(any(Job.class));
    }

    @Test
    void interruptionCancelsTheBuild() throws Exception {
        doThrow(new InterruptedException())
            .when(clusterJobClient).awaitCompletion(eq("build-1"), any(Duration.class));

        BuildResult result = executor.execute(job, BuildDeadline.after(Duration.ofMinutes(30)), logLines::add);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).isEqualTo("build cancelled");
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        verify(clusterJobClient, never()).streamLogs(anyString(), anyString(), any());
    }

    @Test
    void sbomFailureDoesNotAffectSigningOrSuccess() throws Exception {
        lenient().doThrow(new ClusterJobException("job failed: OOMKilled"))
            .when(clusterJobClient).awaitCompletion(eq("sbom-1"), any(Duration.class));

        BuildResult result = executor.execute(job, BuildDeadline.after(Duration.ofMinutes(30)), logLines::add);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSbom()).isNull();
        assertThat(result.getSbomFormat()).isNull();
        assertThat(result.getImageSignature()).isEqualTo(IMAGE_TAG + ".sig");
    }

    @Test
    void signingTimeoutDoesNotAffectSbomOrSuccess() throws Exception {
        lenient().doThrow(new TimeoutException())
            .when(clusterJobClient).awaitCompletion(eq("sign-1"), any(Duration.class));

        BuildResult result = executor.execute(job, BuildDeadline.after(Duration.ofMinutes(30)), logLines::add);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSbom()).isEqualTo(SBOM);
        assertThat(result.getImageSignature()).isNull();
    }

    @Test
    void unexpectedSbomErrorStillSucceeds() {
        lenient().doThrow(new IllegalStateException("client closed"))
            .when(clusterJobClient).readLogs("sbom-1", "syft");

        BuildResult result = executor.execute(job, BuildDeadline.after(Duration.ofMinutes(30)), logLines::add);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getImageUri()).isEqualTo(IMAGE_TAG);
        assertThat(result.getSbom()).isNull();
        assertThat(result.getImageSignature()).isEqualTo(IMAGE_TAG + ".sig");
        assertThat(logLines).contains("SBOM generation skipped: client closed");
    }

    @Test
    void unexpectedSigningErrorStillSucceeds() {
        lenient().doThrow(new IllegalArgumentException("cosign key secret is malformed"))
            .when(specFactory).signingJob(eq(job), anyString());

        BuildResult result = executor.execute(job, BuildDeadline.after(Duration.ofMinutes(30)), logLines::add);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSbom()).isEqualTo(SBOM);
        assertThat(result.getImageSignature()).isNull();
        assertThat(logLines).contains("Image signing skipped: cosign key secret is malformed");
    }

    @Test
    void digestFailureFallsBackToTag() {
        when(digestResolver.resolve(IMAGE_TAG)).thenReturn(Mono.error(new IllegalStateException("registry answered 404")));

        BuildResult result = executor.execute(job, BuildDeadline.after(Duration.ofMinutes(30)), logLines::add);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getImageDigest()).isNull();
        verify(specFactory).signingJob(job, IMAGE_TAG);
    }

    @Test
    void disabledStagesAreSkipped() {
        properties.getSbom().setEnabled(false);
        properties.getSigning().setKeySecret(null);

        BuildResult result = executor.execute(job, BuildDeadline.after(Duration.ofMinutes(30)), logLines::add);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSbom()).isNull();
        assertThat(result.getImageSignature()).isNull();
        verify(specFactory, never()).sbomJob(any(), anyString());
        verify(specFactory, never()).signingJob(any(), anyString());
    }

    @Test
    void emptySbomOutputIsDropped() {
        when(clusterJobClient.readLogs("sbom-1", "syft")).thenReturn("  ");

        BuildResult result = executor.execute(job, BuildDeadline.after(Duration.ofMinutes(30)), logLines::add);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSbom()).isNull();
    }

    private static Job named(String name) {
        return new JobBuilder().withNewMetadata().withName(name).endMetadata().build();
    }
}
