package com.whereq.kiln.executor;

import com.whereq.kiln.config.KilnProperties;
import com.whereq.kiln.model.BuildConfig;
import com.whereq.kiln.model.BuildJob;
import io.fabric8.kubernetes.api.model.Affinity;
import io.fabric8.kubernetes.api.model.AffinityBuilder;
import io.fabric8.kubernetes.api.model.CapabilitiesBuilder;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.EnvVarBuilder;
import io.fabric8.kubernetes.api.model.KeyToPathBuilder;
import io.fabric8.kubernetes.api.model.NodeAffinityBuilder;
import io.fabric8.kubernetes.api.model.NodeSelectorRequirementBuilder;
import io.fabric8.kubernetes.api.model.NodeSelectorTermBuilder;
import io.fabric8.kubernetes.api.model.PodSecurityContext;
import io.fabric8.kubernetes.api.model.PodSecurityContextBuilder;
import io.fabric8.kubernetes.api.model.PodSpecBuilder;
import io.fabric8.kubernetes.api.model.PreferredSchedulingTermBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.fabric8.kubernetes.api.model.ResourceRequirementsBuilder;
import io.fabric8.kubernetes.api.model.SeccompProfileBuilder;
import io.fabric8.kubernetes.api.model.SecurityContext;
import io.fabric8.kubernetes.api.model.SecurityContextBuilder;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.api.model.VolumeBuilder;
import io.fabric8.kubernetes.api.model.VolumeMount;
import io.fabric8.kubernetes.api.model.VolumeMountBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobBuilder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the Kubernetes Job specifications for each pipeline stage.
 *
 * Every job disables retries ({@code backoffLimit=0}, {@code restartPolicy=Never}),
 * carries an active deadline and a TTL so the cluster reclaims it even if the worker
 * is gone, and is labelled with the build id and its stage.
 */
@Component
public class BuildJobSpecFactory {

    public static final String LABEL_BUILD_ID = "kiln.whereq.com/build-id";
    public static final String LABEL_SERVICE_ID = "kiln.whereq.com/service-id";
    public static final String LABEL_COMPONENT = "app.kubernetes.io/component";
    public static final String LABEL_MANAGED_BY = "app.kubernetes.io/managed-by";
    public static final String MANAGED_BY_VALUE = "kiln";

    private static final String ANNOTATION_GIT_REPO = "kiln.whereq.com/git-repo";
    private static final String ANNOTATION_GIT_SHA = "kiln.whereq.com/git-sha";
    private static final String ANNOTATION_GIT_BRANCH = "kiln.whereq.com/git-branch";

    private static final String DEFAULT_BRANCH = "main";
    private static final String DOCKER_CONFIG_VOLUME = "docker-config";
    private static final String TMP_VOLUME = "tmp";
    private static final String COSIGN_KEY_VOLUME = "cosign-key";
    private static final String COSIGN_KEY_PATH = "/cosign";
    private static final long NON_ROOT_ID = 1000L;
    private static final long ROOT_ID = 0L;

    @Autowired
    private KilnProperties properties;

    private Clock clock = Clock.systemUTC();

    /**
     * Kaniko job that fetches the commit, builds it and pushes both tags.
     *
     * Kaniko has to run as root inside its container to recreate the ownership of
     * arbitrary base image layers. The container still drops every capability, cannot
     * escalate and runs under the runtime default seccomp profile.
     */
    public Job imageBuildJob(BuildJob job, String imageTag, String latestTag) {
        KilnProperties.ClusterBuildConfig build = properties.getBuild();

        List<EnvVar> env = new ArrayList<>();
        if (hasText(build.getGitCredentialsSecret())) {
            env.add(new EnvVarBuilder()
                .withName("GIT_TOKEN")
                .withNewValueFrom()
                    .withNewSecretKeyRef()
                        .withName(build.getGitCredentialsSecret())
                        .withKey("token")
                        .withOptional(true)
                    .endSecretKeyRef()
                .endValueFrom()
                .build());
        }

        Container kaniko = new ContainerBuilder()
            .withName(BuildStage.BUILD.getContainerName())
            .withImage(build.getKanikoImage())
            .withArgs(kanikoArgs(job, imageTag, latestTag))
            .withEnv(env)
            .withResources(resources(build.getCpuRequest(), build.getMemoryRequest(),
                build.getCpuLimit(), build.getMemoryLimit()))
            // Kaniko writes its snapshot under /kaniko, so the root filesystem stays writable
            .withSecurityContext(containerSecurityContext(false))
            .withVolumeMounts(mount(DOCKER_CONFIG_VOLUME, "/kaniko/.docker", true))
            .build();

        Map<String, String> annotations = new HashMap<>();
        annotations.put(ANNOTATION_GIT_REPO, job.getGitRepo());
        annotations.put(ANNOTATION_GIT_SHA, job.getGitSha());
        annotations.put(ANNOTATION_GIT_BRANCH, branch(job));

        Map<String, String> labels = labels(job, BuildStage.BUILD);
        labels.put(LABEL_SERVICE_ID, String.valueOf(job.getServiceId()));

        return new JobBuilder()
            .withNewMetadata()
                .withName(jobName(BuildStage.BUILD, job))
                .withNamespace(build.getNamespace())
                .withLabels(labels)
                .withAnnotations(annotations)
            .endMetadata()
            .withNewSpec()
                .withBackoffLimit(0)
                .withTtlSecondsAfterFinished(build.getTtlSecondsAfterFinished())
                .withActiveDeadlineSeconds(build.getTimeout().toSeconds())
                .withNewTemplate()
                    .withNewMetadata()
                        .withLabels(labels(job, BuildStage.BUILD))
                    .endMetadata()
                    .withSpec(new PodSpecBuilder()
                        .withRestartPolicy("Never")
                        .withSecurityContext(podSecurityContext(ROOT_ID))
                        .withAffinity(avoidGpuNodes())
                        .withContainers(kaniko)
                        .withVolumes(registryCredentials())
                        .build())
                .endTemplate()
            .endSpec()
            .build();
    }

    /**
     * Syft job that scans the pushed image and prints the SBOM to its log
     */
    public Job sbomJob(BuildJob job, String imageRef) {
        KilnProperties.SbomConfig sbom = properties.getSbom();

        Container syft = new ContainerBuilder()
            .withName(BuildStage.SBOM.getContainerName())
            .withImage(sbom.getImage())
            .withArgs("scan", "--quiet", "--output", sbom.getFormat(), "registry:" + imageRef)
            .withEnv(new EnvVarBuilder().withName("DOCKER_CONFIG").withValue("/home/syft/.docker").build())
            .withResources(resources("100m", "256Mi", "500m", "1Gi"))
            .withSecurityContext(containerSecurityContext(true))
            .withVolumeMounts(
                mount(DOCKER_CONFIG_VOLUME, "/home/syft/.docker", true),
                mount(TMP_VOLUME, "/tmp", false))
            .build();

        return optionalStageJob(job, BuildStage.SBOM, syft, sbom.getDeadline().toSeconds(),
            sbom.getTtlSecondsAfterFinished(), List.of(registryCredentials(), scratch()));
    }

    /**
     * Cosign job. Uses the mounted key when a key secret is configured, keyless
     * signing otherwise.
     */
    public Job signingJob(BuildJob job, String imageRef) {
        KilnProperties.SigningConfig signing = properties.getSigning();

        List<String> args = new ArrayList<>();
        List<EnvVar> env = new ArrayList<>();
        List<Volume> volumes = new ArrayList<>(List.of(registryCredentials(), scratch()));
        List<VolumeMount> mounts = new ArrayList<>(List.of(
            mount(DOCKER_CONFIG_VOLUME, "/home/nonroot/.docker", true),
            mount(TMP_VOLUME, "/tmp", false)));

        env.add(new EnvVarBuilder().withName("DOCKER_CONFIG").withValue("/home/nonroot/.docker").build());
        args.add("sign");

        if (hasText(signing.getKeySecret())) {
            args.add("--key");
            args.add(COSIGN_KEY_PATH + "/cosign.key");

            volumes.add(new VolumeBuilder()
                .withName(COSIGN_KEY_VOLUME)
                .withNewSecret()
                    .withSecretName(signing.getKeySecret())
                .endSecret()
                .build());
            mounts.add(mount(COSIGN_KEY_VOLUME, COSIGN_KEY_PATH, true));

            // Passphrase for an encrypted key, absent for unencrypted keys
            env.add(new EnvVarBuilder()
                .withName("COSIGN_PASSWORD")
                .withNewValueFrom()
                    .withNewSecretKeyRef()
                        .withName(signing.getKeySecret())
                        .withKey("password")
                        .withOptional(true)
                    .endSecretKeyRef()
                .endValueFrom()
                .build());
        } else {
            env.add(new EnvVarBuilder().withName("COSIGN_EXPERIMENTAL").withValue("1").build());
        }

        args.add("--yes");
        args.add(imageRef);

        Container cosign = new ContainerBuilder()
            .withName(BuildStage.SIGN.getContainerName())
            .withImage(signing.getImage())
            .withArgs(args)
            .withEnv(env)
            .withResources(resources("50m", "128Mi", "200m", "512Mi"))
            .withSecurityContext(containerSecurityContext(true))
            .withVolumeMounts(mounts)
            .build();

        return optionalStageJob(job, BuildStage.SIGN, cosign, signing.getDeadline().toSeconds(),
            signing.getTtlSecondsAfterFinished(), volumes);
    }

    /**
     * Kaniko executor arguments. Build args are sorted so the same job always yields
     * the same argument list.
     */
    List<String> kanikoArgs(BuildJob job, String imageTag, String latestTag) {
        BuildConfig config = job.getBuildConfig() != null ? job.getBuildConfig() : new BuildConfig();
        KilnProperties.ClusterBuildConfig build = properties.getBuild();

        List<String> args = new ArrayList<>();
        args.add("--dockerfile=" + config.dockerfileOrDefault());
        args.add("--context=" + gitContext(job));
        args.add("--destination=" + imageTag);
        args.add("--destination=" + latestTag);
        // Layer caching
        args.add("--cache=true");
        args.add("--cache-repo=" + properties.resolvedCacheRepo());
        args.add("--cache-ttl=" + build.getCacheTtl());
        // Reproducibility
        args.add("--reproducible");
        args.add("--snapshot-mode=redo");
        // Build metadata
        args.add("--label=org.opencontainers.image.source=" + job.getGitRepo());
        args.add("--label=org.opencontainers.image.revision=" + job.getGitSha());
        args.add("--label=org.opencontainers.image.created=" + Instant.now(clock).truncatedTo(ChronoUnit.SECONDS));
        args.add("--label=com.whereq.kiln.service-id=" + job.getServiceId());
        args.add("--label=com.whereq.kiln.release-id=" + job.getReleaseId());
        args.add("--verbosity=info");

        if (config.getBuildArgs() != null) {
            new TreeMap<>(config.getBuildArgs())
                .forEach((key, value) -> args.add("--build-arg=" + key + "=" + value));
        }

        if (hasText(config.getTarget())) {
            args.add("--target=" + config.getTarget());
        }

        return args;
    }

    /**
     * Kaniko git context: git://{repo without scheme}#refs/heads/{branch}#{sha}, with
     * ":{context}" appended when building from a subdirectory
     */
    static String gitContext(BuildJob job) {
        String repo = job.getGitRepo();
        if (repo.startsWith("https://")) {
            repo = repo.substring("https://".length());
        } else if (repo.startsWith("http://")) {
            repo = repo.substring("http://".length());
        }

        String context = "git://" + repo + "#refs/heads/" + branch(job) + "#" + job.getGitSha();

        String contextPath = job.getBuildConfig() != null
            ? job.getBuildConfig().contextOrDefault()
            : BuildConfig.DEFAULT_CONTEXT;
        if (!BuildConfig.DEFAULT_CONTEXT.equals(contextPath)) {
            context = context + ":" + contextPath;
        }
        return context;
    }

    /**
     * Job names stay well below the 63 character limit: {stage}-{first 8 of job id}
     */
    public static String jobName(BuildStage stage, BuildJob job) {
        return stage.getJobNamePrefix() + "-" + job.getId().toString().substring(0, 8);
    }

    void setClock(Clock clock) {
        this.clock = clock;
    }

    private Job optionalStageJob(BuildJob job, BuildStage stage, Container container,
                                 long activeDeadlineSeconds, int ttlSeconds, List<Volume> volumes) {
        return new JobBuilder()
            .withNewMetadata()
                .withName(jobName(stage, job))
                .withNamespace(properties.getBuild().getNamespace())
                .withLabels(labels(job, stage))
            .endMetadata()
            .withNewSpec()
                .withBackoffLimit(0)
                .withTtlSecondsAfterFinished(ttlSeconds)
                .withActiveDeadlineSeconds(activeDeadlineSeconds)
                .withNewTemplate()
                    .withNewMetadata()
                        .withLabels(labels(job, stage))
                    .endMetadata()
                    .withSpec(new PodSpecBuilder()
                        .withRestartPolicy("Never")
                        .withSecurityContext(podSecurityContext(NON_ROOT_ID))
                        .withContainers(container)
                        .withVolumes(volumes)
                        .build())
                .endTemplate()
            .endSpec()
            .build();
    }

    private static Map<String, String> labels(BuildJob job, BuildStage stage) {
        Map<String, String> labels = new HashMap<>();
        labels.put(LABEL_BUILD_ID, job.getId().toString());
        labels.put(LABEL_COMPONENT, stage.getComponent());
        labels.put(LABEL_MANAGED_BY, MANAGED_BY_VALUE);
        return labels;
    }

    private static PodSecurityContext podSecurityContext(long id) {
        return new PodSecurityContextBuilder()
            .withRunAsNonRoot(id != ROOT_ID)
            .withRunAsUser(id)
            .withRunAsGroup(id)
            .withFsGroup(id)
            .withSeccompProfile(new SeccompProfileBuilder().withType("RuntimeDefault").build())
            .build();
    }

    private static SecurityContext containerSecurityContext(boolean readOnlyRootFilesystem) {
        return new SecurityContextBuilder()
            .withAllowPrivilegeEscalation(false)
            .withReadOnlyRootFilesystem(readOnlyRootFilesystem)
            .withCapabilities(new CapabilitiesBuilder().withDrop("ALL").build())
            .build();
    }

    private static ResourceRequirements resources(String cpuRequest, String memoryRequest,
                                                  String cpuLimit, String memoryLimit) {
        return new ResourceRequirementsBuilder()
            .withRequests(Map.of("cpu", new Quantity(cpuRequest), "memory", new Quantity(memoryRequest)))
            .withLimits(Map.of("cpu", new Quantity(cpuLimit), "memory", new Quantity(memoryLimit)))
            .build();
    }

    /**
     * Prefer nodes without GPUs; builds never need them
     */
    private static Affinity avoidGpuNodes() {
        return new AffinityBuilder()
            .withNodeAffinity(new NodeAffinityBuilder()
                .withPreferredDuringSchedulingIgnoredDuringExecution(new PreferredSchedulingTermBuilder()
                    .withWeight(100)
                    .withPreference(new NodeSelectorTermBuilder()
                        .withMatchExpressions(new NodeSelectorRequirementBuilder()
                            .withKey("nvidia.com/gpu")
                            .withOperator("DoesNotExist")
                            .build())
                        .build())
                    .build())
                .build())
            .build();
    }

    private Volume registryCredentials() {
        return new VolumeBuilder()
            .withName(DOCKER_CONFIG_VOLUME)
            .withNewSecret()
                .withSecretName(properties.getBuild().getRegistrySecret())
                .withItems(new KeyToPathBuilder().withKey(".dockerconfigjson").withPath("config.json").build())
            .endSecret()
            .build();
    }

    private static Volume scratch() {
        return new VolumeBuilder()
            .withName(TMP_VOLUME)
            .withNewEmptyDir()
            .endEmptyDir()
            .build();
    }

    private static VolumeMount mount(String name, String path, boolean readOnly) {
        return new VolumeMountBuilder()
            .withName(name)
            .withMountPath(path)
            .withReadOnly(readOnly)
            .build();
    }

    private static String branch(BuildJob job) {
        return hasText(job.getGitBranch()) ? job.getGitBranch() : DEFAULT_BRANCH;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
