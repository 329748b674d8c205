package com.whereq.kiln.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for WhereQ Kiln.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "kiln")
@Data
public class KilnProperties {

    private WorkerConfig worker = new WorkerConfig();

    private ClusterBuildConfig build = new ClusterBuildConfig();

    private RegistryConfig registry = new RegistryConfig();

    private SbomConfig sbom = new SbomConfig();

    private SigningConfig signing = new SigningConfig();

    private CallbackConfig callback = new CallbackConfig();

    @Data
    public static class WorkerConfig {
        /**
         * Worker identity. Generated from the hostname when empty.
         */
        private String id;

        /**
         * Maximum number of builds this worker runs at once.
         */
        private int maxConcurrentBuilds = 3;

        /**
         * How long a single dequeue call may block waiting for work.
         */
        private Duration pollInterval = Duration.ofSeconds(5);

        /**
         * Pause after a failed dequeue before trying again.
         */
        private Duration dequeueErrorBackoff = Duration.ofSeconds(1);

        /**
         * Upper bound for draining in-flight builds on shutdown.
         */
        private Duration shutdownTimeout = Duration.ofMinutes(5);

        /**
         * Upper bound for the unregister call made after draining.
         */
        private Duration unregisterTimeout = Duration.ofSeconds(5);

        /**
         * Upper bound for each status, result and log write.
         */
        private Duration queueWriteTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class ClusterBuildConfig {
        /**
         * Wall-clock cap for a whole build, all stages included.
         */
        private Duration timeout = Duration.ofMinutes(30);

        /**
         * Namespace the build jobs are created in.
         */
        private String namespace = "kiln-builds";

        private String kanikoImage = "gcr.io/kaniko-project/executor:v1.19.0";

        /**
         * Registry path for the remote layer cache. Defaults to {registry}/cache.
         */
        private String cacheRepo;

        private String cacheTtl = "168h";

        /**
         * Secret holding a git token under the key "token", optional.
         */
        private String gitCredentialsSecret = "git-credentials";

        /**
         * Secret of type dockerconfigjson used to push and pull.
         */
        private String registrySecret = "regcred";

        /**
         * Seconds a finished cluster job is kept before the cluster deletes it.
         */
        private int ttlSecondsAfterFinished = 3600;

        private String cpuRequest = "500m";
        private String memoryRequest = "1Gi";
        private String cpuLimit = "2";
        private String memoryLimit = "4Gi";
    }

    @Data
    public static class RegistryConfig {
        /**
         * Registry host plus optional namespace, e.g. ghcr.io/acme.
         */
        private String url = "ghcr.io";

        private String username;

        private String password;

        /**
         * Talk plain http to the registry when resolving digests.
         */
        private boolean insecure = false;

        private Duration digestTimeout = Duration.ofSeconds(15);
    }

    @Data
    public static class SbomConfig {
        private boolean enabled = true;

        private String image = "anchore/syft:v1.4.1";

        private String format = "spdx-json";

        private Duration deadline = Duration.ofMinutes(5);

        private int ttlSecondsAfterFinished = 1800;
    }

    @Data
    public static class SigningConfig {
        private boolean enabled = true;

        private String image = "gcr.io/projectsigstore/cosign:v2.2.3";

        /**
         * Secret holding cosign.key and an optional password. Selects key-based signing.
         */
        private String keySecret;

        /**
         * Sign through the identity-federated keyless flow when no key secret is set.
         */
        private boolean keyless = false;

        private Duration deadline = Duration.ofMinutes(3);

        private int ttlSecondsAfterFinished = 1800;
    }

    @Data
    public static class CallbackConfig {
        /**
         * Bearer token sent with every callback, optional.
         */
        private String apiKey;

        private Duration timeout = Duration.ofSeconds(30);
    }

    /**
     * Signing needs either a key or the keyless identity.
     */
    public boolean isSigningConfigured() {
        return signing.isEnabled()
            && ((signing.getKeySecret() != null && !signing.getKeySecret().isBlank()) || signing.isKeyless());
    }

    public String resolvedCacheRepo() {
        String cacheRepo = build.getCacheRepo();
        return cacheRepo == null || cacheRepo.isBlank() ? registry.getUrl() + "/cache" : cacheRepo;
    }
}
