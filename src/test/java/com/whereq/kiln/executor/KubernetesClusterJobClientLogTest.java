package com.whereq.kiln.executor;

import com.whereq.kiln.config.KilnProperties;
import com.whereq.kiln.exception.ClusterJobException;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodList;
import io.fabric8.kubernetes.api.model.PodListBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.ContainerResource;
import io.fabric8.kubernetes.client.dsl.FilterWatchListDeletable;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.PodResource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KubernetesClusterJobClientLogTest {

    private static final String NAMESPACE = "kiln-builds";
    private static final String JOB_NAME = "kaniko-build-1a2b3c4d";
    private static final String POD_NAME = JOB_NAME + "-x7k2p";

    @Mock
    private KubernetesClient kubernetesClient;

    @Mock
    private MixedOperation<Pod, PodList, PodResource> pods;

    @Mock
    private NonNamespaceOperation<Pod, PodList, PodResource> namespacedPods;

    @Mock
    private FilterWatchListDeletable<Pod, PodList, PodResource> jobPods;

    @Mock
    private PodResource podResource;

    @Mock
    private ContainerResource containerResource;

    private KubernetesClusterJobClient clusterJobClient;

    @BeforeEach
    void setUp() {
        clusterJobClient = new KubernetesClusterJobClient();
        ReflectionTestUtils.setField(clusterJobClient, "kubernetesClient", kubernetesClient);
        ReflectionTestUtils.setField(clusterJobClient, "properties", new KilnProperties());

        when(kubernetesClient.pods()).thenReturn(pods);
        when(pods.inNamespace(NAMESPACE)).thenReturn(namespacedPods);
        when(namespacedPods.withLabel(KubernetesClusterJobClient.JOB_NAME_LABEL, JOB_NAME)).thenReturn(jobPods);
        when(jobPods.list()).thenReturn(new PodListBuilder()
            .addNewItem().withNewMetadata().withName(POD_NAME).endMetadata().endItem()
            .build());
        when(namespacedPods.withName(POD_NAME)).thenReturn(podResource);
    }

    @Test
    void streamLogsForwardsEveryLine() {
        when(podResource.inContainer("kaniko")).thenReturn(containerResource);
        when(containerResource.getLogReader()).thenReturn(new StringReader(
            "INFO[0001] Retrieving image manifest golang:1.22\nINFO[0042] Pushing image to ghcr.io/acme/api:abc123de\n"));

        List<String> lines = new ArrayList<>();
        clusterJobClient.streamLogs(JOB_NAME, "kaniko", lines::add);

        assertThat(lines).containsExactly(
            "INFO[0001] Retrieving image manifest golang:1.22",
            "INFO[0042] Pushing image to ghcr.io/acme/api:abc123de");
    }

    @Test
    void readLogsReturnsWholeOutput() {
        when(podResource.inContainer("syft")).thenReturn(containerResource);
        when(containerResource.getLog()).thenReturn("{\"spdxVersion\":\"SPDX-2.3\"}\n");

        assertThat(clusterJobClient.readLogs(JOB_NAME, "syft")).isEqualTo("{\"spdxVersion\":\"SPDX-2.3\"}\n");
    }

    @Test
    void apiErrorWhileReadingBecomesClusterJobException() {
        when(podResource.inContainer("syft")).thenReturn(containerResource);
        when(containerResource.getLog()).thenThrow(new KubernetesClientException("pods \"" + POD_NAME + "\" not found"));

        assertThatThrownBy(() -> clusterJobClient.readLogs(JOB_NAME, "syft"))
            .isInstanceOf(ClusterJobException.class)
            .hasMessageContaining("failed to read logs of job " + JOB_NAME);
    }
}
