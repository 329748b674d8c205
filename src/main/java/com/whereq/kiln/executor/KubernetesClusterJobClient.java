package com.whereq.kiln.executor;

import com.whereq.kiln.config.KilnProperties;
import com.whereq.kiln.exception.ClusterJobException;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.Watch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * {@link ClusterJobClient} backed by the fabric8 Kubernetes client.
 *
 * Completion is detected only through a watch on the job name; there is no polling.
 */
@Slf4j
@Component
public class KubernetesClusterJobClient implements ClusterJobClient {

    /**
     * Label the Job controller puts on the pods it creates
     */
    static final String JOB_NAME_LABEL = "job-name";

    @Autowired
    private KubernetesClient kubernetesClient;

    @Autowired
    private KilnProperties properties;

    @Override
    public String submit(Job job) {
        String namespace = namespace();
        try {
            Job created = kubernetesClient.batch().v1().jobs()
                .inNamespace(namespace)
                .resource(job)
                .create();
            String name = created.getMetadata().getName();
            log.info("Created job {} in namespace {}", name, namespace);
            return name;
        } catch (KubernetesClientException e) {
            throw new ClusterJobException("failed to create job " + job.getMetadata().getName()
                + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void awaitCompletion(String jobName, Duration timeout) throws TimeoutException, InterruptedException {
        JobCompletionWatcher watcher = new JobCompletionWatcher(jobName);

        try (Watch ignored = kubernetesClient.batch().v1().jobs()
                .inNamespace(namespace())
                .withName(jobName)
                .watch(watcher)) {
            watcher.completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (KubernetesClientException e) {
            throw new ClusterJobException("failed to watch job " + jobName + ": " + e.getMessage(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ClusterJobException clusterJobException) {
                throw clusterJobException;
            }
            throw new ClusterJobException("watch for job " + jobName + " failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    public void streamLogs(String jobName, String container, Consumer<String> lineConsumer) {
        Pod pod = findPod(jobName);
        try (Reader reader = kubernetesClient.pods()
                .inNamespace(namespace())
                .withName(pod.getMetadata().getName())
                .inContainer(container)
                .getLogReader();
             BufferedReader lines = new BufferedReader(reader)) {
            String line;
            while ((line = lines.readLine()) != null) {
                lineConsumer.accept(line);
            }
        } catch (IOException | KubernetesClientException e) {
            throw new ClusterJobException("failed to stream logs of job " + jobName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String readLogs(String jobName, String container) {
        Pod pod = findPod(jobName);
        try {
            return kubernetesClient.pods()
                .inNamespace(namespace())
                .withName(pod.getMetadata().getName())
                .inContainer(container)
                .getLog();
        } catch (KubernetesClientException e) {
            throw new ClusterJobException("failed to read logs of job " + jobName + ": " + e.getMessage(), e);
        }
    }

    private Pod findPod(String jobName) {
        List<Pod> pods;
        try {
            pods = kubernetesClient.pods()
                .inNamespace(namespace())
                .withLabel(JOB_NAME_LABEL, jobName)
                .list()
                .getItems();
        } catch (KubernetesClientException e) {
            throw new ClusterJobException("failed to list pods of job " + jobName + ": " + e.getMessage(), e);
        }
        if (pods.isEmpty()) {
            throw new ClusterJobException("no pod found for job " + jobName);
        }
        return pods.get(0);
    }

    private String namespace() {
        return properties.getBuild().getNamespace();
    }
}
