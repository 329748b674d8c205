package com.whereq.kiln.executor;

import io.fabric8.kubernetes.api.model.batch.v1.Job;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * The cluster operations the build pipeline relies on.
 *
 * Implementations throw {@link com.whereq.kiln.exception.ClusterJobException} when the
 * cluster rejects a request or a watch ends without a terminal condition.
 */
public interface ClusterJobClient {

    /**
     * Create the job.
     *
     * @return the name of the created job
     */
    String submit(Job job);

    /**
     * Block until the job reports Complete.
     *
     * @throws com.whereq.kiln.exception.ClusterJobException if the job fails or the watch breaks
     * @throws TimeoutException if the job is still running when the timeout elapses
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    void awaitCompletion(String jobName, Duration timeout) throws TimeoutException, InterruptedException;

    /**
     * Forward the container log of the job's pod line by line
     */
    void streamLogs(String jobName, String container, Consumer<String> lineConsumer);

    /**
     * Read the full container log of the job's pod
     */
    String readLogs(String jobName, String container);
}
