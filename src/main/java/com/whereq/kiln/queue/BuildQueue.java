package com.whereq.kiln.queue;

import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildResult;
import com.whereq.kiln.model.JobStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.UUID;

/**
 * Shared build queue used by every worker.
 *
 * Dequeue is atomic across workers: no two callers ever receive the same job.
 * Callers treat every write as fire-and-forget and only log failures.
 */
public interface BuildQueue {

    /**
     * Enqueue a job, assigning its id and creation time
     *
     * @param job the job to enqueue
     * @return Mono with the stored job
     */
    Mono<BuildJob> enqueue(BuildJob job);

    /**
     * Take the next job, waiting at most {@code timeout} for one to arrive
     *
     * @param timeout maximum wait
     * @return Mono with the job, empty when none arrived in time
     */
    Mono<BuildJob> dequeue(Duration timeout);

    /**
     * Record a status transition made by a worker
     */
    Mono<Void> updateStatus(UUID jobId, JobStatus status, String workerId);

    /**
     * Store the terminal result. The first stored result wins.
     *
     * @return Mono with true if this call stored the result
     */
    Mono<Boolean> setResult(UUID jobId, BuildResult result);

    /**
     * Append one line to the job's build log
     */
    Mono<Void> appendLog(UUID jobId, String line);

    Mono<Void> registerWorker(String workerId);

    Mono<Void> unregisterWorker(String workerId);

    /**
     * Withdraw a job that no worker has taken yet
     *
     * @return Mono with true if the job was still queued and is now cancelled
     */
    Mono<Boolean> cancel(UUID jobId);

    Mono<BuildJob> getJob(UUID jobId);

    Mono<JobStatus> getStatus(UUID jobId);

    Mono<BuildResult> getResult(UUID jobId);

    /**
     * Build log lines recorded so far, oldest first
     */
    Flux<String> getLogs(UUID jobId);

    Flux<String> activeWorkers();

    /**
     * Number of jobs waiting across all lanes
     */
    Mono<Long> size();
}
