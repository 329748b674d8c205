package com.whereq.kiln.controller;

import com.whereq.kiln.dto.JobCancellationResponse;
import com.whereq.kiln.dto.JobDetailsResponse;
import com.whereq.kiln.model.JobStatus;
import com.whereq.kiln.queue.BuildQueue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Lookup and cancellation of queued builds
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@Tag(name = "Jobs", description = "Build job status, logs and cancellation")
public class JobController {

    @Autowired
    private BuildQueue buildQueue;

    /**
     * Get a job with its status and result
     *
     * @param jobId job identifier
     * @return Mono with the job details, 404 when the job is unknown or expired
     */
    @GetMapping("/{jobId}")
    @Operation(summary = "Job details", description = "Stored job, current status and result when finished")
    public Mono<ResponseEntity<JobDetailsResponse>> getJob(@PathVariable UUID jobId) {
        return buildQueue.getJob(jobId)
            .flatMap(job -> Mono.zip(
                    buildQueue.getStatus(jobId).map(Optional::of).defaultIfEmpty(Optional.empty()),
                    buildQueue.getResult(jobId).map(Optional::of).defaultIfEmpty(Optional.empty()))
                .map(state -> ResponseEntity.ok(JobDetailsResponse.builder()
                    .job(job)
                    .status(state.getT1().orElse(null))
                    .result(state.getT2().orElse(null))
                    .build())))
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .onErrorResume(Exception.class, e -> {
                log.error("Error reading job {}", jobId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .build());
            });
    }

    /**
     * Withdraw a job that no worker has taken yet
     *
     * @param jobId job identifier
     * @return Mono with cancellation response, 409 once a worker holds the job
     */
    @PostMapping("/{jobId}/cancel")
    @Operation(summary = "Cancel job", description = "Only queued jobs can be cancelled")
    public Mono<ResponseEntity<JobCancellationResponse>> cancelJob(@PathVariable UUID jobId) {
        log.info("Cancellation request for job {}", jobId);

        return buildQueue.getStatus(jobId)
            .flatMap(status -> buildQueue.cancel(jobId)
                .map(cancelled -> {
                    if (cancelled) {
                        return ResponseEntity.ok(JobCancellationResponse.builder()
                            .jobId(jobId)
                            .status(JobStatus.CANCELLED)
                            .cancelledAt(Instant.now())
                            .message("job cancelled")
                            .build());
                    }
                    return ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(JobCancellationResponse.builder()
                            .jobId(jobId)
                            .status(status)
                            .message("job is no longer queued")
                            .build());
                }))
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .onErrorResume(Exception.class, e -> {
                log.error("Error cancelling job {}", jobId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .build());
            });
    }

    /**
     * Replay the build log recorded so far as server-sent events
     */
    @GetMapping(value = "/{jobId}/logs", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Build log", description = "Log lines recorded so far, one event per line")
    public Flux<ServerSentEvent<String>> getLogs(@PathVariable UUID jobId) {
        return buildQueue.getLogs(jobId)
            .map(line -> ServerSentEvent.<String>builder()
                .event("log")
                .data(line)
                .build());
    }
}
