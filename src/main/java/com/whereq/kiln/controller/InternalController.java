package com.whereq.kiln.controller;

import com.whereq.kiln.dto.EnqueueRequest;
import com.whereq.kiln.dto.EnqueueResponse;
import com.whereq.kiln.queue.BuildQueue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Entry point the release API uses to queue builds
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/internal")
@Tag(name = "Internal", description = "Build submission for the release API")
public class InternalController {

    @Autowired
    private BuildQueue buildQueue;

    /**
     * Queue a build
     *
     * @param request commit to build
     * @return Mono with 202 Accepted and the job id
     */
    @PostMapping("/enqueue")
    @Operation(summary = "Enqueue build", description = "Queue a commit for building; priority above zero jumps the FIFO lane")
    public Mono<ResponseEntity<EnqueueResponse>> enqueue(@RequestBody EnqueueRequest request) {
        log.info("Received build request for service {} at {} (priority {})",
            request.getServiceId(), request.getGitSha(), request.getPriority());

        return Mono.fromCallable(() -> {
                request.validate();
                return request.toJob();
            })
            .flatMap(buildQueue::enqueue)
            .flatMap(job -> buildQueue.size()
                .onErrorResume(e -> {
                    log.warn("Queued job {} but could not read queue length: {}", job.getId(), e.getMessage());
                    return Mono.empty();
                })
                .map(size -> EnqueueResponse.builder().jobId(job.getId()).position(size).build())
                .defaultIfEmpty(EnqueueResponse.builder().jobId(job.getId()).build()))
            .map(response -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/jobs/" + response.getJobId()))
                .body(response))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.warn("Rejected build request: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(EnqueueResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Failed to enqueue build", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(EnqueueResponse.error("failed to enqueue build")));
            });
    }
}
