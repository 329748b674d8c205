package com.whereq.kiln.controller;

import com.whereq.kiln.dto.WorkerListResponse;
import com.whereq.kiln.dto.WorkerStatsResponse;
import com.whereq.kiln.queue.BuildQueue;
import com.whereq.kiln.worker.BuildJobProcessor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Read-only view of this worker and the workers registered with the queue.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Workers", description = "Build worker status")
public class WorkerController {

    @Autowired
    private BuildJobProcessor processor;

    @Autowired
    private BuildQueue buildQueue;

    @GetMapping("/worker")
    @Operation(summary = "Worker stats", description = "Build slots of this worker and the shared queue length")
    public Mono<ResponseEntity<WorkerStatsResponse>> stats() {
        WorkerStatsResponse stats = WorkerStatsResponse.builder()
            .workerId(processor.getWorkerId())
            .maxConcurrentBuilds(processor.getMaxConcurrentBuilds())
            .activeBuilds(processor.getActiveBuilds())
            .availableSlots(processor.getAvailableSlots())
            .build();

        return buildQueue.size()
            .map(size -> {
                stats.setQueueLength(size);
                return ResponseEntity.ok(stats);
            })
            .onErrorResume(e -> {
                log.warn("Could not read queue length: {}", e.getMessage());
                return Mono.just(ResponseEntity.ok(stats));
            })
            .defaultIfEmpty(ResponseEntity.ok(stats));
    }

    @GetMapping("/workers")
    @Operation(summary = "Active workers", description = "Workers currently registered with the shared queue")
    public Mono<ResponseEntity<WorkerListResponse>> workers() {
        return buildQueue.activeWorkers()
            .sort()
            .collectList()
            .map(workers -> ResponseEntity.ok(WorkerListResponse.builder()
                .workers(workers)
                .count(workers.size())
                .build()))
            .onErrorResume(Exception.class, e -> {
                log.error("Could not list active workers", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .build());
            });
    }
}
