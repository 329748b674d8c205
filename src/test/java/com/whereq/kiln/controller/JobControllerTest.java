package com.whereq.kiln.controller;

import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildResult;
import com.whereq.kiln.model.JobStatus;
import com.whereq.kiln.queue.BuildQueue;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(JobController.class)
class JobControllerTest {

    @Autowired
    private WebTestClient client;

    @MockBean
    private BuildQueue buildQueue;

    private final UUID jobId = UUID.randomUUID();

    @Test
    void returnsJobStatusAndResult() {
        BuildJob job = BuildJob.builder().id(jobId).gitSha("abc123def456").build();
        BuildResult result = BuildResult.builder()
            .jobId(jobId)
            .success(true)
            .imageUri("ghcr.io/acme/api:abc123de")
            .build();

        when(buildQueue.getJob(jobId)).thenReturn(Mono.just(job));
        when(buildQueue.getStatus(jobId)).thenReturn(Mono.just(JobStatus.COMPLETED));
        when(buildQueue.getResult(jobId)).thenReturn(Mono.just(result));

        client.get().uri("/api/v1/jobs/{id}", jobId)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.job.id").isEqualTo(jobId.toString())
            .jsonPath("$.job.git_sha").isEqualTo("abc123def456")
            .jsonPath("$.status").isEqualTo("completed")
            .jsonPath("$.result.success").isEqualTo(true)
            .jsonPath("$.result.image_uri").isEqualTo("ghcr.io/acme/api:abc123de");
    }

    @Test
    void runningJobHasNoResultYet() {
        when(buildQueue.getJob(jobId)).thenReturn(Mono.just(BuildJob.builder().id(jobId).build()));
        when(buildQueue.getStatus(jobId)).thenReturn(Mono.just(JobStatus.BUILDING));
        when(buildQueue.getResult(jobId)).thenReturn(Mono.empty());

        client.get().uri("/api/v1/jobs/{id}", jobId)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("building")
            .jsonPath("$.result").doesNotExist();
    }

    @Test
    void unknownJobIsNotFound() {
        when(buildQueue.getJob(jobId)).thenReturn(Mono.empty());

        client.get().uri("/api/v1/jobs/{id}", jobId)
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    void malformedJobIdIsRejected() {
        client.get().uri("/api/v1/jobs/not-a-uuid")
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    void cancelsQueuedJob() {
        when(buildQueue.getStatus(jobId)).thenReturn(Mono.just(JobStatus.QUEUED));
        when(buildQueue.cancel(jobId)).thenReturn(Mono.just(true));

        client.post().uri("/api/v1/jobs/{id}/cancel", jobId)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("cancelled")
            .jsonPath("$.cancelledAt").exists();
    }

    @Test
    void jobHeldByAWorkerCannotBeCancelled() {
        when(buildQueue.getStatus(jobId)).thenReturn(Mono.just(JobStatus.BUILDING));
        when(buildQueue.cancel(jobId)).thenReturn(Mono.just(false));

        client.post().uri("/api/v1/jobs/{id}/cancel", jobId)
            .exchange()
            .expectStatus().isEqualTo(409)
            .expectBody()
            .jsonPath("$.status").isEqualTo("building")
            .jsonPath("$.message").isEqualTo("job is no longer queued");
    }

    @Test
    void cancellingUnknownJobIsNotFound() {
        when(buildQueue.getStatus(jobId)).thenReturn(Mono.empty());

        client.post().uri("/api/v1/jobs/{id}/cancel", jobId)
            .exchange()
            .expectStatus().isNotFound();

        verify(buildQueue, never()).cancel(any());
    }

    @Test
    void replaysBuildLogAsEvents() {
        when(buildQueue.getLogs(jobId)).thenReturn(Flux.just("Submitted build job kaniko-build-1a2b3c4d", "Image pushed"));

        Flux<String> lines = client.get().uri("/api/v1/jobs/{id}/logs", jobId)
            .accept(MediaType.TEXT_EVENT_STREAM)
            .exchange()
            .expectStatus().isOk()
            .returnResult(String.class)
            .getResponseBody();

        StepVerifier.create(lines)
            .expectNext("Submitted build job kaniko-build-1a2b3c4d", "Image pushed")
            .verifyComplete();
    }
}
