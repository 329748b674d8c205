package com.whereq.kiln.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildResult;
import com.whereq.kiln.model.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Redis-backed build queue.
 *
 * Job ids sit in a FIFO list (LPUSH/BRPOP) or, for prioritised jobs, a sorted set
 * popped with ZPOPMIN. Both pops are atomic, which is what keeps a job with a single
 * worker. Job data, status and result live in one hash per job.
 */
@Slf4j
@Service
public class RedisBuildQueue implements BuildQueue {

    static final String QUEUE_KEY = "kiln:queue:builds";
    static final String PRIORITY_QUEUE_KEY = "kiln:queue:priority";
    static final String JOB_KEY_PREFIX = "kiln:job:";
    static final String LOGS_KEY_PREFIX = "kiln:logs:";
    static final String ACTIVE_WORKERS_KEY = "kiln:workers:active";

    static final String FIELD_DATA = "data";
    static final String FIELD_STATUS = "status";
    static final String FIELD_RESULT = "result";
    static final String FIELD_WORKER_ID = "worker_id";

    private static final Duration TTL = Duration.ofDays(7); // Keep jobs and logs for 7 days
    private static final Duration MIN_BLOCKING_TIMEOUT = Duration.ofSeconds(1);

    @Autowired
    private ReactiveRedisTemplate<String, String> redisTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Override
    public Mono<BuildJob> enqueue(BuildJob job) {
        if (job.getId() == null) {
            job.setId(UUID.randomUUID());
        }
        job.setCreatedAt(Instant.now());

        String jobKey = jobKey(job.getId());

        return Mono.fromCallable(() -> writeJson(job))
            .flatMap(json -> {
                Map<String, String> fields = new HashMap<>();
                fields.put(FIELD_DATA, json);
                fields.put(FIELD_STATUS, JobStatus.QUEUED.getValue());
                fields.put("created_at", job.getCreatedAt().toString());
                return redisTemplate.<String, String>opsForHash().putAll(jobKey, fields);
            })
            .then(redisTemplate.expire(jobKey, TTL))
            .then(Mono.defer(() -> job.getPriority() > 0
                ? redisTemplate.opsForZSet()
                    .add(PRIORITY_QUEUE_KEY, job.getId().toString(), priorityScore(job))
                    .then()
                : redisTemplate.opsForList()
                    .leftPush(QUEUE_KEY, job.getId().toString())
                    .then()))
            .doOnSuccess(v -> log.info("Enqueued job {} for service {} at {} (priority {})",
                job.getId(), job.getServiceId(), job.shortSha(), job.getPriority()))
            .thenReturn(job);
    }

    @Override
    public Mono<BuildJob> dequeue(Duration timeout) {
        Duration blockFor = timeout.compareTo(MIN_BLOCKING_TIMEOUT) < 0 ? MIN_BLOCKING_TIMEOUT : timeout;

        return redisTemplate.opsForZSet().popMin(PRIORITY_QUEUE_KEY)
            .map(ZSetOperations.TypedTuple::getValue)
            .switchIfEmpty(Mono.defer(() -> redisTemplate.opsForList().rightPop(QUEUE_KEY, blockFor)))
            .flatMap(this::loadDequeuedJob);
    }

    private Mono<BuildJob> loadDequeuedJob(String jobId) {
        String jobKey = JOB_KEY_PREFIX + jobId;

        return redisTemplate.<String, String>opsForHash().multiGet(jobKey, List.of(FIELD_DATA, FIELD_STATUS))
            .flatMap(values -> {
                String data = values.get(0);
                String status = values.get(1);

                if (data == null) {
                    log.error("Dequeued job {} has no stored data, dropping it", jobId);
                    return Mono.empty();
                }
                if (JobStatus.CANCELLED.getValue().equals(status)) {
                    log.info("Skipping cancelled job {}", jobId);
                    return Mono.empty();
                }

                try {
                    BuildJob job = objectMapper.readValue(data, BuildJob.class);
                    log.debug("Dequeued job {}", jobId);
                    return Mono.just(job);
                } catch (JsonProcessingException e) {
                    log.error("Failed to deserialize job {}", jobId, e);
                    return Mono.empty();
                }
            });
    }

    @Override
    public Mono<Void> updateStatus(UUID jobId, JobStatus status, String workerId) {
        Map<String, String> updates = new HashMap<>();
        updates.put(FIELD_STATUS, status.getValue());
        if (workerId != null) {
            updates.put(FIELD_WORKER_ID, workerId);
        }

        String now = Instant.now().toString();
        switch (status) {
            case BUILDING -> updates.put("started_at", now);
            case COMPLETED, FAILED, CANCELLED -> updates.put("completed_at", now);
            default -> {
            }
        }

        return redisTemplate.<String, String>opsForHash()
            .putAll(jobKey(jobId), updates)
            .doOnSuccess(v -> log.debug("Job {} status updated: {}", jobId, status))
            .then();
    }

    @Override
    public Mono<Boolean> setResult(UUID jobId, BuildResult result) {
        return Mono.fromCallable(() -> writeJson(result))
            .flatMap(json -> redisTemplate.<String, String>opsForHash().putIfAbsent(jobKey(jobId), FIELD_RESULT, json))
            .doOnNext(stored -> {
                if (!stored) {
                    log.warn("Result for job {} already recorded, keeping the first one", jobId);
                }
            });
    }

    @Override
    public Mono<Void> appendLog(UUID jobId, String line) {
        String streamKey = LOGS_KEY_PREFIX + jobId;

        Map<String, String> entry = new HashMap<>();
        entry.put("line", line);
        entry.put("timestamp", Instant.now().toString());

        return redisTemplate.<String, String>opsForStream()
            .add(StreamRecords.newRecord().in(streamKey).ofMap(entry))
            .then(redisTemplate.expire(streamKey, TTL))
            .then();
    }

    @Override
    public Mono<Void> registerWorker(String workerId) {
        return redisTemplate.opsForSet().add(ACTIVE_WORKERS_KEY, workerId)
            .doOnSuccess(added -> log.info("Registered worker {}", workerId))
            .then();
    }

    @Override
    public Mono<Void> unregisterWorker(String workerId) {
        return redisTemplate.opsForSet().remove(ACTIVE_WORKERS_KEY, workerId)
            .doOnSuccess(removed -> log.info("Unregistered worker {}", workerId))
            .then();
    }

    @Override
    public Mono<Boolean> cancel(UUID jobId) {
        String member = jobId.toString();

        return Mono.zip(
                redisTemplate.opsForList().remove(QUEUE_KEY, 0, member),
                redisTemplate.opsForZSet().remove(PRIORITY_QUEUE_KEY, member))
            .flatMap(removed -> {
                if (removed.getT1() + removed.getT2() == 0) {
                    log.info("Job {} is no longer queued, cannot cancel", jobId);
                    return Mono.just(false);
                }
                return updateStatus(jobId, JobStatus.CANCELLED, null)
                    .doOnSuccess(v -> log.info("Cancelled queued job {}", jobId))
                    .thenReturn(true);
            });
    }

    @Override
    public Mono<BuildJob> getJob(UUID jobId) {
        return redisTemplate.<String, String>opsForHash().get(jobKey(jobId), FIELD_DATA)
            .map(json -> readJson(json, BuildJob.class));
    }

    @Override
    public Mono<JobStatus> getStatus(UUID jobId) {
        return redisTemplate.<String, String>opsForHash().get(jobKey(jobId), FIELD_STATUS)
            .map(JobStatus::fromValue);
    }

    @Override
    public Mono<BuildResult> getResult(UUID jobId) {
        return redisTemplate.<String, String>opsForHash().get(jobKey(jobId), FIELD_RESULT)
            .map(json -> readJson(json, BuildResult.class));
    }

    @Override
    public Flux<String> getLogs(UUID jobId) {
        return redisTemplate.<String, String>opsForStream()
            .range(LOGS_KEY_PREFIX + jobId, Range.unbounded())
            .mapNotNull(record -> record.getValue().get("line"));
    }

    @Override
    public Flux<String> activeWorkers() {
        return redisTemplate.opsForSet().members(ACTIVE_WORKERS_KEY);
    }

    @Override
    public Mono<Long> size() {
        return Mono.zip(
                redisTemplate.opsForList().size(QUEUE_KEY).defaultIfEmpty(0L),
                redisTemplate.opsForZSet().size(PRIORITY_QUEUE_KEY).defaultIfEmpty(0L))
            .map(sizes -> sizes.getT1() + sizes.getT2());
    }

    /**
     * Lower scores pop first; each priority point is worth 1000 seconds of waiting
     */
    static double priorityScore(BuildJob job) {
        return job.getCreatedAt().getEpochSecond() - job.getPriority() * 1000.0;
    }

    private static String jobKey(UUID jobId) {
        return JOB_KEY_PREFIX + jobId;
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T readJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
