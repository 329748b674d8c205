package com.whereq.kiln.worker;

import com.whereq.kiln.config.KilnProperties;
import com.whereq.kiln.executor.BuildDeadline;
import com.whereq.kiln.executor.BuildExecutor;
import com.whereq.kiln.executor.BuildLogSink;
import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildResult;
import com.whereq.kiln.model.JobStatus;
import com.whereq.kiln.queue.BuildQueue;
import com.whereq.kiln.service.CallbackNotifier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pulls build jobs from the shared queue and runs them, at most
 * {@code kiln.worker.max-concurrent-builds} at a time.
 *
 * A slot is taken from the admission semaphore before every dequeue and handed back
 * either right away (no job, dequeue error) or in a {@code finally} block once the
 * build task has returned, so the number of running builds never exceeds the
 * configured limit.
 *
 * Started and stopped with the application context. Stopping drains in-flight builds
 * up to {@code kiln.worker.shutdown-timeout}, then unregisters the worker.
 */
@Slf4j
@Service
public class BuildJobProcessor implements SmartLifecycle {

    private static final long ADMISSION_WAIT_MILLIS = 200;
    private static final Duration DEQUEUE_MARGIN = Duration.ofSeconds(2);

    static final String BUILD_THREAD_PREFIX = "kiln-build-";

    @Autowired
    private BuildQueue buildQueue;

    @Autowired
    private BuildExecutor buildExecutor;

    @Autowired
    private CallbackNotifier callbackNotifier;

    @Autowired
    private KilnProperties properties;

    @Autowired
    private WorkerIdentity workerIdentity;

    @Autowired
    private MeterRegistry meterRegistry;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final AtomicInteger activeBuilds = new AtomicInteger();

    private Semaphore slots;
    private ExecutorService buildPool;
    private Thread dequeueThread;

    private Counter successCounter;
    private Counter failureCounter;
    private Timer durationTimer;

    @PostConstruct
    public void initialize() {
        slots = new Semaphore(properties.getWorker().getMaxConcurrentBuilds());

        successCounter = Counter.builder("kiln.builds.succeeded")
            .description("Number of builds that produced an image")
            .register(meterRegistry);

        failureCounter = Counter.builder("kiln.builds.failed")
            .description("Number of builds that failed")
            .register(meterRegistry);

        durationTimer = Timer.builder("kiln.builds.duration")
            .description("Wall-clock time of a build, all stages included")
            .register(meterRegistry);

        Gauge.builder("kiln.builds.active", activeBuilds, AtomicInteger::get)
            .description("Builds currently running on this worker")
            .register(meterRegistry);
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        shuttingDown.set(false);

        String workerId = workerIdentity.getId();
        int maxConcurrent = properties.getWorker().getMaxConcurrentBuilds();
        log.info("Starting build worker {} with {} build slots", workerId, maxConcurrent);

        awaitQuietly("register worker " + workerId, buildQueue.registerWorker(workerId),
            properties.getWorker().getQueueWriteTimeout());

        buildPool = Executors.newFixedThreadPool(maxConcurrent, daemonThreads(BUILD_THREAD_PREFIX));
        dequeueThread = daemonThreads("kiln-dequeue-").newThread(this::dequeueLoop);
        dequeueThread.start();
    }

    /**
     * Graceful stop: admit no more jobs, let running builds finish within the
     * shutdown timeout, then unregister.
     */
    @Override
    public void stop() {
        shutdown(false);
    }

    /**
     * Immediate stop: interrupt running builds, then unregister. Interrupted builds are
     * recorded as failed.
     */
    public void abort() {
        shutdown(true);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    public String getWorkerId() {
        return workerIdentity.getId();
    }

    public int getMaxConcurrentBuilds() {
        return properties.getWorker().getMaxConcurrentBuilds();
    }

    public int getActiveBuilds() {
        return activeBuilds.get();
    }

    public int getAvailableSlots() {
        return slots.availablePermits();
    }

    private void dequeueLoop() {
        Duration pollInterval = properties.getWorker().getPollInterval();

        while (!shuttingDown.get()) {
            boolean acquired;
            try {
                acquired = slots.tryAcquire(ADMISSION_WAIT_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (!acquired) {
                continue;
            }
            if (shuttingDown.get()) {
                slots.release();
                break;
            }

            BuildJob job;
            try {
                job = buildQueue.dequeue(pollInterval).block(pollInterval.plus(DEQUEUE_MARGIN));
            } catch (RuntimeException e) {
                slots.release();
                if (shuttingDown.get()) {
                    break;
                }
                log.error("Dequeue failed on worker {}: {}", workerIdentity.getId(), e.getMessage());
                if (!backOff()) {
                    break;
                }
                continue;
            }

            if (job == null) {
                slots.release();
                continue;
            }

            dispatch(job);
        }

        log.info("Worker {} stopped taking new jobs", workerIdentity.getId());
    }

    private void dispatch(BuildJob job) {
        activeBuilds.incrementAndGet();
        try {
            buildPool.execute(() -> {
                try {
                    process(job);
                } finally {
                    activeBuilds.decrementAndGet();
                    slots.release();
                }
            });
        } catch (RejectedExecutionException e) {
            activeBuilds.decrementAndGet();
            slots.release();
            log.error("Worker {} could not start job {}: {}", workerIdentity.getId(), job.getId(), e.getMessage());
            recordResult(job, BuildResult.failure(job, "worker shutting down before the build started", 0));
        }
    }

    /**
     * Runs one job to completion on a build thread
     */
    void process(BuildJob job) {
        String workerId = workerIdentity.getId();
        Duration writeTimeout = properties.getWorker().getQueueWriteTimeout();

        log.info("Worker {} picked up job {} ({} @ {})", workerId, job.getId(), job.getGitRepo(), job.shortSha());
        awaitQuietly("mark job " + job.getId() + " building",
            buildQueue.updateStatus(job.getId(), JobStatus.BUILDING, workerId), writeTimeout);

        BuildDeadline deadline = BuildDeadline.after(properties.getBuild().getTimeout());
        QueueLogSink logSink = new QueueLogSink(job);
        long startNanos = System.nanoTime();

        BuildResult result;
        Error fatal = null;
        try {
            result = buildExecutor.execute(job, deadline, logSink);
        } catch (RuntimeException e) {
            log.error("Build executor crashed on job {}", job.getId(), e);
            result = BuildResult.failure(job, "build crashed: " + e.getMessage(),
                (System.nanoTime() - startNanos) / 1_000_000_000.0);
        } catch (Error e) {
            log.error("Build executor failed fatally on job {}", job.getId(), e);
            result = BuildResult.failure(job, "build crashed: " + e,
                (System.nanoTime() - startNanos) / 1_000_000_000.0);
            fatal = e;
        }
        durationTimer.record(Duration.ofNanos(System.nanoTime() - startNanos));

        // Queue writes below must not see the interrupt that may have ended the build
        boolean interrupted = Thread.interrupted();
        try {
            recordResult(job, result);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        // Recorded as failed above; the error itself still ends this build thread
        if (fatal != null) {
            throw fatal;
        }
    }

    private void recordResult(BuildJob job, BuildResult result) {
        Duration writeTimeout = properties.getWorker().getQueueWriteTimeout();
        JobStatus status = result.isSuccess() ? JobStatus.COMPLETED : JobStatus.FAILED;

        if (result.isSuccess()) {
            successCounter.increment();
            log.info("Job {} completed: {} in {}s", job.getId(), result.getImageUri(),
                String.format("%.1f", result.getDurationSecs()));
        } else {
            failureCounter.increment();
            log.warn("Job {} failed after {}s: {}", job.getId(),
                String.format("%.1f", result.getDurationSecs()), result.getErrorMessage());
        }

        awaitQuietly("store result of job " + job.getId(), buildQueue.setResult(job.getId(), result), writeTimeout);
        awaitQuietly("mark job " + job.getId() + " " + status.getValue(),
            buildQueue.updateStatus(job.getId(), status, workerIdentity.getId()), writeTimeout);

        if (job.getCallbackUrl() != null && !job.getCallbackUrl().isBlank()) {
            awaitQuietly("notify callback of job " + job.getId(),
                callbackNotifier.notify(job.getCallbackUrl(), result),
                properties.getCallback().getTimeout().plus(DEQUEUE_MARGIN));
        }
    }

    private void shutdown(boolean interruptBuilds) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        shuttingDown.set(true);

        Duration ceiling = properties.getWorker().getShutdownTimeout();
        long deadlineNanos = System.nanoTime() + ceiling.toNanos();
        log.info("Stopping worker {} with {} builds in flight", workerIdentity.getId(), activeBuilds.get());

        try {
            if (interruptBuilds) {
                dequeueThread.interrupt();
            }
            dequeueThread.join(Math.max(1, remainingMillis(deadlineNanos)));

            if (interruptBuilds) {
                buildPool.shutdownNow();
            } else {
                buildPool.shutdown();
            }

            if (!buildPool.awaitTermination(remainingMillis(deadlineNanos), TimeUnit.MILLISECONDS)) {
                log.warn("Shutdown timeout of {} reached with {} builds still running; they may be interrupted",
                    ceiling, activeBuilds.get());
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while draining builds on worker {}", workerIdentity.getId());
            Thread.currentThread().interrupt();
        }

        unregister();
    }

    /**
     * Unregisters within its own timeout even when the caller's thread is interrupted
     */
    private void unregister() {
        boolean interrupted = Thread.interrupted();
        try {
            awaitQuietly("unregister worker " + workerIdentity.getId(),
                buildQueue.unregisterWorker(workerIdentity.getId()),
                properties.getWorker().getUnregisterTimeout());
            log.info("Worker {} stopped", workerIdentity.getId());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private boolean backOff() {
        try {
            Thread.sleep(properties.getWorker().getDequeueErrorBackoff().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Block on a queue or callback call, logging instead of propagating failures
     */
    private void awaitQuietly(String action, Mono<?> operation, Duration timeout) {
        try {
            operation.block(timeout);
        } catch (RuntimeException e) {
            log.error("Failed to {}: {}", action, e.getMessage());
        }
    }

    private static long remainingMillis(long deadlineNanos) {
        return Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
    }

    private static CustomizableThreadFactory daemonThreads(String namePrefix) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(namePrefix);
        threadFactory.setDaemon(true);
        return threadFactory;
    }

    /**
     * Appends build output to the job's log stream. Stops after the first failed write so
     * an unreachable queue does not stall the build line by line.
     */
    private class QueueLogSink implements BuildLogSink {

        private final BuildJob job;

        private volatile boolean broken;

        QueueLogSink(BuildJob job) {
            this.job = job;
        }

        @Override
        public void append(String line) {
            if (broken) {
                return;
            }
            try {
                buildQueue.appendLog(job.getId(), line).block(properties.getWorker().getQueueWriteTimeout());
            } catch (RuntimeException e) {
                broken = true;
                log.warn("Stopped writing build log of job {}: {}", job.getId(), e.getMessage());
            }
        }
    }
}
