package com.whereq.kiln.executor;

import com.whereq.kiln.exception.ClusterJobException;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobCondition;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Completes a future once a watched Job reaches a terminal condition.
 *
 * A Complete condition completes the future normally, a Failed condition completes it
 * with the condition message. Watch errors, deletion of the Job and closure of the
 * watch before either condition all complete it exceptionally, so a waiter never
 * mistakes a broken watch for a running job.
 */
@Slf4j
class JobCompletionWatcher implements Watcher<Job> {

    static final String CONDITION_COMPLETE = "Complete";
    static final String CONDITION_FAILED = "Failed";

    private final String jobName;

    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    JobCompletionWatcher(String jobName) {
        this.jobName = jobName;
    }

    CompletableFuture<Void> completion() {
        return completion;
    }

    @Override
    public void eventReceived(Action action, Job job) {
        switch (action) {
            case ERROR -> completion.completeExceptionally(
                new ClusterJobException("watch error for job " + jobName));
            case DELETED -> completion.completeExceptionally(
                new ClusterJobException("job " + jobName + " was deleted before it finished"));
            default -> inspect(job);
        }
    }

    @Override
    public void onClose(WatcherException cause) {
        if (!completion.isDone()) {
            log.warn("Watch for job {} closed: {}", jobName, cause.getMessage());
        }
        completion.completeExceptionally(
            new ClusterJobException("watch stream closed before job " + jobName + " finished", cause));
    }

    @Override
    public void onClose() {
        completion.completeExceptionally(
            new ClusterJobException("watch stream closed before job " + jobName + " finished"));
    }

    private void inspect(Job job) {
        if (job == null || job.getStatus() == null) {
            return;
        }
        List<JobCondition> conditions = job.getStatus().getConditions();
        if (conditions == null) {
            return;
        }

        for (JobCondition condition : conditions) {
            if (!"True".equals(condition.getStatus())) {
                continue;
            }
            if (CONDITION_COMPLETE.equals(condition.getType())) {
                log.debug("Job {} completed", jobName);
                completion.complete(null);
                return;
            }
            if (CONDITION_FAILED.equals(condition.getType())) {
                String message = condition.getMessage() != null ? condition.getMessage() : condition.getReason();
                completion.completeExceptionally(new ClusterJobException("job failed: " + message));
                return;
            }
        }
    }
}
