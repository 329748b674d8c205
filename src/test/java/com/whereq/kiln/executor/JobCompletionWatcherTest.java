package com.whereq.kiln.executor;

import com.whereq.kiln.exception.ClusterJobException;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobBuilder;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobCompletionWatcherTest {

    private final JobCompletionWatcher watcher = new JobCompletionWatcher("kaniko-build-1234abcd");

    @Test
    void completeConditionCompletesNormally() throws Exception {
        watcher.eventReceived(Watcher.Action.MODIFIED, jobWithCondition("Complete", "True", null));

        assertThat(watcher.completion()).isCompleted();
        watcher.completion().get();
    }

    @Test
    void failedConditionCarriesMessage() {
        watcher.eventReceived(Watcher.Action.MODIFIED,
            jobWithCondition("Failed", "True", "Job has reached the specified backoff limit"));

        assertThatThrownBy(() -> watcher.completion().get())
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(ClusterJobException.class)
            .hasMessageContaining("job failed: Job has reached the specified backoff limit");
    }

    @Test
    void runningJobKeepsWaiting() {
        watcher.eventReceived(Watcher.Action.ADDED, new JobBuilder().withNewStatus().withActive(1).endStatus().build());
        watcher.eventReceived(Watcher.Action.MODIFIED, jobWithCondition("Complete", "False", null));

        assertThat(watcher.completion()).isNotDone();
    }

    @Test
    void closureWithoutTerminalConditionFails() {
        watcher.onClose(new WatcherException("connection reset"));

        assertThatThrownBy(() -> watcher.completion().get())
            .hasCauseInstanceOf(ClusterJobException.class)
            .hasMessageContaining("watch stream closed before job kaniko-build-1234abcd finished");
    }

    @Test
    void gracefulClosureAlsoFails() {
        watcher.onClose();

        assertThat(watcher.completion()).isCompletedExceptionally();
    }

    @Test
    void closureAfterCompletionKeepsSuccess() throws Exception {
        watcher.eventReceived(Watcher.Action.MODIFIED, jobWithCondition("Complete", "True", null));
        watcher.onClose();

        assertThat(watcher.completion()).isCompleted();
        watcher.completion().get();
    }

    @Test
    void deletionFails() {
        watcher.eventReceived(Watcher.Action.DELETED, new Job());

        assertThatThrownBy(() -> watcher.completion().get())
            .hasMessageContaining("was deleted before it finished");
    }

    private static Job jobWithCondition(String type, String status, String message) {
        return new JobBuilder()
            .withNewStatus()
                .addNewCondition()
                    .withType(type)
                    .withStatus(status)
                    .withMessage(message)
                .endCondition()
            .endStatus()
            .build();
    }
}
