package com.whereq.kiln.executor;

import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildResult;

/**
 * Turns one build job into its terminal result
 */
public interface BuildExecutor {
    /**
     * Run every pipeline stage for the job (blocking).
     *
     * Failures are reported through the returned result rather than thrown. Thread
     * interruption aborts the active stage and yields a failed result.
     *
     * @param job the job to build
     * @param deadline wall-clock cap for the whole pipeline
     * @param logSink receiver for progress and build output
     * @return the terminal result
     */
    BuildResult execute(BuildJob job, BuildDeadline deadline, BuildLogSink logSink);
}
