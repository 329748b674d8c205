package com.whereq.kiln.exception;

import com.whereq.kiln.executor.BuildStage;
import lombok.Getter;

/**
 * A pipeline stage ended without success
 */
@Getter
public class BuildStageException extends RuntimeException {

    private final BuildStage stage;

    private final Outcome outcome;

    public BuildStageException(BuildStage stage, Outcome outcome, String message) {
        super(message);
        this.stage = stage;
        this.outcome = outcome;
    }

    public BuildStageException(BuildStage stage, Outcome outcome, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.outcome = outcome;
    }

    /**
     * How the stage ended
     */
    public enum Outcome {
        /**
         * The cluster job reported a Failed condition or could not be run
         */
        FAILED,

        /**
         * The build deadline passed while the stage was active
         */
        TIMED_OUT,

        /**
         * The worker thread was interrupted
         */
        CANCELLED
    }
}
