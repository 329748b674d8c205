package com.whereq.kiln.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Build job lifecycle states
 *
 * State transitions:
 * QUEUED → BUILDING → {COMPLETED, FAILED}
 * QUEUED → CANCELLED
 */
public enum JobStatus {
    /**
     * Waiting in the queue for a worker
     */
    QUEUED("queued"),

    /**
     * Held by exactly one worker
     */
    BUILDING("building"),

    /**
     * Image built and pushed
     */
    COMPLETED("completed"),

    /**
     * Build stage failed, timed out or was aborted
     */
    FAILED("failed"),

    /**
     * Withdrawn before any worker picked it up
     */
    CANCELLED("cancelled");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        for (JobStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + value);
    }

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
