package com.whereq.kiln.exception;

/**
 * Thrown when the cluster cannot accept, report on or serve logs for a build job.
 * Covers API errors, rejected submissions and watch streams that end early.
 */
public class ClusterJobException extends RuntimeException {
    public ClusterJobException(String message) {
        super(message);
    }

    public ClusterJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
