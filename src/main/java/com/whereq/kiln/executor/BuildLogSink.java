package com.whereq.kiln.executor;

/**
 * Receives build progress and container output, one line at a time
 */
@FunctionalInterface
public interface BuildLogSink {

    BuildLogSink NONE = line -> { };

    void append(String line);
}
