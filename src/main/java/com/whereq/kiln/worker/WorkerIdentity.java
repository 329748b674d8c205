package com.whereq.kiln.worker;

import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Identity under which this process registers with the shared queue.
 *
 * Owned by the Spring context and handed to the processor, so registration and
 * unregistration always use the same id.
 */
@Slf4j
public final class WorkerIdentity {

    private static final String FALLBACK_HOST = "kiln-worker";

    private final String id;

    private WorkerIdentity(String id) {
        this.id = id;
    }

    /**
     * Use the configured id, or generate {hostname}-{8 random hex chars} when it is blank
     */
    public static WorkerIdentity of(String configuredId) {
        if (configuredId != null && !configuredId.isBlank()) {
            return new WorkerIdentity(configuredId.trim());
        }
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return new WorkerIdentity(hostname() + "-" + suffix);
    }

    public String getId() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String fromEnv = System.getenv("HOSTNAME");
            log.warn("Could not resolve local hostname ({}), using {}", e.getMessage(),
                fromEnv != null ? fromEnv : FALLBACK_HOST);
            return fromEnv != null ? fromEnv : FALLBACK_HOST;
        }
    }
}
