package com.whereq.kiln.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of this worker's build capacity
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerStatsResponse {
    private String workerId;

    private int maxConcurrentBuilds;

    private int activeBuilds;

    /**
     * Free admission slots; one may be held briefly by a pending dequeue
     */
    private int availableSlots;

    /**
     * Jobs waiting in the shared queue, null when the queue could not be read
     */
    private Long queueLength;
}
