package com.whereq.kiln.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Workers currently registered with the shared queue
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerListResponse {
    private List<String> workers;

    private int count;
}
