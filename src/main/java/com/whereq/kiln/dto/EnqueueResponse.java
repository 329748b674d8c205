package com.whereq.kiln.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Response for a queued build
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EnqueueResponse {
    private UUID jobId;

    /**
     * Jobs waiting across all lanes after this one was added
     */
    private Long position;

    /**
     * Error message (if the job was not queued)
     */
    private String error;

    public static EnqueueResponse error(String message) {
        return EnqueueResponse.builder()
            .error(message)
            .build();
    }
}
