package com.whereq.kiln.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How the image is built from the checked out source
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BuildConfig {

    public static final String DEFAULT_DOCKERFILE = "Dockerfile";
    public static final String DEFAULT_CONTEXT = ".";

    /**
     * Dockerfile path relative to the build context
     */
    private String dockerfile;

    /**
     * Subdirectory of the repository used as build context
     */
    private String context;

    @Builder.Default
    private Map<String, String> buildArgs = new LinkedHashMap<>();

    /**
     * Multi-stage build target, optional
     */
    private String target;

    public String dockerfileOrDefault() {
        return dockerfile == null || dockerfile.isBlank() ? DEFAULT_DOCKERFILE : dockerfile;
    }

    public String contextOrDefault() {
        return context == null || context.isBlank() ? DEFAULT_CONTEXT : context;
    }
}
