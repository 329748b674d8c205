package com.whereq.kiln.executor;

import lombok.Value;

/**
 * A parsed image reference: registry host, repository path and tag
 */
@Value
public class ImageReference {

    private static final String DOCKER_HUB = "registry-1.docker.io";

    String registry;
    String repository;
    String tag;

    public static ImageReference parse(String reference) {
        String remainder = reference;
        String registry = DOCKER_HUB;

        int slash = remainder.indexOf('/');
        if (slash > 0) {
            String first = remainder.substring(0, slash);
            if (first.contains(".") || first.contains(":") || first.equals("localhost")) {
                registry = first;
                remainder = remainder.substring(slash + 1);
            }
        }

        String tag = ImageTags.LATEST;
        int at = remainder.indexOf('@');
        if (at >= 0) {
            remainder = remainder.substring(0, at);
        }
        int colon = remainder.lastIndexOf(':');
        if (colon > remainder.lastIndexOf('/')) {
            tag = remainder.substring(colon + 1);
            remainder = remainder.substring(0, colon);
        }

        if (DOCKER_HUB.equals(registry) && !remainder.contains("/")) {
            remainder = "library/" + remainder;
        }

        return new ImageReference(registry, remainder, tag);
    }

    public String withDigest(String digest) {
        return registry + "/" + repository + "@" + digest;
    }
}
