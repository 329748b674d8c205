package com.whereq.kiln;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Kiln.
 * A build worker that takes queued commits, builds them into container images on a
 * Kubernetes cluster, and attaches an SBOM and a signature to each image.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class KilnApplication {

    public static void main(String[] args) {
        SpringApplication.run(KilnApplication.class, args);
    }
}
