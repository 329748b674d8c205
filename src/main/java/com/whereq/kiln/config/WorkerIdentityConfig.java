package com.whereq.kiln.config;

import com.whereq.kiln.worker.WorkerIdentity;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Owns the process-wide worker identity handed to the processor
 */
@Configuration
public class WorkerIdentityConfig {

    @Bean
    public WorkerIdentity workerIdentity(KilnProperties properties) {
        return WorkerIdentity.of(properties.getWorker().getId());
    }
}
