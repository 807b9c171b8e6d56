package com.project.image.anomalies.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool for the per-frame stages. Golden synthesis and ROI extraction run on the caller thread.
 */
@Configuration
public class PipelineConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService detectionExecutor(AnomalyProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "detection-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.getParallelism(), factory);
    }
}
