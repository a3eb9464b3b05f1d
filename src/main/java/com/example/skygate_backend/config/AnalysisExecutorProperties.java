package com.example.skygate_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sizes the pool shared by all concurrently running analyzers.
 */
@ConfigurationProperties(prefix = "detection.executor")
public class AnalysisExecutorProperties {

    private int threads = Runtime.getRuntime().availableProcessors();
    private int queueCapacity = 64;

    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        this.threads = threads;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }
}
