package com.example.vrudetect_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sizes the shared pools: one for frame inference across all jobs, one for job supervisors.
 */
@ConfigurationProperties(prefix = "worker")
public class WorkerExecutorProperties {

    private int inferenceThreads = 4;
    private int inferenceQueueCapacity = 256;
    private int supervisorThreads = 4;
    private int supervisorQueueCapacity = 100;
    private int schedulerThreads = 2;

    public int getInferenceThreads() {
        return inferenceThreads;
    }

    public void setInferenceThreads(int inferenceThreads) {
        this.inferenceThreads = inferenceThreads;
    }

    public int getInferenceQueueCapacity() {
        return inferenceQueueCapacity;
    }

    public void setInferenceQueueCapacity(int inferenceQueueCapacity) {
        this.inferenceQueueCapacity = inferenceQueueCapacity;
    }

    public int getSupervisorThreads() {
        return supervisorThreads;
    }

    public void setSupervisorThreads(int supervisorThreads) {
        this.supervisorThreads = supervisorThreads;
    }

    public int getSupervisorQueueCapacity() {
        return supervisorQueueCapacity;
    }

    public void setSupervisorQueueCapacity(int supervisorQueueCapacity) {
        this.supervisorQueueCapacity = supervisorQueueCapacity;
    }

    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    public void setSchedulerThreads(int schedulerThreads) {
        this.schedulerThreads = schedulerThreads;
    }
}
