package com.example.vrudetect_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools of the detection pipeline.
 * <ul>
 *     <li>{@code inferenceTaskExecutor}: shared by every job, caps system-wide detector calls.</li>
 *     <li>{@code supervisorTaskExecutor}: one thread per running job; jobs waiting here stay QUEUED.</li>
 *     <li>{@code registryTaskExecutor}: exactly one thread; owns all job state.</li>
 *     <li>{@code pipelineScheduler}: per-frame deadlines.</li>
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({WorkerExecutorProperties.class, PipelineProperties.class})
public class WorkerExecutorConfig {

    @Bean(name = "inferenceTaskExecutor")
    public ThreadPoolTaskExecutor inferenceTaskExecutor(WorkerExecutorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getInferenceThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getInferenceQueueCapacity());
        executor.setThreadNamePrefix("inference-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "supervisorTaskExecutor")
    public ThreadPoolTaskExecutor supervisorTaskExecutor(WorkerExecutorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getSupervisorThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getSupervisorQueueCapacity());
        executor.setThreadNamePrefix("supervisor-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean(name = "registryTaskExecutor")
    public ThreadPoolTaskExecutor registryTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("task-registry-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }

    @Bean(name = "pipelineScheduler")
    public ThreadPoolTaskScheduler pipelineScheduler(WorkerExecutorProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(1, properties.getSchedulerThreads()));
        scheduler.setThreadNamePrefix("pipeline-sched-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
