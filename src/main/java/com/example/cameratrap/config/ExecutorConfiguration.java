package com.example.cameratrap.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class ExecutorConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** One thread per in-flight image; the queue absorbs notification bursts. */
    @Bean
    public ThreadPoolTaskExecutor pipelineExecutor(PipelineProperties properties) {
        int workers = properties.pipeline().workerThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.pipeline().invocationTimeout().toSeconds() + 1);
        executor.initialize();
        return executor;
    }

    @Bean
    public ThreadPoolTaskExecutor trackingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("tracking-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
