package com.example.sgkdocumentreader.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/** Thread pools and the clock shared by the pipeline. */
@Configuration
public class PipelineExecutorConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor(PipelineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getUpload().getBatchThreads());
        executor.setMaxPoolSize(properties.getUpload().getBatchThreads());
        executor.setQueueCapacity(properties.getUpload().getBatchQueueCapacity());
        executor.setThreadNamePrefix("sgk-pipeline-");
        return executor;
    }

    @Bean(name = "ocrExecutor")
    public ThreadPoolTaskExecutor ocrExecutor(PipelineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getOcr().getThreads());
        executor.setMaxPoolSize(properties.getOcr().getThreads());
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("sgk-ocr-");
        return executor;
    }
}
