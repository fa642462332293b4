package com.flamingo.ai.pitchscoop.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Worker pools for transcription, scoring and pipeline events. */
@Configuration
@EnableAsync
public class AsyncConfig {

  @Bean(name = "transcriptionExecutor")
  public Executor transcriptionExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("stt-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "scoringExecutor")
  public Executor scoringExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("scoring-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "pipelineEventExecutor")
  public Executor pipelineEventExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("pipeline-evt-");
    executor.initialize();
    return executor;
  }
}
