package com.flamingo.ai.memorystore.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
public class AsyncConfig {

  /** Runs embedding model calls so that callers can bound them with a timeout. */
  @Bean(name = "embeddingExecutor")
  public AsyncTaskExecutor embeddingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("embedding-");
    executor.initialize();
    return executor;
  }
}
