package com.scholary.meetings.config;

import com.scholary.meetings.service.TaskQueueService;
import com.scholary.meetings.worker.JobProcessor;
import com.scholary.meetings.worker.WorkerPool;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the background worker pool.
 *
 * <p>Set {@code worker.enabled=false} to run an API-only node that enqueues and reports status but
 * never executes jobs.
 */
@Configuration
@EnableConfigurationProperties(WorkerProperties.class)
public class WorkerConfig {

  @Bean
  @ConditionalOnProperty(
      prefix = "worker",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public WorkerPool workerPool(
      TaskQueueService taskQueueService, JobProcessor processor, WorkerProperties properties) {
    return new WorkerPool(taskQueueService, processor, properties);
  }
}
