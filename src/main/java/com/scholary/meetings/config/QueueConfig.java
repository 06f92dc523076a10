package com.scholary.meetings.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meetings.job.InMemoryJobRecordStore;
import com.scholary.meetings.job.JobRecordStore;
import com.scholary.meetings.job.RedisJobRecordStore;
import com.scholary.meetings.queue.InMemoryQueueStore;
import com.scholary.meetings.queue.QueueStore;
import com.scholary.meetings.queue.RedisQueueStore;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Wires the queue store and the job record store for the configured backend.
 *
 * <p>{@code queue.backend=redis} (the default) shares state with every other worker through Redis;
 * {@code memory} keeps everything inside this process.
 */
@Configuration
@EnableConfigurationProperties(QueueProperties.class)
public class QueueConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(QueueConfig.class);

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public QueueStore queueStore(
      QueueProperties properties, ObjectProvider<StringRedisTemplate> redisTemplate) {
    LOGGER.info(
        "Initializing queue store: backend={}, pendingKey={}, inFlightKey={}",
        properties.backend(),
        properties.pendingKey(),
        properties.inFlightKey());

    if (properties.backend() == QueueProperties.Backend.MEMORY) {
      return new InMemoryQueueStore();
    }
    return new RedisQueueStore(
        redisTemplate.getObject(),
        properties.pendingKey(),
        properties.inFlightKey(),
        properties.deadLetterKey());
  }

  @Bean
  public JobRecordStore jobRecordStore(
      QueueProperties properties,
      ObjectProvider<StringRedisTemplate> redisTemplate,
      ObjectMapper objectMapper) {
    if (properties.backend() == QueueProperties.Backend.MEMORY) {
      return new InMemoryJobRecordStore(properties.memoryMaxRecords());
    }
    return new RedisJobRecordStore(
        redisTemplate.getObject(), objectMapper, properties.jobKeyPrefix());
  }
}
