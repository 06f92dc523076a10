package com.scholary.meetings.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meetings.queue.QueueUnavailableException;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed job record store.
 *
 * <p>Each job is one string key ({@code <prefix><jobId>}) holding the JSON record, written with
 * {@code SET ... EX} so every save re-arms the expiration.
 */
public class RedisJobRecordStore implements JobRecordStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(RedisJobRecordStore.class);

  private final StringRedisTemplate redis;
  private final ObjectMapper objectMapper;
  private final String keyPrefix;

  public RedisJobRecordStore(
      StringRedisTemplate redis, ObjectMapper objectMapper, String keyPrefix) {
    this.redis = redis;
    this.objectMapper = objectMapper;
    this.keyPrefix = keyPrefix;
  }

  @Override
  public void save(MeetingJob job, Duration ttl) {
    String json = toJson(job);
    try {
      redis.opsForValue().set(key(job.getId()), json, ttl);
      LOGGER.debug("Saved job record: id={}, status={}, ttl={}", job.getId(), job.getStatus(), ttl);
    } catch (DataAccessException e) {
      throw new QueueUnavailableException("Failed to save job " + job.getId(), e);
    }
  }

  @Override
  public boolean saveIfAbsent(MeetingJob job, Duration ttl) {
    String json = toJson(job);
    try {
      // SET NX EX
      return Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(key(job.getId()), json, ttl));
    } catch (DataAccessException e) {
      throw new QueueUnavailableException("Failed to create job " + job.getId(), e);
    }
  }

  @Override
  public Optional<MeetingJob> load(String jobId) {
    String json;
    try {
      json = redis.opsForValue().get(key(jobId));
    } catch (DataAccessException e) {
      throw new QueueUnavailableException("Failed to load job " + jobId, e);
    }

    if (json == null) {
      return Optional.empty();
    }

    try {
      return Optional.of(objectMapper.readValue(json, MeetingJob.class));
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new MalformedJobException(jobId, json, e);
    }
  }

  @Override
  public void delete(String jobId) {
    try {
      redis.delete(key(jobId));
    } catch (DataAccessException e) {
      throw new QueueUnavailableException("Failed to delete job " + jobId, e);
    }
  }

  private String toJson(MeetingJob job) {
    try {
      return objectMapper.writeValueAsString(job);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize job " + job.getId(), e);
    }
  }

  private String key(String jobId) {
    return keyPrefix + jobId;
  }
}
