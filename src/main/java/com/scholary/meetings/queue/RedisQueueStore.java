package com.scholary.meetings.queue;

import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis implementation of {@link QueueStore}.
 *
 * <p>The pending sequence is a list written with {@code LPUSH} and consumed with {@code BRPOP};
 * the in-flight set is a Redis set. Sub-second pop timeouts are rounded up to one second by Redis.
 */
public class RedisQueueStore implements QueueStore {

  private final StringRedisTemplate redis;
  private final String pendingKey;
  private final String inFlightKey;
  private final String deadLetterKey;

  public RedisQueueStore(
      StringRedisTemplate redis, String pendingKey, String inFlightKey, String deadLetterKey) {
    this.redis = redis;
    this.pendingKey = pendingKey;
    this.inFlightKey = inFlightKey;
    this.deadLetterKey = deadLetterKey;
  }

  @Override
  public void pushPending(String jobId) {
    run("push " + jobId, () -> redis.opsForList().leftPush(pendingKey, jobId));
  }

  @Override
  public Optional<String> popPending(Duration timeout) {
    return Optional.ofNullable(
        run("pop pending", () -> redis.opsForList().rightPop(pendingKey, timeout)));
  }

  @Override
  public void markInFlight(String jobId) {
    run("mark in-flight " + jobId, () -> redis.opsForSet().add(inFlightKey, jobId));
  }

  @Override
  public void unmarkInFlight(String jobId) {
    run("unmark in-flight " + jobId, () -> redis.opsForSet().remove(inFlightKey, jobId));
  }

  @Override
  public long inFlightCount() {
    return orZero(run("count in-flight", () -> redis.opsForSet().size(inFlightKey)));
  }

  @Override
  public long pendingLength() {
    return orZero(run("count pending", () -> redis.opsForList().size(pendingKey)));
  }

  @Override
  public Set<String> inFlightIds() {
    Set<String> members = run("list in-flight", () -> redis.opsForSet().members(inFlightKey));
    return members == null ? Set.of() : new HashSet<>(members);
  }

  @Override
  public void pushDeadLetter(String entry) {
    run("push dead letter", () -> redis.opsForList().leftPush(deadLetterKey, entry));
  }

  @Override
  public long deadLetterLength() {
    return orZero(run("count dead letters", () -> redis.opsForList().size(deadLetterKey)));
  }

  @Override
  public void ping() {
    run("ping", () -> redis.execute((RedisCallback<String>) RedisConnection::ping));
  }

  private static long orZero(Long value) {
    return value == null ? 0L : value;
  }

  private static <T> T run(String operation, Supplier<T> command) {
    try {
      return command.get();
    } catch (DataAccessException e) {
      throw new QueueUnavailableException("Redis " + operation + " failed", e);
    }
  }
}
