package com.scholary.meetings.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import java.time.Duration;
import java.util.Optional;

/**
 * In-memory job record store backed by Caffeine.
 *
 * <p>Each entry carries its own expiration so the live/terminal TTL split works the same way it
 * does in Redis. Records are copied on the way in and out; callers never share a mutable instance
 * with the store.
 */
public class InMemoryJobRecordStore implements JobRecordStore {

  private final Cache<String, Entry> cache;

  public InMemoryJobRecordStore(int maxSize) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfter(new PerEntryExpiry())
            .build();
  }

  @Override
  public void save(MeetingJob job, Duration ttl) {
    cache.put(job.getId(), new Entry(job.copy(), ttl));
  }

  @Override
  public boolean saveIfAbsent(MeetingJob job, Duration ttl) {
    return cache.asMap().putIfAbsent(job.getId(), new Entry(job.copy(), ttl)) == null;
  }

  @Override
  public Optional<MeetingJob> load(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId)).map(entry -> entry.job().copy());
  }

  @Override
  public void delete(String jobId) {
    cache.invalidate(jobId);
  }

  private record Entry(MeetingJob job, Duration ttl) {}

  private static final class PerEntryExpiry implements Expiry<String, Entry> {

    @Override
    public long expireAfterCreate(String key, Entry value, long currentTime) {
      return value.ttl().toNanos();
    }

    @Override
    public long expireAfterUpdate(
        String key, Entry value, long currentTime, long currentDuration) {
      return value.ttl().toNanos();
    }

    @Override
    public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
