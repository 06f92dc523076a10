package com.scholary.meetings.job;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable key-value storage for job records, keyed by job id.
 *
 * <p>Saves are whole-record upserts: a later save overwrites an earlier one and re-arms the
 * expiration. There are no partial-field updates, so callers read, modify and write back the full
 * record. Nothing here guards against two concurrent writers on the same id.
 */
public interface JobRecordStore {

  /**
   * Upsert the full job state with an expiration.
   *
   * @param job the job to store
   * @param ttl how long the record lives after this save
   * @throws com.scholary.meetings.queue.QueueUnavailableException if the backing store is down
   */
  void save(MeetingJob job, Duration ttl);

  /**
   * Store a new job record unless one already exists under its id.
   *
   * @return false if a record with the same id is present, in which case nothing is written
   * @throws com.scholary.meetings.queue.QueueUnavailableException if the backing store is down
   */
  boolean saveIfAbsent(MeetingJob job, Duration ttl);

  /**
   * Load a job by id.
   *
   * @param jobId the job id
   * @return the job, or empty if it never existed or has expired
   * @throws MalformedJobException if a record exists but cannot be parsed
   */
  Optional<MeetingJob> load(String jobId);

  /** Remove a job record. Missing ids are ignored. */
  void delete(String jobId);
}
