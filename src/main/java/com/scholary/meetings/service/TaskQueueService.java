package com.scholary.meetings.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meetings.config.QueueProperties;
import com.scholary.meetings.job.JobRecordStore;
import com.scholary.meetings.job.JobStatus;
import com.scholary.meetings.job.MalformedJobException;
import com.scholary.meetings.job.MeetingJob;
import com.scholary.meetings.logging.StructuredLogger;
import com.scholary.meetings.queue.QueueStore;
import com.scholary.meetings.queue.QueueUnavailableException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Policy layer over the queue store and the job record store.
 *
 * <p>Owns job creation and every state transition:
 *
 * <ul>
 *   <li>create → queued: record saved with the live TTL, then the id is pushed
 *   <li>queued → processing: id added to the in-flight set, live TTL
 *   <li>processing → completed: terminal TTL
 *   <li>processing → queued: failure counted, terminal TTL, id re-pushed at the fresh-work end
 *   <li>processing → failed: failure counted, terminal TTL
 * </ul>
 *
 * <p>Transitions are read-modify-write on the whole record with no locking. Only the worker that
 * popped an id writes that job's record while it is processing.
 *
 * <p>An id leaves the in-flight set only after the record has settled and any retry push went
 * through. If the broker fails in between, the id stays in the set and {@link #reapStaleJobs}
 * picks it up later.
 */
@Service
public class TaskQueueService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TaskQueueService.class);
  private static final int MAX_ID_COLLISIONS = 3;
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final QueueStore queueStore;
  private final JobRecordStore jobStore;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Duration liveTtl;
  private final Duration terminalTtl;
  private final int defaultMaxAttempts;

  public TaskQueueService(
      QueueStore queueStore,
      JobRecordStore jobStore,
      ObjectMapper objectMapper,
      Clock clock,
      QueueProperties properties) {
    this.queueStore = queueStore;
    this.jobStore = jobStore;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.liveTtl = properties.liveTtl();
    this.terminalTtl = properties.terminalTtl();
    this.defaultMaxAttempts = properties.defaultMaxAttempts();
  }

  /** Enqueue a meeting job with the default attempt budget. */
  public String enqueueMeetingJob(long meetingId, String filePath, String filename) {
    return enqueueMeetingJob(meetingId, filePath, filename, defaultMaxAttempts);
  }

  /**
   * Create a queued job and make it visible to workers.
   *
   * @return the new job id
   * @throws com.scholary.meetings.queue.QueueUnavailableException if the broker is down
   */
  public String enqueueMeetingJob(
      long meetingId, String filePath, String filename, int maxAttempts) {
    // Record first, so a worker never pops an id it cannot load.
    MeetingJob job = createRecord(meetingId, filePath, filename, maxAttempts);
    queueStore.pushPending(job.getId());

    structuredLogger.logJobEnqueued(job);
    return job.getId();
  }

  /**
   * Pop the next job id and move that job to processing.
   *
   * <p>Returns empty on timeout, and also when the popped id cannot be started: its record expired,
   * it is not queued, or it cannot be parsed (the raw record then goes to the dead-letter list).
   *
   * <p>If the broker fails after the pop, the id is pushed back to pending before the exception
   * propagates.
   *
   * @param timeout how long to block waiting for an id
   */
  public Optional<MeetingJob> startNextJob(Duration timeout) {
    Optional<String> popped = queueStore.popPending(timeout);
    if (popped.isEmpty()) {
      return Optional.empty();
    }
    String jobId = popped.get();

    try {
      return start(jobId);
    } catch (QueueUnavailableException e) {
      returnToPending(jobId, e);
      throw e;
    }
  }

  private Optional<MeetingJob> start(String jobId) {
    MeetingJob job;
    try {
      Optional<MeetingJob> loaded = jobStore.load(jobId);
      if (loaded.isEmpty()) {
        LOGGER.warn("Dropping popped job with no record (expired or deleted): id={}", jobId);
        return Optional.empty();
      }
      job = loaded.get();
    } catch (MalformedJobException e) {
      deadLetter(e);
      return Optional.empty();
    }

    if (job.getStatus() != JobStatus.QUEUED) {
      LOGGER.warn(
          "Dropping popped job that is not queued: id={}, status={}",
          jobId,
          job.getStatus().wireName());
      return Optional.empty();
    }

    job.startProcessing(now());
    queueStore.markInFlight(jobId);
    jobStore.save(job, liveTtl);

    structuredLogger.logJobStarted(job);
    return Optional.of(job);
  }

  /**
   * Mark a processing job as completed.
   *
   * <p>A missing record is a no-op.
   */
  public void completeJob(String jobId, Map<String, Object> result) {
    completeJob(jobId, result, 0L);
  }

  /** As {@link #completeJob(String, Map)}, recording how long processing took. */
  public void completeJob(String jobId, Map<String, Object> result, long processingMs) {
    Optional<MeetingJob> loaded = loadForUpdate(jobId, "complete");
    if (loaded.isEmpty()) {
      queueStore.unmarkInFlight(jobId);
      return;
    }
    MeetingJob job = loaded.get();

    job.complete(now(), result);
    jobStore.save(job, terminalTtl);
    queueStore.unmarkInFlight(jobId);
    structuredLogger.logJobCompleted(job, processingMs);
  }

  /**
   * Record a failed attempt.
   *
   * <p>The job goes back to queued and its id is re-pushed if {@code retry} is set and attempts
   * remain; otherwise it fails terminally. A missing record is a no-op.
   *
   * @return the resulting status, or empty if the record was missing
   */
  public Optional<JobStatus> failJob(String jobId, String errorMessage, boolean retry) {
    return failJob(jobId, errorMessage, retry, "unknown");
  }

  /** As {@link #failJob(String, String, boolean)}, deriving the message from an exception. */
  public Optional<JobStatus> failJob(String jobId, Throwable error, boolean retry) {
    String message = error.getMessage() != null ? error.getMessage() : error.toString();
    return failJob(jobId, message, retry, error.getClass().getSimpleName());
  }

  private Optional<JobStatus> failJob(
      String jobId, String errorMessage, boolean retry, String errorType) {
    Optional<MeetingJob> loaded = loadForUpdate(jobId, "fail");
    if (loaded.isEmpty()) {
      queueStore.unmarkInFlight(jobId);
      return Optional.empty();
    }
    MeetingJob job = loaded.get();

    boolean requeue = job.fail(now(), errorMessage, retry);
    jobStore.save(job, terminalTtl);

    if (requeue) {
      try {
        queueStore.pushPending(jobId);
      } catch (QueueUnavailableException e) {
        LOGGER.error(
            "Retry push failed, job stays in the in-flight set until reaped: id={}", jobId, e);
        throw e;
      }
      queueStore.unmarkInFlight(jobId);
      structuredLogger.logJobRetry(job, errorType);
    } else {
      queueStore.unmarkInFlight(jobId);
      structuredLogger.logJobFailed(job, errorType);
    }
    return Optional.of(job.getStatus());
  }

  /**
   * Point-in-time read of a job record.
   *
   * @return the job, or empty if it never existed or has expired
   */
  public Optional<MeetingJob> getJobStatus(String jobId) {
    return jobStore.load(jobId);
  }

  /** Best-effort instantaneous queue counts. */
  public QueueStats queueStats() {
    return new QueueStats(queueStore.pendingLength(), queueStore.inFlightCount());
  }

  /**
   * Delete a settled job record.
   *
   * @return false if the job is still queued or processing, in which case nothing is deleted
   * @throws JobNotFoundException if there is no such job
   */
  public boolean deleteJob(String jobId) {
    MeetingJob job = jobStore.load(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    if (!job.isTerminal()) {
      return false;
    }
    jobStore.delete(jobId);
    LOGGER.info("Deleted job record: id={}, status={}", jobId, job.getStatus().wireName());
    return true;
  }

  /**
   * Reclaim jobs left in the in-flight set by a worker that stopped mid-job.
   *
   * <p>A job qualifies when its record is still processing and its {@code started_at} is older
   * than {@code staleAfter}. It then takes the normal failure path with retry requested.
   *
   * <p>A queued record whose id is still in the set means a retry push or a start was cut short by
   * a broker error. Once it has been queued for longer than {@code staleAfter}, its id is pushed
   * back to pending. In-flight ids whose record is gone or already settled are removed from the
   * set.
   *
   * @return number of jobs reclaimed
   */
  public int reapStaleJobs(Duration staleAfter) {
    Instant cutoff = now().minus(staleAfter);
    int reaped = 0;

    for (String jobId : queueStore.inFlightIds()) {
      Optional<MeetingJob> loaded;
      try {
        loaded = jobStore.load(jobId);
      } catch (MalformedJobException e) {
        queueStore.unmarkInFlight(jobId);
        deadLetter(e);
        continue;
      }

      if (loaded.isPresent() && loaded.get().getStatus() == JobStatus.QUEUED) {
        if (recoverStrandedQueuedJob(loaded.get(), cutoff)) {
          reaped++;
        }
        continue;
      }
      if (loaded.isEmpty() || loaded.get().getStatus() != JobStatus.PROCESSING) {
        queueStore.unmarkInFlight(jobId);
        continue;
      }

      MeetingJob job = loaded.get();
      if (job.getStartedAt() == null || !job.getStartedAt().isBefore(cutoff)) {
        continue;
      }

      long stuckSeconds = Duration.between(job.getStartedAt(), now()).getSeconds();
      structuredLogger.logJobReaped(job, stuckSeconds);
      failJob(jobId, "worker lost: processing exceeded " + staleAfter, true, "WorkerLost");
      reaped++;
    }

    return reaped;
  }

  private boolean recoverStrandedQueuedJob(MeetingJob job, Instant cutoff) {
    Instant queuedSince = job.getFailedAt() != null ? job.getFailedAt() : job.getCreatedAt();
    if (!queuedSince.isBefore(cutoff)) {
      return false;
    }
    queueStore.pushPending(job.getId());
    queueStore.unmarkInFlight(job.getId());
    LOGGER.warn(
        "Recovered queued job left in the in-flight set: id={}, queuedSince={}",
        job.getId(),
        queuedSince);
    return true;
  }

  private MeetingJob createRecord(
      long meetingId, String filePath, String filename, int maxAttempts) {
    for (int i = 0; i < MAX_ID_COLLISIONS; i++) {
      MeetingJob job = MeetingJob.create(meetingId, filePath, filename, maxAttempts, now());
      if (jobStore.saveIfAbsent(job, liveTtl)) {
        return job;
      }
      LOGGER.warn("Job id already taken, generating another: id={}", job.getId());
    }
    throw new IllegalStateException(
        "Could not allocate a unique job id for meeting " + meetingId);
  }

  private void returnToPending(String jobId, QueueUnavailableException cause) {
    try {
      queueStore.pushPending(jobId);
      queueStore.unmarkInFlight(jobId);
      LOGGER.warn("Returned job to pending after broker error: id={}", jobId);
    } catch (QueueUnavailableException e) {
      cause.addSuppressed(e);
      LOGGER.error("Could not return job to pending after broker error: id={}", jobId, e);
    }
  }

  private Optional<MeetingJob> loadForUpdate(String jobId, String action) {
    Optional<MeetingJob> loaded;
    try {
      loaded = jobStore.load(jobId);
    } catch (MalformedJobException e) {
      deadLetter(e);
      return Optional.empty();
    }

    if (loaded.isEmpty()) {
      LOGGER.warn("Cannot {} job with no record, skipping: id={}", action, jobId);
      return Optional.empty();
    }
    if (loaded.get().getStatus() != JobStatus.PROCESSING) {
      LOGGER.warn(
          "Cannot {} job that is not processing, skipping: id={}, status={}",
          action,
          jobId,
          loaded.get().getStatus().wireName());
      return Optional.empty();
    }
    return loaded;
  }

  private void deadLetter(MalformedJobException e) {
    String reason = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
    DeadLetterEntry entry = new DeadLetterEntry(e.getJobId(), reason, e.getRawRecord(), now());
    try {
      queueStore.pushDeadLetter(objectMapper.writeValueAsString(entry));
    } catch (JsonProcessingException jsonError) {
      throw new IllegalStateException(
          "Failed to serialize dead letter for " + e.getJobId(), jsonError);
    }
    queueStore.unmarkInFlight(e.getJobId());
    structuredLogger.logJobDeadLettered(e.getJobId(), reason);
  }

  private Instant now() {
    return clock.instant();
  }
}
