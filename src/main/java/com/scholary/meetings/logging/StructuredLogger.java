package com.scholary.meetings.logging;

import com.scholary.meetings.job.MeetingJob;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each job lifecycle event carries an {@code event_type} plus the job's id, meeting and attempt
 * counters so that a single job can be followed across workers in Kibana.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log job enqueued event. */
  public void logJobEnqueued(MeetingJob job) {
    boolean ownsContext = false;
    try {
      ownsContext = putJobFields("job_enqueued", job);
      logger.info(
          "Job enqueued: id={}, meetingId={}, file={}, maxAttempts={}",
          job.getId(),
          job.getMeetingId(),
          job.getFilename(),
          job.getMaxAttempts());
    } finally {
      clearEventFields(ownsContext);
    }
  }

  /** Log job started event. */
  public void logJobStarted(MeetingJob job) {
    boolean ownsContext = false;
    try {
      ownsContext = putJobFields("job_started", job);
      logger.info(
          "Job started: id={}, attempts={}/{}",
          job.getId(),
          job.getAttempts(),
          job.getMaxAttempts());
    } finally {
      clearEventFields(ownsContext);
    }
  }

  /** Log job completed event. */
  public void logJobCompleted(MeetingJob job, long processingMs) {
    boolean ownsContext = false;
    try {
      ownsContext = putJobFields("job_completed", job);
      MDC.put("processingMs", String.valueOf(processingMs));
      logger.info(
          "Job completed: id={}, attempts={}/{}, took={}ms",
          job.getId(),
          job.getAttempts(),
          job.getMaxAttempts(),
          processingMs);
    } finally {
      clearEventFields(ownsContext);
    }
  }

  /** Log job requeued for another attempt. */
  public void logJobRetry(MeetingJob job, String errorType) {
    boolean ownsContext = false;
    try {
      ownsContext = putJobFields("job_retry", job);
      MDC.put("errorType", errorType);
      logger.warn(
          "Job retry: id={}, attempts={}/{}, error={}, message={}",
          job.getId(),
          job.getAttempts(),
          job.getMaxAttempts(),
          errorType,
          job.getLastError());
    } finally {
      clearEventFields(ownsContext);
    }
  }

  /** Log terminal job failure. */
  public void logJobFailed(MeetingJob job, String errorType) {
    boolean ownsContext = false;
    try {
      ownsContext = putJobFields("job_failed", job);
      MDC.put("errorType", errorType);
      logger.error(
          "Job failed: id={}, attempts={}/{}, error={}, message={}",
          job.getId(),
          job.getAttempts(),
          job.getMaxAttempts(),
          errorType,
          job.getLastError());
    } finally {
      clearEventFields(ownsContext);
    }
  }

  /** Log a stored record that could not be parsed and was moved to the dead-letter list. */
  public void logJobDeadLettered(String jobId, String reason) {
    boolean ownsContext = MDC.get("jobId") == null;
    try {
      if (ownsContext) {
        MDC.put("jobId", jobId);
      }
      MDC.put("event_type", "job_dead_lettered");
      logger.error("Job dead-lettered: id={}, reason={}", jobId, reason);
    } finally {
      clearEventFields(ownsContext);
    }
  }

  /** Log a processing job reclaimed from a lost worker. */
  public void logJobReaped(MeetingJob job, long stuckSeconds) {
    boolean ownsContext = false;
    try {
      ownsContext = putJobFields("job_reaped", job);
      MDC.put("stuckSeconds", String.valueOf(stuckSeconds));
      logger.warn(
          "Job reaped: id={}, attempts={}/{}, stuckFor={}s",
          job.getId(),
          job.getAttempts(),
          job.getMaxAttempts(),
          stuckSeconds);
    } finally {
      clearEventFields(ownsContext);
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, long meetingId) {
    MDC.put("jobId", jobId);
    MDC.put("meetingId", String.valueOf(meetingId));
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("meetingId");
  }

  /**
   * Put the job's event fields into MDC.
   *
   * @return true if this call set the job context, i.e. none was active on the thread
   */
  private boolean putJobFields(String eventType, MeetingJob job) {
    boolean ownsContext = MDC.get("jobId") == null;
    if (ownsContext) {
      setJobContext(job.getId(), job.getMeetingId());
    }
    MDC.put("event_type", eventType);
    MDC.put("attempts", String.valueOf(job.getAttempts()));
    MDC.put("maxAttempts", String.valueOf(job.getMaxAttempts()));
    MDC.put("status", job.getStatus().wireName());
    return ownsContext;
  }

  /** Clear event-specific fields from MDC, and the job context if the event set it. */
  private void clearEventFields(boolean ownsContext) {
    if (ownsContext) {
      clearJobContext();
    }
    MDC.remove("event_type");
    MDC.remove("attempts");
    MDC.remove("maxAttempts");
    MDC.remove("status");
    MDC.remove("errorType");
    MDC.remove("processingMs");
    MDC.remove("stuckSeconds");
  }
}
