package com.scholary.meetings.worker;

import com.scholary.meetings.job.MeetingJob;
import java.util.Map;

/**
 * The processing function a worker runs for each job it dequeues.
 *
 * <p>Implementations must be safe to run again from scratch: a failed attempt is retried in full,
 * with no partial-completion resume.
 */
@FunctionalInterface
public interface JobProcessor {

  /**
   * Process a job.
   *
   * @param job the job, already in processing
   * @return the success payload stored as the job's result
   * @throws Exception any failure; the worker turns it into a retry or a terminal failure
   */
  Map<String, Object> process(MeetingJob job) throws Exception;
}
