package com.scholary.meetings.job;

/**
 * Thrown when a stored job record exists but cannot be parsed.
 *
 * <p>Carries the raw stored value so the caller can route it to the dead-letter list.
 */
public class MalformedJobException extends RuntimeException {

  private final String jobId;
  private final String rawRecord;

  public MalformedJobException(String jobId, String rawRecord, Throwable cause) {
    super("Malformed job record: " + jobId, cause);
    this.jobId = jobId;
    this.rawRecord = rawRecord;
  }

  public String getJobId() {
    return jobId;
  }

  public String getRawRecord() {
    return rawRecord;
  }
}
