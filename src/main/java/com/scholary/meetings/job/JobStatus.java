package com.scholary.meetings.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle state of a meeting job.
 *
 * <p>{@link #COMPLETED} and {@link #FAILED} are terminal.
 */
public enum JobStatus {
  QUEUED,
  PROCESSING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static JobStatus fromWireName(String value) {
    return JobStatus.valueOf(value.toUpperCase(Locale.ROOT));
  }
}
