package com.scholary.meetings.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Durable record of a meeting processing job.
 *
 * <p>The identifier and payload (meeting id, file path, filename) are fixed at creation. Everything
 * else moves through the state machine exposed by {@link #startProcessing}, {@link #complete} and
 * {@link #fail}; illegal transitions throw {@link IllegalStateException}. Retries mutate this same
 * record, so {@code id}, {@code createdAt} and the accumulated {@code attempts} survive a requeue.
 *
 * <p>{@code attempts} counts failed attempts. A job that fails once and then succeeds on its retry
 * ends with {@code attempts == 1}. It never exceeds {@code maxAttempts}.
 *
 * <p>Serialized as JSON with snake_case field names. Absent optional fields are omitted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MeetingJob {

  private final String id;
  private final long meetingId;
  private final String filePath;
  private final String filename;
  private final Instant createdAt;
  private final int maxAttempts;

  private JobStatus status;
  private int attempts;
  private Instant startedAt;
  private Instant completedAt;
  private Instant failedAt;
  private String lastError;
  private Map<String, Object> result;

  @JsonCreator
  public MeetingJob(
      @JsonProperty("id") String id,
      @JsonProperty("meeting_id") long meetingId,
      @JsonProperty("file_path") String filePath,
      @JsonProperty("filename") String filename,
      @JsonProperty("created_at") Instant createdAt,
      @JsonProperty("max_attempts") int maxAttempts) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("job id must not be blank");
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("max_attempts must be >= 1, got " + maxAttempts);
    }
    this.id = id;
    this.meetingId = meetingId;
    this.filePath = filePath;
    this.filename = filename;
    this.createdAt = Objects.requireNonNull(createdAt, "created_at");
    this.maxAttempts = maxAttempts;
    this.status = JobStatus.QUEUED;
    this.attempts = 0;
  }

  /**
   * Create a fresh queued job for a meeting.
   *
   * <p>The id has the form {@code meeting_<meetingId>_<epochSeconds>_<suffix>}, where the suffix
   * is 8 random hex characters so that two jobs for one meeting created in the same second differ.
   */
  public static MeetingJob create(
      long meetingId, String filePath, String filename, int maxAttempts, Instant now) {
    String suffix = UUID.randomUUID().toString().substring(0, 8);
    String id = String.format("meeting_%d_%d_%s", meetingId, now.getEpochSecond(), suffix);
    return new MeetingJob(id, meetingId, filePath, filename, now, maxAttempts);
  }

  /** queued → processing. */
  public void startProcessing(Instant now) {
    requireStatus(JobStatus.QUEUED, "start");
    startedAt = now;
    status = JobStatus.PROCESSING;
  }

  /** processing → completed. */
  public void complete(Instant now, Map<String, Object> resultData) {
    requireStatus(JobStatus.PROCESSING, "complete");
    completedAt = now;
    lastError = null;
    result = resultData == null ? null : new LinkedHashMap<>(resultData);
    status = JobStatus.COMPLETED;
  }

  /**
   * processing → queued (retry) or failed. Counts the failed attempt before deciding.
   *
   * @param retry whether the caller asks for another attempt
   * @return true if the job went back to {@link JobStatus#QUEUED} and must be re-pushed
   */
  public boolean fail(Instant now, String errorMessage, boolean retry) {
    requireStatus(JobStatus.PROCESSING, "fail");
    attempts++;
    lastError = errorMessage;
    failedAt = now;
    if (retry && canRetry()) {
      status = JobStatus.QUEUED;
      return true;
    }
    status = JobStatus.FAILED;
    return false;
  }

  /** Whether another attempt is allowed given the failures counted so far. */
  @JsonIgnore
  public boolean canRetry() {
    return attempts < maxAttempts;
  }

  @JsonIgnore
  public boolean isTerminal() {
    return status.isTerminal();
  }

  /** Deep enough copy for stores that keep records in process memory. */
  public MeetingJob copy() {
    MeetingJob copy = new MeetingJob(id, meetingId, filePath, filename, createdAt, maxAttempts);
    copy.status = status;
    copy.attempts = attempts;
    copy.startedAt = startedAt;
    copy.completedAt = completedAt;
    copy.failedAt = failedAt;
    copy.lastError = lastError;
    copy.result = result == null ? null : new LinkedHashMap<>(result);
    return copy;
  }

  private void requireStatus(JobStatus expected, String action) {
    if (status != expected) {
      throw new IllegalStateException(
          String.format("Cannot %s job %s in status %s", action, id, status.wireName()));
    }
  }

  @JsonProperty("id")
  public String getId() {
    return id;
  }

  @JsonProperty("meeting_id")
  public long getMeetingId() {
    return meetingId;
  }

  @JsonProperty("file_path")
  public String getFilePath() {
    return filePath;
  }

  @JsonProperty("filename")
  public String getFilename() {
    return filename;
  }

  @JsonProperty("status")
  public JobStatus getStatus() {
    return status;
  }

  @JsonProperty("status")
  void setStatus(JobStatus status) {
    this.status = status;
  }

  @JsonProperty("created_at")
  public Instant getCreatedAt() {
    return createdAt;
  }

  @JsonProperty("attempts")
  public int getAttempts() {
    return attempts;
  }

  @JsonProperty("attempts")
  void setAttempts(int attempts) {
    this.attempts = attempts;
  }

  @JsonProperty("max_attempts")
  public int getMaxAttempts() {
    return maxAttempts;
  }

  @JsonProperty("started_at")
  public Instant getStartedAt() {
    return startedAt;
  }

  @JsonProperty("started_at")
  void setStartedAt(Instant startedAt) {
    this.startedAt = startedAt;
  }

  @JsonProperty("completed_at")
  public Instant getCompletedAt() {
    return completedAt;
  }

  @JsonProperty("completed_at")
  void setCompletedAt(Instant completedAt) {
    this.completedAt = completedAt;
  }

  @JsonProperty("failed_at")
  public Instant getFailedAt() {
    return failedAt;
  }

  @JsonProperty("failed_at")
  void setFailedAt(Instant failedAt) {
    this.failedAt = failedAt;
  }

  @JsonProperty("last_error")
  public String getLastError() {
    return lastError;
  }

  @JsonProperty("last_error")
  void setLastError(String lastError) {
    this.lastError = lastError;
  }

  @JsonProperty("result")
  public Map<String, Object> getResult() {
    return result == null ? null : Collections.unmodifiableMap(result);
  }

  @JsonProperty("result")
  void setResult(Map<String, Object> result) {
    this.result = result;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MeetingJob)) {
      return false;
    }
    MeetingJob other = (MeetingJob) o;
    return meetingId == other.meetingId
        && maxAttempts == other.maxAttempts
        && attempts == other.attempts
        && id.equals(other.id)
        && Objects.equals(filePath, other.filePath)
        && Objects.equals(filename, other.filename)
        && createdAt.equals(other.createdAt)
        && status == other.status
        && Objects.equals(startedAt, other.startedAt)
        && Objects.equals(completedAt, other.completedAt)
        && Objects.equals(failedAt, other.failedAt)
        && Objects.equals(lastError, other.lastError)
        && Objects.equals(result, other.result);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, status, attempts);
  }

  @Override
  public String toString() {
    return String.format(
        "MeetingJob[id=%s, meetingId=%d, status=%s, attempts=%d/%d]",
        id, meetingId, status.wireName(), attempts, maxAttempts);
  }
}
