package com.scholary.meetings.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.scholary.meetings.config.QueueProperties;
import com.scholary.meetings.job.InMemoryJobRecordStore;
import com.scholary.meetings.job.JobRecordStore;
import com.scholary.meetings.job.JobStatus;
import com.scholary.meetings.job.MalformedJobException;
import com.scholary.meetings.job.MeetingJob;
import com.scholary.meetings.queue.InMemoryQueueStore;
import com.scholary.meetings.queue.QueueUnavailableException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/** Tests for TaskQueueService over the in-memory stores. */
class TaskQueueServiceTest {

  private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");
  private static final Duration NO_WAIT = Duration.ZERO;

  private final ObjectMapper objectMapper =
      JsonMapper.builder()
          .findAndAddModules()
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .build();

  private MutableClock clock;
  private InMemoryQueueStore queueStore;
  private InMemoryJobRecordStore jobStore;
  private TaskQueueService service;

  static QueueProperties queueProperties() {
    return new QueueProperties(
        QueueProperties.Backend.MEMORY,
        "meeting_processing_queue",
        "processing_meetings",
        "meeting_processing_dlq",
        "job:",
        Duration.ofHours(24),
        Duration.ofHours(1),
        3,
        1000,
        new QueueProperties.ReaperProperties(true, Duration.ofHours(2), Duration.ofMinutes(5)));
  }

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    queueStore = new InMemoryQueueStore();
    jobStore = new InMemoryJobRecordStore(1000);
    service = new TaskQueueService(queueStore, jobStore, objectMapper, clock, queueProperties());
  }

  @Test
  void enqueue_shouldStoreQueuedRecordAndPushId() {
    String jobId = service.enqueueMeetingJob(12L, "/data/m.mp3", "m.mp3");

    assertThat(jobId).startsWith("meeting_12_" + START.getEpochSecond() + "_");
    MeetingJob job = service.getJobStatus(jobId).orElseThrow();
    assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
    assertThat(job.getAttempts()).isZero();
    assertThat(job.getMaxAttempts()).isEqualTo(3);
    assertThat(service.queueStats()).isEqualTo(new QueueStats(1, 0));
  }

  @Test
  void failedAttemptWithRetry_shouldRequeueThenComplete() {
    String jobId = service.enqueueMeetingJob(1L, "/data/m1.mp3", "m1.mp3", 3);

    MeetingJob first = service.startNextJob(NO_WAIT).orElseThrow();
    assertThat(first.getId()).isEqualTo(jobId);
    assertThat(service.queueStats()).isEqualTo(new QueueStats(0, 1));

    assertThat(service.failJob(jobId, "whisper timeout", true)).contains(JobStatus.QUEUED);
    MeetingJob requeued = service.getJobStatus(jobId).orElseThrow();
    assertThat(requeued.getStatus()).isEqualTo(JobStatus.QUEUED);
    assertThat(requeued.getAttempts()).isEqualTo(1);
    assertThat(requeued.getLastError()).isEqualTo("whisper timeout");
    assertThat(service.queueStats()).isEqualTo(new QueueStats(1, 0));

    MeetingJob second = service.startNextJob(NO_WAIT).orElseThrow();
    assertThat(second.getId()).isEqualTo(jobId);
    service.completeJob(jobId, Map.of("keywords_count", 8));

    MeetingJob done = service.getJobStatus(jobId).orElseThrow();
    assertThat(done.getStatus()).isEqualTo(JobStatus.COMPLETED);
    assertThat(done.getAttempts()).isEqualTo(1);
    assertThat(done.getLastError()).isNull();
    assertThat(done.getResult()).containsEntry("keywords_count", 8);
    assertThat(service.queueStats()).isEqualTo(new QueueStats(0, 0));
  }

  @Test
  void enqueue_shouldNotDisturbJobOfSameMeetingEnqueuedInSameSecond() {
    String first = service.enqueueMeetingJob(7L, "/data/a.mp3", "a.mp3");
    service.startNextJob(NO_WAIT).orElseThrow();

    String second = service.enqueueMeetingJob(7L, "/data/b.mp3", "b.mp3");

    assertThat(second).isNotEqualTo(first);
    MeetingJob running = service.getJobStatus(first).orElseThrow();
    assertThat(running.getStatus()).isEqualTo(JobStatus.PROCESSING);
    assertThat(running.getFilePath()).isEqualTo("/data/a.mp3");

    service.completeJob(first, Map.of("keywords_count", 3));

    assertThat(service.getJobStatus(first).orElseThrow().getStatus())
        .isEqualTo(JobStatus.COMPLETED);
    MeetingJob waiting = service.getJobStatus(second).orElseThrow();
    assertThat(waiting.getStatus()).isEqualTo(JobStatus.QUEUED);
    assertThat(waiting.getFilePath()).isEqualTo("/data/b.mp3");
    assertThat(service.queueStats()).isEqualTo(new QueueStats(1, 0));
  }

  @Test
  void enqueue_shouldGenerateAnotherIdWhenRecordAlreadyExists() {
    JobRecordStore takenStore = mock(JobRecordStore.class);
    when(takenStore.saveIfAbsent(any(MeetingJob.class), eq(Duration.ofHours(24))))
        .thenReturn(false)
        .thenReturn(true);
    TaskQueueService takenService =
        new TaskQueueService(queueStore, takenStore, objectMapper, clock, queueProperties());

    String jobId = takenService.enqueueMeetingJob(7L, "/data/a.mp3", "a.mp3");

    ArgumentCaptor<MeetingJob> saved = ArgumentCaptor.forClass(MeetingJob.class);
    verify(takenStore, times(2)).saveIfAbsent(saved.capture(), eq(Duration.ofHours(24)));
    assertThat(saved.getAllValues().get(1).getId()).isEqualTo(jobId);
    assertThat(queueStore.pendingLength()).isEqualTo(1);
  }

  @Test
  void failedAttemptWithSingleAttemptBudget_shouldFailTerminally() {
    String jobId = service.enqueueMeetingJob(2L, "/data/m2.mp3", "m2.mp3", 1);
    service.startNextJob(NO_WAIT).orElseThrow();

    assertThat(service.failJob(jobId, "corrupt audio", true)).contains(JobStatus.FAILED);

    MeetingJob failed = service.getJobStatus(jobId).orElseThrow();
    assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(failed.getAttempts()).isEqualTo(1);
    assertThat(failed.getFailedAt()).isEqualTo(START);
    assertThat(service.startNextJob(NO_WAIT)).isEmpty();
    assertThat(service.queueStats()).isEqualTo(new QueueStats(0, 0));
  }

  @Test
  void queueStats_shouldBeZeroOnEmptyStore() {
    assertThat(service.queueStats()).isEqualTo(new QueueStats(0, 0));
    assertThat(service.queueStats()).isEqualTo(service.queueStats());
  }

  @Test
  void getJobStatus_shouldReturnEmptyForUnknownId() {
    assertThat(service.getJobStatus("meeting_999_1")).isEmpty();
  }

  @Test
  void startNextJob_shouldReturnEmptyWhenNothingIsPending() {
    assertThat(service.startNextJob(Duration.ofMillis(20))).isEmpty();
  }

  @Test
  void startNextJob_shouldDeliverFreshJobsInArrivalOrder() {
    String a = service.enqueueMeetingJob(1L, "/a", "a");
    String b = service.enqueueMeetingJob(2L, "/b", "b");
    String c = service.enqueueMeetingJob(3L, "/c", "c");

    assertThat(service.startNextJob(NO_WAIT)).map(MeetingJob::getId).contains(a);
    assertThat(service.startNextJob(NO_WAIT)).map(MeetingJob::getId).contains(b);
    assertThat(service.startNextJob(NO_WAIT)).map(MeetingJob::getId).contains(c);
  }

  @Test
  void retriedJob_shouldGoBehindWorkAlreadyPending() {
    String a = service.enqueueMeetingJob(1L, "/a", "a");
    String b = service.enqueueMeetingJob(2L, "/b", "b");

    service.startNextJob(NO_WAIT).orElseThrow();
    service.failJob(a, "flaky", true);

    assertThat(service.startNextJob(NO_WAIT)).map(MeetingJob::getId).contains(b);
    assertThat(service.startNextJob(NO_WAIT)).map(MeetingJob::getId).contains(a);
  }

  @Test
  void attempts_shouldNeverExceedMaxAttempts() {
    String jobId = service.enqueueMeetingJob(5L, "/m", "m", 3);
    List<JobStatus> outcomes = new ArrayList<>();

    Optional<MeetingJob> next;
    while ((next = service.startNextJob(NO_WAIT)).isPresent()) {
      assertThat(next.get().getAttempts()).isLessThanOrEqualTo(3);
      outcomes.add(service.failJob(jobId, "always fails", true).orElseThrow());
    }

    assertThat(outcomes)
        .containsExactly(JobStatus.QUEUED, JobStatus.QUEUED, JobStatus.FAILED);
    assertThat(service.getJobStatus(jobId).orElseThrow().getAttempts()).isEqualTo(3);
  }

  @Test
  void failJob_withoutRetry_shouldFailEvenWithAttemptsLeft() {
    String jobId = service.enqueueMeetingJob(6L, "/m", "m", 3);
    service.startNextJob(NO_WAIT).orElseThrow();

    assertThat(service.failJob(jobId, new IllegalArgumentException("bad file"), false))
        .contains(JobStatus.FAILED);
    assertThat(service.getJobStatus(jobId).orElseThrow().getLastError()).isEqualTo("bad file");
  }

  @Test
  void completeAndFail_shouldBeNoOpsForMissingRecords() {
    queueStore.markInFlight("ghost");

    service.completeJob("ghost", Map.of());
    assertThat(service.failJob("ghost", "boom", true)).isEmpty();

    assertThat(service.getJobStatus("ghost")).isEmpty();
    assertThat(service.queueStats()).isEqualTo(new QueueStats(0, 0));
  }

  @Test
  void completeJob_shouldIgnoreJobThatIsNotProcessing() {
    String jobId = service.enqueueMeetingJob(7L, "/m", "m");

    service.completeJob(jobId, Map.of());

    assertThat(service.getJobStatus(jobId).orElseThrow().getStatus())
        .isEqualTo(JobStatus.QUEUED);
  }

  @Test
  void startNextJob_shouldDropIdWhoseRecordExpired() {
    queueStore.pushPending("meeting_1_1");

    assertThat(service.startNextJob(NO_WAIT)).isEmpty();
    assertThat(service.queueStats()).isEqualTo(new QueueStats(0, 0));
  }

  @Test
  void startNextJob_shouldDeadLetterMalformedRecord() throws Exception {
    JobRecordStore brokenStore = mock(JobRecordStore.class);
    when(brokenStore.load("bad"))
        .thenThrow(
            new MalformedJobException("bad", "{oops", new IllegalArgumentException("bad json")));
    TaskQueueService brokenService =
        new TaskQueueService(queueStore, brokenStore, objectMapper, clock, queueProperties());
    queueStore.pushPending("bad");

    assertThat(brokenService.startNextJob(NO_WAIT)).isEmpty();

    assertThat(queueStore.deadLetterLength()).isEqualTo(1);
    assertThat(queueStore.inFlightCount()).isZero();
  }

  @Test
  void startNextJob_shouldReturnIdToPendingWhenLoadFailsAfterPop() {
    FlakyJobRecordStore flakyStore = new FlakyJobRecordStore();
    TaskQueueService flaky =
        new TaskQueueService(queueStore, flakyStore, objectMapper, clock, queueProperties());
    String jobId = flaky.enqueueMeetingJob(4L, "/m", "m");

    flakyStore.failNextLoad = true;
    assertThatThrownBy(() -> flaky.startNextJob(NO_WAIT))
        .isInstanceOf(QueueUnavailableException.class);

    assertThat(flaky.queueStats()).isEqualTo(new QueueStats(1, 0));
    assertThat(flaky.startNextJob(NO_WAIT)).map(MeetingJob::getId).contains(jobId);
  }

  @Test
  void startNextJob_shouldReturnIdToPendingWhenSaveFailsAfterMarkingInFlight() {
    FlakyJobRecordStore flakyStore = new FlakyJobRecordStore();
    TaskQueueService flaky =
        new TaskQueueService(queueStore, flakyStore, objectMapper, clock, queueProperties());
    String jobId = flaky.enqueueMeetingJob(4L, "/m", "m");

    flakyStore.failNextSave = true;
    assertThatThrownBy(() -> flaky.startNextJob(NO_WAIT))
        .isInstanceOf(QueueUnavailableException.class);

    assertThat(flaky.getJobStatus(jobId).orElseThrow().getStatus()).isEqualTo(JobStatus.QUEUED);
    assertThat(flaky.queueStats()).isEqualTo(new QueueStats(1, 0));
    assertThat(flaky.startNextJob(NO_WAIT)).map(MeetingJob::getId).contains(jobId);
  }

  @Test
  void failJob_shouldLeaveIdInFlightForReaperWhenRetryPushFails() {
    FlakyQueueStore flakyQueue = new FlakyQueueStore();
    TaskQueueService flaky =
        new TaskQueueService(flakyQueue, jobStore, objectMapper, clock, queueProperties());
    String jobId = flaky.enqueueMeetingJob(5L, "/m", "m", 3);
    flaky.startNextJob(NO_WAIT).orElseThrow();

    flakyQueue.failNextPush = true;
    assertThatThrownBy(() -> flaky.failJob(jobId, "whisper timeout", true))
        .isInstanceOf(QueueUnavailableException.class);

    assertThat(flaky.getJobStatus(jobId).orElseThrow().getStatus()).isEqualTo(JobStatus.QUEUED);
    assertThat(flaky.queueStats()).isEqualTo(new QueueStats(0, 1));
    assertThat(flaky.reapStaleJobs(Duration.ofHours(2))).isZero();

    clock.advance(Duration.ofHours(3));
    assertThat(flaky.reapStaleJobs(Duration.ofHours(2))).isEqualTo(1);

    assertThat(flaky.queueStats()).isEqualTo(new QueueStats(1, 0));
    MeetingJob retried = flaky.startNextJob(NO_WAIT).orElseThrow();
    assertThat(retried.getId()).isEqualTo(jobId);
    assertThat(retried.getAttempts()).isEqualTo(1);
  }

  @Test
  void completeJob_shouldKeepIdInFlightWhenSaveFails() {
    FlakyJobRecordStore flakyStore = new FlakyJobRecordStore();
    TaskQueueService flaky =
        new TaskQueueService(queueStore, flakyStore, objectMapper, clock, queueProperties());
    String jobId = flaky.enqueueMeetingJob(6L, "/m", "m");
    flaky.startNextJob(NO_WAIT).orElseThrow();

    flakyStore.failNextSave = true;
    assertThatThrownBy(() -> flaky.completeJob(jobId, Map.of()))
        .isInstanceOf(QueueUnavailableException.class);

    assertThat(flaky.getJobStatus(jobId).orElseThrow().getStatus())
        .isEqualTo(JobStatus.PROCESSING);
    assertThat(queueStore.inFlightIds()).containsExactly(jobId);
  }

  @Test
  void deadLetterEntry_shouldCarryRawPayloadAndReason() throws Exception {
    DeadLetterEntry entry = new DeadLetterEntry("bad", "bad json", "{oops", START);

    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(entry));

    assertThat(json.get("job_id").asText()).isEqualTo("bad");
    assertThat(json.get("payload").asText()).isEqualTo("{oops");
    assertThat(json.get("dead_lettered_at").asText()).isEqualTo("2024-03-01T10:00:00Z");
  }

  @Test
  void deleteJob_shouldOnlyDeleteSettledJobs() {
    String jobId = service.enqueueMeetingJob(8L, "/m", "m");

    assertThat(service.deleteJob(jobId)).isFalse();
    service.startNextJob(NO_WAIT).orElseThrow();
    assertThat(service.deleteJob(jobId)).isFalse();

    service.completeJob(jobId, Map.of());
    assertThat(service.deleteJob(jobId)).isTrue();
    assertThat(service.getJobStatus(jobId)).isEmpty();
  }

  @Test
  void deleteJob_shouldThrowForUnknownJob() {
    assertThatThrownBy(() -> service.deleteJob("nope"))
        .isInstanceOf(JobNotFoundException.class);
  }

  @Test
  void reapStaleJobs_shouldRequeueJobsStuckPastThreshold() {
    String stuck = service.enqueueMeetingJob(9L, "/m", "m");
    service.startNextJob(NO_WAIT).orElseThrow();

    clock.advance(Duration.ofHours(1));
    String recent = service.enqueueMeetingJob(10L, "/n", "n");
    service.startNextJob(NO_WAIT).orElseThrow();

    clock.advance(Duration.ofMinutes(90));
    int reaped = service.reapStaleJobs(Duration.ofHours(2));

    assertThat(reaped).isEqualTo(1);
    MeetingJob requeued = service.getJobStatus(stuck).orElseThrow();
    assertThat(requeued.getStatus()).isEqualTo(JobStatus.QUEUED);
    assertThat(requeued.getLastError()).startsWith("worker lost");
    assertThat(service.getJobStatus(recent).orElseThrow().getStatus())
        .isEqualTo(JobStatus.PROCESSING);
    assertThat(service.queueStats()).isEqualTo(new QueueStats(1, 1));
  }

  @Test
  void reapStaleJobs_shouldDropInFlightIdsWithoutProcessingRecord() {
    queueStore.markInFlight("ghost");

    assertThat(service.reapStaleJobs(Duration.ofHours(2))).isZero();
    assertThat(queueStore.inFlightCount()).isZero();
  }

  /** Record store that fails its next load or save the way a dropped broker connection does. */
  private static final class FlakyJobRecordStore extends InMemoryJobRecordStore {

    private boolean failNextLoad;
    private boolean failNextSave;

    FlakyJobRecordStore() {
      super(1000);
    }

    @Override
    public Optional<MeetingJob> load(String jobId) {
      if (failNextLoad) {
        failNextLoad = false;
        throw new QueueUnavailableException("Failed to load job " + jobId);
      }
      return super.load(jobId);
    }

    @Override
    public void save(MeetingJob job, Duration ttl) {
      if (failNextSave) {
        failNextSave = false;
        throw new QueueUnavailableException("Failed to save job " + job.getId());
      }
      super.save(job, ttl);
    }
  }

  /** Queue store whose next pending push fails. */
  private static final class FlakyQueueStore extends InMemoryQueueStore {

    private boolean failNextPush;

    @Override
    public void pushPending(String jobId) {
      if (failNextPush) {
        failNextPush = false;
        throw new QueueUnavailableException("Redis push pending failed");
      }
      super.pushPending(jobId);
    }
  }
}
