package com.scholary.meetings.api;

import com.scholary.meetings.job.MeetingJob;
import com.scholary.meetings.service.JobNotFoundException;
import com.scholary.meetings.service.QueueStats;
import com.scholary.meetings.service.TaskQueueService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the meeting job queue.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Queueing a recording for processing
 *   <li>Reading a job's status
 *   <li>Queue counts
 *   <li>Removing a settled job record
 * </ul>
 */
@RestController
@Tag(name = "Jobs", description = "Meeting processing job queue")
public class JobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobController.class);

  private final TaskQueueService taskQueueService;

  public JobController(TaskQueueService taskQueueService) {
    this.taskQueueService = taskQueueService;
  }

  @PostMapping("/jobs")
  @Operation(
      summary = "Queue a meeting recording",
      description =
          "Creates a job record and appends it to the pending queue. "
              + "A worker will transcribe, summarize and persist the meeting.")
  public ResponseEntity<EnqueueJobResponse> enqueue(@Valid @RequestBody EnqueueJobRequest request) {
    String jobId =
        request.maxAttempts() == null
            ? taskQueueService.enqueueMeetingJob(
                request.meetingId(), request.filePath(), request.filename())
            : taskQueueService.enqueueMeetingJob(
                request.meetingId(),
                request.filePath(),
                request.filename(),
                request.maxAttempts());
    LOGGER.info("Accepted meeting {} as job {}", request.meetingId(), jobId);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(new EnqueueJobResponse(jobId));
  }

  @GetMapping("/job-status/{jobId}")
  @Operation(
      summary = "Get job status",
      description = "Returns the stored job record. Records expire after completion or failure.")
  public ResponseEntity<MeetingJob> getJobStatus(@PathVariable String jobId) {
    return taskQueueService
        .getJobStatus(jobId)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @GetMapping("/queue-stats")
  @Operation(summary = "Get queue counts", description = "Pending and in-flight job counts.")
  public QueueStats getQueueStats() {
    return taskQueueService.queueStats();
  }

  @DeleteMapping("/jobs/{jobId}")
  @Operation(
      summary = "Delete a job record",
      description = "Only completed or failed jobs can be deleted.")
  public ResponseEntity<Void> deleteJob(@PathVariable String jobId) {
    try {
      if (!taskQueueService.deleteJob(jobId)) {
        return ResponseEntity.status(HttpStatus.CONFLICT).build();
      }
      return ResponseEntity.noContent().build();
    } catch (JobNotFoundException e) {
      return ResponseEntity.notFound().build();
    }
  }
}
