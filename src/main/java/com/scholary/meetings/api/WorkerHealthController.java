package com.scholary.meetings.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.meetings.queue.QueueUnavailableException;
import com.scholary.meetings.service.QueueStats;
import com.scholary.meetings.service.TaskQueueService;
import com.scholary.meetings.worker.WorkerPool;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health and statistics for the worker process.
 *
 * <p>Health never fails on a broker outage; it reports {@code unhealthy} with the error instead.
 */
@RestController
@Tag(name = "Worker", description = "Worker health and statistics")
public class WorkerHealthController {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkerHealthController.class);

  private final TaskQueueService taskQueueService;
  private final ObjectProvider<WorkerPool> workerPool;
  private final Clock clock;

  public WorkerHealthController(
      TaskQueueService taskQueueService, ObjectProvider<WorkerPool> workerPool, Clock clock) {
    this.taskQueueService = taskQueueService;
    this.workerPool = workerPool;
    this.clock = clock;
  }

  @GetMapping("/health")
  @Operation(summary = "Worker health", description = "Broker connectivity and worker state.")
  public HealthResponse health() {
    boolean running = isWorkerRunning();
    try {
      QueueStats stats = taskQueueService.queueStats();
      return new HealthResponse(
          "healthy",
          Instant.now(clock),
          running,
          true,
          stats.pendingLength(),
          stats.inFlightCount(),
          null);
    } catch (QueueUnavailableException e) {
      LOGGER.warn("Health check could not reach the broker: {}", e.getMessage());
      return new HealthResponse(
          "unhealthy", Instant.now(clock), running, false, 0, 0, e.getMessage());
    }
  }

  @GetMapping("/stats")
  @Operation(summary = "Worker statistics", description = "Queue counts and active workers.")
  public StatsResponse stats() {
    QueueStats stats = taskQueueService.queueStats();
    WorkerPool pool = workerPool.getIfAvailable();
    return new StatsResponse(
        stats.pendingLength(),
        stats.inFlightCount(),
        isWorkerRunning(),
        pool == null ? 0 : pool.getActiveWorkers());
  }

  private boolean isWorkerRunning() {
    WorkerPool pool = workerPool.getIfAvailable();
    return pool != null && pool.isRunning();
  }

  /** Body of GET /health. */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record HealthResponse(
      String status,
      Instant timestamp,
      boolean workerRunning,
      boolean redisConnected,
      long queueLength,
      long processingCount,
      String redisError) {}

  /** Body of GET /stats. */
  public record StatsResponse(
      long queueLength, long processingCount, boolean workerRunning, int activeWorkers) {}
}
