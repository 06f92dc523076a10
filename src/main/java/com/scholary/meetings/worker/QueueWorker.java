package com.scholary.meetings.worker;

import com.scholary.meetings.job.MeetingJob;
import com.scholary.meetings.logging.StructuredLogger;
import com.scholary.meetings.service.TaskQueueService;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A worker that continuously pulls jobs from the queue and runs the processing function.
 *
 * <p>The running flag is checked between dequeues, so an idle worker notices a stop request within
 * one dequeue timeout. A job that is already running cannot be cancelled; {@link #stop(Duration)}
 * waits for it up to a bound.
 *
 * <p>Processing errors never end the loop; they become a retry or a terminal failure of that job.
 * Errors from the dequeue step itself (broker down) are logged and followed by a fixed sleep.
 */
public class QueueWorker {

  private static final Logger LOGGER = LoggerFactory.getLogger(QueueWorker.class);

  private final String workerId;
  private final TaskQueueService taskQueueService;
  private final JobProcessor processor;
  private final Duration dequeueTimeout;
  private final Duration errorBackoff;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicLong processedCount = new AtomicLong(0);
  private final AtomicLong failedCount = new AtomicLong(0);

  private volatile Thread workerThread;

  public QueueWorker(
      String workerId,
      TaskQueueService taskQueueService,
      JobProcessor processor,
      Duration dequeueTimeout,
      Duration errorBackoff) {
    this.workerId = workerId;
    this.taskQueueService = taskQueueService;
    this.processor = processor;
    this.dequeueTimeout = dequeueTimeout;
    this.errorBackoff = errorBackoff;
  }

  /** Start the worker loop on its own thread. No-op if already running. */
  public void start() {
    if (running.compareAndSet(false, true)) {
      workerThread = new Thread(this::run, "queue-worker-" + workerId);
      workerThread.setDaemon(false);
      workerThread.start();
      LOGGER.info("Worker thread started: {}", workerId);
    } else {
      LOGGER.warn("Worker already running: {}", workerId);
    }
  }

  /** Ask the loop to exit after the current dequeue or job. Does not wait. */
  public void requestStop() {
    running.set(false);
  }

  /**
   * Stop the worker and wait for the current job to finish.
   *
   * @param timeout how long to wait for the thread to exit
   * @return true if the thread exited within the timeout
   */
  public boolean stop(Duration timeout) {
    requestStop();
    Thread thread = workerThread;
    if (thread == null) {
      return true;
    }

    try {
      // join(0) would wait forever
      thread.join(Math.max(1, timeout.toMillis()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }

    if (thread.isAlive()) {
      LOGGER.warn("Worker thread did not stop gracefully: {}", workerId);
      return false;
    }
    LOGGER.info("Worker stopped successfully: {}", workerId);
    return true;
  }

  /**
   * Dequeue and process at most one job.
   *
   * @return true if a job was processed (successfully or not), false on dequeue timeout
   * @throws com.scholary.meetings.queue.QueueUnavailableException if the broker is down
   */
  public boolean processNext() {
    Optional<MeetingJob> next = taskQueueService.startNextJob(dequeueTimeout);
    if (next.isEmpty()) {
      return false;
    }
    execute(next.get());
    return true;
  }

  private void execute(MeetingJob job) {
    String jobId = job.getId();
    StructuredLogger.setJobContext(jobId, job.getMeetingId());
    try {
      LOGGER.info("Picked up job: {}", jobId);
      long startNanos = System.nanoTime();

      Map<String, Object> result;
      try {
        result = processor.process(job);
      } catch (Exception e) {
        if (e instanceof InterruptedException) {
          Thread.currentThread().interrupt();
        }
        LOGGER.error("Job {} failed on attempt {}", jobId, job.getAttempts() + 1, e);
        taskQueueService.failJob(jobId, e, true);
        failedCount.incrementAndGet();
        return;
      } catch (Error e) {
        // Settle the job before the error ends this thread.
        LOGGER.error("Job {} hit a fatal error, stopping worker {}", jobId, workerId, e);
        taskQueueService.failJob(jobId, e, true);
        failedCount.incrementAndGet();
        throw e;
      }

      long processingMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
      taskQueueService.completeJob(jobId, result, processingMs);
      processedCount.incrementAndGet();
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void run() {
    LOGGER.info("Worker loop started: {}", workerId);

    try {
      while (running.get()) {
        try {
          processNext();
        } catch (RuntimeException e) {
          LOGGER.error("Worker loop error, retrying in {}: {}", errorBackoff, workerId, e);
          if (!sleepBackoff()) {
            break;
          }
        }
      }
    } catch (Error e) {
      LOGGER.error("Worker loop terminated by fatal error: {}", workerId, e);
      throw e;
    } finally {
      running.set(false);
    }

    LOGGER.info("Worker loop stopped: {}", workerId);
  }

  private boolean sleepBackoff() {
    try {
      Thread.sleep(errorBackoff.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  public String getWorkerId() {
    return workerId;
  }

  public long getProcessedCount() {
    return processedCount.get();
  }

  public long getFailedCount() {
    return failedCount.get();
  }

  public boolean isRunning() {
    return running.get();
  }
}
