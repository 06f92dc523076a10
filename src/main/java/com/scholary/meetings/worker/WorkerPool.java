package com.scholary.meetings.worker;

import com.scholary.meetings.config.WorkerProperties;
import com.scholary.meetings.service.TaskQueueService;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Runs the configured number of {@link QueueWorker} loops for the lifetime of the application.
 *
 * <p>All workers share the same queue and processing function. On shutdown every worker is told to
 * stop first, then each is joined against what is left of the shared shutdown timeout.
 */
public class WorkerPool implements SmartLifecycle {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkerPool.class);

  private final TaskQueueService taskQueueService;
  private final JobProcessor processor;
  private final WorkerProperties properties;
  private final List<QueueWorker> workers = new CopyOnWriteArrayList<>();

  private volatile boolean running;

  public WorkerPool(
      TaskQueueService taskQueueService, JobProcessor processor, WorkerProperties properties) {
    this.taskQueueService = taskQueueService;
    this.processor = processor;
    this.properties = properties;
  }

  @Override
  public synchronized void start() {
    if (running) {
      LOGGER.warn("Worker pool already running");
      return;
    }

    LOGGER.info(
        "Starting worker pool: threads={}, dequeueTimeout={}, errorBackoff={}",
        properties.threads(),
        properties.dequeueTimeout(),
        properties.errorBackoff());

    for (int i = 1; i <= properties.threads(); i++) {
      QueueWorker worker =
          new QueueWorker(
              String.valueOf(i),
              taskQueueService,
              processor,
              properties.dequeueTimeout(),
              properties.errorBackoff());
      workers.add(worker);
      worker.start();
    }
    running = true;
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }

    LOGGER.info("Stopping worker pool...");
    workers.forEach(QueueWorker::requestStop);

    long deadline = System.nanoTime() + properties.shutdownTimeout().toNanos();
    boolean graceful = true;
    for (QueueWorker worker : workers) {
      Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
      graceful &= worker.stop(remaining);
    }

    if (graceful) {
      LOGGER.info("Worker pool stopped");
    } else {
      LOGGER.warn("Worker pool did not stop gracefully within {}", properties.shutdownTimeout());
    }
    workers.clear();
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  public int getActiveWorkers() {
    return (int) workers.stream().filter(QueueWorker::isRunning).count();
  }

  public long getProcessedCount() {
    return workers.stream().mapToLong(QueueWorker::getProcessedCount).sum();
  }

  public long getFailedCount() {
    return workers.stream().mapToLong(QueueWorker::getFailedCount).sum();
  }
}
