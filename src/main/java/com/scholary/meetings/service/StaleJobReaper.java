package com.scholary.meetings.service;

import com.scholary.meetings.config.QueueProperties;
import com.scholary.meetings.queue.QueueUnavailableException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically requeues jobs stuck in processing after their worker went away.
 *
 * <p>Off unless {@code queue.reaper.enabled=true}. The threshold must comfortably exceed the
 * longest legitimate processing time, or a slow job will be run twice.
 */
@Component
@ConditionalOnProperty(prefix = "queue.reaper", name = "enabled", havingValue = "true")
public class StaleJobReaper {

  private static final Logger LOGGER = LoggerFactory.getLogger(StaleJobReaper.class);

  private final TaskQueueService taskQueueService;
  private final QueueProperties.ReaperProperties properties;
  private final AtomicBoolean running = new AtomicBoolean(false);

  public StaleJobReaper(TaskQueueService taskQueueService, QueueProperties queueProperties) {
    this.taskQueueService = taskQueueService;
    this.properties = queueProperties.reaper();
    LOGGER.info(
        "Stale job reaper enabled: staleAfter={}, interval={}",
        properties.staleAfter(),
        properties.interval());
  }

  @Scheduled(
      initialDelayString = "${queue.reaper.interval}",
      fixedDelayString = "${queue.reaper.interval}")
  public void tick() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    try {
      int reaped = taskQueueService.reapStaleJobs(properties.staleAfter());
      if (reaped > 0) {
        LOGGER.warn("Reaped {} stale in-flight jobs", reaped);
      } else {
        LOGGER.debug("No stale in-flight jobs");
      }
    } catch (QueueUnavailableException e) {
      LOGGER.warn("Reaper skipped, queue unavailable: {}", e.getMessage());
    } finally {
      running.set(false);
    }
  }
}
