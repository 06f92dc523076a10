package com.scholary.meetings.queue;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

/**
 * Single-process {@link QueueStore} with the same push/pop ends as the Redis list.
 *
 * <p>Ids are pushed at the head and popped from the tail. Interrupting a thread blocked in {@link
 * #popPending(Duration)} returns empty and keeps the interrupt flag set.
 */
public class InMemoryQueueStore implements QueueStore {

  private final BlockingDeque<String> pending = new LinkedBlockingDeque<>();
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
  private final BlockingDeque<String> deadLetters = new LinkedBlockingDeque<>();

  @Override
  public void pushPending(String jobId) {
    pending.offerFirst(jobId);
  }

  @Override
  public Optional<String> popPending(Duration timeout) {
    try {
      return Optional.ofNullable(pending.pollLast(timeout.toMillis(), TimeUnit.MILLISECONDS));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Optional.empty();
    }
  }

  @Override
  public void markInFlight(String jobId) {
    inFlight.add(jobId);
  }

  @Override
  public void unmarkInFlight(String jobId) {
    inFlight.remove(jobId);
  }

  @Override
  public long inFlightCount() {
    return inFlight.size();
  }

  @Override
  public long pendingLength() {
    return pending.size();
  }

  @Override
  public Set<String> inFlightIds() {
    return Set.copyOf(inFlight);
  }

  @Override
  public void pushDeadLetter(String entry) {
    deadLetters.offerFirst(entry);
  }

  @Override
  public long deadLetterLength() {
    return deadLetters.size();
  }

  @Override
  public void ping() {}
}
