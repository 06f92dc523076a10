package com.scholary.meetings.queue;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Broker-level primitives for the job queue: a pending sequence of job ids and an in-flight set.
 *
 * <p>Ids are pushed at one end of the pending sequence and popped from the other, so fresh pushes
 * come out in arrival order. Retries are pushed at the same end as fresh work. The pop is the only
 * mutual-exclusion point between workers: any given id is handed to exactly one caller.
 *
 * <p>Every operation except {@link #popPending(Duration)} completes without waiting on application
 * state. Broker failures surface as {@link QueueUnavailableException}.
 */
public interface QueueStore {

  /** Append an id to the pending sequence. Not idempotent: pushing twice yields two pops. */
  void pushPending(String jobId);

  /**
   * Remove and return the oldest pending id, waiting up to {@code timeout}.
   *
   * @return the id, or empty on timeout
   */
  Optional<String> popPending(Duration timeout);

  /** Add an id to the in-flight set. Idempotent. */
  void markInFlight(String jobId);

  /** Remove an id from the in-flight set. Idempotent. */
  void unmarkInFlight(String jobId);

  long inFlightCount();

  long pendingLength();

  /** Snapshot of the in-flight set, for diagnostics and the stale-job reaper. */
  Set<String> inFlightIds();

  /** Append a dead-letter entry (an opaque JSON envelope). */
  void pushDeadLetter(String entry);

  long deadLetterLength();

  /**
   * Check broker connectivity.
   *
   * @throws QueueUnavailableException if the broker is unreachable
   */
  void ping();
}
