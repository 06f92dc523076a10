package com.scholary.meetings.queue;

/**
 * Exception thrown when the queue broker or the job record store cannot be reached.
 *
 * <p>No job is held by the caller when this surfaces from a dequeue, so job state is never
 * corrupted by it. Workers log it and back off; producers report the queue as unavailable.
 */
public class QueueUnavailableException extends RuntimeException {

  public QueueUnavailableException(String message) {
    super(message);
  }

  public QueueUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
