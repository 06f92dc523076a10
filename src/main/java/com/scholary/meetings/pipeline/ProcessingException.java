package com.scholary.meetings.pipeline;

/**
 * Exception thrown when a step of the meeting pipeline fails.
 *
 * <p>Missing audio, a failed ffmpeg run or a meeting row that could not be updated all end up
 * here. The worker treats it like any other processing error.
 */
public class ProcessingException extends RuntimeException {

  public ProcessingException(String message) {
    super(message);
  }

  public ProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
