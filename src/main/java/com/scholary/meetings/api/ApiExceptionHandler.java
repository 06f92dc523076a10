package com.scholary.meetings.api;

import com.scholary.meetings.job.MalformedJobException;
import com.scholary.meetings.queue.QueueUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps queue failures to HTTP responses. Validation errors keep Spring's default 400. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(QueueUnavailableException.class)
  public ResponseEntity<ErrorResponse> handleQueueUnavailable(QueueUnavailableException e) {
    LOGGER.error("Queue unavailable: {}", e.getMessage(), e);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ErrorResponse(e.getMessage()));
  }

  @ExceptionHandler(MalformedJobException.class)
  public ResponseEntity<ErrorResponse> handleMalformedJob(MalformedJobException e) {
    LOGGER.error("Stored record for job {} is unreadable", e.getJobId(), e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ErrorResponse("Job record is unreadable: " + e.getJobId()));
  }
}
