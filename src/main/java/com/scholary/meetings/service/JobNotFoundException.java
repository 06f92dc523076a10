package com.scholary.meetings.service;

/** Thrown when an operation addresses a job id with no stored record. */
public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String jobId) {
    super("Job not found: " + jobId);
  }
}
