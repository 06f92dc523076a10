package com.scholary.meetings.api;

/** Returned by POST /jobs. Poll /job-status/{jobId} for progress. */
public record EnqueueJobResponse(String jobId) {}
