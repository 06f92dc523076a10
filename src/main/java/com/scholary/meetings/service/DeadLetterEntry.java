package com.scholary.meetings.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** Envelope written to the dead-letter list for a stored job record that could not be parsed. */
public record DeadLetterEntry(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("reason") String reason,
    @JsonProperty("payload") String payload,
    @JsonProperty("dead_lettered_at") Instant deadLetteredAt) {}
