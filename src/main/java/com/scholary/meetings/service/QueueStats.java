package com.scholary.meetings.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Point-in-time queue counts. Not consistent with any concurrently read job record. */
public record QueueStats(
    @JsonProperty("pending_length") long pendingLength,
    @JsonProperty("in_flight_count") long inFlightCount) {}
