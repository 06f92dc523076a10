package com.scholary.meetings.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request to queue a meeting recording for processing.
 *
 * <p>{@code filePath} is either a path on the worker's filesystem or an {@code s3://bucket/key}
 * location. {@code maxAttempts} falls back to the configured default when omitted.
 */
public record EnqueueJobRequest(
    @NotNull @Positive Long meetingId,
    @NotBlank String filePath,
    @NotBlank String filename,
    @Min(1) @Max(20) Integer maxAttempts) {}
