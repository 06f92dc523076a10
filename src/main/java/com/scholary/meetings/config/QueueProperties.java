package com.scholary.meetings.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the job queue.
 *
 * <p>Key names default to the ones the worker fleet already shares in Redis. TTLs follow the
 * live/terminal split: long while a job can still move, short once it has settled.
 */
@ConfigurationProperties(prefix = "queue")
@Validated
public record QueueProperties(
    @NotNull Backend backend,
    @NotBlank String pendingKey,
    @NotBlank String inFlightKey,
    @NotBlank String deadLetterKey,
    @NotBlank String jobKeyPrefix,
    @NotNull Duration liveTtl,
    @NotNull Duration terminalTtl,
    @Positive int defaultMaxAttempts,
    @Positive int memoryMaxRecords,
    @Valid @NotNull ReaperProperties reaper) {

  public enum Backend {
    REDIS,
    MEMORY
  }

  public record ReaperProperties(
      boolean enabled, @NotNull Duration staleAfter, @NotNull Duration interval) {}
}
