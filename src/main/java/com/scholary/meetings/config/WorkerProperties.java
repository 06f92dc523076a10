package com.scholary.meetings.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the in-process worker pool.
 *
 * <p>{@code dequeueTimeout} bounds how long a stop request can go unnoticed by an idle worker.
 */
@ConfigurationProperties(prefix = "worker")
@Validated
public record WorkerProperties(
    boolean enabled,
    @Positive int threads,
    @NotNull Duration dequeueTimeout,
    @NotNull Duration errorBackoff,
    @NotNull Duration shutdownTimeout) {}
