package com.scholary.meetings.summary;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the chat-completions summarizer.
 *
 * <p>{@code apiKey} may be left blank; the service still starts, but every summary degrades to the
 * failure text.
 */
@ConfigurationProperties(prefix = "summarizer")
@Validated
public record SummarizerProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @DecimalMin("0.0") @DecimalMax("2.0") double temperature,
    @Positive int maxTokens,
    @Positive int timeoutSeconds) {}
