package com.scholary.meetings.pipeline;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the meeting processing pipeline.
 *
 * <p>Controls where intermediate audio files go, which ffmpeg binaries are used and how many
 * keywords are kept per meeting.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @NotBlank String tempDir,
    @NotBlank String ffmpegBinary,
    @NotBlank String ffprobeBinary,
    @Positive int keywordCount) {}
