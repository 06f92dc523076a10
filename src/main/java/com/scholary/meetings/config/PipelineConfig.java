package com.scholary.meetings.config;

import com.scholary.meetings.pipeline.PipelineProperties;
import com.scholary.meetings.summary.SummarizerProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the meeting processing pipeline.
 *
 * <p>Makes sure the temp directory exists before the first job needs it.
 */
@Configuration
@EnableConfigurationProperties({PipelineProperties.class, SummarizerProperties.class})
public class PipelineConfig {

  public PipelineConfig(PipelineProperties properties) {
    try {
      Files.createDirectories(Paths.get(properties.tempDir()));
    } catch (IOException e) {
      throw new UncheckedIOException(
          "Failed to create temp directory: " + properties.tempDir(), e);
    }
  }
}
