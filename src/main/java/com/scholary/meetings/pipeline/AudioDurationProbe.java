package com.scholary.meetings.pipeline;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads a recording's duration with ffprobe.
 *
 * <p>Duration is metadata, not a reason to fail a meeting: any probe failure is logged and reported
 * as an absent duration.
 */
@Component
public class AudioDurationProbe {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioDurationProbe.class);

  private final String ffprobeBinary;

  public AudioDurationProbe(PipelineProperties properties) {
    this.ffprobeBinary = properties.ffprobeBinary();
  }

  /**
   * Probe the duration of an audio file.
   *
   * @return seconds rounded to two decimals, or empty if it could not be determined
   */
  public OptionalDouble durationSeconds(Path audioFile) {
    List<String> command =
        List.of(
            ffprobeBinary,
            "-v",
            "error",
            "-show_entries",
            "format=duration",
            "-of",
            "default=noprint_wrappers=1:nokey=1",
            audioFile.toString());

    try {
      Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
      String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
      int exitCode = process.waitFor();
      if (exitCode != 0) {
        LOGGER.warn("ffprobe exited with code {} for {}: {}", exitCode, audioFile, output.trim());
        return OptionalDouble.empty();
      }
      return parseDuration(output);
    } catch (IOException e) {
      LOGGER.warn("Failed to run ffprobe on {}: {}", audioFile, e.getMessage());
      return OptionalDouble.empty();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return OptionalDouble.empty();
    }
  }

  static OptionalDouble parseDuration(String output) {
    String value = output == null ? "" : output.trim();
    if (value.isEmpty() || "N/A".equals(value)) {
      return OptionalDouble.empty();
    }
    try {
      BigDecimal seconds = new BigDecimal(value).setScale(2, RoundingMode.HALF_UP);
      return OptionalDouble.of(seconds.doubleValue());
    } catch (NumberFormatException e) {
      LOGGER.warn("Unparseable ffprobe duration: {}", value);
      return OptionalDouble.empty();
    }
  }
}
