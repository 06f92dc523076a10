package com.scholary.meetings.pipeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts uploaded recordings to the 16 kHz mono WAV the transcription service expects.
 *
 * <p>The WAV is written next to the source with a {@code .wav} extension. The caller deletes it.
 */
@Component
public class AudioConverter {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioConverter.class);

  private final String ffmpegBinary;

  public AudioConverter(PipelineProperties properties) {
    this.ffmpegBinary = properties.ffmpegBinary();
  }

  /**
   * Convert a file to 16 kHz mono WAV.
   *
   * @param source the source recording
   * @return the WAV file
   * @throws ProcessingException if ffmpeg fails
   */
  public Path toWav16kMono(Path source) {
    Path wav = wavPathFor(source);
    if (wav.equals(source)) {
      wav = source.resolveSibling(source.getFileName() + ".16k.wav");
    }

    // -y: overwrite, -ar 16000: sample rate, -ac 1: mono
    List<String> command =
        List.of(
            ffmpegBinary, "-y", "-i", source.toString(), "-ar", "16000", "-ac", "1",
            wav.toString());
    LOGGER.debug("Executing: {}", String.join(" ", command));

    try {
      Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
      String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
      int exitCode = process.waitFor();
      if (exitCode != 0) {
        LOGGER.error("ffmpeg conversion failed (exit {}): {}", exitCode, output);
        throw new ProcessingException(
            String.format("ffmpeg conversion of %s failed with exit code %d", source, exitCode));
      }
    } catch (IOException e) {
      throw new ProcessingException("Failed to run ffmpeg on " + source, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProcessingException("Audio conversion interrupted", e);
    }

    LOGGER.info("Converted {} to {}", source, wav);
    return wav;
  }

  static Path wavPathFor(Path source) {
    String name = source.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String base = dot > 0 ? name.substring(0, dot) : name;
    return source.resolveSibling(base + ".wav");
  }
}
