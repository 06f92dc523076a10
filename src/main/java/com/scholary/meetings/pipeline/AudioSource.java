package com.scholary.meetings.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A recording available on local disk for the duration of one job attempt.
 *
 * <p>Closing a temporary source deletes its file; closing a caller-owned file does nothing.
 */
public final class AudioSource implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioSource.class);

  private final Path path;
  private final boolean temporary;

  private AudioSource(Path path, boolean temporary) {
    this.path = path;
    this.temporary = temporary;
  }

  static AudioSource local(Path path) {
    return new AudioSource(path, false);
  }

  static AudioSource temporary(Path path) {
    return new AudioSource(path, true);
  }

  public Path path() {
    return path;
  }

  public boolean isTemporary() {
    return temporary;
  }

  @Override
  public void close() {
    if (temporary) {
      deleteQuietly(path);
    }
  }

  static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temporary file {}: {}", file, e.getMessage());
    }
  }
}
