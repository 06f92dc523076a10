package com.scholary.meetings.whisper;

import java.nio.file.Path;

/**
 * Interface for speech-to-text engines.
 *
 * <p>The engine is an explicitly constructed collaborator handed to the pipeline, so each worker
 * process owns its own client and nothing is shared through static state.
 */
public interface TranscriptionEngine {

  /**
   * Transcribe a whole recording.
   *
   * @param audioFile 16 kHz mono WAV
   * @return the transcript
   * @throws WhisperException if transcription fails
   */
  Transcript transcribe(Path audioFile);
}
