package com.scholary.meetings.whisper;

/**
 * Full transcript of a recording.
 *
 * @param text the transcript text, never null
 * @param language detected language code, or null if the engine did not report one
 */
public record Transcript(String text, String language) {

  public Transcript {
    text = text == null ? "" : text;
  }
}
