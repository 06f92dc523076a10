package com.scholary.meetings.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Response from the Whisper transcription API.
 *
 * <p>Contains a list of segments and the detected language.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(List<TranscriptSegment> segments, String language) {

  /** Segment texts joined with single spaces, trimmed. */
  public String fullText() {
    if (segments == null) {
      return "";
    }
    return segments.stream()
        .map(TranscriptSegment::text)
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(text -> !text.isEmpty())
        .collect(Collectors.joining(" "))
        .trim();
  }
}
