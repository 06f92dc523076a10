package com.scholary.meetings.meeting;

import java.util.List;

/**
 * Everything the pipeline learned about a meeting, ready to be persisted.
 *
 * @param language null when the engine did not detect one
 * @param durationSeconds null when the duration could not be probed
 * @param keywords may be empty, never null
 */
public record MeetingAnalysis(
    String transcript,
    String summary,
    String language,
    Double durationSeconds,
    List<String> keywords) {

  public MeetingAnalysis {
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
  }

  /** Keywords as stored in the meetings table, or null when there are none. */
  public String keywordsColumn() {
    return keywords.isEmpty() ? null : String.join(",", keywords);
  }
}
