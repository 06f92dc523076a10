package com.scholary.meetings.summary;

/** Produces a written summary of a meeting transcript. */
public interface Summarizer {

  /** Text recorded in place of a summary when the summarizer could not produce one. */
  String FAILED_SUMMARY = "Summary generation failed";

  /**
   * Summarize a transcript.
   *
   * <p>Never throws: a blank transcript yields an empty summary and any failure yields {@link
   * #FAILED_SUMMARY}, so a summarizer outage does not fail the meeting.
   */
  String summarize(String transcript);
}
