package com.scholary.meetings.whisper;

/** A single timed segment as returned by the Whisper service. */
public record TranscriptSegment(double start, double end, String text) {}
