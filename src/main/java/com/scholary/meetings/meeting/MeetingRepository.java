package com.scholary.meetings.meeting;

/** Persistence of the final meeting artifact. */
public interface MeetingRepository {

  /**
   * Write the analysis onto an existing meeting row.
   *
   * <p>Transcript and summary are always written. Language, duration and keywords only overwrite
   * the stored value when present.
   *
   * @return false if no meeting with that id exists
   */
  boolean saveAnalysis(long meetingId, MeetingAnalysis analysis);
}
