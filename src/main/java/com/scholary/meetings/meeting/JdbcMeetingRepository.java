package com.scholary.meetings.meeting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * JDBC repository for the {@code meetings} table.
 *
 * <p>One UPDATE per meeting; COALESCE keeps existing optional columns when the new value is null.
 */
@Repository
public class JdbcMeetingRepository implements MeetingRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcMeetingRepository.class);

  static final String UPDATE_SQL =
      "UPDATE meetings SET transcript = ?, summary = ?, "
          + "language = COALESCE(?, language), "
          + "duration_seconds = COALESCE(?, duration_seconds), "
          + "keywords = COALESCE(?, keywords) "
          + "WHERE id = ?";

  private final JdbcTemplate jdbcTemplate;

  public JdbcMeetingRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public boolean saveAnalysis(long meetingId, MeetingAnalysis analysis) {
    int updated =
        jdbcTemplate.update(
            UPDATE_SQL,
            analysis.transcript(),
            analysis.summary(),
            analysis.language(),
            analysis.durationSeconds(),
            analysis.keywordsColumn(),
            meetingId);

    if (updated == 0) {
      LOGGER.error("Meeting {} not found in database", meetingId);
      return false;
    }
    LOGGER.info("Meeting {} updated successfully", meetingId);
    return true;
  }
}
