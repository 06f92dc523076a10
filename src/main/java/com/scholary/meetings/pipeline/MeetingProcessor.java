package com.scholary.meetings.pipeline;

import com.scholary.meetings.job.MeetingJob;
import com.scholary.meetings.meeting.MeetingAnalysis;
import com.scholary.meetings.meeting.MeetingRepository;
import com.scholary.meetings.summary.Summarizer;
import com.scholary.meetings.whisper.Transcript;
import com.scholary.meetings.whisper.TranscriptionEngine;
import com.scholary.meetings.worker.JobProcessor;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The processing function for meeting jobs.
 *
 * <p>Steps, in order:
 *
 * <ol>
 *   <li>Resolve the recording to a local file (downloading {@code s3://} references)
 *   <li>Convert to 16 kHz mono WAV
 *   <li>Transcribe
 *   <li>Summarize
 *   <li>Extract keywords
 *   <li>Probe the duration
 *   <li>Persist everything onto the meeting row
 * </ol>
 *
 * <p>Each attempt starts from scratch. Temporary files are removed whether the attempt succeeds or
 * not.
 */
@Service
public class MeetingProcessor implements JobProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(MeetingProcessor.class);

  private final AudioSourceResolver audioSourceResolver;
  private final AudioConverter audioConverter;
  private final TranscriptionEngine transcriptionEngine;
  private final Summarizer summarizer;
  private final KeywordExtractor keywordExtractor;
  private final AudioDurationProbe durationProbe;
  private final MeetingRepository meetingRepository;
  private final int keywordCount;

  public MeetingProcessor(
      AudioSourceResolver audioSourceResolver,
      AudioConverter audioConverter,
      TranscriptionEngine transcriptionEngine,
      Summarizer summarizer,
      KeywordExtractor keywordExtractor,
      AudioDurationProbe durationProbe,
      MeetingRepository meetingRepository,
      PipelineProperties properties) {
    this.audioSourceResolver = audioSourceResolver;
    this.audioConverter = audioConverter;
    this.transcriptionEngine = transcriptionEngine;
    this.summarizer = summarizer;
    this.keywordExtractor = keywordExtractor;
    this.durationProbe = durationProbe;
    this.meetingRepository = meetingRepository;
    this.keywordCount = properties.keywordCount();
  }

  @Override
  public Map<String, Object> process(MeetingJob job) {
    LOGGER.info("Processing job {} for meeting {}", job.getId(), job.getMeetingId());

    try (AudioSource source = audioSourceResolver.resolve(job)) {
      Transcript transcript = transcribe(source.path());
      String summary = summarizer.summarize(transcript.text());
      List<String> keywords = keywordExtractor.extract(transcript.text(), keywordCount);
      OptionalDouble duration = durationProbe.durationSeconds(source.path());

      MeetingAnalysis analysis =
          new MeetingAnalysis(
              transcript.text(),
              summary,
              transcript.language(),
              duration.isPresent() ? duration.getAsDouble() : null,
              keywords);

      if (!meetingRepository.saveAnalysis(job.getMeetingId(), analysis)) {
        throw new ProcessingException(
            "Failed to update database record for meeting " + job.getMeetingId());
      }

      Map<String, Object> result = new LinkedHashMap<>();
      result.put("transcript_length", transcript.text().length());
      result.put("language", transcript.language());
      result.put("summary_length", summary.length());
      result.put("keywords_count", keywords.size());
      result.put("duration_seconds", analysis.durationSeconds());

      LOGGER.info("Job {} completed successfully", job.getId());
      return result;
    }
  }

  private Transcript transcribe(Path recording) {
    Path wav = audioConverter.toWav16kMono(recording);
    try {
      return transcriptionEngine.transcribe(wav);
    } finally {
      if (!wav.equals(recording)) {
        AudioSource.deleteQuietly(wav);
      }
    }
  }
}
