package com.scholary.meetings.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.meetings.job.MeetingJob;
import com.scholary.meetings.meeting.MeetingAnalysis;
import com.scholary.meetings.meeting.MeetingRepository;
import com.scholary.meetings.objectstore.ObjectStoreClient;
import com.scholary.meetings.summary.Summarizer;
import com.scholary.meetings.whisper.Transcript;
import com.scholary.meetings.whisper.TranscriptionEngine;
import com.scholary.meetings.whisper.WhisperException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Tests for the meeting pipeline with every external tool mocked. */
@ExtendWith(MockitoExtension.class)
class MeetingProcessorTest {

  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
  private static final String TRANSCRIPT =
      "Budget review. The budget is approved. Hiring starts next sprint.";

  @Mock private ObjectStoreClient objectStoreClient;
  @Mock private AudioConverter audioConverter;
  @Mock private TranscriptionEngine transcriptionEngine;
  @Mock private Summarizer summarizer;
  @Mock private AudioDurationProbe durationProbe;
  @Mock private MeetingRepository meetingRepository;

  @TempDir Path tempDir;

  private Path recording;
  private Path wav;
  private MeetingJob job;
  private MeetingProcessor processor;

  @BeforeEach
  void setUp() throws Exception {
    PipelineProperties properties =
        new PipelineProperties(tempDir.toString(), "ffmpeg", "ffprobe", 8);
    processor =
        new MeetingProcessor(
            new AudioSourceResolver(objectStoreClient, properties),
            audioConverter,
            transcriptionEngine,
            summarizer,
            new KeywordExtractor(),
            durationProbe,
            meetingRepository,
            properties);

    recording = Files.writeString(tempDir.resolve("standup.mp3"), "mp3");
    wav = Files.writeString(tempDir.resolve("standup.wav"), "wav");
    job = MeetingJob.create(77L, recording.toString(), "standup.mp3", 3, NOW);
    job.startProcessing(NOW);
  }

  @Test
  void process_shouldPersistAnalysisAndReturnSummaryOfResults() throws Exception {
    when(audioConverter.toWav16kMono(recording)).thenReturn(wav);
    when(transcriptionEngine.transcribe(wav)).thenReturn(new Transcript(TRANSCRIPT, "en"));
    when(summarizer.summarize(TRANSCRIPT)).thenReturn("- budget approved");
    when(durationProbe.durationSeconds(recording)).thenReturn(OptionalDouble.of(61.25));
    when(meetingRepository.saveAnalysis(eq(77L), any(MeetingAnalysis.class))).thenReturn(true);

    Map<String, Object> result = processor.process(job);

    assertThat(result)
        .containsExactly(
            Map.entry("transcript_length", TRANSCRIPT.length()),
            Map.entry("language", "en"),
            Map.entry("summary_length", "- budget approved".length()),
            Map.entry("keywords_count", 7),
            Map.entry("duration_seconds", 61.25));

    ArgumentCaptor<MeetingAnalysis> analysis = ArgumentCaptor.forClass(MeetingAnalysis.class);
    verify(meetingRepository).saveAnalysis(eq(77L), analysis.capture());
    assertThat(analysis.getValue().transcript()).isEqualTo(TRANSCRIPT);
    assertThat(analysis.getValue().summary()).isEqualTo("- budget approved");
    assertThat(analysis.getValue().keywords()).startsWith("budget");
    assertThat(analysis.getValue().durationSeconds()).isEqualTo(61.25);

    assertThat(wav).doesNotExist();
    assertThat(recording).exists();
  }

  @Test
  void process_shouldRecordAbsentDurationWhenProbeFails() throws Exception {
    when(audioConverter.toWav16kMono(recording)).thenReturn(wav);
    when(transcriptionEngine.transcribe(wav)).thenReturn(new Transcript("", null));
    when(summarizer.summarize("")).thenReturn("");
    when(durationProbe.durationSeconds(recording)).thenReturn(OptionalDouble.empty());
    when(meetingRepository.saveAnalysis(eq(77L), any(MeetingAnalysis.class))).thenReturn(true);

    Map<String, Object> result = processor.process(job);

    assertThat(result).containsEntry("duration_seconds", null).containsEntry("keywords_count", 0);
  }

  @Test
  void process_shouldFailWhenMeetingRowIsMissing() throws Exception {
    when(audioConverter.toWav16kMono(recording)).thenReturn(wav);
    when(transcriptionEngine.transcribe(wav)).thenReturn(new Transcript(TRANSCRIPT, "en"));
    when(summarizer.summarize(TRANSCRIPT)).thenReturn("summary");
    when(durationProbe.durationSeconds(recording)).thenReturn(OptionalDouble.of(1.0));
    when(meetingRepository.saveAnalysis(anyLong(), any(MeetingAnalysis.class))).thenReturn(false);

    assertThatThrownBy(() -> processor.process(job))
        .isInstanceOf(ProcessingException.class)
        .hasMessageContaining("Failed to update database record");
  }

  @Test
  void process_shouldCleanUpWavWhenTranscriptionFails() throws Exception {
    when(audioConverter.toWav16kMono(recording)).thenReturn(wav);
    when(transcriptionEngine.transcribe(wav)).thenThrow(new WhisperException("service down"));

    assertThatThrownBy(() -> processor.process(job)).isInstanceOf(WhisperException.class);

    assertThat(wav).doesNotExist();
    verify(summarizer, never()).summarize(any());
    verify(meetingRepository, never()).saveAnalysis(anyLong(), any());
  }

  @Test
  void process_shouldFailWhenRecordingIsMissing() throws Exception {
    Files.delete(recording);

    assertThatThrownBy(() -> processor.process(job))
        .isInstanceOf(ProcessingException.class)
        .hasMessageContaining("not found");
  }

  @Test
  void process_shouldPassEmptyKeywordListWhenTranscriptHasNoTerms() throws Exception {
    when(audioConverter.toWav16kMono(recording)).thenReturn(wav);
    when(transcriptionEngine.transcribe(wav)).thenReturn(new Transcript("ok so um", "en"));
    when(summarizer.summarize("ok so um")).thenReturn("nothing");
    when(durationProbe.durationSeconds(recording)).thenReturn(OptionalDouble.of(3.0));
    when(meetingRepository.saveAnalysis(eq(77L), any(MeetingAnalysis.class))).thenReturn(true);

    processor.process(job);

    ArgumentCaptor<MeetingAnalysis> analysis = ArgumentCaptor.forClass(MeetingAnalysis.class);
    verify(meetingRepository).saveAnalysis(eq(77L), analysis.capture());
    assertThat(analysis.getValue().keywords()).isEqualTo(List.of());
    assertThat(analysis.getValue().keywordsColumn()).isNull();
  }
}
