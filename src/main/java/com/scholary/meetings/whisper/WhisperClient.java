package com.scholary.meetings.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the faster-whisper transcription API.
 *
 * <p>Sends the whole meeting recording as multipart/form-data and retries transient failures with
 * exponential backoff. Decoding is done server side with beam size 5 and VAD filtering.
 *
 * <p>These in-call retries are separate from job-level retries: when this client gives up, the job
 * attempt fails and the queue decides whether to run it again.
 */
@Component
public class WhisperClient implements TranscriptionEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized Whisper client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public Transcript transcribe(Path audioFile) {
    LOGGER.info("Starting transcription of {}", audioFile);

    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        WhisperResponse response = attemptTranscribe(audioFile);
        Transcript transcript = new Transcript(response.fullText(), response.language());
        LOGGER.info(
            "Transcription completed. Language: {}, Length: {} chars",
            transcript.language(),
            transcript.text().length());
        return transcript;
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          // Exponential backoff with jitter
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "Transcription attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          sleep(backoffMs);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new WhisperException("Transcription interrupted", e);
      }
    }

    throw new WhisperException(
        String.format("Transcription failed after %d attempts", properties.maxRetries()),
        lastException);
  }

  private WhisperResponse attemptTranscribe(Path audioFile)
      throws IOException, InterruptedException {
    String boundary = UUID.randomUUID().toString();

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/transcribe"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(buildMultipartBody(audioFile, boundary))
            .build();

    LOGGER.debug("Sending transcription request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "Whisper API returned status %d: %s", response.statusCode(), response.body()));
    }

    return objectMapper.readValue(response.body(), WhisperResponse.class);
  }

  /**
   * Build the multipart body: the audio file part followed by the decoding options.
   *
   * <p>Java's HttpClient has no multipart support, so the parts are written by hand.
   */
  private BodyPublisher buildMultipartBody(Path audioFile, String boundary) throws IOException {
    ByteArrayOutputStream body = new ByteArrayOutputStream();

    String filePart =
        "--"
            + boundary
            + "\r\n"
            + "Content-Disposition: form-data; name=\"file\"; filename=\""
            + audioFile.getFileName()
            + "\"\r\n"
            + "Content-Type: audio/wav\r\n\r\n";
    body.write(filePart.getBytes(StandardCharsets.UTF_8));
    body.write(Files.readAllBytes(audioFile));
    body.write("\r\n".getBytes(StandardCharsets.UTF_8));

    writeField(body, boundary, "beam_size", "5");
    writeField(body, boundary, "vad_filter", "true");

    body.write(("--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
    return BodyPublishers.ofByteArray(body.toByteArray());
  }

  private static void writeField(
      ByteArrayOutputStream body, String boundary, String name, String value) throws IOException {
    String part =
        "--"
            + boundary
            + "\r\n"
            + "Content-Disposition: form-data; name=\""
            + name
            + "\"\r\n\r\n"
            + value
            + "\r\n";
    body.write(part.getBytes(StandardCharsets.UTF_8));
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new WhisperException("Transcription interrupted", ie);
    }
  }
}
