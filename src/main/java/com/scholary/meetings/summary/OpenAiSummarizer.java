package com.scholary.meetings.summary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Summarizer backed by an OpenAI-compatible chat-completions endpoint.
 *
 * <p>Asks for bullet points with action items, key decisions and follow-up tasks.
 */
@Component
public class OpenAiSummarizer implements Summarizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiSummarizer.class);

  static final String SYSTEM_PROMPT = "You are a meeting assistant.";
  static final String PROMPT_PREFIX =
      "Summarize the following meeting transcript in bullet points, "
          + "highlight action items, key decisions, and follow-up tasks. "
          + "Use clear English. Transcript:\n";

  private final HttpClient httpClient;
  private final SummarizerProperties properties;
  private final ObjectMapper objectMapper;

  public OpenAiSummarizer(SummarizerProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.timeoutSeconds()))
            .build();

    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      LOGGER.warn("summarizer.apiKey not set - summary generation will fail");
    }
  }

  @Override
  public String summarize(String transcript) {
    if (transcript == null || transcript.isBlank()) {
      return "";
    }

    LOGGER.info("Generating summary with model {}", properties.model());

    try {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/chat/completions"))
              .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
              .header("Content-Type", "application/json")
              .header("Authorization", "Bearer " + nullToEmpty(properties.apiKey()))
              .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(transcript)))
              .build();

      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() != 200) {
        throw new IOException(
            String.format(
                "Summarizer returned status %d: %s", response.statusCode(), response.body()));
      }

      String summary = extractContent(response.body());
      LOGGER.info("Summary generated: {} chars", summary.length());
      return summary;

    } catch (IOException e) {
      LOGGER.error("Summary generation failed: {}", e.getMessage());
      return FAILED_SUMMARY;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.error("Summary generation interrupted");
      return FAILED_SUMMARY;
    }
  }

  String buildRequestBody(String transcript) throws IOException {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", properties.model());
    body.put("temperature", properties.temperature());
    body.put("max_tokens", properties.maxTokens());

    ArrayNode messages = body.putArray("messages");
    messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
    messages.addObject().put("role", "user").put("content", PROMPT_PREFIX + transcript);

    return objectMapper.writeValueAsString(body);
  }

  String extractContent(String responseBody) throws IOException {
    JsonNode content = objectMapper.readTree(responseBody).path("choices").path(0).path("message");
    return content.path("content").asText("");
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
