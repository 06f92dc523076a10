package com.scholary.meetings.pipeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Frequency-based keyword extraction for meeting transcripts.
 *
 * <p>Tokens are words of three or more letters (hyphens allowed after the first letter), lower
 * cased, with common English stop words removed. Keywords are ordered by frequency; ties keep the
 * order in which the words first appear.
 */
@Component
public class KeywordExtractor {

  private static final Pattern TOKEN = Pattern.compile("[a-z][a-z\\-]{2,}");

  private static final Set<String> STOPWORDS =
      Set.of(
          "the", "a", "an", "and", "or", "but", "if", "then", "else", "for", "on", "in", "of",
          "to", "is", "am", "are", "was", "were", "be", "been", "with", "by", "as", "at", "that",
          "this", "it", "its", "from", "we", "you", "i", "they", "he", "she", "them", "our",
          "your", "their", "not", "no", "yes", "do", "did", "done", "can", "could", "should");

  /**
   * Extract the most frequent terms.
   *
   * @param text the transcript, may be null
   * @param topK maximum number of keywords
   * @return up to {@code topK} keywords, most frequent first
   */
  public List<String> extract(String text, int topK) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }

    Map<String, Integer> frequencies = new LinkedHashMap<>();
    Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      String token = matcher.group();
      if (!STOPWORDS.contains(token)) {
        frequencies.merge(token, 1, Integer::sum);
      }
    }

    // Stable sort, so equal counts stay in first-appearance order.
    return frequencies.entrySet().stream()
        .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
        .limit(topK)
        .map(Map.Entry::getKey)
        .collect(Collectors.toList());
  }
}
