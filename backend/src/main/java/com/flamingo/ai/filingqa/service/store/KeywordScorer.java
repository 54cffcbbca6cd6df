package com.flamingo.ai.filingqa.service.store;

import com.flamingo.ai.filingqa.util.StopWords;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token-overlap keyword scoring between a query and chunk text.
 *
 * <p>Each query keyword scores 1.0 on an exact token hit, 0.5 on a partial hit (a chunk token
 * starting with the keyword, or the keyword occurring inside the text), and 0 otherwise. The
 * chunk score is the mean over keywords, so it lies in [0,1].
 */
public final class KeywordScorer {

  private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}][\\p{L}\\p{N}&'-]*");
  private static final int MIN_KEYWORD_LENGTH = 3;
  private static final double PARTIAL_MATCH = 0.5;

  /**
   * Extracts meaningful query keywords: lowercase words longer than two characters that are not
   * stop words, deduplicated in order.
   */
  public List<String> extractKeywords(String query) {
    if (query == null || query.isBlank()) {
      return List.of();
    }
    Set<String> keywords = new LinkedHashSet<>();
    for (String token : tokenize(query)) {
      if (token.length() >= MIN_KEYWORD_LENGTH && !StopWords.isStopWord(token)) {
        keywords.add(token);
      }
    }
    return new ArrayList<>(keywords);
  }

  /** Lowercase word tokens of a text, possessive suffixes removed. */
  public Set<String> tokenize(String text) {
    Set<String> tokens = new LinkedHashSet<>();
    if (text == null) {
      return tokens;
    }
    Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      String token = matcher.group();
      if (token.endsWith("'s")) {
        token = token.substring(0, token.length() - 2);
      }
      token = token.replaceAll("['-]+$", "");
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  /**
   * Scores pre-tokenized chunk text against query keywords.
   *
   * @param keywords output of {@link #extractKeywords(String)}
   * @param chunkTokens output of {@link #tokenize(String)} for the chunk
   * @param lowerCaseText the chunk text in lower case, for substring hits
   * @return score in [0,1]; 0 when there are no keywords
   */
  public double score(List<String> keywords, Set<String> chunkTokens, String lowerCaseText) {
    if (keywords.isEmpty()) {
      return 0.0;
    }
    double total = 0.0;
    for (String keyword : keywords) {
      if (chunkTokens.contains(keyword)) {
        total += 1.0;
      } else if (isPartialMatch(keyword, chunkTokens, lowerCaseText)) {
        total += PARTIAL_MATCH;
      }
    }
    return total / keywords.size();
  }

  private boolean isPartialMatch(String keyword, Set<String> chunkTokens, String lowerCaseText) {
    if (lowerCaseText.contains(keyword)) {
      return true;
    }
    for (String token : chunkTokens) {
      if (token.startsWith(keyword)) {
        return true;
      }
    }
    return false;
  }
}
