package com.flamingo.ai.filingqa.service.embedding;

import com.flamingo.ai.filingqa.util.StopWords;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Domain-specific text normalization for the fallback embeddings.
 *
 * <p>Lowercases, keeps only word characters, whitespace and {@code . $ % -}, drops stop words and
 * tokens shorter than two characters. Single characters that carry financial meaning are kept.
 */
public final class FinancialTextNormalizer {

  private static final Pattern DISALLOWED = Pattern.compile("[^\\w\\s.$%-]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[.\\-]+|[.\\-]+$");

  private static final int MIN_TOKEN_LENGTH = 2;

  /** Short tokens kept despite the length rule. */
  static final Set<String> SHORT_TOKEN_ALLOW_LIST = Set.of("$", "%");

  /** Returns the normalized text, tokens separated by single spaces. */
  public String normalize(String text) {
    return String.join(" ", tokenize(text));
  }

  /**
   * Normalizes and splits text into tokens.
   *
   * @param text raw text, may be null
   * @return tokens in document order; empty for null or blank input
   */
  public List<String> tokenize(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    String cleaned = DISALLOWED.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
    List<String> tokens = new ArrayList<>();
    for (String raw : WHITESPACE.split(cleaned.trim())) {
      String token = raw.length() > 1 ? EDGE_PUNCTUATION.matcher(raw).replaceAll("") : raw;
      if (token.isEmpty() || StopWords.isStopWord(token)) {
        continue;
      }
      if (token.length() < MIN_TOKEN_LENGTH && !SHORT_TOKEN_ALLOW_LIST.contains(token)) {
        continue;
      }
      tokens.add(token);
    }
    return tokens;
  }
}
