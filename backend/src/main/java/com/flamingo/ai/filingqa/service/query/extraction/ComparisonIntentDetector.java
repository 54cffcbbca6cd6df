package com.flamingo.ai.filingqa.service.query.extraction;

import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Detects comparison wording. Wording alone is reported as comparison language; it only counts as
 * comparison intent when the query names at least two companies.
 */
@Component
public class ComparisonIntentDetector {

  static final List<String> LEXICON =
      List.of(
          "compare",
          "compared",
          "comparing",
          "comparison",
          "versus",
          "vs",
          "against",
          "difference",
          "differences",
          "similar",
          "contrast",
          "between",
          "relative to");

  private static final List<Pattern> PATTERNS =
      LEXICON.stream().map(word -> Phrases.wholeWord(word, true)).toList();

  public boolean hasComparisonLanguage(String query) {
    if (query == null || query.isBlank()) {
      return false;
    }
    return PATTERNS.stream().anyMatch(pattern -> pattern.matcher(query).find());
  }

  /**
   * Comparison intent: comparison wording together with at least two distinct tickers.
   *
   * @param query raw query
   * @param tickerCount number of distinct tickers extracted from the query
   */
  public boolean hasComparisonIntent(String query, int tickerCount) {
    return tickerCount >= 2 && hasComparisonLanguage(query);
  }
}
