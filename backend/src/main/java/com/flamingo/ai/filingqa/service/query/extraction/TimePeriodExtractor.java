package com.flamingo.ai.filingqa.service.query.extraction;

import com.flamingo.ai.filingqa.config.RagConfig;
import com.flamingo.ai.filingqa.domain.model.TimePeriods;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Extracts years, quarters and relative time terms. Years outside the configured bounds are
 * ignored; quarters are normalized to {@code Q1}..{@code Q4}.
 */
@Component
@RequiredArgsConstructor
public class TimePeriodExtractor {

  static final List<String> RELATIVE_TERMS =
      List.of(
          "recent",
          "latest",
          "current",
          "last year",
          "this year",
          "over time",
          "historical",
          "trend",
          "evolution");

  private static final Pattern YEAR = Pattern.compile("(?<!\\w)(\\d{4})(?!\\w)");
  private static final Pattern QUARTER_PREFIX =
      Pattern.compile("(?<!\\w)Q([1-4])(?!\\w)", Pattern.CASE_INSENSITIVE);
  private static final Pattern QUARTER_SUFFIX =
      Pattern.compile("(?<!\\w)([1-4])Q(?!\\w)", Pattern.CASE_INSENSITIVE);
  private static final Map<Pattern, String> QUARTER_WORDS = quarterWords();
  private static final Map<String, Pattern> RELATIVE_PATTERNS = relativePatterns();

  private final RagConfig ragConfig;

  public TimePeriods extract(String query) {
    if (query == null || query.isBlank()) {
      return TimePeriods.none();
    }
    return new TimePeriods(years(query), quarters(query), relativeTerms(query));
  }

  private Set<Integer> years(String query) {
    int min = ragConfig.getQuery().getMinYear();
    int max = ragConfig.getQuery().getMaxYear();
    Set<Integer> years = new TreeSet<>();
    Matcher matcher = YEAR.matcher(query);
    while (matcher.find()) {
      int year = Integer.parseInt(matcher.group(1));
      if (year >= min && year <= max) {
        years.add(year);
      }
    }
    return years;
  }

  private static Set<String> quarters(String query) {
    Set<String> quarters = new TreeSet<>();
    for (Pattern pattern : List.of(QUARTER_PREFIX, QUARTER_SUFFIX)) {
      Matcher matcher = pattern.matcher(query);
      while (matcher.find()) {
        quarters.add("Q" + matcher.group(1));
      }
    }
    QUARTER_WORDS.forEach(
        (pattern, quarter) -> {
          if (pattern.matcher(query).find()) {
            quarters.add(quarter);
          }
        });
    return quarters;
  }

  private static Set<String> relativeTerms(String query) {
    Set<String> terms = new LinkedHashSet<>();
    RELATIVE_PATTERNS.forEach(
        (term, pattern) -> {
          if (pattern.matcher(query).find()) {
            terms.add(term);
          }
        });
    return terms;
  }

  private static Map<Pattern, String> quarterWords() {
    Map<Pattern, String> words = new LinkedHashMap<>();
    words.put(Phrases.wholeWord("first quarter", true), "Q1");
    words.put(Phrases.wholeWord("second quarter", true), "Q2");
    words.put(Phrases.wholeWord("third quarter", true), "Q3");
    words.put(Phrases.wholeWord("fourth quarter", true), "Q4");
    return words;
  }

  private static Map<String, Pattern> relativePatterns() {
    Map<String, Pattern> patterns = new LinkedHashMap<>();
    RELATIVE_TERMS.forEach(term -> patterns.put(term, Phrases.wholeWord(term, true)));
    return patterns;
  }
}
