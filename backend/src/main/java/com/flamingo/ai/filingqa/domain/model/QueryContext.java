package com.flamingo.ai.filingqa.domain.model;

import com.flamingo.ai.filingqa.domain.enums.FilingType;
import com.flamingo.ai.filingqa.domain.enums.FinancialConcept;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import lombok.Builder;

/**
 * Entities extracted from a single query. Created per request and discarded afterwards.
 *
 * @param tickers recognised tickers, sorted
 * @param timePeriods years, quarters and relative time terms
 * @param filingTypes requested SEC forms
 * @param concepts financial topics
 * @param comparisonIntent comparison wording together with at least two tickers
 * @param comparisonLanguage comparison wording alone
 * @param originalQuery the raw query text
 */
@Builder
public record QueryContext(
    SortedSet<String> tickers,
    TimePeriods timePeriods,
    Set<FilingType> filingTypes,
    Set<FinancialConcept> concepts,
    boolean comparisonIntent,
    boolean comparisonLanguage,
    String originalQuery) {

  public QueryContext {
    tickers = tickers == null ? new TreeSet<>() : new TreeSet<>(tickers);
    timePeriods = timePeriods == null ? TimePeriods.none() : timePeriods;
    filingTypes = filingTypes == null ? Set.of() : Set.copyOf(filingTypes);
    concepts = concepts == null ? Set.of() : Set.copyOf(concepts);
    originalQuery = originalQuery == null ? "" : originalQuery;
  }

  /** Context for a blank or unparseable query. */
  public static QueryContext empty(String query) {
    return QueryContext.builder().originalQuery(query).build();
  }
}
