package com.flamingo.ai.filingqa.service.query.extraction;

import com.flamingo.ai.filingqa.domain.model.QueryContext;
import io.micrometer.core.annotation.Timed;
import java.util.SortedSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds a {@link QueryContext} by running the independent extractors over a query. Never throws
 * for query content: a blank query yields an empty context.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityExtractor {

  private final TickerExtractor tickerExtractor;
  private final TimePeriodExtractor timePeriodExtractor;
  private final FilingTypeExtractor filingTypeExtractor;
  private final FinancialConceptExtractor financialConceptExtractor;
  private final ComparisonIntentDetector comparisonIntentDetector;

  @Timed(value = "query.extract", description = "Time to extract entities from a query")
  public QueryContext extract(String query) {
    if (query == null || query.isBlank()) {
      return QueryContext.empty(query);
    }
    SortedSet<String> tickers = tickerExtractor.extract(query);
    QueryContext context =
        QueryContext.builder()
            .tickers(tickers)
            .timePeriods(timePeriodExtractor.extract(query))
            .filingTypes(filingTypeExtractor.extract(query))
            .concepts(financialConceptExtractor.extract(query))
            .comparisonLanguage(comparisonIntentDetector.hasComparisonLanguage(query))
            .comparisonIntent(comparisonIntentDetector.hasComparisonIntent(query, tickers.size()))
            .originalQuery(query)
            .build();
    log.debug(
        "Extracted tickers={} periods={} filingTypes={} concepts={} comparison={}",
        context.tickers(),
        context.timePeriods(),
        context.filingTypes(),
        context.concepts(),
        context.comparisonIntent());
    return context;
  }
}
