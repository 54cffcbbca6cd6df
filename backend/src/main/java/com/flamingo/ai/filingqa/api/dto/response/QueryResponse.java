package com.flamingo.ai.filingqa.api.dto.response;

import com.flamingo.ai.filingqa.domain.enums.FilingType;
import com.flamingo.ai.filingqa.domain.enums.FinancialConcept;
import com.flamingo.ai.filingqa.domain.enums.QueryComplexity;
import com.flamingo.ai.filingqa.domain.enums.QueryType;
import com.flamingo.ai.filingqa.domain.enums.RetrievalStrategy;
import com.flamingo.ai.filingqa.domain.enums.SearchStatus;
import com.flamingo.ai.filingqa.domain.model.ProcessingHints;
import com.flamingo.ai.filingqa.domain.model.QueryContext;
import com.flamingo.ai.filingqa.domain.model.RoutedQuery;
import com.flamingo.ai.filingqa.domain.model.RoutingDecision;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a routed and retrieved query. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

  private String query;
  private QueryType queryType;
  private RetrievalStrategy strategy;
  private SearchStatus status;
  private Entities entities;
  private ProcessingHints processingHints;
  private QueryComplexity complexity;
  private List<SearchResultResponse> results;

  /** Entities extracted from the query. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Entities {
    private List<String> tickers;
    private Set<Integer> years;
    private Set<String> quarters;
    private Set<String> relativeTerms;
    private List<FilingType> filingTypes;
    private List<FinancialConcept> concepts;
    private boolean comparisonIntent;

    static Entities fromContext(QueryContext context) {
      return Entities.builder()
          .tickers(List.copyOf(context.tickers()))
          .years(new TreeSet<>(context.timePeriods().years()))
          .quarters(new TreeSet<>(context.timePeriods().quarters()))
          .relativeTerms(new TreeSet<>(context.timePeriods().relativeTerms()))
          .filingTypes(context.filingTypes().stream().sorted().toList())
          .concepts(context.concepts().stream().sorted().toList())
          .comparisonIntent(context.comparisonIntent())
          .build();
    }
  }

  /** Creates a QueryResponse from a routed query. */
  public static QueryResponse fromRoutedQuery(RoutedQuery routed) {
    RoutingDecision decision = routed.decision();
    return QueryResponse.builder()
        .query(decision.context().originalQuery())
        .queryType(decision.queryType())
        .strategy(decision.strategy())
        .status(routed.outcome().status())
        .entities(Entities.fromContext(decision.context()))
        .processingHints(decision.processingHints())
        .complexity(decision.complexity())
        .results(routed.outcome().results().stream().map(SearchResultResponse::fromResult).toList())
        .build();
  }
}
