package com.flamingo.ai.filingqa.service.query;

import com.flamingo.ai.filingqa.domain.enums.QueryComplexity;
import com.flamingo.ai.filingqa.domain.enums.QueryType;
import com.flamingo.ai.filingqa.domain.enums.RetrievalStrategy;
import com.flamingo.ai.filingqa.domain.model.EmbeddingVector;
import com.flamingo.ai.filingqa.domain.model.ProcessingHints;
import com.flamingo.ai.filingqa.domain.model.QueryContext;
import com.flamingo.ai.filingqa.domain.model.RoutedQuery;
import com.flamingo.ai.filingqa.domain.model.RoutingDecision;
import com.flamingo.ai.filingqa.domain.model.SearchOutcome;
import com.flamingo.ai.filingqa.service.embedding.EmbeddingGenerator;
import com.flamingo.ai.filingqa.service.query.extraction.EntityExtractor;
import com.flamingo.ai.filingqa.service.retrieval.RetrievalEngine;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Classifies a query from its extracted entities and picks the retrieval strategy.
 *
 * <p>Rules are evaluated in order and the first match wins:
 *
 * <ol>
 *   <li>two or more tickers, or comparison intent: multi-entity balanced retrieval
 *   <li>one ticker with a time period: temporal retrieval scoped to the ticker
 *   <li>one ticker: filtered retrieval
 *   <li>no ticker but financial concepts: concept-weighted general retrieval
 *   <li>anything else: general hybrid retrieval
 * </ol>
 *
 * <p>The router trusts the extractor's output and does not re-validate entities.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryRouter {

  private final EntityExtractor entityExtractor;
  private final RetrievalEngine retrievalEngine;
  private final EmbeddingGenerator embeddingGenerator;
  private final MeterRegistry meterRegistry;

  /** Extracts entities from a query and decides how to retrieve for it. */
  public RoutingDecision route(String query) {
    return decide(entityExtractor.extract(query));
  }

  /** Routing decision for an already extracted context. */
  public RoutingDecision decide(QueryContext context) {
    QueryType queryType = classify(context);
    RetrievalStrategy strategy = strategyFor(queryType);
    QueryComplexity complexity = QueryComplexity.fromScore(complexityScore(context));
    meterRegistry.counter("query.routed", "type", queryType.name()).increment();
    log.debug("Routed query as {} -> {} (complexity {})", queryType, strategy, complexity);
    return new RoutingDecision(
        context, queryType, strategy, ProcessingHints.forQueryType(queryType), complexity);
  }

  /**
   * Routes a query, embeds it and retrieves passages with the chosen strategy. Query content never
   * causes an exception; problems show up in the outcome's status.
   */
  public RoutedQuery routeAndRetrieve(String query) {
    return routeAndRetrieve(query, null);
  }

  /**
   * Routes a query and retrieves passages.
   *
   * @param topK budget override, null for the strategy default
   */
  @Timed(value = "query.route_and_retrieve", description = "Time to route and retrieve a query")
  public RoutedQuery routeAndRetrieve(String query, Integer topK) {
    RoutingDecision decision = route(query);
    SearchOutcome outcome;
    if (!retrievalEngine.hasData()) {
      // Checked before embedding: the first store access also restores a persisted fallback fit.
      outcome = SearchOutcome.noData();
    } else {
      EmbeddingVector queryVector = embeddingGenerator.embedOne(query);
      outcome =
          retrievalEngine.retrieve(
              queryVector, query, decision.context(), decision.strategy(), topK);
    }
    log.info(
        "Query type={} strategy={} status={} results={}",
        decision.queryType(),
        decision.strategy(),
        outcome.status(),
        outcome.results().size());
    return new RoutedQuery(decision, outcome);
  }

  static QueryType classify(QueryContext context) {
    int tickers = context.tickers().size();
    if (tickers >= 2 || context.comparisonIntent()) {
      return QueryType.MULTI_COMPANY;
    }
    if (tickers == 1 && context.timePeriods().isPresent()) {
      return QueryType.TEMPORAL_ANALYSIS;
    }
    if (tickers == 1) {
      return QueryType.SINGLE_COMPANY;
    }
    if (!context.concepts().isEmpty()) {
      return QueryType.CROSS_SECTIONAL;
    }
    return QueryType.GENERAL_SEARCH;
  }

  static RetrievalStrategy strategyFor(QueryType queryType) {
    return switch (queryType) {
      case MULTI_COMPANY -> RetrievalStrategy.MULTI_ENTITY_BALANCED;
      case TEMPORAL_ANALYSIS -> RetrievalStrategy.TEMPORAL;
      case SINGLE_COMPANY -> RetrievalStrategy.FILTERED;
      case CROSS_SECTIONAL, GENERAL_SEARCH -> RetrievalStrategy.GENERAL_HYBRID;
    };
  }

  /** 2 per ticker, 1 per year, filing type and concept, 3 for comparison wording. */
  static int complexityScore(QueryContext context) {
    return 2 * context.tickers().size()
        + context.timePeriods().years().size()
        + context.filingTypes().size()
        + (context.comparisonLanguage() ? 3 : 0)
        + context.concepts().size();
  }
}
