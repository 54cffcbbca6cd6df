package com.flamingo.ai.filingqa.service.retrieval;

import com.flamingo.ai.filingqa.config.RagConfig;
import com.flamingo.ai.filingqa.domain.enums.FilingType;
import com.flamingo.ai.filingqa.domain.enums.RetrievalStrategy;
import com.flamingo.ai.filingqa.domain.enums.SearchStatus;
import com.flamingo.ai.filingqa.domain.model.ChunkMetadata;
import com.flamingo.ai.filingqa.domain.model.DateRange;
import com.flamingo.ai.filingqa.domain.model.EmbeddingVector;
import com.flamingo.ai.filingqa.domain.model.QueryContext;
import com.flamingo.ai.filingqa.domain.model.SearchOutcome;
import com.flamingo.ai.filingqa.domain.model.SearchResult;
import com.flamingo.ai.filingqa.domain.model.TimePeriods;
import com.flamingo.ai.filingqa.exception.IngestionStateException;
import com.flamingo.ai.filingqa.service.store.VectorStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Executes a retrieval strategy against the vector store.
 *
 * <p>Strategies that run several sub-searches aggregate their statuses: any degraded sub-search
 * degrades the outcome, an empty corpus yields {@link SearchStatus#NO_DATA}, and an empty merged
 * result yields {@link SearchStatus#NO_MATCHES}. Unexpected failures are logged and reported as
 * an empty {@link SearchStatus#DEGRADED} outcome; corpus state errors propagate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalEngine {

  private static final Map<String, String> QUARTER_WORDS =
      Map.of(
          "Q1", "FIRST QUARTER",
          "Q2", "SECOND QUARTER",
          "Q3", "THIRD QUARTER",
          "Q4", "FOURTH QUARTER");

  private final VectorStore vectorStore;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Retrieves passages with the strategy's default budget.
   *
   * @param queryVector embedding of the query
   * @param queryText raw query text, used for keyword scoring
   * @param context extracted entities
   * @param strategy strategy chosen by the router
   */
  public SearchOutcome retrieve(
      EmbeddingVector queryVector,
      String queryText,
      QueryContext context,
      RetrievalStrategy strategy) {
    return retrieve(queryVector, queryText, context, strategy, null);
  }

  /**
   * Retrieves passages.
   *
   * @param topK budget override; null uses the strategy's configured budget. For the
   *     multi-entity strategy this is the total budget shared across tickers.
   */
  @Timed(value = "retrieval.retrieve", description = "Time to run a retrieval strategy")
  public SearchOutcome retrieve(
      EmbeddingVector queryVector,
      String queryText,
      QueryContext context,
      RetrievalStrategy strategy,
      Integer topK) {
    log.debug("Retrieving with strategy {} for tickers {}", strategy, context.tickers());
    meterRegistry.counter("retrieval.requests", "strategy", strategy.name()).increment();
    try {
      return switch (strategy) {
        case FILTERED -> filtered(queryVector, queryText, context, topK);
        case MULTI_ENTITY_BALANCED -> multiEntity(queryVector, queryText, context, topK);
        case TEMPORAL -> temporal(queryVector, queryText, context, topK);
        case GENERAL_HYBRID -> general(queryVector, queryText, context, topK);
      };
    } catch (IngestionStateException e) {
      throw e;
    } catch (RuntimeException e) {
      meterRegistry.counter("retrieval.errors", "strategy", strategy.name()).increment();
      log.error("Retrieval failed for strategy {}: {}", strategy, e.getMessage(), e);
      return SearchOutcome.failed();
    }
  }

  /** Whether the corpus holds any chunks. Triggers the lazy store load. */
  public boolean hasData() {
    return !vectorStore.isEmpty();
  }

  /**
   * Searches one company's filings, optionally restricted to a form type and a filing-date range.
   *
   * @param ticker required ticker
   * @param filingType optional form type
   * @param dateRange optional inclusive filing-date range, applied after scoring
   * @param limit maximum number of results
   */
  public SearchOutcome searchWithFilters(
      EmbeddingVector queryVector,
      String queryText,
      String ticker,
      FilingType filingType,
      DateRange dateRange,
      int limit) {
    Map<String, String> filters = new LinkedHashMap<>();
    filters.put(ChunkMetadata.FIELD_TICKER, ticker);
    if (filingType != null) {
      filters.put(ChunkMetadata.FIELD_FILING_TYPE, filingType.getCode());
    }
    if (dateRange == null) {
      return vectorStore.search(queryVector, queryText, filters, limit);
    }
    return postFiltered(
        queryVector, queryText, filters, limit, result -> dateRange.contains(result.filingDate()));
  }

  /**
   * Searches for passages from particular document sections, such as "risk factors" or "legal
   * proceedings".
   *
   * <p>The section keywords are added to the keyword-scoring text, and a hit is kept only when its
   * text or its section type mentions one of them. Without keywords this is a plain unfiltered
   * search.
   */
  public SearchOutcome searchBySection(
      EmbeddingVector queryVector, String queryText, List<String> sectionKeywords, int limit) {
    List<String> keywords =
        sectionKeywords == null
            ? List.of()
            : sectionKeywords.stream()
                .filter(keyword -> keyword != null && !keyword.isBlank())
                .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
                .toList();
    if (keywords.isEmpty()) {
      return vectorStore.search(queryVector, queryText, Map.of(), limit);
    }
    String enhanced = (queryText == null ? "" : queryText) + " " + String.join(" ", keywords);
    return postFiltered(
        queryVector, enhanced, Map.of(), limit, result -> mentionsSection(result, keywords));
  }

  private SearchOutcome filtered(
      EmbeddingVector queryVector, String queryText, QueryContext context, Integer topK) {
    int limit = budget(topK, ragConfig.getRetrieval().getFilteredTopK());
    Map<String, String> filters = new LinkedHashMap<>();
    if (!context.tickers().isEmpty()) {
      filters.put(ChunkMetadata.FIELD_TICKER, context.tickers().first());
    }
    addFilingType(filters, context);
    return periodScoped(queryVector, queryText, filters, context.timePeriods(), limit);
  }

  private SearchOutcome multiEntity(
      EmbeddingVector queryVector, String queryText, QueryContext context, Integer topK) {
    if (context.tickers().isEmpty()) {
      log.debug("Multi-entity strategy without tickers, using general hybrid search");
      return general(queryVector, queryText, context, topK);
    }
    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    int budget = budget(topK, retrieval.getMultiEntityBudget());
    int quota = Math.max(retrieval.getMinPerEntity(), budget / context.tickers().size());

    List<SearchOutcome> outcomes = new ArrayList<>();
    List<SearchResult> merged = new ArrayList<>();
    for (String ticker : context.tickers()) {
      Map<String, String> filters = new LinkedHashMap<>();
      filters.put(ChunkMetadata.FIELD_TICKER, ticker);
      addFilingType(filters, context);
      SearchOutcome outcome = vectorStore.search(queryVector, queryText, filters, quota);
      log.debug(
          "Ticker {} contributed {} results ({})",
          ticker,
          outcome.results().size(),
          outcome.status());
      outcomes.add(outcome);
      merged.addAll(outcome.results());
    }
    return aggregate(outcomes, merged);
  }

  private SearchOutcome temporal(
      EmbeddingVector queryVector, String queryText, QueryContext context, Integer topK) {
    int limit = budget(topK, ragConfig.getRetrieval().getTemporalTopK());
    Map<String, String> filters = new LinkedHashMap<>();
    if (context.tickers().size() == 1) {
      filters.put(ChunkMetadata.FIELD_TICKER, context.tickers().first());
    }
    return periodScoped(queryVector, queryText, filters, context.timePeriods(), limit);
  }

  private SearchOutcome general(
      EmbeddingVector queryVector, String queryText, QueryContext context, Integer topK) {
    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    if (context.concepts().isEmpty()) {
      return vectorStore.search(
          queryVector, queryText, Map.of(), budget(topK, retrieval.getGeneralTopK()));
    }
    return vectorStore.search(
        queryVector,
        queryText,
        Map.of(),
        budget(topK, retrieval.getConceptTopK()),
        retrieval.getConceptKeywordBoost());
  }

  /**
   * Runs one search per requested year on the {@code filing_year} index, or a single search when
   * no year was given, and merges the hits by rank. When quarters were requested, 10-Q hits must
   * mention one of them; the pool is over-fetched to make up for the dropped hits.
   */
  private SearchOutcome periodScoped(
      EmbeddingVector queryVector,
      String queryText,
      Map<String, String> baseFilters,
      TimePeriods periods,
      int limit) {
    Set<String> quarters = periods.quarters();
    int fetch =
        quarters.isEmpty() ? limit : limit * ragConfig.getRetrieval().getCandidatesMultiplier();

    List<Map<String, String>> scopes = new ArrayList<>();
    if (periods.years().isEmpty()) {
      scopes.add(baseFilters);
    }
    for (Integer year : new TreeSet<>(periods.years())) {
      Map<String, String> filters = new LinkedHashMap<>(baseFilters);
      filters.put(ChunkMetadata.FIELD_FILING_YEAR, String.valueOf(year));
      scopes.add(filters);
    }

    List<SearchOutcome> outcomes = new ArrayList<>();
    Map<String, SearchResult> merged = new LinkedHashMap<>();
    for (Map<String, String> filters : scopes) {
      SearchOutcome outcome = vectorStore.search(queryVector, queryText, filters, fetch);
      outcomes.add(outcome);
      outcome.results().forEach(result -> merged.putIfAbsent(result.chunkId(), result));
    }
    List<SearchResult> ranked =
        merged.values().stream()
            .filter(result -> matchesQuarter(result, quarters))
            .sorted(SearchResult.RANKING)
            .limit(limit)
            .toList();
    return aggregate(outcomes, ranked);
  }

  /** Non-10-Q hits always match; a 10-Q hit must name the quarter, as "Q2" or "second quarter". */
  static boolean matchesQuarter(SearchResult result, Set<String> quarters) {
    if (quarters.isEmpty()
        || result.metadata() == null
        || result.metadata().filingType() != FilingType.FORM_10Q) {
      return true;
    }
    String text = result.text() == null ? "" : result.text().toUpperCase(Locale.ROOT);
    return quarters.stream()
        .anyMatch(
            quarter ->
                text.contains(quarter)
                    || text.contains(QUARTER_WORDS.getOrDefault(quarter, quarter)));
  }

  static boolean mentionsSection(SearchResult result, List<String> keywords) {
    String text = result.text() == null ? "" : result.text().toLowerCase(Locale.ROOT);
    String section =
        result.metadata() == null || result.metadata().sectionType() == null
            ? ""
            : result.metadata().sectionType().toLowerCase(Locale.ROOT).replace('_', ' ');
    return keywords.stream()
        .anyMatch(keyword -> text.contains(keyword) || section.contains(keyword));
  }

  /** Adds the first extracted filing type, in form order, as an exact filter. */
  private static void addFilingType(Map<String, String> filters, QueryContext context) {
    context.filingTypes().stream()
        .min(Comparator.naturalOrder())
        .ifPresent(type -> filters.put(ChunkMetadata.FIELD_FILING_TYPE, type.getCode()));
  }

  private SearchOutcome postFiltered(
      EmbeddingVector queryVector,
      String queryText,
      Map<String, String> filters,
      int limit,
      Predicate<SearchResult> keep) {
    int candidates = limit * ragConfig.getRetrieval().getCandidatesMultiplier();
    SearchOutcome outcome = vectorStore.search(queryVector, queryText, filters, candidates);
    if (outcome.status() == SearchStatus.NO_DATA) {
      return outcome;
    }
    List<SearchResult> kept = outcome.results().stream().filter(keep).limit(limit).toList();
    return aggregate(List.of(outcome), kept);
  }

  private static SearchOutcome aggregate(List<SearchOutcome> outcomes, List<SearchResult> merged) {
    if (!outcomes.isEmpty()
        && outcomes.stream().allMatch(outcome -> outcome.status() == SearchStatus.NO_DATA)) {
      return SearchOutcome.noData();
    }
    boolean degraded =
        outcomes.stream().anyMatch(outcome -> outcome.status() == SearchStatus.DEGRADED);
    return SearchOutcome.of(merged, degraded);
  }

  private static int budget(Integer override, int configured) {
    return override != null && override > 0 ? override : configured;
  }
}
