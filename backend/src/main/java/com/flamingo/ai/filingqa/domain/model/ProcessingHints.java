package com.flamingo.ai.filingqa.domain.model;

import com.flamingo.ai.filingqa.domain.enums.QueryType;

/**
 * Downstream hints for the answer-generation layer.
 *
 * @param approach analysis style
 * @param synthesisMethod how retrieved passages should be combined
 * @param contextWindow scope of the context handed to the model
 */
public record ProcessingHints(String approach, String synthesisMethod, String contextWindow) {

  public static ProcessingHints forQueryType(QueryType queryType) {
    return switch (queryType) {
      case SINGLE_COMPANY ->
          new ProcessingHints("focused_analysis", "single_source", "company_specific");
      case MULTI_COMPANY ->
          new ProcessingHints("comparative_analysis", "cross_company", "multi_entity");
      case TEMPORAL_ANALYSIS ->
          new ProcessingHints("time_series_analysis", "temporal_synthesis", "chronological");
      case CROSS_SECTIONAL ->
          new ProcessingHints("thematic_analysis", "concept_aggregation", "industry_wide");
      case GENERAL_SEARCH -> new ProcessingHints("broad_search", "relevance_ranking", "general");
    };
  }
}
