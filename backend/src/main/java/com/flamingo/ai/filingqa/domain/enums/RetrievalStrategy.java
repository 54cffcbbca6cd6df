package com.flamingo.ai.filingqa.domain.enums;

/** Retrieval strategies selected by the query router. */
public enum RetrievalStrategy {
  /** Metadata-constrained hybrid search for a single ticker. */
  FILTERED,

  /** Independent per-ticker searches with a per-ticker quota, concatenated. */
  MULTI_ENTITY_BALANCED,

  /** Year-scoped search ordered by score, then filing recency. */
  TEMPORAL,

  /** Unfiltered hybrid search across the whole corpus. */
  GENERAL_HYBRID
}
