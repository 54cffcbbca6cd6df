package com.flamingo.ai.filingqa.domain.model;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * A scored chunk returned by the vector store.
 *
 * <p>The natural ranking is descending combined score, with ties broken by the more recent filing
 * date and then by chunk id so the order is total.
 */
public record SearchResult(
    String chunkId,
    String text,
    ChunkMetadata metadata,
    double combinedScore,
    double semanticScore,
    double keywordScore) {

  public static final Comparator<SearchResult> RANKING =
      Comparator.comparingDouble(SearchResult::combinedScore)
          .reversed()
          .thenComparing(SearchResult::filingDate, Comparator.reverseOrder())
          .thenComparing(SearchResult::chunkId);

  /** Filing date of the underlying chunk, {@link LocalDate#MIN} when unknown. */
  public LocalDate filingDate() {
    return metadata == null || metadata.filingDate() == null
        ? LocalDate.MIN
        : metadata.filingDate();
  }
}
