package com.flamingo.ai.filingqa.domain.model;

import com.flamingo.ai.filingqa.domain.enums.EmbeddingMethod;
import java.util.List;

/**
 * Per-batch ingestion report. Malformed records are counted in {@code skipped} and described in
 * {@code warnings}; they never fail the batch.
 */
public record IngestionSummary(
    int received, int accepted, int skipped, List<String> warnings, EmbeddingMethod activeMethod) {

  public IngestionSummary {
    warnings = List.copyOf(warnings);
  }
}
