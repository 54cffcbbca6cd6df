package com.flamingo.ai.filingqa.service.store;

import com.flamingo.ai.filingqa.domain.enums.EmbeddingMethod;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;

/** Summary statistics of the stored corpus. */
@Builder
public record StoreStats(
    int totalChunks,
    List<String> tickers,
    List<String> filingTypes,
    List<String> sectors,
    LocalDate earliestFilingDate,
    LocalDate latestFilingDate,
    EmbeddingMethod activeMethod,
    long embeddingsAvailable,
    double averageWordsPerChunk) {}
