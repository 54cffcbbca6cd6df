package com.flamingo.ai.filingqa.api.dto.response;

import com.flamingo.ai.filingqa.domain.model.ChunkMetadata;
import com.flamingo.ai.filingqa.domain.model.SearchResult;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one retrieved passage, carrying what a citation needs. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResultResponse {

  private String chunkId;
  private String text;
  private String ticker;
  private String companyName;
  private String filingType;
  private LocalDate filingDate;
  private String sectionType;
  private double combinedScore;
  private double semanticScore;
  private double keywordScore;

  /** Creates a SearchResultResponse from a search result. */
  public static SearchResultResponse fromResult(SearchResult result) {
    ChunkMetadata metadata = result.metadata();
    return SearchResultResponse.builder()
        .chunkId(result.chunkId())
        .text(result.text())
        .ticker(metadata.ticker())
        .companyName(metadata.companyName())
        .filingType(metadata.filingType().getCode())
        .filingDate(metadata.filingDate())
        .sectionType(metadata.sectionType())
        .combinedScore(result.combinedScore())
        .semanticScore(result.semanticScore())
        .keywordScore(result.keywordScore())
        .build();
  }
}
