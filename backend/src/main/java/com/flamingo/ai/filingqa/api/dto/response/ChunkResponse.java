package com.flamingo.ai.filingqa.api.dto.response;

import com.flamingo.ai.filingqa.domain.model.Chunk;
import com.flamingo.ai.filingqa.domain.model.ChunkMetadata;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a stored chunk. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResponse {

  private String id;
  private String text;
  private String ticker;
  private String companyName;
  private String sector;
  private String filingType;
  private LocalDate filingDate;
  private String sectionType;
  private double qualityScore;

  /** Creates a ChunkResponse from a stored chunk. */
  public static ChunkResponse fromChunk(Chunk chunk) {
    ChunkMetadata metadata = chunk.metadata();
    return ChunkResponse.builder()
        .id(chunk.id())
        .text(chunk.text())
        .ticker(metadata.ticker())
        .companyName(metadata.companyName())
        .sector(metadata.sector())
        .filingType(metadata.filingType().getCode())
        .filingDate(metadata.filingDate())
        .sectionType(metadata.sectionType())
        .qualityScore(metadata.qualityScore())
        .build();
  }
}
