package com.flamingo.ai.filingqa.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One chunk record produced by the document processor.
 *
 * <p>Fields are bound leniently as strings; the ingestion service validates each record and skips
 * malformed ones with a warning instead of rejecting the whole batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkIngestRequest {

  private String id;
  private String text;
  private String ticker;

  /** SEC form code, e.g. "10-K" or "DEF 14A". */
  private String filingType;

  /** ISO date, e.g. "2023-10-27". */
  private String filingDate;

  private String sectionType;

  /** Processor-assigned quality in [0,1]; defaults to 1.0 when absent. */
  private Double qualityScore;

  private String companyName;
  private String sector;
}
