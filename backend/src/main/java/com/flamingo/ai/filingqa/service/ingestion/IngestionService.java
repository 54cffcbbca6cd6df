package com.flamingo.ai.filingqa.service.ingestion;

import com.flamingo.ai.filingqa.api.dto.request.ChunkIngestRequest;
import com.flamingo.ai.filingqa.domain.model.IngestionSummary;
import java.util.List;

/** Service interface for loading processed filing chunks into the vector store. */
public interface IngestionService {

  /**
   * Validates, embeds and stores a batch of chunks, then persists the store. Malformed records are
   * skipped and reported in the summary.
   *
   * @param records chunk records from the document processor
   * @return per-batch report
   */
  IngestionSummary ingest(List<ChunkIngestRequest> records);
}
