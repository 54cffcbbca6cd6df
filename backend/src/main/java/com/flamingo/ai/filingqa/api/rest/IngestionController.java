package com.flamingo.ai.filingqa.api.rest;

import com.flamingo.ai.filingqa.api.dto.request.IngestChunksRequest;
import com.flamingo.ai.filingqa.domain.model.IngestionSummary;
import com.flamingo.ai.filingqa.service.ingestion.IngestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for loading processed filing chunks. */
@RestController
@RequestMapping("/api/ingest")
@RequiredArgsConstructor
public class IngestionController {

  private final IngestionService ingestionService;

  /** Embeds and stores a batch of chunks. Malformed records are skipped and reported. */
  @PostMapping("/chunks")
  public ResponseEntity<IngestionSummary> ingestChunks(
      @Valid @RequestBody IngestChunksRequest request) {
    return ResponseEntity.ok(ingestionService.ingest(request.getChunks()));
  }
}
