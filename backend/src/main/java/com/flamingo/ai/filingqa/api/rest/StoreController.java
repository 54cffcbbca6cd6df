package com.flamingo.ai.filingqa.api.rest;

import com.flamingo.ai.filingqa.api.dto.response.ChunkResponse;
import com.flamingo.ai.filingqa.api.dto.response.SearchResultResponse;
import com.flamingo.ai.filingqa.exception.ChunkNotFoundException;
import com.flamingo.ai.filingqa.service.store.StoreStats;
import com.flamingo.ai.filingqa.service.store.VectorStore;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for inspecting and resetting the vector store. */
@RestController
@RequestMapping("/api/store")
@RequiredArgsConstructor
@Slf4j
public class StoreController {

  private static final int MAX_SIMILAR = 50;

  private final VectorStore vectorStore;

  /** Returns collection statistics. */
  @GetMapping("/stats")
  public ResponseEntity<StoreStats> stats() {
    return ResponseEntity.ok(vectorStore.stats());
  }

  /** Gets a stored chunk by ID. */
  @GetMapping("/chunks/{chunkId}")
  public ResponseEntity<ChunkResponse> getChunk(@PathVariable String chunkId) {
    return vectorStore
        .getChunk(chunkId)
        .map(ChunkResponse::fromChunk)
        .map(ResponseEntity::ok)
        .orElseThrow(() -> new ChunkNotFoundException(chunkId));
  }

  /** Gets the chunks closest to a stored chunk. */
  @GetMapping("/chunks/{chunkId}/similar")
  public ResponseEntity<List<SearchResultResponse>> getSimilar(
      @PathVariable String chunkId, @RequestParam(defaultValue = "5") int limit) {
    if (vectorStore.getChunk(chunkId).isEmpty()) {
      throw new ChunkNotFoundException(chunkId);
    }
    int bounded = Math.max(1, Math.min(limit, MAX_SIMILAR));
    List<SearchResultResponse> similar =
        vectorStore.findSimilar(chunkId, bounded).stream()
            .map(SearchResultResponse::fromResult)
            .toList();
    return ResponseEntity.ok(similar);
  }

  /** Drops every stored chunk and deletes the snapshot. */
  @DeleteMapping
  public ResponseEntity<Void> reset() {
    log.info("Resetting vector store");
    vectorStore.clear();
    return ResponseEntity.noContent().build();
  }
}
