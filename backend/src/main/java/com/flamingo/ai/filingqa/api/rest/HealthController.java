package com.flamingo.ai.filingqa.api.rest;

import com.flamingo.ai.filingqa.service.embedding.EmbeddingGenerator;
import com.flamingo.ai.filingqa.service.store.VectorStore;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final EmbeddingGenerator embeddingGenerator;
  private final VectorStore vectorStore;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "filingqa");
    health.put("embeddingMethod", embeddingGenerator.getActiveMethod());
    health.put("chunkCount", vectorStore.size());
    return ResponseEntity.ok(health);
  }
}
