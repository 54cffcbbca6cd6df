package com.flamingo.ai.filingqa.api.rest;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.filingqa.api.dto.request.ChunkIngestRequest;
import com.flamingo.ai.filingqa.api.dto.request.IngestChunksRequest;
import com.flamingo.ai.filingqa.domain.enums.EmbeddingMethod;
import com.flamingo.ai.filingqa.domain.model.IngestionSummary;
import com.flamingo.ai.filingqa.exception.GlobalExceptionHandler;
import com.flamingo.ai.filingqa.exception.IngestionStateException;
import com.flamingo.ai.filingqa.service.ingestion.IngestionService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionController Tests")
class IngestionControllerTest {

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @Mock private IngestionService ingestionService;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new IngestionController(ingestionService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    objectMapper = new ObjectMapper();
  }

  @Test
  @DisplayName("Should return the ingestion summary")
  void shouldReturnSummary() throws Exception {
    when(ingestionService.ingest(anyList()))
        .thenReturn(
            new IngestionSummary(
                2, 1, 1, List.of("#1 (b): unknown filing type 'S-1'"), EmbeddingMethod.FALLBACK));

    mockMvc
        .perform(
            post("/api/ingest/chunks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    objectMapper.writeValueAsString(
                        new IngestChunksRequest(List.of(chunk("a"), chunk("b"))))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.received").value(2))
        .andExpect(jsonPath("$.accepted").value(1))
        .andExpect(jsonPath("$.warnings[0]").value("#1 (b): unknown filing type 'S-1'"))
        .andExpect(jsonPath("$.activeMethod").value("FALLBACK"));
  }

  @Test
  @DisplayName("Should reject an empty batch")
  void shouldRejectEmptyBatch() throws Exception {
    mockMvc
        .perform(
            post("/api/ingest/chunks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"chunks\": []}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));

    verify(ingestionService, never()).ingest(anyList());
  }

  @Test
  @DisplayName("Should reject unreadable JSON")
  void shouldRejectMalformedJson() throws Exception {
    mockMvc
        .perform(
            post("/api/ingest/chunks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"chunks\": [{"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("The request could not be read."));
  }

  @Test
  @DisplayName("Should map corpus state conflicts to 409")
  void shouldMapStateConflict() throws Exception {
    when(ingestionService.ingest(anyList()))
        .thenThrow(new IngestionStateException("Snapshot was built with PRIMARY embeddings"));

    mockMvc
        .perform(
            post("/api/ingest/chunks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    objectMapper.writeValueAsString(new IngestChunksRequest(List.of(chunk("a"))))))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("INGEST_001"));
  }

  private static ChunkIngestRequest chunk(String id) {
    return ChunkIngestRequest.builder()
        .id(id)
        .text("Net sales increased.")
        .ticker("AAPL")
        .filingType("10-K")
        .filingDate("2023-11-03")
        .build();
  }
}
