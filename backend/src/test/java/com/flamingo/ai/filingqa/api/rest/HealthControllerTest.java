package com.flamingo.ai.filingqa.api.rest;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.filingqa.domain.enums.EmbeddingMethod;
import com.flamingo.ai.filingqa.service.embedding.EmbeddingGenerator;
import com.flamingo.ai.filingqa.service.store.VectorStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

  @Mock private EmbeddingGenerator embeddingGenerator;
  @Mock private VectorStore vectorStore;

  @Test
  void shouldReportEmbeddingMethodAndChunkCount() throws Exception {
    when(embeddingGenerator.getActiveMethod()).thenReturn(EmbeddingMethod.FALLBACK);
    when(vectorStore.size()).thenReturn(42);
    MockMvc mockMvc =
        MockMvcBuilders.standaloneSetup(new HealthController(embeddingGenerator, vectorStore))
            .build();

    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"))
        .andExpect(jsonPath("$.service").value("filingqa"))
        .andExpect(jsonPath("$.embeddingMethod").value("FALLBACK"))
        .andExpect(jsonPath("$.chunkCount").value(42));
  }
}
