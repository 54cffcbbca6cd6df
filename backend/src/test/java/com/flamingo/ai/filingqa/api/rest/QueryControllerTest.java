package com.flamingo.ai.filingqa.api.rest;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.filingqa.TestFixtures;
import com.flamingo.ai.filingqa.domain.enums.QueryComplexity;
import com.flamingo.ai.filingqa.domain.enums.QueryType;
import com.flamingo.ai.filingqa.domain.enums.RetrievalStrategy;
import com.flamingo.ai.filingqa.domain.model.Chunk;
import com.flamingo.ai.filingqa.domain.model.ProcessingHints;
import com.flamingo.ai.filingqa.domain.model.QueryContext;
import com.flamingo.ai.filingqa.domain.model.RoutedQuery;
import com.flamingo.ai.filingqa.domain.model.RoutingDecision;
import com.flamingo.ai.filingqa.domain.model.SearchOutcome;
import com.flamingo.ai.filingqa.domain.model.SearchResult;
import com.flamingo.ai.filingqa.exception.GlobalExceptionHandler;
import com.flamingo.ai.filingqa.service.query.QueryRouter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.TreeSet;
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
@DisplayName("QueryController Tests")
class QueryControllerTest {

  private MockMvc mockMvc;

  @Mock private QueryRouter queryRouter;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new QueryController(queryRouter))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should return routing details with cited results")
  void shouldReturnRoutedResults() throws Exception {
    String query = "What are Apple's risk factors?";
    Chunk chunk = TestFixtures.chunk("a1", "AAPL", "2023-11-03", "Supply chain risk.");
    SearchResult result =
        new SearchResult(chunk.id(), chunk.text(), chunk.metadata(), 0.82, 0.8, 0.9);
    QueryContext context =
        QueryContext.builder().tickers(new TreeSet<>(List.of("AAPL"))).originalQuery(query).build();
    RoutingDecision decision =
        new RoutingDecision(
            context,
            QueryType.SINGLE_COMPANY,
            RetrievalStrategy.FILTERED,
            ProcessingHints.forQueryType(QueryType.SINGLE_COMPANY),
            QueryComplexity.SIMPLE);
    when(queryRouter.routeAndRetrieve(eq(query), isNull()))
        .thenReturn(new RoutedQuery(decision, SearchOutcome.of(List.of(result), false)));

    mockMvc
        .perform(
            post("/api/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"What are Apple's risk factors?\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.queryType").value("SINGLE_COMPANY"))
        .andExpect(jsonPath("$.strategy").value("FILTERED"))
        .andExpect(jsonPath("$.status").value("OK"))
        .andExpect(jsonPath("$.entities.tickers[0]").value("AAPL"))
        .andExpect(jsonPath("$.processingHints.approach").value("focused_analysis"))
        .andExpect(jsonPath("$.results[0].chunkId").value("a1"))
        .andExpect(jsonPath("$.results[0].filingType").value("10-K"))
        .andExpect(jsonPath("$.results[0].filingDate").value("2023-11-03"))
        .andExpect(jsonPath("$.results[0].combinedScore").value(0.82));
  }

  @Test
  @DisplayName("Should reject a blank query")
  void shouldRejectBlankQuery() throws Exception {
    mockMvc
        .perform(
            post("/api/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \" \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"))
        .andExpect(jsonPath("$.message").value("query: Query is required"));
  }

  @Test
  @DisplayName("Should reject an out-of-range topK")
  void shouldRejectInvalidTopK() throws Exception {
    mockMvc
        .perform(
            post("/api/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"revenue\", \"topK\": 500}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  @DisplayName("Should answer a failed retrieval with a degraded, empty result")
  void shouldReturnDegradedOutcome() throws Exception {
    QueryContext context = QueryContext.empty("revenue");
    RoutingDecision decision =
        new RoutingDecision(
            context,
            QueryType.GENERAL_SEARCH,
            RetrievalStrategy.GENERAL_HYBRID,
            ProcessingHints.forQueryType(QueryType.GENERAL_SEARCH),
            QueryComplexity.SIMPLE);
    when(queryRouter.routeAndRetrieve(anyString(), isNull()))
        .thenReturn(new RoutedQuery(decision, SearchOutcome.failed()));

    mockMvc
        .perform(
            post("/api/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"revenue\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("DEGRADED"))
        .andExpect(jsonPath("$.results").isEmpty());
  }
}
