package com.flamingo.ai.filingqa.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.filingqa.api.rest.HealthController;
import com.flamingo.ai.filingqa.api.rest.IngestionController;
import com.flamingo.ai.filingqa.api.rest.QueryController;
import com.flamingo.ai.filingqa.api.rest.StoreController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests pinning the controller base paths:
 *
 * <ul>
 *   <li>POST /api/ingest/chunks - Ingest a batch of chunks
 *   <li>POST /api/query - Route and retrieve
 *   <li>GET /api/store/stats - Collection statistics
 *   <li>GET /api/store/chunks/{id} - Get a chunk
 *   <li>GET /api/store/chunks/{id}/similar - Nearest chunks
 *   <li>DELETE /api/store - Reset the collection
 *   <li>GET /health - Health check
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("IngestionController API contract")
  class IngestionControllerContract {

    @Test
    @DisplayName("should be mapped to /api/ingest")
    void shouldBeMappedToApiIngest() {
      RequestMapping mapping = IngestionController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/ingest");
    }
  }

  @Nested
  @DisplayName("QueryController API contract")
  class QueryControllerContract {

    @Test
    @DisplayName("should be mapped to /api/query")
    void shouldBeMappedToApiQuery() {
      RequestMapping mapping = QueryController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/query");
    }
  }

  @Nested
  @DisplayName("StoreController API contract")
  class StoreControllerContract {

    @Test
    @DisplayName("should be mapped to /api/store")
    void shouldBeMappedToApiStore() {
      RequestMapping mapping = StoreController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/store");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /health")
    void shouldBeMappedToHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/health");
    }
  }
}
