package com.flamingo.ai.filingqa.config;

import com.flamingo.ai.filingqa.service.embedding.EmbeddingGenerator;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the primary LangChain4j embedding model. When the configured model cannot be
 * created the generator is built without one and runs on the statistical fallback.
 */
@Configuration
@Slf4j
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Bean
  public EmbeddingGenerator embeddingGenerator(RagConfig ragConfig, MeterRegistry meterRegistry) {
    EmbeddingModel primary = createPrimaryModel(ragConfig.getEmbedding());
    return new EmbeddingGenerator(primary, ragConfig, meterRegistry);
  }

  /**
   * Builds the primary model for the configured provider.
   *
   * @return the model, or null when the provider is disabled or fails to load
   */
  EmbeddingModel createPrimaryModel(RagConfig.Embedding config) {
    String provider = config.getProvider() == null ? "none" : config.getProvider().trim();
    try {
      return switch (provider.toLowerCase()) {
        case "minilm" -> new AllMiniLmL6V2EmbeddingModel();
        case "openai" -> openAiEmbeddingModel(config);
        case "none" -> null;
        default -> {
          log.warn("Unknown embedding provider '{}', using fallback embeddings", provider);
          yield null;
        }
      };
    } catch (RuntimeException | LinkageError e) {
      log.warn(
          "Primary embedding provider '{}' unavailable, using fallback embeddings: {}",
          provider,
          e.getMessage());
      return null;
    }
  }

  private EmbeddingModel openAiEmbeddingModel(RagConfig.Embedding config) {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required for the openai provider. Set OPENAI_API_KEY.");
    }
    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(config.getDimensions())
        .timeout(Duration.ofMillis(config.getTimeoutMs()))
        .build();
  }
}
