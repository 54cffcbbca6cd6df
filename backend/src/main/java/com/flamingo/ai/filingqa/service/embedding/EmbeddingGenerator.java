package com.flamingo.ai.filingqa.service.embedding;

import com.flamingo.ai.filingqa.config.RagConfig;
import com.flamingo.ai.filingqa.domain.enums.EmbeddingMethod;
import com.flamingo.ai.filingqa.domain.model.EmbeddingVector;
import com.flamingo.ai.filingqa.exception.EmbeddingNotFittedException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts text into fixed-size, L2-normalized vectors.
 *
 * <p>Uses the primary LangChain4j model when one is available. If the model is missing, fails its
 * probe during {@link #fit(List)}, or returns vectors of the wrong size, the generator switches to
 * the statistical fallback for the rest of its lifetime and logs the switch once.
 *
 * <p>{@link #embedOne(String)} and {@link #embedBatch(List)} share the same per-text path, so a
 * text embedded alone equals the same text embedded in a batch.
 *
 * <p>{@code fit} is single-writer; the embedding methods are safe to call concurrently once the
 * generator is fitted.
 */
@Slf4j
public class EmbeddingGenerator {

  private static final String PROBE_TEXT = "annual report revenue and risk factors";

  private final EmbeddingModel primaryModel;
  private final RagConfig.Embedding config;
  private final MeterRegistry meterRegistry;
  private final FinancialTextNormalizer normalizer = new FinancialTextNormalizer();
  private final TimeLimiter timeLimiter;

  private volatile EmbeddingMethod activeMethod;
  private volatile FallbackEmbeddingModel fallbackModel;

  /**
   * Creates a generator.
   *
   * @param primaryModel the primary model, or null to run on the fallback from the start
   * @param ragConfig pipeline configuration
   * @param meterRegistry metrics registry
   */
  public EmbeddingGenerator(
      EmbeddingModel primaryModel, RagConfig ragConfig, MeterRegistry meterRegistry) {
    this.primaryModel = primaryModel;
    this.config = ragConfig.getEmbedding();
    this.meterRegistry = meterRegistry;
    this.timeLimiter =
        TimeLimiter.of(
            "primary-embedding",
            TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(config.getTimeoutMs()))
                .cancelRunningFuture(true)
                .build());
    if (primaryModel == null) {
      this.activeMethod = EmbeddingMethod.FALLBACK;
      log.info("No primary embedding model configured, using fallback embeddings");
    } else {
      this.activeMethod = EmbeddingMethod.PRIMARY;
      log.info("Primary embedding model configured: {}", primaryModel.getClass().getSimpleName());
    }
  }

  /**
   * Prepares the generator for a corpus. For the primary method this probes the model; for the
   * fallback it fits TF-IDF and SVD on the whole corpus, replacing any previous fit.
   *
   * @param corpus every text that will be stored
   */
  public void fit(List<String> corpus) {
    if (activeMethod == EmbeddingMethod.PRIMARY) {
      Optional<String> failure = probePrimary();
      if (failure.isEmpty()) {
        log.info("Primary embedding model verified, {} dimensions", config.getDimensions());
        return;
      }
      switchToFallback(failure.get());
    }

    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<List<String>> documents = corpus.stream().map(normalizer::tokenize).toList();
      FallbackEmbeddingModel fitted =
          FallbackEmbeddingModel.fit(
              documents, config.getFallback().getMaxFeatures(), config.getDimensions());
      this.fallbackModel = fitted;
      log.info(
          "Fitted fallback embeddings on {} texts: vocabulary={}, rank={}, dimensions={}",
          corpus.size(),
          fitted.getVocabulary().size(),
          fitted.getRank(),
          fitted.getDimensions());
      if (fitted.getRank() < config.getDimensions()) {
        log.debug(
            "Fallback rank {} below {} dimensions, vectors are zero-padded",
            fitted.getRank(),
            config.getDimensions());
      }
    } finally {
      sample.stop(meterRegistry.timer("embedding.fit.duration"));
    }
  }

  /**
   * Embeds texts one at a time through the same path as {@link #embedOne(String)}.
   *
   * @return one vector per input text, in order
   */
  public List<EmbeddingVector> embedBatch(List<String> texts) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<EmbeddingVector> vectors = new ArrayList<>(texts.size());
      for (String text : texts) {
        vectors.add(embedOne(text));
      }
      return vectors;
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }

  /**
   * Embeds a single text. Blank input yields the zero vector. A primary-model timeout or error
   * also yields the zero vector and is counted as a failure.
   *
   * @throws EmbeddingNotFittedException when running on an unfitted fallback
   */
  public EmbeddingVector embedOne(String text) {
    EmbeddingMethod method = activeMethod;
    if (method == EmbeddingMethod.FALLBACK) {
      FallbackEmbeddingModel model = fallbackModel;
      if (model == null) {
        throw new EmbeddingNotFittedException();
      }
      if (text == null || text.isBlank()) {
        return EmbeddingVector.zero(config.getDimensions(), method);
      }
      return model.embed(normalizer.tokenize(text));
    }

    if (text == null || text.isBlank()) {
      return EmbeddingVector.zero(config.getDimensions(), method);
    }
    try {
      float[] vector = callPrimary(text);
      if (vector.length != config.getDimensions()) {
        log.error(
            "Primary model returned {} dimensions, expected {}",
            vector.length,
            config.getDimensions());
        meterRegistry.counter("embedding.requests.failure", "method", "primary").increment();
        return EmbeddingVector.zero(config.getDimensions(), method);
      }
      meterRegistry.counter("embedding.requests.success", "method", "primary").increment();
      double[] raw = new double[vector.length];
      for (int i = 0; i < vector.length; i++) {
        raw[i] = vector[i];
      }
      return EmbeddingVector.normalized(raw, method);
    } catch (TimeoutException e) {
      log.warn("Primary embedding timed out after {} ms", config.getTimeoutMs());
      meterRegistry.counter("embedding.requests.failure", "method", "primary").increment();
      return EmbeddingVector.zero(config.getDimensions(), method);
    } catch (Exception e) {
      log.warn("Primary embedding failed: {}", e.getMessage());
      meterRegistry.counter("embedding.requests.failure", "method", "primary").increment();
      return EmbeddingVector.zero(config.getDimensions(), method);
    }
  }

  /**
   * Adopts a fallback fit restored from a snapshot. Only valid while running on the fallback.
   *
   * @throws IllegalStateException when the active method is primary or dimensions differ
   */
  public void restoreFallbackModel(FallbackEmbeddingModel model) {
    if (activeMethod != EmbeddingMethod.FALLBACK) {
      throw new IllegalStateException("Cannot restore a fallback fit while using primary model");
    }
    if (model.getDimensions() != config.getDimensions()) {
      throw new IllegalStateException(
          "Restored fallback model has "
              + model.getDimensions()
              + " dimensions, expected "
              + config.getDimensions());
    }
    this.fallbackModel = model;
    log.info(
        "Restored fallback embeddings: vocabulary={}, rank={}",
        model.getVocabulary().size(),
        model.getRank());
  }

  public EmbeddingMethod getActiveMethod() {
    return activeMethod;
  }

  public Optional<FallbackEmbeddingModel> getFallbackModel() {
    return Optional.ofNullable(fallbackModel);
  }

  /** True when {@link #embedOne(String)} can be called without a prior fit. */
  public boolean isReady() {
    return activeMethod == EmbeddingMethod.PRIMARY || fallbackModel != null;
  }

  public int getDimensions() {
    return config.getDimensions();
  }

  private Optional<String> probePrimary() {
    try {
      float[] vector = callPrimary(PROBE_TEXT);
      if (vector.length != config.getDimensions()) {
        return Optional.of(
            "model returned "
                + vector.length
                + " dimensions, expected "
                + config.getDimensions());
      }
      return Optional.empty();
    } catch (TimeoutException e) {
      return Optional.of("probe timed out after " + config.getTimeoutMs() + " ms");
    } catch (Exception e) {
      return Optional.of(e.getClass().getSimpleName() + ": " + e.getMessage());
    }
  }

  private float[] callPrimary(String text) throws Exception {
    String input =
        text.length() > config.getMaxChars() ? text.substring(0, config.getMaxChars()) : text;
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response =
          timeLimiter.executeFutureSupplier(
              () -> CompletableFuture.supplyAsync(() -> primaryModel.embed(input)));
      return response.content().vector();
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  private synchronized void switchToFallback(String reason) {
    if (activeMethod == EmbeddingMethod.FALLBACK) {
      return;
    }
    activeMethod = EmbeddingMethod.FALLBACK;
    meterRegistry.counter("embedding.fallback.switch").increment();
    log.warn("Primary embedding model unavailable ({}), switching to fallback embeddings", reason);
  }
}
