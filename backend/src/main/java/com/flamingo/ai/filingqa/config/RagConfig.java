package com.flamingo.ai.filingqa.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the retrieval pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Embedding embedding = new Embedding();
  private Scoring scoring = new Scoring();
  private Retrieval retrieval = new Retrieval();
  private Query query = new Query();
  private Store store = new Store();

  @Getter
  @Setter
  public static class Embedding {
    /** Primary model provider: "minilm" (in-process), "openai", or "none" to force fallback. */
    private String provider = "minilm";

    /** Fixed output dimensionality for both methods. */
    private int dimensions = 384;

    /** Upper bound for a single primary-model call. */
    private long timeoutMs = 10000;

    /** Texts longer than this are truncated before reaching the primary model. */
    private int maxChars = 5000;

    private Fallback fallback = new Fallback();

    /** Configuration for the TF-IDF + SVD fallback. */
    @Getter
    @Setter
    public static class Fallback {
      /** Vocabulary cap; the most frequent unigrams and bigrams are kept. */
      private int maxFeatures = 5000;
    }
  }

  @Getter
  @Setter
  public static class Scoring {
    private Profile primary = new Profile(0.7, 0.3, 0.10);
    private Profile fallback = new Profile(0.4, 0.6, 0.05);

    /** Weights and cutoff for one embedding method. */
    @Getter
    @Setter
    public static class Profile {
      private double semanticWeight;
      private double keywordWeight;
      private double minScore;

      public Profile() {}

      public Profile(double semanticWeight, double keywordWeight, double minScore) {
        this.semanticWeight = semanticWeight;
        this.keywordWeight = keywordWeight;
        this.minScore = minScore;
      }
    }
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int filteredTopK = 15;
    private int generalTopK = 15;
    private int conceptTopK = 25;
    private int temporalTopK = 20;

    /** Total result budget shared across tickers by the multi-entity strategy. */
    private int multiEntityBudget = 20;

    /** Floor on the per-ticker quota of the multi-entity strategy. */
    private int minPerEntity = 5;

    /** Over-fetch factor applied before post-filtering. */
    private int candidatesMultiplier = 2;

    /** Extra keyword weight for concept queries, added to the active profile's keyword weight. */
    private double conceptKeywordBoost = 0.1;
  }

  @Getter
  @Setter
  public static class Query {
    /** Earliest year accepted as a time period (EDGAR electronic filings start in 1993). */
    private int minYear = 1993;

    private int maxYear = 2035;
  }

  @Getter
  @Setter
  public static class Store {
    /** Directory holding the snapshot file. */
    private String path = "data/vector_store";

    private String collectionName = "sec_filings";
  }
}
