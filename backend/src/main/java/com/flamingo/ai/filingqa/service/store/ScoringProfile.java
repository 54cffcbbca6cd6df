package com.flamingo.ai.filingqa.service.store;

import com.flamingo.ai.filingqa.config.RagConfig;
import com.flamingo.ai.filingqa.domain.enums.EmbeddingMethod;

/**
 * Method-dependent hybrid scoring parameters. One profile is selected for the store's active
 * embedding method and used for every search.
 *
 * <p>The fallback's semantic signal is weaker than a dense model's, so its profile must weight
 * keywords at least as heavily relative to semantics as the primary profile does, with a cutoff no
 * higher than the primary one. {@link #forMethod} enforces this.
 */
public record ScoringProfile(
    EmbeddingMethod method, double semanticWeight, double keywordWeight, double minScore) {

  public ScoringProfile {
    if (semanticWeight < 0 || keywordWeight < 0 || semanticWeight + keywordWeight <= 0) {
      throw new IllegalArgumentException("Weights must be non-negative and not both zero");
    }
    double total = semanticWeight + keywordWeight;
    semanticWeight = semanticWeight / total;
    keywordWeight = keywordWeight / total;
    if (minScore < 0 || minScore > 1) {
      throw new IllegalArgumentException("minScore must be within [0,1]: " + minScore);
    }
  }

  /**
   * Builds the profile for a method after validating the adaptation direction between the
   * configured primary and fallback profiles.
   *
   * @throws IllegalStateException when the fallback profile trusts keywords less, or applies a
   *     higher cutoff, than the primary profile
   */
  public static ScoringProfile forMethod(EmbeddingMethod method, RagConfig.Scoring scoring) {
    ScoringProfile primary = of(EmbeddingMethod.PRIMARY, scoring.getPrimary());
    ScoringProfile fallback = of(EmbeddingMethod.FALLBACK, scoring.getFallback());
    if (fallback.minScore > primary.minScore) {
      throw new IllegalStateException(
          "Fallback min score "
              + fallback.minScore
              + " must not exceed primary min score "
              + primary.minScore);
    }
    if (fallback.keywordWeight < primary.keywordWeight) {
      throw new IllegalStateException(
          "Fallback keyword weight "
              + fallback.keywordWeight
              + " must not be below primary keyword weight "
              + primary.keywordWeight);
    }
    return method == EmbeddingMethod.PRIMARY ? primary : fallback;
  }

  private static ScoringProfile of(EmbeddingMethod method, RagConfig.Scoring.Profile profile) {
    return new ScoringProfile(
        method, profile.getSemanticWeight(), profile.getKeywordWeight(), profile.getMinScore());
  }

  /**
   * Same profile with extra weight on the keyword signal. Weights are renormalised, so a boost of
   * 0.1 on the 0.7/0.3 primary profile yields roughly 0.64/0.36.
   */
  public ScoringProfile withKeywordBoost(double boost) {
    if (boost <= 0) {
      return this;
    }
    return new ScoringProfile(method, semanticWeight, keywordWeight + boost, minScore);
  }

  /** Weighted sum of the two signals, each expected in [0,1]. */
  public double combine(double semanticScore, double keywordScore) {
    return semanticWeight * semanticScore + keywordWeight * keywordScore;
  }

  public boolean passes(double combinedScore) {
    return combinedScore >= minScore;
  }
}
