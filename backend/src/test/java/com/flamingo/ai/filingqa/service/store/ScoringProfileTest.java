package com.flamingo.ai.filingqa.service.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.filingqa.config.RagConfig;
import com.flamingo.ai.filingqa.domain.enums.EmbeddingMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ScoringProfile Tests")
class ScoringProfileTest {

  @Test
  @DisplayName("Should select the configured profile per method")
  void shouldSelectProfilePerMethod() {
    RagConfig.Scoring scoring = new RagConfig.Scoring();

    ScoringProfile primary = ScoringProfile.forMethod(EmbeddingMethod.PRIMARY, scoring);
    ScoringProfile fallback = ScoringProfile.forMethod(EmbeddingMethod.FALLBACK, scoring);

    assertThat(primary.semanticWeight()).isCloseTo(0.7, within(1e-9));
    assertThat(primary.minScore()).isEqualTo(0.10);
    assertThat(fallback.keywordWeight()).isCloseTo(0.6, within(1e-9));
    assertThat(fallback.minScore()).isEqualTo(0.05);
  }

  @Test
  @DisplayName("Should normalize weights to sum to one")
  void shouldNormalizeWeights() {
    ScoringProfile profile = new ScoringProfile(EmbeddingMethod.PRIMARY, 3, 1, 0.1);

    assertThat(profile.semanticWeight()).isEqualTo(0.75);
    assertThat(profile.combine(1.0, 0.0)).isEqualTo(0.75);
    assertThat(profile.passes(0.1)).isTrue();
    assertThat(profile.passes(0.09)).isFalse();
  }

  @Test
  @DisplayName("Should shift weight towards keywords when boosted")
  void shouldBoostKeywordWeight() {
    ScoringProfile primary =
        ScoringProfile.forMethod(EmbeddingMethod.PRIMARY, new RagConfig.Scoring());

    ScoringProfile boosted = primary.withKeywordBoost(0.1);

    assertThat(boosted.keywordWeight()).isCloseTo(0.4 / 1.1, within(1e-9));
    assertThat(boosted.semanticWeight()).isCloseTo(0.7 / 1.1, within(1e-9));
    assertThat(boosted.minScore()).isEqualTo(primary.minScore());
    assertThat(primary.withKeywordBoost(0.0)).isSameAs(primary);
  }

  @Test
  @DisplayName("Should reject a fallback profile that trusts keywords less than the primary")
  void shouldRejectInvertedAdaptation() {
    RagConfig.Scoring scoring = new RagConfig.Scoring();
    scoring.setFallback(new RagConfig.Scoring.Profile(0.8, 0.2, 0.05));

    assertThatThrownBy(() -> ScoringProfile.forMethod(EmbeddingMethod.FALLBACK, scoring))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("keyword weight");
  }

  @Test
  @DisplayName("Should reject a fallback cutoff above the primary cutoff")
  void shouldRejectHigherFallbackCutoff() {
    RagConfig.Scoring scoring = new RagConfig.Scoring();
    scoring.setFallback(new RagConfig.Scoring.Profile(0.4, 0.6, 0.2));

    assertThatThrownBy(() -> ScoringProfile.forMethod(EmbeddingMethod.PRIMARY, scoring))
        .isInstanceOf(IllegalStateException.class);
  }
}
