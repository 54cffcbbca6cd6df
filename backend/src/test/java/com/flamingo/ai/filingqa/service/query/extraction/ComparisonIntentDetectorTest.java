package com.flamingo.ai.filingqa.service.query.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ComparisonIntentDetector Tests")
class ComparisonIntentDetectorTest {

  private final ComparisonIntentDetector detector = new ComparisonIntentDetector();

  @Test
  @DisplayName("Should detect comparison wording")
  void shouldDetectLanguage() {
    assertThat(detector.hasComparisonLanguage("Apple versus Microsoft")).isTrue();
    assertThat(detector.hasComparisonLanguage("AAPL vs. MSFT")).isTrue();
    assertThat(detector.hasComparisonLanguage("margins relative to peers")).isTrue();
    assertThat(detector.hasComparisonLanguage("Apple's revenue")).isFalse();
    assertThat(detector.hasComparisonLanguage("comparable store sales")).isFalse();
  }

  @Test
  @DisplayName("Should require two tickers for comparison intent")
  void shouldRequireTwoTickers() {
    assertThat(detector.hasComparisonIntent("Compare Apple and Microsoft", 2)).isTrue();
    assertThat(detector.hasComparisonIntent("Compare Apple to last year", 1)).isFalse();
    assertThat(detector.hasComparisonIntent("Apple and Microsoft", 2)).isFalse();
  }
}
