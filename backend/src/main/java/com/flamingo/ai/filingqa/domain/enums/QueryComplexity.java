package com.flamingo.ai.filingqa.domain.enums;

/** Rough complexity bucket of a query, derived from the number of extracted entities. */
public enum QueryComplexity {
  SIMPLE,
  MODERATE,
  COMPLEX;

  /**
   * Maps a complexity score to a bucket.
   *
   * @param score weighted entity count
   * @return SIMPLE up to 3, MODERATE up to 7, COMPLEX above
   */
  public static QueryComplexity fromScore(int score) {
    if (score <= 3) {
      return SIMPLE;
    }
    if (score <= 7) {
      return MODERATE;
    }
    return COMPLEX;
  }
}
