package com.flamingo.ai.filingqa.domain.model;

import com.flamingo.ai.filingqa.domain.enums.SearchStatus;
import java.util.List;

/** Ranked results plus a status flag distinguishing "no data" from "nothing matched". */
public record SearchOutcome(SearchStatus status, List<SearchResult> results) {

  public SearchOutcome {
    results = List.copyOf(results);
  }

  public static SearchOutcome noData() {
    return new SearchOutcome(SearchStatus.NO_DATA, List.of());
  }

  public static SearchOutcome noMatches() {
    return new SearchOutcome(SearchStatus.NO_MATCHES, List.of());
  }

  /** Empty degraded outcome, returned when retrieval itself failed. */
  public static SearchOutcome failed() {
    return new SearchOutcome(SearchStatus.DEGRADED, List.of());
  }

  /**
   * Builds an outcome from results, flagging {@code NO_MATCHES} when the list is empty.
   *
   * @param results ranked results
   * @param degraded whether the semantic signal was unavailable
   */
  public static SearchOutcome of(List<SearchResult> results, boolean degraded) {
    if (results.isEmpty()) {
      return noMatches();
    }
    return new SearchOutcome(degraded ? SearchStatus.DEGRADED : SearchStatus.OK, results);
  }

  public boolean isEmpty() {
    return results.isEmpty();
  }
}
