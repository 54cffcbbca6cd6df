package com.flamingo.ai.filingqa.domain.model;

import java.util.Set;

/**
 * Time references found in a query. Relative terms such as "latest" are kept verbatim and are not
 * resolved to dates.
 */
public record TimePeriods(Set<Integer> years, Set<String> quarters, Set<String> relativeTerms) {

  public TimePeriods {
    years = Set.copyOf(years);
    quarters = Set.copyOf(quarters);
    relativeTerms = Set.copyOf(relativeTerms);
  }

  public static TimePeriods none() {
    return new TimePeriods(Set.of(), Set.of(), Set.of());
  }

  public boolean isPresent() {
    return !years.isEmpty() || !quarters.isEmpty() || !relativeTerms.isEmpty();
  }
}
