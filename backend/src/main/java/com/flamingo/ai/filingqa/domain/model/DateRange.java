package com.flamingo.ai.filingqa.domain.model;

import java.time.LocalDate;

/**
 * Inclusive filing-date range. Either bound may be null for an open end.
 *
 * @param from earliest filing date, inclusive
 * @param to latest filing date, inclusive
 */
public record DateRange(LocalDate from, LocalDate to) {

  public DateRange {
    if (from != null && to != null && from.isAfter(to)) {
      throw new IllegalArgumentException("Date range start " + from + " is after end " + to);
    }
  }

  public boolean contains(LocalDate date) {
    if (date == null) {
      return false;
    }
    return (from == null || !date.isBefore(from)) && (to == null || !date.isAfter(to));
  }
}
