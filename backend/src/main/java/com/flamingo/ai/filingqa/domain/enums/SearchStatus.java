package com.flamingo.ai.filingqa.domain.enums;

/** Status flag attached to every search outcome. */
public enum SearchStatus {
  /** Results were scored with both semantic and keyword signals. */
  OK,

  /** The corpus is empty. This is a system-state signal, not a content signal. */
  NO_DATA,

  /** The corpus has data but nothing scored above the cutoff. */
  NO_MATCHES,

  /**
   * Results were produced without a usable semantic signal, or retrieval failed and the result
   * list is empty.
   */
  DEGRADED
}
