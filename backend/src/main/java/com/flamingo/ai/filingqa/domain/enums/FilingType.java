package com.flamingo.ai.filingqa.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** SEC form codes handled by the retrieval core. */
public enum FilingType {
  /** Annual report. */
  FORM_10K("10-K"),

  /** Quarterly report. */
  FORM_10Q("10-Q"),

  /** Current report for material events. */
  FORM_8K("8-K"),

  /** Definitive proxy statement. */
  DEF_14A("DEF 14A"),

  FORM_3("3"),
  FORM_4("4"),
  FORM_5("5");

  private final String code;

  FilingType(String code) {
    this.code = code;
  }

  @JsonValue
  public String getCode() {
    return code;
  }

  /**
   * Resolves a form code such as {@code "10-K"} or {@code "def 14a"}. Matching ignores case and
   * surrounding whitespace.
   */
  public static Optional<FilingType> fromCode(String code) {
    if (code == null || code.isBlank()) {
      return Optional.empty();
    }
    String normalized = code.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
    return Arrays.stream(values()).filter(type -> type.code.equals(normalized)).findFirst();
  }

  /** Strict variant of {@link #fromCode(String)} used when binding JSON. */
  @JsonCreator
  public static FilingType of(String code) {
    return fromCode(code)
        .orElseThrow(() -> new IllegalArgumentException("Unknown filing type: " + code));
  }
}
