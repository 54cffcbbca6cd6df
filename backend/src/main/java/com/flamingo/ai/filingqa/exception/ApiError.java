package com.flamingo.ai.filingqa.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String INGESTION_STATE_ERROR = "INGEST_001";
  public static final String EMBEDDING_NOT_FITTED = "EMBEDDING_001";
  public static final String CHUNK_NOT_FOUND = "CHUNK_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details (validation errors only). */
  private final String details;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
