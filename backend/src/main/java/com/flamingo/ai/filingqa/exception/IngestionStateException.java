package com.flamingo.ai.filingqa.exception;

/**
 * Thrown when the persisted or in-memory ingestion state is inconsistent, e.g. mixing embedding
 * methods or loading a snapshot fitted with a different fallback model. Never recovered from
 * silently.
 */
public class IngestionStateException extends RuntimeException {

  private final String userMessage;

  public IngestionStateException(String message) {
    super(message);
    this.userMessage = "The document index is in an inconsistent state and must be rebuilt.";
  }

  public IngestionStateException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "The document index is in an inconsistent state and must be rebuilt.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
