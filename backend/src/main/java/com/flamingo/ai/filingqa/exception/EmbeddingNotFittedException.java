package com.flamingo.ai.filingqa.exception;

/** Thrown when fallback embeddings are requested before the vectorizer was fitted. */
public class EmbeddingNotFittedException extends IllegalStateException {

  public EmbeddingNotFittedException() {
    super("Fallback embedding model is not fitted; call fit(corpus) before embedding");
  }

  public String getUserMessage() {
    return "No documents have been indexed yet.";
  }
}
