package com.flamingo.ai.filingqa.domain.enums;

/**
 * The method that produced an embedding. Vectors are only comparable when they share the same
 * method.
 */
public enum EmbeddingMethod {
  /** Dense vectors from the configured LangChain4j embedding model. */
  PRIMARY,

  /** TF-IDF vectors projected with truncated SVD, computed locally. */
  FALLBACK
}
