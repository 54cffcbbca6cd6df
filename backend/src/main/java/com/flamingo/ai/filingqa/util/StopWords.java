package com.flamingo.ai.filingqa.util;

import java.util.Set;

/** English stop words shared by keyword scoring and fallback embeddings. */
public final class StopWords {

  public static final Set<String> ENGLISH =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he", "in", "is",
          "it", "its", "of", "on", "or", "that", "the", "to", "was", "were", "will", "with", "this",
          "but", "they", "have", "had", "what", "when", "where", "who", "which", "why", "how",
          "all", "each", "every", "both", "few", "more", "most", "other", "some", "such", "no",
          "nor", "not", "only", "own", "same", "so", "than", "too", "very", "just", "can", "should",
          "now", "been", "being", "do", "does", "did", "doing", "would", "could", "might", "must",
          "shall", "may", "about", "above", "after", "again", "against", "before", "below",
          "between", "down", "during", "into", "over", "through", "under", "until", "up", "while",
          "am", "i", "me", "my", "we", "our", "you", "your", "him", "her", "them", "their", "if",
          "then", "also", "here", "there", "these", "those", "else", "any", "many", "much", "even",
          "tell", "show", "give", "describe", "explain", "list");

  private StopWords() {}

  public static boolean isStopWord(String token) {
    return ENGLISH.contains(token);
  }
}
