package com.flamingo.ai.filingqa.service.embedding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Unigram + bigram TF-IDF over pre-normalized tokens.
 *
 * <p>Uses sublinear term frequency ({@code 1 + ln tf}), smoothed inverse document frequency
 * ({@code ln((1 + n) / (1 + df)) + 1}) and L2-normalized rows.
 */
final class TfidfVectorizer {

  private TfidfVectorizer() {}

  /** Vocabulary (sorted) and matching idf weights produced by {@link #fit}. */
  record Fit(List<String> vocabulary, double[] idf) {}

  /**
   * Learns the vocabulary and idf weights.
   *
   * @param documents tokenized documents
   * @param maxFeatures cap on vocabulary size; the most frequent terms are kept, ties broken
   *     alphabetically
   */
  static Fit fit(List<List<String>> documents, int maxFeatures) {
    Map<String, Integer> corpusFrequency = new HashMap<>();
    Map<String, Integer> documentFrequency = new HashMap<>();
    for (List<String> tokens : documents) {
      List<String> terms = terms(tokens);
      for (String term : terms) {
        corpusFrequency.merge(term, 1, Integer::sum);
      }
      for (String term : new HashSet<>(terms)) {
        documentFrequency.merge(term, 1, Integer::sum);
      }
    }

    List<String> vocabulary =
        corpusFrequency.entrySet().stream()
            .sorted(
                Map.Entry.<String, Integer>comparingByValue()
                    .reversed()
                    .thenComparing(Map.Entry.comparingByKey()))
            .limit(Math.max(0, maxFeatures))
            .map(Map.Entry::getKey)
            .sorted()
            .toList();

    int n = documents.size();
    double[] idf = new double[vocabulary.size()];
    for (int i = 0; i < vocabulary.size(); i++) {
      int df = documentFrequency.get(vocabulary.get(i));
      idf[i] = Math.log((1.0 + n) / (1.0 + df)) + 1.0;
    }
    return new Fit(vocabulary, idf);
  }

  /**
   * Computes the L2-normalized TF-IDF row of one document.
   *
   * @return sparse row keyed by vocabulary index, in ascending index order; empty when no term is
   *     in the vocabulary
   */
  static Map<Integer, Double> transform(
      List<String> tokens, Map<String, Integer> vocabularyIndex, double[] idf) {
    Map<Integer, Integer> counts = new HashMap<>();
    for (String term : terms(tokens)) {
      Integer index = vocabularyIndex.get(term);
      if (index != null) {
        counts.merge(index, 1, Integer::sum);
      }
    }
    if (counts.isEmpty()) {
      return Collections.emptyMap();
    }

    Map<Integer, Double> row = new TreeMap<>();
    double sumSquares = 0.0;
    for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
      double weight = (1.0 + Math.log(entry.getValue())) * idf[entry.getKey()];
      row.put(entry.getKey(), weight);
      sumSquares += weight * weight;
    }
    double norm = Math.sqrt(sumSquares);
    row.replaceAll((index, weight) -> weight / norm);
    return row;
  }

  /** Unigrams followed by space-joined bigrams of consecutive tokens. */
  static List<String> terms(List<String> tokens) {
    List<String> terms = new ArrayList<>(tokens.size() * 2);
    terms.addAll(tokens);
    for (int i = 0; i + 1 < tokens.size(); i++) {
      terms.add(tokens.get(i) + " " + tokens.get(i + 1));
    }
    return terms;
  }
}
