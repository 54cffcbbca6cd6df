package com.flamingo.ai.filingqa.service.embedding;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.filingqa.domain.enums.EmbeddingMethod;
import com.flamingo.ai.filingqa.domain.model.EmbeddingVector;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Fitted state of the statistical fallback: TF-IDF vocabulary and idf weights plus the SVD
 * components. Immutable and safe to share between threads; serialized into the store snapshot so
 * that query-time embeddings after a restart match the stored ones.
 *
 * <p>The fingerprint is a SHA-256 digest over all fitted values and identifies the fit.
 */
public final class FallbackEmbeddingModel {

  private final List<String> vocabulary;
  private final double[] idf;
  private final double[][] components;
  private final int dimensions;
  private final String fingerprint;
  private final Map<String, Integer> vocabularyIndex;

  @JsonCreator
  public FallbackEmbeddingModel(
      @JsonProperty("vocabulary") List<String> vocabulary,
      @JsonProperty("idf") double[] idf,
      @JsonProperty("components") double[][] components,
      @JsonProperty("dimensions") int dimensions) {
    if (vocabulary.size() != idf.length) {
      throw new IllegalArgumentException("Vocabulary and idf sizes differ");
    }
    if (components.length > dimensions) {
      throw new IllegalArgumentException("More components than output dimensions");
    }
    this.vocabulary = List.copyOf(vocabulary);
    this.idf = idf.clone();
    this.components = deepCopy(components);
    this.dimensions = dimensions;
    this.fingerprint = computeFingerprint();
    Map<String, Integer> index = new HashMap<>(vocabulary.size() * 2);
    for (int i = 0; i < vocabulary.size(); i++) {
      index.put(vocabulary.get(i), i);
    }
    this.vocabularyIndex = Map.copyOf(index);
  }

  /**
   * Fits TF-IDF and SVD on a tokenized corpus.
   *
   * @param documents normalized token lists, one per corpus text
   * @param maxFeatures vocabulary cap
   * @param dimensions output dimensionality
   */
  public static FallbackEmbeddingModel fit(
      List<List<String>> documents, int maxFeatures, int dimensions) {
    TfidfVectorizer.Fit fit = TfidfVectorizer.fit(documents, maxFeatures);
    Map<String, Integer> index = new HashMap<>();
    for (int i = 0; i < fit.vocabulary().size(); i++) {
      index.put(fit.vocabulary().get(i), i);
    }
    List<Map<Integer, Double>> rows = new ArrayList<>(documents.size());
    for (List<String> tokens : documents) {
      rows.add(TfidfVectorizer.transform(tokens, index, fit.idf()));
    }
    double[][] components =
        TruncatedSvdProjector.fitComponents(rows, fit.vocabulary().size(), dimensions);
    return new FallbackEmbeddingModel(fit.vocabulary(), fit.idf(), components, dimensions);
  }

  /**
   * Embeds one tokenized text. Output always has {@link #getDimensions()} entries, zero-padded
   * past the fitted rank, and is unit length or zero.
   */
  public EmbeddingVector embed(List<String> tokens) {
    Map<Integer, Double> row = TfidfVectorizer.transform(tokens, vocabularyIndex, idf);
    double[] padded = new double[dimensions];
    if (!row.isEmpty()) {
      double[] projected = TruncatedSvdProjector.project(row, components);
      System.arraycopy(projected, 0, padded, 0, projected.length);
    }
    return EmbeddingVector.normalized(padded, EmbeddingMethod.FALLBACK);
  }

  public List<String> getVocabulary() {
    return vocabulary;
  }

  public double[] getIdf() {
    return idf.clone();
  }

  public double[][] getComponents() {
    return deepCopy(components);
  }

  public int getDimensions() {
    return dimensions;
  }

  @JsonIgnore
  public String getFingerprint() {
    return fingerprint;
  }

  /** Number of SVD components actually fitted; at most the output dimensionality. */
  @JsonIgnore
  public int getRank() {
    return components.length;
  }

  private String computeFingerprint() {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      digest.update(ByteBuffer.allocate(4).putInt(dimensions).array());
      for (String term : vocabulary) {
        digest.update(term.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
      }
      ByteBuffer buffer = ByteBuffer.allocate(8);
      for (double weight : idf) {
        digest.update(buffer.clear().putDouble(weight).array());
      }
      for (double[] component : components) {
        for (double loading : component) {
          digest.update(buffer.clear().putDouble(loading).array());
        }
      }
      return HexFormat.of().formatHex(digest.digest());
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private static double[][] deepCopy(double[][] source) {
    double[][] copy = new double[source.length][];
    for (int i = 0; i < source.length; i++) {
      copy[i] = source[i].clone();
    }
    return copy;
  }
}
