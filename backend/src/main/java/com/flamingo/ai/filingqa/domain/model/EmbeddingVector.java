package com.flamingo.ai.filingqa.domain.model;

import com.flamingo.ai.filingqa.domain.enums.EmbeddingMethod;
import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-length embedding tagged with the method that produced it. Values are either unit length
 * or all zero.
 */
public record EmbeddingVector(float[] values, EmbeddingMethod method) {

  public EmbeddingVector {
    Objects.requireNonNull(values, "values");
    Objects.requireNonNull(method, "method");
  }

  public static EmbeddingVector zero(int dimensions, EmbeddingMethod method) {
    return new EmbeddingVector(new float[dimensions], method);
  }

  /**
   * L2-normalizes raw values. A vector with zero (or non-finite) norm becomes the zero vector.
   *
   * @param raw unnormalized values, left untouched
   * @param method method tag for the result
   */
  public static EmbeddingVector normalized(double[] raw, EmbeddingMethod method) {
    double sumSquares = 0.0;
    for (double value : raw) {
      sumSquares += value * value;
    }
    double norm = Math.sqrt(sumSquares);
    float[] values = new float[raw.length];
    if (norm > 0.0 && Double.isFinite(norm)) {
      for (int i = 0; i < raw.length; i++) {
        values[i] = (float) (raw[i] / norm);
      }
    }
    return new EmbeddingVector(values, method);
  }

  public int dimensions() {
    return values.length;
  }

  public boolean isZero() {
    for (float value : values) {
      if (value != 0.0f) {
        return false;
      }
    }
    return true;
  }

  public double norm() {
    double sumSquares = 0.0;
    for (float value : values) {
      sumSquares += (double) value * value;
    }
    return Math.sqrt(sumSquares);
  }

  /**
   * Dot product, which equals cosine similarity for unit vectors.
   *
   * @throws IllegalArgumentException when dimensions differ
   */
  public double dot(EmbeddingVector other) {
    if (other.values.length != values.length) {
      throw new IllegalArgumentException(
          "Dimension mismatch: " + values.length + " vs " + other.values.length);
    }
    double sum = 0.0;
    for (int i = 0; i < values.length; i++) {
      sum += (double) values[i] * other.values[i];
    }
    return sum;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof EmbeddingVector other
        && method == other.method
        && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(values) + method.hashCode();
  }

  @Override
  public String toString() {
    return "EmbeddingVector[method=" + method + ", dimensions=" + values.length + "]";
  }
}
