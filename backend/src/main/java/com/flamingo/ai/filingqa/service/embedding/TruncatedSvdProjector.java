package com.flamingo.ai.filingqa.service.embedding;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;

/**
 * Linear dimensionality reduction of TF-IDF rows by truncated SVD.
 *
 * <p>Components are the leading right singular vectors of the document-term matrix, clipped to
 * its numeric rank. Each component is sign-normalized so that its largest-magnitude loading is
 * positive, which keeps the projection deterministic across refits of the same corpus.
 */
final class TruncatedSvdProjector {

  private static final double RANK_TOLERANCE = 1e-10;

  private TruncatedSvdProjector() {}

  /**
   * Computes up to {@code maxComponents} components.
   *
   * @param rows sparse TF-IDF rows
   * @param vocabularySize number of columns
   * @param maxComponents target dimensionality
   * @return {@code k x vocabularySize} component matrix with {@code k <= maxComponents}
   */
  static double[][] fitComponents(
      List<Map<Integer, Double>> rows, int vocabularySize, int maxComponents) {
    if (rows.isEmpty() || vocabularySize == 0 || maxComponents <= 0) {
      return new double[0][vocabularySize];
    }

    DMatrixRMaj matrix = new DMatrixRMaj(rows.size(), vocabularySize);
    for (int r = 0; r < rows.size(); r++) {
      for (Map.Entry<Integer, Double> cell : rows.get(r).entrySet()) {
        matrix.set(r, cell.getKey(), cell.getValue());
      }
    }

    SingularValueDecomposition_F64<DMatrixRMaj> svd =
        DecompositionFactory_DDRM.svd(rows.size(), vocabularySize, false, true, true);
    if (!svd.decompose(matrix)) {
      throw new IllegalStateException("SVD of the TF-IDF matrix did not converge");
    }

    double[] singularValues = svd.getSingularValues();
    int count = svd.numberOfSingularValues();
    double largest = IntStream.range(0, count).mapToDouble(i -> singularValues[i]).max().orElse(0);
    if (largest <= 0.0) {
      return new double[0][vocabularySize];
    }

    int[] order =
        IntStream.range(0, count)
            .boxed()
            .filter(i -> singularValues[i] > largest * RANK_TOLERANCE)
            .sorted(Comparator.comparingDouble((Integer i) -> singularValues[i]).reversed())
            .limit(maxComponents)
            .mapToInt(Integer::intValue)
            .toArray();

    // Rows of V^T are the right singular vectors.
    DMatrixRMaj vt = svd.getV(null, true);
    boolean rowMajor = vt.getNumCols() == vocabularySize;

    double[][] components = new double[order.length][vocabularySize];
    for (int k = 0; k < order.length; k++) {
      int source = order[k];
      for (int c = 0; c < vocabularySize; c++) {
        components[k][c] = rowMajor ? vt.get(source, c) : vt.get(c, source);
      }
      flipSign(components[k]);
    }
    return components;
  }

  /**
   * Projects a sparse row onto the components.
   *
   * @return one coordinate per component
   */
  static double[] project(Map<Integer, Double> row, double[][] components) {
    double[] projected = new double[components.length];
    for (int k = 0; k < components.length; k++) {
      double sum = 0.0;
      for (Map.Entry<Integer, Double> cell : row.entrySet()) {
        sum += cell.getValue() * components[k][cell.getKey()];
      }
      projected[k] = sum;
    }
    return projected;
  }

  private static void flipSign(double[] component) {
    int strongest = 0;
    for (int i = 1; i < component.length; i++) {
      if (Math.abs(component[i]) > Math.abs(component[strongest])) {
        strongest = i;
      }
    }
    if (component.length > 0 && component[strongest] < 0) {
      for (int i = 0; i < component.length; i++) {
        component[i] = -component[i];
      }
    }
  }
}
