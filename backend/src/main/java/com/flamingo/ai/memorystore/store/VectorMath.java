package com.flamingo.ai.memorystore.store;

import java.util.ArrayList;
import java.util.List;

/** Vector helpers shared by the store implementations and the embedding gateway. */
public final class VectorMath {

  private VectorMath() {}

  /**
   * Cosine distance ({@code 1 - cosine similarity}) between two vectors of equal length. A
   * zero-magnitude operand has no direction; it is treated as orthogonal (distance 1).
   */
  public static double cosineDistance(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "Vectors must have the same length: " + a.length + " vs " + b.length);
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return 1.0;
    }
    return 1.0 - dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  /** Returns true when every component is finite and at least one is non-zero. */
  public static boolean isUsable(float[] vector) {
    boolean nonZero = false;
    for (float f : vector) {
      if (!Float.isFinite(f)) {
        return false;
      }
      if (f != 0.0f) {
        nonZero = true;
      }
    }
    return nonZero;
  }

  /** Converts a float array to a boxed list (the Elasticsearch document representation). */
  public static List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  /** Converts a list of numbers back into a float array. */
  public static float[] toFloatArray(List<? extends Number> values) {
    float[] result = new float[values.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = values.get(i).floatValue();
    }
    return result;
  }
}
