package com.cvtailor.ai.service.text;

import java.util.List;

public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity in [-1, 1]; 0 when either vector has zero length.
     *
     * @throws IllegalArgumentException on dimension mismatch
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.length + " vs " + b.length);
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
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Element-wise mean, used to pool chunk embeddings into one vector.
     */
    public static float[] mean(List<float[]> vectors) {
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot average zero vectors");
        }
        int dimensions = vectors.get(0).length;
        double[] sum = new double[dimensions];
        for (float[] vector : vectors) {
            if (vector.length != dimensions) {
                throw new IllegalArgumentException("Dimension mismatch: " + vector.length + " vs " + dimensions);
            }
            for (int i = 0; i < dimensions; i++) {
                sum[i] += vector[i];
            }
        }
        float[] mean = new float[dimensions];
        for (int i = 0; i < dimensions; i++) {
            mean[i] = (float) (sum[i] / vectors.size());
        }
        return mean;
    }

    public static boolean isFinite(float[] vector) {
        for (float v : vector) {
            if (!Float.isFinite(v)) {
                return false;
            }
        }
        return true;
    }
}
