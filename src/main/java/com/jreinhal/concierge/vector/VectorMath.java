package com.jreinhal.concierge.vector;

import java.util.ArrayList;
import java.util.List;

/**
 * Norms here are squared sums, the form stored next to each embedding.
 */
public final class VectorMath {

    private VectorMath() {
    }

    public static double squaredNorm(float[] embedding) {
        if (embedding == null || embedding.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (float f : embedding) {
            sum += (double) f * (double) f;
        }
        return sum;
    }

    public static double squaredNorm(List<Double> embedding) {
        if (embedding == null || embedding.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (Double value : embedding) {
            if (value != null) {
                sum += value * value;
            }
        }
        return sum;
    }

    /**
     * Cosine similarity; 0 for empty, zero or mismatched vectors.
     */
    public static double cosine(float[] query, double queryNorm, List<Double> candidate, Double candidateNorm) {
        if (query == null || candidate == null || query.length == 0 || query.length != candidate.size()) {
            return 0.0;
        }
        double norm = candidateNorm != null ? candidateNorm : squaredNorm(candidate);
        if (queryNorm == 0.0 || norm == 0.0) {
            return 0.0;
        }
        double dot = 0.0;
        for (int i = 0; i < query.length; ++i) {
            Double value = candidate.get(i);
            dot += value != null ? query[i] * value : 0.0;
        }
        return dot / (Math.sqrt(queryNorm) * Math.sqrt(norm));
    }

    public static List<Double> toList(float[] embedding) {
        List<Double> values = new ArrayList<>(embedding.length);
        for (float f : embedding) {
            values.add((double) f);
        }
        return values;
    }
}
