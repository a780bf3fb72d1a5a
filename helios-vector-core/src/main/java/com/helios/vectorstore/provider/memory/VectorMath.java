/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.provider.memory;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Similarity scoring and metadata filter matching for the brute-force memory backend.
 */
final class VectorMath {

    static final String COSINE = "cosine";
    static final String EUCLIDEAN = "euclidean";
    static final String DOT = "dot";

    private VectorMath() {
        throw new AssertionError("No instances");
    }

    /**
     * Score and distance of {@code candidate} against {@code query}. Higher scores
     * are closer for every metric.
     *
     * @return {@code [score, distance]}
     */
    static double[] score(String metric, float[] query, float[] candidate) {
        if (query.length != candidate.length) {
            throw new IllegalArgumentException(String.format(
                    "Dimension mismatch: query has %d components, vector has %d", query.length, candidate.length));
        }
        switch (normalizeMetric(metric)) {
            case EUCLIDEAN: {
                double distance = euclidean(query, candidate);
                return new double[]{1.0 / (1.0 + distance), distance};
            }
            case DOT: {
                double dot = dot(query, candidate);
                return new double[]{dot, -dot};
            }
            default: {
                double cosine = cosine(query, candidate);
                return new double[]{cosine, 1.0 - cosine};
            }
        }
    }

    static String normalizeMetric(String metric) {
        if (metric == null) {
            return COSINE;
        }
        String key = metric.trim().toLowerCase(Locale.ROOT);
        switch (key) {
            case "l2":
            case EUCLIDEAN:
                return EUCLIDEAN;
            case "ip":
            case "dot_product":
            case DOT:
                return DOT;
            case COSINE:
                return COSINE;
            default:
                throw new IllegalArgumentException("Unsupported metric: " + metric);
        }
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    static double dot(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    static double euclidean(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double diff = (double) a[i] - b[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    /**
     * Every filter entry must match. A collection-valued filter matches if the
     * metadata value equals any element; numbers compare by value.
     */
    static boolean matches(Map<String, Object> metadata, Map<String, Object> filters) {
        if (filters == null || filters.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Object> filter : filters.entrySet()) {
            Object actual = metadata.get(filter.getKey());
            Object expected = filter.getValue();
            if (expected instanceof Collection<?> options) {
                boolean any = false;
                for (Object option : options) {
                    if (valueEquals(actual, option)) {
                        any = true;
                        break;
                    }
                }
                if (!any) {
                    return false;
                }
            } else if (!valueEquals(actual, expected)) {
                return false;
            }
        }
        return true;
    }

    private static boolean valueEquals(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        return Objects.equals(actual, expected);
    }
}
