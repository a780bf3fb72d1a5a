/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * A similarity query.
 *
 * <p>Either {@code embedding} or {@code text} must be present; backends that cannot
 * embed text reject text-only queries.
 */
public record VectorQuery(
        float[] embedding,
        String text,
        String collection,
        String namespace,
        int topK,
        double threshold,
        boolean includeVector,
        Map<String, Object> filters
) {

    public static final int DEFAULT_TOP_K = 10;

    public VectorQuery {
        if ((embedding == null || embedding.length == 0) && (text == null || text.isBlank())) {
            throw new IllegalArgumentException("Query requires an embedding or text");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive: " + topK);
        }
        embedding = embedding != null ? embedding.clone() : null;
        filters = filters != null ? Map.copyOf(filters) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public float[] embedding() {
        return embedding != null ? embedding.clone() : null;
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VectorQuery other)) {
            return false;
        }
        return topK == other.topK
                && Double.compare(threshold, other.threshold) == 0
                && includeVector == other.includeVector
                && Arrays.equals(embedding, other.embedding)
                && Objects.equals(text, other.text)
                && Objects.equals(collection, other.collection)
                && Objects.equals(namespace, other.namespace)
                && filters.equals(other.filters);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(text, collection, namespace, topK, threshold, includeVector, filters)
                + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return String.format("VectorQuery{collection=%s, topK=%d, threshold=%.3f, filters=%s}",
                collection, topK, threshold, filters.keySet());
    }

    public static final class Builder {
        private float[] embedding;
        private String text;
        private String collection;
        private String namespace;
        private int topK = DEFAULT_TOP_K;
        private double threshold;
        private boolean includeVector;
        private Map<String, Object> filters;

        private Builder() {
        }

        public Builder embedding(float[] embedding) {
            this.embedding = embedding;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder collection(String collection) {
            this.collection = collection;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder topK(int topK) {
            this.topK = topK;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder includeVector(boolean includeVector) {
            this.includeVector = includeVector;
            return this;
        }

        public Builder filters(Map<String, Object> filters) {
            this.filters = filters;
            return this;
        }

        public VectorQuery build() {
            return new VectorQuery(embedding, text, collection, namespace, topK, threshold, includeVector, filters);
        }
    }
}
