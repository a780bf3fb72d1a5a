/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Requested shape of a new collection.
 *
 * @param metric similarity metric name, e.g. {@code cosine}, {@code l2}, {@code dot}
 */
public record CollectionConfig(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("dimension") int dimension,
        @JsonProperty("metric") String metric,
        @JsonProperty("properties") Map<String, Object> properties,
        @JsonProperty("replicas") int replicas,
        @JsonProperty("shards") int shards
) {

    public static final String DEFAULT_METRIC = "cosine";

    public CollectionConfig {
        if (dimension < 0) {
            throw new IllegalArgumentException("Dimension cannot be negative: " + dimension);
        }
        metric = metric != null ? metric : DEFAULT_METRIC;
        properties = properties != null ? Map.copyOf(properties) : Map.of();
    }

    public static CollectionConfig of(String name, int dimension, String metric) {
        return new CollectionConfig(name, null, dimension, metric, null, 1, 1);
    }
}
