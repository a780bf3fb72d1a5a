/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Requested index on a collection.
 *
 * @param type backend index kind, e.g. {@code flat}, {@code hnsw}, {@code ivf_flat}
 */
public record IndexConfig(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("metric") String metric,
        @JsonProperty("parameters") Map<String, Object> parameters
) {

    public IndexConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Index name cannot be null or blank");
        }
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }
}
