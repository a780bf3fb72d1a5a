/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.provider.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.helios.vectorstore.api.model.CollectionConfig;
import com.helios.vectorstore.api.model.IndexConfig;
import com.helios.vectorstore.api.model.VectorData;

import java.time.Instant;
import java.util.List;

/**
 * On-disk form of a memory provider backup.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record MemorySnapshot(
        @JsonProperty("format_version") int formatVersion,
        @JsonProperty("provider") String provider,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("collections") List<CollectionSnapshot> collections
) {

    static final int FORMAT_VERSION = 1;

    MemorySnapshot {
        collections = collections != null ? List.copyOf(collections) : List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CollectionSnapshot(
            @JsonProperty("config") CollectionConfig config,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("indexes") List<IndexConfig> indexes,
            @JsonProperty("vectors") List<VectorData> vectors
    ) {

        CollectionSnapshot {
            indexes = indexes != null ? List.copyOf(indexes) : List.of();
            vectors = vectors != null ? List.copyOf(vectors) : List.of();
        }
    }
}
