/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single vector with its payload.
 *
 * <p>Identifiers are unique within a collection and embeddings are fixed-length
 * per collection. Both are backend-enforced; this type only rejects a missing id.
 *
 * @param id         caller-supplied identifier
 * @param embedding  vector components
 * @param metadata   free-form payload
 * @param collection target collection, or {@code null} for the backend default
 * @param namespace  optional tenant/partition tag
 * @param timestamp  when the vector was produced
 * @param ttl        optional time to live, {@code null} for no expiry
 */
public record VectorData(
        @JsonProperty("id") String id,
        @JsonProperty("embedding") float[] embedding,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("collection") String collection,
        @JsonProperty("namespace") String namespace,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("ttl") Duration ttl
) {

    public VectorData {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Vector id cannot be null or blank");
        }
        embedding = embedding != null ? embedding.clone() : new float[0];
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static VectorData of(String id, float[] embedding, Map<String, Object> metadata) {
        return new VectorData(id, embedding, metadata, null, null, null, null);
    }

    public VectorData inCollection(String collectionName) {
        return new VectorData(id, embedding, metadata, collectionName, namespace, timestamp, ttl);
    }

    public VectorData withMetadata(Map<String, Object> newMetadata) {
        return new VectorData(id, embedding, newMetadata, collection, namespace, timestamp, ttl);
    }

    public VectorData withTtl(Duration timeToLive) {
        return new VectorData(id, embedding, metadata, collection, namespace, timestamp, timeToLive);
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    public int dimension() {
        return embedding.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VectorData other)) {
            return false;
        }
        return id.equals(other.id)
                && Arrays.equals(embedding, other.embedding)
                && metadata.equals(other.metadata)
                && Objects.equals(collection, other.collection)
                && Objects.equals(namespace, other.namespace)
                && timestamp.equals(other.timestamp)
                && Objects.equals(ttl, other.ttl);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, metadata, collection, namespace, timestamp, ttl);
        return 31 * result + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return String.format("VectorData{id=%s, dimension=%d, collection=%s, metadataKeys=%s}",
                id, embedding.length, collection, metadata.keySet());
    }
}
