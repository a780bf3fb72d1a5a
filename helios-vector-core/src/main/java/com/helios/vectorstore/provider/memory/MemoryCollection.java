/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.provider.memory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.helios.vectorstore.api.model.CollectionConfig;
import com.helios.vectorstore.api.model.CollectionInfo;
import com.helios.vectorstore.api.model.IndexConfig;
import com.helios.vectorstore.api.model.IndexInfo;
import com.helios.vectorstore.api.model.VectorData;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * One named collection: a Caffeine cache of vectors keyed by id plus index descriptors.
 *
 * <p>Per-vector TTLs are honored through a variable {@link Expiry}; vectors without
 * a TTL never expire. When the size bound is reached Caffeine evicts by its usual
 * frequency/recency policy.
 */
final class MemoryCollection {

    private static final Logger logger = Logger.getLogger(MemoryCollection.class.getName());

    private static final long BYTES_PER_COMPONENT = Float.BYTES;
    private static final long ENTRY_OVERHEAD_BYTES = 64;

    private final CollectionConfig config;
    private final Instant createdAt;
    private volatile Instant updatedAt;
    private final Cache<String, VectorData> vectors;
    private final Map<String, IndexInfo> indexes = new ConcurrentHashMap<>();

    MemoryCollection(CollectionConfig config, long maxVectors, Instant createdAt) {
        this.config = config;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.vectors = Caffeine.newBuilder()
                .maximumSize(maxVectors)
                .expireAfter(new TtlExpiry())
                .removalListener((String key, VectorData value, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        logger.fine(String.format("Vector %s evicted from %s: %s", key, config.name(), cause));
                    }
                })
                .build();
    }

    CollectionConfig config() {
        return config;
    }

    String name() {
        return config.name();
    }

    Instant createdAt() {
        return createdAt;
    }

    int dimension() {
        return config.dimension();
    }

    void put(VectorData vector) {
        if (config.dimension() > 0 && vector.dimension() != config.dimension()) {
            throw new IllegalArgumentException(String.format(
                    "Vector %s has dimension %d, collection %s expects %d",
                    vector.id(), vector.dimension(), config.name(), config.dimension()));
        }
        vectors.put(vector.id(), vector.inCollection(config.name()));
        touch();
    }

    VectorData get(String id) {
        return vectors.getIfPresent(id);
    }

    boolean remove(String id) {
        boolean present = vectors.asMap().remove(id) != null;
        if (present) {
            touch();
        }
        return present;
    }

    List<VectorData> snapshot() {
        return new ArrayList<>(vectors.asMap().values());
    }

    long size() {
        return vectors.estimatedSize();
    }

    long sizeBytes() {
        long total = 0;
        for (VectorData vector : vectors.asMap().values()) {
            total += vector.dimension() * BYTES_PER_COMPONENT + ENTRY_OVERHEAD_BYTES;
        }
        return total;
    }

    void cleanUp() {
        vectors.cleanUp();
    }

    void clear() {
        vectors.invalidateAll();
        touch();
    }

    IndexInfo addIndex(IndexConfig index) {
        Instant now = Instant.now();
        IndexInfo info = new IndexInfo(index.name(), index.type() != null ? index.type() : "flat", "ready",
                now, now, index.parameters());
        if (indexes.putIfAbsent(index.name(), info) != null) {
            throw new IllegalStateException(String.format(
                    "Index %s already exists on collection %s", index.name(), config.name()));
        }
        touch();
        return info;
    }

    boolean removeIndex(String indexName) {
        return indexes.remove(indexName) != null;
    }

    List<IndexInfo> indexes() {
        return List.copyOf(indexes.values());
    }

    List<IndexConfig> indexConfigs() {
        List<IndexConfig> configs = new ArrayList<>();
        for (IndexInfo info : indexes.values()) {
            configs.add(new IndexConfig(info.name(), info.type(), config.metric(), info.parameters()));
        }
        return configs;
    }

    CollectionInfo info() {
        cleanUp();
        return new CollectionInfo(config.name(), config.dimension(), config.metric(), size(), sizeBytes(),
                "ready", createdAt, updatedAt, config.properties());
    }

    private void touch() {
        updatedAt = Instant.now();
    }

    private static final class TtlExpiry implements Expiry<String, VectorData> {

        @Override
        public long expireAfterCreate(String key, VectorData value, long currentTime) {
            return nanosFor(value.ttl());
        }

        @Override
        public long expireAfterUpdate(String key, VectorData value, long currentTime, long currentDuration) {
            return nanosFor(value.ttl());
        }

        @Override
        public long expireAfterRead(String key, VectorData value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private static long nanosFor(Duration ttl) {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                return Long.MAX_VALUE;
            }
            try {
                return ttl.toNanos();
            } catch (ArithmeticException e) {
                return Long.MAX_VALUE;
            }
        }
    }
}
