/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api;

import com.helios.vectorstore.api.model.CollectionConfig;
import com.helios.vectorstore.api.model.CollectionInfo;
import com.helios.vectorstore.api.model.CostInfo;
import com.helios.vectorstore.api.model.HealthStatus;
import com.helios.vectorstore.api.model.IndexConfig;
import com.helios.vectorstore.api.model.IndexInfo;
import com.helios.vectorstore.api.model.ProviderStats;
import com.helios.vectorstore.api.model.SimilarityResult;
import com.helios.vectorstore.api.model.VectorData;
import com.helios.vectorstore.api.model.VectorQuery;
import com.helios.vectorstore.api.model.VectorSearchResult;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Capability contract every vector backend implements.
 *
 * <p>The orchestration layer (factory, fallback chain, hybrid router, manager) only
 * ever talks to backends through this interface, and composite providers implement
 * it themselves so they can be nested.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 * initialize(settings) -> start() -> [data / search / admin operations]* -> stop()
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IVectorProvider provider = factory.create("memory", Map.of("dimension", 3));
 * OperationContext ctx = OperationContext.background();
 * provider.initialize(ctx, settings);
 * provider.start(ctx);
 *
 * provider.store(ctx, List.of(VectorData.of("doc-1", new float[]{0.1f, 0.2f, 0.3f}, Map.of())));
 * List<SimilarityResult> hits = provider.findSimilar(ctx, new float[]{0.1f, 0.2f, 0.3f}, 5, Map.of());
 * }</pre>
 *
 * <h2>Errors</h2>
 * <p>Backends report failures by throwing unchecked exceptions. Callers must not
 * assume any particular subtype; composite providers pass them through unmodified.
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be safe for concurrent use once started.
 */
public interface IVectorProvider {

    // ----------------------------------------------------------------- lifecycle

    void initialize(OperationContext ctx, ProviderSettings settings);

    void start(OperationContext ctx);

    void stop(OperationContext ctx);

    /**
     * Queries current health. Implementations should not throw for a merely
     * unhealthy state; throwing signals the backend is unreachable.
     */
    HealthStatus health(OperationContext ctx);

    // ----------------------------------------------------------------- data

    void store(OperationContext ctx, List<VectorData> vectors);

    /**
     * Returns the vectors found for {@code ids}. Missing ids are skipped.
     */
    List<VectorData> retrieve(OperationContext ctx, List<String> ids);

    void update(OperationContext ctx, String id, VectorData vector);

    void delete(OperationContext ctx, List<String> ids);

    // ----------------------------------------------------------------- search

    VectorSearchResult search(OperationContext ctx, VectorQuery query);

    List<SimilarityResult> findSimilar(OperationContext ctx, float[] embedding, int k, Map<String, Object> filters);

    List<List<SimilarityResult>> batchFindSimilar(OperationContext ctx, List<float[]> queries, int k);

    // ----------------------------------------------------------------- collections & indexes

    void createCollection(OperationContext ctx, String name, CollectionConfig config);

    void deleteCollection(OperationContext ctx, String name);

    List<CollectionInfo> listCollections(OperationContext ctx);

    CollectionInfo getCollection(OperationContext ctx, String name);

    void createIndex(OperationContext ctx, String collection, IndexConfig config);

    void deleteIndex(OperationContext ctx, String collection, String indexName);

    List<IndexInfo> listIndexes(OperationContext ctx, String collection);

    // ----------------------------------------------------------------- metadata

    void addMetadata(OperationContext ctx, String id, Map<String, Object> metadata);

    void updateMetadata(OperationContext ctx, String id, Map<String, Object> metadata);

    /**
     * @return metadata keyed by vector id; ids that do not exist are absent
     */
    Map<String, Map<String, Object>> getMetadata(OperationContext ctx, List<String> ids);

    void deleteMetadata(OperationContext ctx, List<String> ids, List<String> keys);

    // ----------------------------------------------------------------- administration

    ProviderStats stats(OperationContext ctx);

    void optimize(OperationContext ctx);

    void backup(OperationContext ctx, String path);

    void restore(OperationContext ctx, String path);

    // ----------------------------------------------------------------- descriptive

    String name();

    String type();

    Set<String> capabilities();

    Map<String, Object> configuration();

    boolean isCloud();

    CostInfo costInfo();
}
