/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api;

import com.helios.vectorstore.api.model.CollectionConfig;
import com.helios.vectorstore.api.model.CollectionInfo;
import com.helios.vectorstore.api.model.FallbackAttempt;
import com.helios.vectorstore.api.model.ProviderHealth;
import com.helios.vectorstore.api.model.ProviderInfo;
import com.helios.vectorstore.api.model.ProviderPerformanceStats;
import com.helios.vectorstore.api.model.SimilarityResult;
import com.helios.vectorstore.api.model.VectorData;
import com.helios.vectorstore.api.model.VectorQuery;
import com.helios.vectorstore.api.model.VectorSearchResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Application-facing facade over a set of named provider instances.
 *
 * <p>Exactly one instance is active at a time. Request operations go to the active
 * instance; health is polled in the background and only influences future
 * selection. Switching replaces the active pointer atomically and does not wait for
 * in-flight calls on the previous instance.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 * UNINITIALIZED -> INITIALIZING -> READY -> (SWITCHING)* -> SHUTTING_DOWN -> SHUT_DOWN
 * </pre>
 */
public interface IVectorProviderManager extends AutoCloseable {

    /**
     * Creates, initializes and starts every configured instance, selects the
     * active one and starts health polling.
     */
    void initialize(OperationContext ctx);

    void store(OperationContext ctx, List<VectorData> vectors);

    List<VectorData> retrieve(OperationContext ctx, List<String> ids);

    void update(OperationContext ctx, String id, VectorData vector);

    void delete(OperationContext ctx, List<String> ids);

    VectorSearchResult search(OperationContext ctx, VectorQuery query);

    List<SimilarityResult> findSimilar(OperationContext ctx, float[] embedding, int k, Map<String, Object> filters);

    List<List<SimilarityResult>> batchFindSimilar(OperationContext ctx, List<float[]> queries, int k);

    void createCollection(OperationContext ctx, String name, CollectionConfig config);

    void deleteCollection(OperationContext ctx, String name);

    List<CollectionInfo> listCollections(OperationContext ctx);

    CollectionInfo getCollection(OperationContext ctx, String name);

    /**
     * Makes {@code name} the active instance if it reports healthy right now.
     *
     * @throws com.helios.vectorstore.api.exceptions.ProviderNotFoundException  if no such instance
     * @throws com.helios.vectorstore.api.exceptions.ProviderUnhealthyException if it is not healthy
     */
    void switchProvider(OperationContext ctx, String name);

    Optional<String> getActiveProviderName();

    Optional<IVectorProvider> getProvider(String name);

    Map<String, ProviderInfo> listProviders();

    /**
     * Forces a fresh health query against every instance.
     */
    Map<String, ProviderHealth> getProviderHealth(OperationContext ctx);

    Map<String, ProviderPerformanceStats> getProviderPerformance();

    /**
     * Runs {@code optimize} on every instance. Failures are logged, not raised.
     */
    void optimizeProviders(OperationContext ctx);

    List<FallbackAttempt> fallbackHistory();

    /**
     * Stops health polling and every instance, then clears all state. Idempotent.
     */
    void shutdown(OperationContext ctx);

    @Override
    default void close() {
        shutdown(OperationContext.background());
    }
}
