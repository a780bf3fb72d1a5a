/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.monitoring;

import com.helios.vectorstore.api.IVectorProvider;
import com.helios.vectorstore.api.Operation;
import com.helios.vectorstore.api.OperationContext;
import com.helios.vectorstore.api.ProviderSettings;
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
import com.helios.vectorstore.infra.metrics.MetricsRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Pass-through decorator that times every capability call of one provider.
 *
 * <p>All calls, whatever the operation, feed a single {@link ProviderMetrics} record
 * for the wrapped instance. {@link #getMetrics()} returns a snapshot taken under the
 * same lock that guards updates, so readers never see a half-applied update.
 * Descriptive accessors such as {@link #name()} are not timed.
 *
 * <p>Each call is additionally published to the {@link MetricsRegistry} as
 * {@value #TIMER_NAME} and, on failure, {@value #ERROR_COUNTER_NAME}, tagged with
 * provider name and operation.
 *
 * <p>Exceptions from the wrapped provider are rethrown unmodified.
 */
public final class MonitoredVectorProvider implements IVectorProvider {

    public static final String TIMER_NAME = "vector_provider_operation";
    public static final String ERROR_COUNTER_NAME = "vector_provider_errors";

    private final IVectorProvider delegate;
    private final ProviderSettings settings;
    private final MetricsRegistry metricsRegistry;
    private final Object lock = new Object();
    private ProviderMetrics metrics = ProviderMetrics.EMPTY;

    public MonitoredVectorProvider(IVectorProvider delegate, MetricsRegistry metricsRegistry) {
        this(delegate, ProviderSettings.empty(), metricsRegistry);
    }

    /**
     * @param settings the validated settings {@code delegate} was constructed with
     */
    public MonitoredVectorProvider(IVectorProvider delegate, ProviderSettings settings, MetricsRegistry metricsRegistry) {
        if (delegate == null) {
            throw new IllegalArgumentException("Delegate provider cannot be null");
        }
        this.delegate = delegate;
        this.settings = settings != null ? settings : ProviderSettings.empty();
        this.metricsRegistry = metricsRegistry != null ? metricsRegistry : MetricsRegistry.getInstance();
    }

    public ProviderMetrics getMetrics() {
        synchronized (lock) {
            return metrics;
        }
    }

    public IVectorProvider delegate() {
        return delegate;
    }

    /**
     * Settings the wrapped provider was built with; empty when unknown.
     */
    public ProviderSettings settings() {
        return settings;
    }

    /**
     * Settings to initialize {@code provider} with: the ones it was built with when
     * it is a factory-built provider, otherwise {@code fallback}.
     */
    public static ProviderSettings settingsFor(IVectorProvider provider, ProviderSettings fallback) {
        if (provider instanceof MonitoredVectorProvider monitored && !monitored.settings.asMap().isEmpty()) {
            return monitored.settings;
        }
        return fallback;
    }

    private <T> T timed(Operation operation, Supplier<T> call) {
        long start = System.nanoTime();
        boolean success = false;
        try {
            T result = call.get();
            success = true;
            return result;
        } finally {
            record(operation, Duration.ofNanos(System.nanoTime() - start), success);
        }
    }

    private void timed(Operation operation, Runnable call) {
        timed(operation, () -> {
            call.run();
            return null;
        });
    }

    private void record(Operation operation, Duration elapsed, boolean success) {
        Instant now = Instant.now();
        synchronized (lock) {
            metrics = metrics.record(operation, elapsed, success, now);
        }
        String name = delegate.name();
        metricsRegistry.timer(TIMER_NAME, "provider", name, "operation", operation.key()).record(elapsed);
        if (!success) {
            metricsRegistry.counter(ERROR_COUNTER_NAME, "provider", name, "operation", operation.key()).increment();
        }
    }

    // ----------------------------------------------------------------- lifecycle

    @Override
    public void initialize(OperationContext ctx, ProviderSettings settings) {
        timed(Operation.INITIALIZE, () -> delegate.initialize(ctx, settings));
    }

    @Override
    public void start(OperationContext ctx) {
        timed(Operation.START, () -> delegate.start(ctx));
    }

    @Override
    public void stop(OperationContext ctx) {
        timed(Operation.STOP, () -> delegate.stop(ctx));
    }

    @Override
    public HealthStatus health(OperationContext ctx) {
        return timed(Operation.HEALTH, () -> delegate.health(ctx));
    }

    // ----------------------------------------------------------------- data

    @Override
    public void store(OperationContext ctx, List<VectorData> vectors) {
        timed(Operation.STORE, () -> delegate.store(ctx, vectors));
    }

    @Override
    public List<VectorData> retrieve(OperationContext ctx, List<String> ids) {
        return timed(Operation.RETRIEVE, () -> delegate.retrieve(ctx, ids));
    }

    @Override
    public void update(OperationContext ctx, String id, VectorData vector) {
        timed(Operation.UPDATE, () -> delegate.update(ctx, id, vector));
    }

    @Override
    public void delete(OperationContext ctx, List<String> ids) {
        timed(Operation.DELETE, () -> delegate.delete(ctx, ids));
    }

    // ----------------------------------------------------------------- search

    @Override
    public VectorSearchResult search(OperationContext ctx, VectorQuery query) {
        return timed(Operation.SEARCH, () -> delegate.search(ctx, query));
    }

    @Override
    public List<SimilarityResult> findSimilar(OperationContext ctx, float[] embedding, int k, Map<String, Object> filters) {
        return timed(Operation.FIND_SIMILAR, () -> delegate.findSimilar(ctx, embedding, k, filters));
    }

    @Override
    public List<List<SimilarityResult>> batchFindSimilar(OperationContext ctx, List<float[]> queries, int k) {
        return timed(Operation.BATCH_FIND_SIMILAR, () -> delegate.batchFindSimilar(ctx, queries, k));
    }

    // ----------------------------------------------------------------- collections & indexes

    @Override
    public void createCollection(OperationContext ctx, String name, CollectionConfig config) {
        timed(Operation.CREATE_COLLECTION, () -> delegate.createCollection(ctx, name, config));
    }

    @Override
    public void deleteCollection(OperationContext ctx, String name) {
        timed(Operation.DELETE_COLLECTION, () -> delegate.deleteCollection(ctx, name));
    }

    @Override
    public List<CollectionInfo> listCollections(OperationContext ctx) {
        return timed(Operation.LIST_COLLECTIONS, () -> delegate.listCollections(ctx));
    }

    @Override
    public CollectionInfo getCollection(OperationContext ctx, String name) {
        return timed(Operation.GET_COLLECTION, () -> delegate.getCollection(ctx, name));
    }

    @Override
    public void createIndex(OperationContext ctx, String collection, IndexConfig config) {
        timed(Operation.CREATE_INDEX, () -> delegate.createIndex(ctx, collection, config));
    }

    @Override
    public void deleteIndex(OperationContext ctx, String collection, String indexName) {
        timed(Operation.DELETE_INDEX, () -> delegate.deleteIndex(ctx, collection, indexName));
    }

    @Override
    public List<IndexInfo> listIndexes(OperationContext ctx, String collection) {
        return timed(Operation.LIST_INDEXES, () -> delegate.listIndexes(ctx, collection));
    }

    // ----------------------------------------------------------------- metadata

    @Override
    public void addMetadata(OperationContext ctx, String id, Map<String, Object> metadata) {
        timed(Operation.ADD_METADATA, () -> delegate.addMetadata(ctx, id, metadata));
    }

    @Override
    public void updateMetadata(OperationContext ctx, String id, Map<String, Object> metadata) {
        timed(Operation.UPDATE_METADATA, () -> delegate.updateMetadata(ctx, id, metadata));
    }

    @Override
    public Map<String, Map<String, Object>> getMetadata(OperationContext ctx, List<String> ids) {
        return timed(Operation.GET_METADATA, () -> delegate.getMetadata(ctx, ids));
    }

    @Override
    public void deleteMetadata(OperationContext ctx, List<String> ids, List<String> keys) {
        timed(Operation.DELETE_METADATA, () -> delegate.deleteMetadata(ctx, ids, keys));
    }

    // ----------------------------------------------------------------- administration

    @Override
    public ProviderStats stats(OperationContext ctx) {
        return timed(Operation.STATS, () -> delegate.stats(ctx));
    }

    @Override
    public void optimize(OperationContext ctx) {
        timed(Operation.OPTIMIZE, () -> delegate.optimize(ctx));
    }

    @Override
    public void backup(OperationContext ctx, String path) {
        timed(Operation.BACKUP, () -> delegate.backup(ctx, path));
    }

    @Override
    public void restore(OperationContext ctx, String path) {
        timed(Operation.RESTORE, () -> delegate.restore(ctx, path));
    }

    // ----------------------------------------------------------------- descriptive

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public String type() {
        return delegate.type();
    }

    @Override
    public Set<String> capabilities() {
        return delegate.capabilities();
    }

    @Override
    public Map<String, Object> configuration() {
        return delegate.configuration();
    }

    @Override
    public boolean isCloud() {
        return delegate.isCloud();
    }

    @Override
    public CostInfo costInfo() {
        return delegate.costInfo();
    }

    @Override
    public String toString() {
        return String.format("MonitoredVectorProvider{provider=%s, %s}", delegate.name(), getMetrics().format());
    }
}
