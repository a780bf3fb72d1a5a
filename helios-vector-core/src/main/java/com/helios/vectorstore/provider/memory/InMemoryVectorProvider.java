/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.provider.memory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.helios.vectorstore.api.IVectorProvider;
import com.helios.vectorstore.api.OperationContext;
import com.helios.vectorstore.api.ProviderCapabilities;
import com.helios.vectorstore.api.ProviderSettings;
import com.helios.vectorstore.api.exceptions.VectorProviderException;
import com.helios.vectorstore.api.model.CollectionConfig;
import com.helios.vectorstore.api.model.CollectionInfo;
import com.helios.vectorstore.api.model.CostInfo;
import com.helios.vectorstore.api.model.HealthState;
import com.helios.vectorstore.api.model.HealthStatus;
import com.helios.vectorstore.api.model.IndexConfig;
import com.helios.vectorstore.api.model.IndexInfo;
import com.helios.vectorstore.api.model.ProviderStats;
import com.helios.vectorstore.api.model.SearchResultItem;
import com.helios.vectorstore.api.model.SimilarityResult;
import com.helios.vectorstore.api.model.VectorData;
import com.helios.vectorstore.api.model.VectorQuery;
import com.helios.vectorstore.api.model.VectorSearchResult;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Logger;

/**
 * In-process vector backend built on Caffeine caches.
 *
 * <p>Each collection is one bounded cache of vectors keyed by id. Similarity search
 * is an exact scan over the target collection(s), so this backend suits tests,
 * development and small local corpora rather than large indexes. Contents live only
 * in memory; {@link #backup} and {@link #restore} write and read JSON snapshots.
 *
 * <h2>Settings</h2>
 * <ul>
 *   <li>{@code dimension} (integer, default 0): fixed dimension for auto-created
 *       collections; 0 adopts the first stored vector's dimension</li>
 *   <li>{@code metric} (string, default {@code cosine}): {@code cosine},
 *       {@code euclidean} or {@code dot}</li>
 *   <li>{@code default_collection} (string, default {@code default})</li>
 *   <li>{@code max_vectors_per_collection} (integer, default 100000)</li>
 * </ul>
 *
 * <p>Data, search, collection and metadata calls require the provider to be
 * started.
 */
public final class InMemoryVectorProvider implements IVectorProvider, AutoCloseable {

    private static final Logger logger = Logger.getLogger(InMemoryVectorProvider.class.getName());

    public static final String TYPE = "memory";

    public static final String DIMENSION_KEY = "dimension";
    public static final String METRIC_KEY = "metric";
    public static final String DEFAULT_COLLECTION_KEY = "default_collection";
    public static final String MAX_VECTORS_KEY = "max_vectors_per_collection";

    static final String DEFAULT_COLLECTION = "default";
    static final long DEFAULT_MAX_VECTORS = 100_000L;

    static final Set<String> CAPABILITIES = Set.of(
            ProviderCapabilities.VECTOR_STORAGE,
            ProviderCapabilities.SIMILARITY_SEARCH,
            ProviderCapabilities.METADATA_FILTERING,
            ProviderCapabilities.COLLECTIONS,
            ProviderCapabilities.INDEXING,
            ProviderCapabilities.BATCH_OPERATIONS,
            ProviderCapabilities.BACKUP,
            ProviderCapabilities.TTL,
            ProviderCapabilities.NAMESPACES);

    private enum State { CREATED, INITIALIZED, STARTED, STOPPED }

    private final ObjectMapper objectMapper;
    private final Map<String, MemoryCollection> collections = new ConcurrentHashMap<>();
    private final LongAdder totalOperations = new LongAdder();
    private final LongAdder failedOperations = new LongAdder();

    private volatile ProviderSettings settings;
    private volatile int dimension;
    private volatile String metric;
    private volatile String defaultCollection;
    private volatile long maxVectors;
    private volatile State state = State.CREATED;
    private volatile Instant startedAt;
    private volatile Instant lastOperation;

    public InMemoryVectorProvider(ProviderSettings settings) {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        apply(settings != null ? settings : ProviderSettings.of(TYPE, Map.of()));
    }

    private void apply(ProviderSettings newSettings) {
        int newDimension = newSettings.getInt(DIMENSION_KEY, 0);
        if (newDimension < 0) {
            throw new IllegalArgumentException("dimension cannot be negative: " + newDimension);
        }
        long newMaxVectors = newSettings.getLong(MAX_VECTORS_KEY, DEFAULT_MAX_VECTORS);
        if (newMaxVectors <= 0) {
            throw new IllegalArgumentException("max_vectors_per_collection must be positive: " + newMaxVectors);
        }
        String newMetric = VectorMath.normalizeMetric(newSettings.getString(METRIC_KEY, VectorMath.COSINE));
        String newDefault = newSettings.getString(DEFAULT_COLLECTION_KEY, DEFAULT_COLLECTION);
        if (newDefault.isBlank()) {
            throw new IllegalArgumentException("default_collection cannot be blank");
        }
        this.settings = newSettings;
        this.dimension = newDimension;
        this.maxVectors = newMaxVectors;
        this.metric = newMetric;
        this.defaultCollection = newDefault;
    }

    // ----------------------------------------------------------------- lifecycle

    @Override
    public void initialize(OperationContext ctx, ProviderSettings newSettings) {
        ctx.checkCancelled("initialize");
        if (newSettings != null) {
            try {
                apply(newSettings);
            } catch (IllegalArgumentException e) {
                throw new VectorProviderException("Invalid settings for memory provider " + name() + ": " + e.getMessage(), e);
            }
        }
        state = State.INITIALIZED;
        logger.info(String.format("Memory provider %s initialized: dimension=%d, metric=%s, maxVectors=%d",
                name(), dimension, metric, maxVectors));
    }

    @Override
    public void start(OperationContext ctx) {
        ctx.checkCancelled("start");
        if (state == State.CREATED) {
            throw new VectorProviderException("Memory provider " + name() + " must be initialized before start");
        }
        state = State.STARTED;
        startedAt = Instant.now();
        logger.info("Memory provider started: " + name());
    }

    @Override
    public void stop(OperationContext ctx) {
        if (state == State.STOPPED) {
            return;
        }
        state = State.STOPPED;
        logger.info("Memory provider stopped: " + name());
    }

    @Override
    public void close() {
        state = State.STOPPED;
        collections.values().forEach(MemoryCollection::clear);
        collections.clear();
    }

    @Override
    public HealthStatus health(OperationContext ctx) {
        long start = System.nanoTime();
        HealthStatus status = switch (state) {
            case CREATED -> HealthStatus.of(HealthState.NOT_INITIALIZED, "provider not initialized");
            case INITIALIZED -> HealthStatus.of(HealthState.NOT_STARTED, "provider not started");
            case STOPPED -> HealthStatus.of(HealthState.UNHEALTHY, "provider stopped");
            case STARTED -> new HealthStatus(HealthState.HEALTHY, "memory provider operational", Instant.now(),
                    Duration.ZERO, Map.of("vectors", (double) totalVectors(), "collections", (double) collections.size()),
                    Map.of());
        };
        return status.withResponseTime(Duration.ofNanos(System.nanoTime() - start));
    }

    // ----------------------------------------------------------------- data

    @Override
    public void store(OperationContext ctx, List<VectorData> vectors) {
        begin(ctx, "store");
        try {
            for (VectorData vector : vectors) {
                String target = vector.collection() != null ? vector.collection() : defaultCollection;
                collectionFor(target, vector.dimension()).put(vector);
            }
            logger.fine(() -> String.format("Stored %d vectors in %s", vectors.size(), name()));
        } catch (IllegalArgumentException e) {
            throw fail(new VectorProviderException(e.getMessage(), e));
        }
    }

    @Override
    public List<VectorData> retrieve(OperationContext ctx, List<String> ids) {
        begin(ctx, "retrieve");
        List<VectorData> found = new ArrayList<>();
        for (String id : ids) {
            VectorData vector = find(id);
            if (vector != null) {
                found.add(vector);
            }
        }
        return found;
    }

    @Override
    public void update(OperationContext ctx, String id, VectorData vector) {
        begin(ctx, "update");
        MemoryCollection owner = owner(id);
        if (owner == null) {
            throw fail(new VectorProviderException(String.format("Vector %s not found", id)));
        }
        VectorData replacement = new VectorData(id, vector.embedding(), vector.metadata(), owner.name(),
                vector.namespace(), vector.timestamp(), vector.ttl());
        try {
            owner.put(replacement);
        } catch (IllegalArgumentException e) {
            throw fail(new VectorProviderException(e.getMessage(), e));
        }
    }

    @Override
    public void delete(OperationContext ctx, List<String> ids) {
        begin(ctx, "delete");
        for (String id : ids) {
            for (MemoryCollection collection : collections.values()) {
                collection.remove(id);
            }
        }
    }

    // ----------------------------------------------------------------- search

    @Override
    public VectorSearchResult search(OperationContext ctx, VectorQuery query) {
        begin(ctx, "search");
        long start = System.nanoTime();
        if (!query.hasEmbedding()) {
            throw fail(new VectorProviderException("Memory provider " + name() + " does not embed text queries"));
        }
        float[] embedding = query.embedding();
        List<Scored> scored = new ArrayList<>();
        for (MemoryCollection collection : targets(query.collection())) {
            for (VectorData vector : collection.snapshot()) {
                if (query.namespace() != null && !query.namespace().equals(vector.namespace())) {
                    continue;
                }
                if (!VectorMath.matches(vector.metadata(), query.filters())) {
                    continue;
                }
                double[] result = scoreOrFail(embedding, vector);
                if (result[0] >= query.threshold()) {
                    scored.add(new Scored(vector, result[0], result[1]));
                }
            }
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());
        List<SearchResultItem> items = new ArrayList<>();
        for (Scored hit : scored.subList(0, Math.min(query.topK(), scored.size()))) {
            items.add(new SearchResultItem(hit.vector().id(), hit.score(), hit.distance(), hit.vector().metadata(),
                    query.includeVector() ? hit.vector().embedding() : null));
        }
        return new VectorSearchResult(items, scored.size(), query, Duration.ofNanos(System.nanoTime() - start),
                query.namespace());
    }

    @Override
    public List<SimilarityResult> findSimilar(OperationContext ctx, float[] embedding, int k, Map<String, Object> filters) {
        begin(ctx, "find_similar");
        return nearest(embedding, k, filters);
    }

    @Override
    public List<List<SimilarityResult>> batchFindSimilar(OperationContext ctx, List<float[]> queries, int k) {
        begin(ctx, "batch_find_similar");
        List<List<SimilarityResult>> results = new ArrayList<>(queries.size());
        for (float[] query : queries) {
            ctx.checkCancelled("batch_find_similar");
            results.add(nearest(query, k, Map.of()));
        }
        return results;
    }

    private List<SimilarityResult> nearest(float[] embedding, int k, Map<String, Object> filters) {
        if (k <= 0) {
            throw fail(new VectorProviderException("k must be positive: " + k));
        }
        List<Scored> scored = new ArrayList<>();
        for (MemoryCollection collection : collections.values()) {
            for (VectorData vector : collection.snapshot()) {
                if (VectorMath.matches(vector.metadata(), filters)) {
                    double[] result = scoreOrFail(embedding, vector);
                    scored.add(new Scored(vector, result[0], result[1]));
                }
            }
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());
        List<SimilarityResult> results = new ArrayList<>();
        for (Scored hit : scored.subList(0, Math.min(k, scored.size()))) {
            results.add(new SimilarityResult(hit.vector().id(), hit.score(), hit.distance(), hit.vector().metadata()));
        }
        return results;
    }

    private double[] scoreOrFail(float[] query, VectorData vector) {
        try {
            return VectorMath.score(metric, query, vector.embedding());
        } catch (IllegalArgumentException e) {
            throw fail(new VectorProviderException(e.getMessage(), e));
        }
    }

    private record Scored(VectorData vector, double score, double distance) {
    }

    // ----------------------------------------------------------------- collections & indexes

    @Override
    public void createCollection(OperationContext ctx, String collection, CollectionConfig config) {
        begin(ctx, "create_collection");
        CollectionConfig effective = config != null
                ? new CollectionConfig(collection, config.description(), config.dimension(),
                        VectorMath.normalizeMetric(config.metric()), config.properties(), config.replicas(), config.shards())
                : CollectionConfig.of(collection, dimension, metric);
        MemoryCollection created = new MemoryCollection(effective, maxVectors, Instant.now());
        if (collections.putIfAbsent(collection, created) != null) {
            throw fail(new VectorProviderException(String.format("Collection %s already exists", collection)));
        }
        logger.info(String.format("Collection %s created in %s (dimension=%d, metric=%s)",
                collection, name(), effective.dimension(), effective.metric()));
    }

    @Override
    public void deleteCollection(OperationContext ctx, String collection) {
        begin(ctx, "delete_collection");
        MemoryCollection removed = collections.remove(collection);
        if (removed == null) {
            throw fail(new VectorProviderException(String.format("Collection %s not found", collection)));
        }
        removed.clear();
        logger.info(String.format("Collection %s deleted from %s", collection, name()));
    }

    @Override
    public List<CollectionInfo> listCollections(OperationContext ctx) {
        begin(ctx, "list_collections");
        List<CollectionInfo> infos = new ArrayList<>();
        for (MemoryCollection collection : collections.values()) {
            infos.add(collection.info());
        }
        infos.sort(Comparator.comparing(CollectionInfo::name));
        return infos;
    }

    @Override
    public CollectionInfo getCollection(OperationContext ctx, String collection) {
        begin(ctx, "get_collection");
        return requireCollection(collection).info();
    }

    @Override
    public void createIndex(OperationContext ctx, String collection, IndexConfig config) {
        begin(ctx, "create_index");
        try {
            requireCollection(collection).addIndex(config);
        } catch (IllegalStateException e) {
            throw fail(new VectorProviderException(e.getMessage(), e));
        }
    }

    @Override
    public void deleteIndex(OperationContext ctx, String collection, String indexName) {
        begin(ctx, "delete_index");
        if (!requireCollection(collection).removeIndex(indexName)) {
            throw fail(new VectorProviderException(String.format(
                    "Index %s not found on collection %s", indexName, collection)));
        }
    }

    @Override
    public List<IndexInfo> listIndexes(OperationContext ctx, String collection) {
        begin(ctx, "list_indexes");
        return requireCollection(collection).indexes();
    }

    // ----------------------------------------------------------------- metadata

    /**
     * Merges {@code metadata} into the vector's existing metadata.
     */
    @Override
    public void addMetadata(OperationContext ctx, String id, Map<String, Object> metadata) {
        begin(ctx, "add_metadata");
        VectorData vector = requireVector(id);
        Map<String, Object> merged = new LinkedHashMap<>(vector.metadata());
        merged.putAll(metadata);
        owner(id).put(vector.withMetadata(merged));
    }

    /**
     * Replaces the vector's metadata with {@code metadata}.
     */
    @Override
    public void updateMetadata(OperationContext ctx, String id, Map<String, Object> metadata) {
        begin(ctx, "update_metadata");
        VectorData vector = requireVector(id);
        owner(id).put(vector.withMetadata(metadata));
    }

    @Override
    public Map<String, Map<String, Object>> getMetadata(OperationContext ctx, List<String> ids) {
        begin(ctx, "get_metadata");
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        for (String id : ids) {
            VectorData vector = find(id);
            if (vector != null) {
                result.put(id, vector.metadata());
            }
        }
        return result;
    }

    /**
     * Removes {@code keys} from each vector's metadata, or all metadata when
     * {@code keys} is empty. Unknown ids are ignored.
     */
    @Override
    public void deleteMetadata(OperationContext ctx, List<String> ids, List<String> keys) {
        begin(ctx, "delete_metadata");
        for (String id : ids) {
            MemoryCollection owner = owner(id);
            if (owner == null) {
                continue;
            }
            VectorData vector = owner.get(id);
            if (vector == null) {
                continue;
            }
            Map<String, Object> remaining = new LinkedHashMap<>(vector.metadata());
            if (keys == null || keys.isEmpty()) {
                remaining.clear();
            } else {
                keys.forEach(remaining::remove);
            }
            owner.put(vector.withMetadata(remaining));
        }
    }

    // ----------------------------------------------------------------- administration

    @Override
    public ProviderStats stats(OperationContext ctx) {
        ctx.checkCancelled("stats");
        long total = totalOperations.sum();
        long failed = failedOperations.sum();
        long sizeBytes = 0;
        for (MemoryCollection collection : collections.values()) {
            collection.cleanUp();
            sizeBytes += collection.sizeBytes();
        }
        Instant started = startedAt;
        Duration uptime = started != null && state == State.STARTED ? Duration.between(started, Instant.now()) : Duration.ZERO;
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(METRIC_KEY, metric);
        metadata.put(DEFAULT_COLLECTION_KEY, defaultCollection);
        return new ProviderStats(name(), TYPE, health(ctx).state(), total, total - failed, failed, Duration.ZERO,
                totalVectors(), collections.size(), sizeBytes, Instant.now(), lastOperation, failed, uptime,
                costInfo(), metadata);
    }

    /**
     * Purges expired vectors from every collection.
     */
    @Override
    public void optimize(OperationContext ctx) {
        ctx.checkCancelled("optimize");
        long before = totalVectors();
        collections.values().forEach(MemoryCollection::cleanUp);
        logger.info(String.format("Optimized %s: %d -> %d vectors", name(), before, totalVectors()));
    }

    @Override
    public void backup(OperationContext ctx, String path) {
        ctx.checkCancelled("backup");
        List<MemorySnapshot.CollectionSnapshot> snapshots = new ArrayList<>();
        for (MemoryCollection collection : collections.values()) {
            collection.cleanUp();
            snapshots.add(new MemorySnapshot.CollectionSnapshot(collection.config(), collection.createdAt(),
                    collection.indexConfigs(), collection.snapshot()));
        }
        MemorySnapshot snapshot = new MemorySnapshot(MemorySnapshot.FORMAT_VERSION, name(), Instant.now(), snapshots);
        Path target = Path.of(path);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(target)) {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, snapshot);
            }
        } catch (IOException e) {
            throw new VectorProviderException(String.format("Failed to back up %s to %s", name(), path), e);
        }
        logger.info(String.format("Backed up %s (%d collections) to %s", name(), snapshots.size(), path));
    }

    /**
     * Replaces all current contents with the snapshot at {@code path}.
     */
    @Override
    public void restore(OperationContext ctx, String path) {
        ctx.checkCancelled("restore");
        MemorySnapshot snapshot;
        try (InputStream in = Files.newInputStream(Path.of(path))) {
            snapshot = objectMapper.readValue(in, MemorySnapshot.class);
        } catch (IOException e) {
            throw new VectorProviderException(String.format("Failed to restore %s from %s", name(), path), e);
        }
        if (snapshot.formatVersion() != MemorySnapshot.FORMAT_VERSION) {
            throw new VectorProviderException(String.format(
                    "Unsupported snapshot format %d in %s", snapshot.formatVersion(), path));
        }
        Map<String, MemoryCollection> restored = new LinkedHashMap<>();
        for (MemorySnapshot.CollectionSnapshot saved : snapshot.collections()) {
            MemoryCollection collection = new MemoryCollection(saved.config(), maxVectors,
                    saved.createdAt() != null ? saved.createdAt() : Instant.now());
            saved.indexes().forEach(collection::addIndex);
            saved.vectors().forEach(collection::put);
            restored.put(collection.name(), collection);
        }
        collections.clear();
        collections.putAll(restored);
        logger.info(String.format("Restored %s from %s: %d collections, %d vectors",
                name(), path, restored.size(), totalVectors()));
    }

    // ----------------------------------------------------------------- descriptive

    @Override
    public String name() {
        return settings.instanceName();
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Set<String> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public Map<String, Object> configuration() {
        return settings.asMap();
    }

    @Override
    public boolean isCloud() {
        return false;
    }

    @Override
    public CostInfo costInfo() {
        return CostInfo.free();
    }

    // ----------------------------------------------------------------- internals

    private void begin(OperationContext ctx, String operation) {
        ctx.checkCancelled(operation);
        totalOperations.increment();
        lastOperation = Instant.now();
        if (state != State.STARTED) {
            throw fail(new VectorProviderException(String.format(
                    "Memory provider %s is not started (state=%s)", name(), state)));
        }
    }

    private VectorProviderException fail(VectorProviderException e) {
        failedOperations.increment();
        return e;
    }

    private MemoryCollection collectionFor(String collection, int vectorDimension) {
        return collections.computeIfAbsent(collection, key -> {
            int effective = dimension > 0 ? dimension : vectorDimension;
            logger.fine(() -> String.format("Auto-creating collection %s in %s", key, name()));
            return new MemoryCollection(CollectionConfig.of(key, effective, metric), maxVectors, Instant.now());
        });
    }

    private MemoryCollection requireCollection(String collection) {
        MemoryCollection found = collections.get(collection);
        if (found == null) {
            throw fail(new VectorProviderException(String.format("Collection %s not found", collection)));
        }
        return found;
    }

    private List<MemoryCollection> targets(String collection) {
        if (collection == null) {
            return new ArrayList<>(collections.values());
        }
        MemoryCollection found = collections.get(collection);
        return found != null ? List.of(found) : List.of();
    }

    private MemoryCollection owner(String id) {
        MemoryCollection preferred = collections.get(defaultCollection);
        if (preferred != null && preferred.get(id) != null) {
            return preferred;
        }
        for (MemoryCollection collection : collections.values()) {
            if (collection.get(id) != null) {
                return collection;
            }
        }
        return null;
    }

    private VectorData find(String id) {
        MemoryCollection owner = owner(id);
        return owner != null ? owner.get(id) : null;
    }

    private VectorData requireVector(String id) {
        VectorData vector = find(id);
        if (vector == null) {
            throw fail(new VectorProviderException(String.format("Vector %s not found", id)));
        }
        return vector;
    }

    private long totalVectors() {
        long total = 0;
        for (MemoryCollection collection : collections.values()) {
            total += collection.size();
        }
        return total;
    }

    @Override
    public String toString() {
        return String.format("InMemoryVectorProvider{name=%s, state=%s, collections=%d}", name(), state, collections.size());
    }
}
