/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.composition;

import com.helios.vectorstore.api.IVectorProvider;
import com.helios.vectorstore.api.Operation;
import com.helios.vectorstore.api.OperationContext;
import com.helios.vectorstore.api.ProviderSettings;
import com.helios.vectorstore.api.exceptions.AllProvidersExhaustedException;
import com.helios.vectorstore.api.exceptions.OperationCancelledException;
import com.helios.vectorstore.api.model.CollectionConfig;
import com.helios.vectorstore.api.model.CollectionInfo;
import com.helios.vectorstore.api.model.CostInfo;
import com.helios.vectorstore.api.model.FallbackAttempt;
import com.helios.vectorstore.api.model.HealthState;
import com.helios.vectorstore.api.model.HealthStatus;
import com.helios.vectorstore.api.model.IndexConfig;
import com.helios.vectorstore.api.model.IndexInfo;
import com.helios.vectorstore.api.model.ProviderStats;
import com.helios.vectorstore.api.model.SimilarityResult;
import com.helios.vectorstore.api.model.VectorData;
import com.helios.vectorstore.api.model.VectorQuery;
import com.helios.vectorstore.api.model.VectorSearchResult;
import com.helios.vectorstore.monitoring.MonitoredVectorProvider;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ordered list of providers tried in turn until one succeeds.
 *
 * <p>The chain keeps a <em>current</em> index. Data, search, collection, index and
 * metadata calls scan members starting at the position given by the
 * {@link FallbackPolicy}; the first member that succeeds serves the call. Under
 * {@link FallbackPolicy#STICKY} every failure moves the current index past the
 * failed member and it never moves back on its own, so an exhausted chain fails
 * immediately until {@link #reset()} or {@link #recheck(OperationContext)}.
 *
 * <p>Lifecycle and administration calls are applied to every member in order and
 * stop at the first failure. Health, stats and descriptive accessors report the
 * current member; {@link #capabilities()} is the union over all members.
 *
 * <p>Every call in which at least one member failed is appended to a bounded
 * {@link FallbackAttempt} history, oldest entries evicted first.
 *
 * <h2>Thread Safety</h2>
 * <p>The current index is an {@link AtomicInteger} that STICKY scans only ever
 * raise. History is guarded by its own monitor.
 */
public final class FallbackChain implements IVectorProvider {

    private static final Logger logger = Logger.getLogger(FallbackChain.class.getName());

    public static final String DEFAULT_NAME = "provider_chain";
    public static final String TYPE = "fallback_chain";
    public static final int DEFAULT_HISTORY_CAPACITY = 100;

    private final String name;
    private final List<IVectorProvider> members;
    private final FallbackPolicy policy;
    private final int historyCapacity;
    private final AtomicInteger current = new AtomicInteger();
    private final Deque<FallbackAttempt> history = new ArrayDeque<>();

    public FallbackChain(List<? extends IVectorProvider> members) {
        this(DEFAULT_NAME, members, FallbackPolicy.STICKY, DEFAULT_HISTORY_CAPACITY);
    }

    public FallbackChain(List<? extends IVectorProvider> members, FallbackPolicy policy) {
        this(DEFAULT_NAME, members, policy, DEFAULT_HISTORY_CAPACITY);
    }

    public FallbackChain(String name, List<? extends IVectorProvider> members, FallbackPolicy policy, int historyCapacity) {
        if (members == null) {
            throw new IllegalArgumentException("Chain members cannot be null");
        }
        if (historyCapacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive: " + historyCapacity);
        }
        this.name = name == null || name.isBlank() ? DEFAULT_NAME : name;
        this.members = List.copyOf(members);
        this.policy = policy != null ? policy : FallbackPolicy.STICKY;
        this.historyCapacity = historyCapacity;
    }

    public List<IVectorProvider> members() {
        return members;
    }

    public FallbackPolicy policy() {
        return policy;
    }

    /**
     * Index of the member calls currently start from (STICKY) or that served the
     * last call (RETRY_FROM_FIRST). Equal to {@code members().size()} once a STICKY
     * chain is exhausted.
     */
    public int currentIndex() {
        return current.get();
    }

    public Optional<IVectorProvider> currentMember() {
        int index = current.get();
        return index < members.size() ? Optional.of(members.get(index)) : Optional.empty();
    }

    public boolean isExhausted() {
        return current.get() >= members.size();
    }

    /**
     * Moves the current index back to the first member.
     */
    public void reset() {
        int previous = current.getAndSet(0);
        if (previous != 0) {
            logger.info(String.format("Fallback chain %s reset from index %d", name, previous));
        }
    }

    /**
     * Queries every member's health and makes the first healthy one current.
     *
     * @return the new current index, or -1 if no member is healthy (index unchanged)
     */
    public int recheck(OperationContext ctx) {
        for (int i = 0; i < members.size(); i++) {
            ctx.checkCancelled("recheck");
            IVectorProvider member = members.get(i);
            try {
                if (member.health(ctx).isHealthy()) {
                    int previous = current.getAndSet(i);
                    if (previous != i) {
                        logger.info(String.format("Fallback chain %s rechecked: current %d -> %d (%s)",
                                name, previous, i, member.name()));
                    }
                    return i;
                }
            } catch (RuntimeException e) {
                logger.log(Level.FINE, "Health check failed for chain member " + member.name(), e);
            }
        }
        logger.warning(String.format("Fallback chain %s recheck found no healthy member", name));
        return -1;
    }

    /**
     * @return recorded attempts, oldest first
     */
    public List<FallbackAttempt> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    // ----------------------------------------------------------------- fallback core

    private <T> T withFallback(OperationContext ctx, Operation operation, Function<IVectorProvider, T> call) {
        long startNanos = System.nanoTime();
        int from = policy == FallbackPolicy.STICKY ? current.get() : 0;
        List<String> tried = new ArrayList<>();
        List<AllProvidersExhaustedException.Failure> failures = new ArrayList<>();

        for (int i = from; i < members.size(); i++) {
            if (ctx.isCancelled() && !failures.isEmpty()) {
                recordAttempt(operation, tried, -1, failures, startNanos);
            }
            ctx.checkCancelled(operation.key());
            IVectorProvider member = members.get(i);
            tried.add(member.name());
            try {
                T result = call.apply(member);
                if (policy == FallbackPolicy.RETRY_FROM_FIRST) {
                    current.set(i);
                }
                if (!failures.isEmpty()) {
                    recordAttempt(operation, tried, tried.size() - 1, failures, startNanos);
                }
                return result;
            } catch (OperationCancelledException e) {
                // caller gave up; the member stays eligible
                if (!failures.isEmpty()) {
                    recordAttempt(operation, tried, -1, failures, startNanos);
                }
                throw e;
            } catch (RuntimeException e) {
                failures.add(new AllProvidersExhaustedException.Failure(member.name(), e));
                if (policy == FallbackPolicy.STICKY) {
                    current.accumulateAndGet(i + 1, Math::max);
                }
                logger.warning(String.format("Chain member %s failed to %s, trying next: %s",
                        member.name(), operation.key(), e.getMessage()));
            }
        }

        if (!failures.isEmpty()) {
            recordAttempt(operation, tried, -1, failures, startNanos);
        }
        throw new AllProvidersExhaustedException(operation.key(), failures);
    }

    private void runWithFallback(OperationContext ctx, Operation operation, Consumer<IVectorProvider> call) {
        withFallback(ctx, operation, member -> {
            call.accept(member);
            return null;
        });
    }

    private void recordAttempt(Operation operation, List<String> tried, int successIndex,
                               List<AllProvidersExhaustedException.Failure> failures, long startNanos) {
        List<String> errors = new ArrayList<>(failures.size());
        for (AllProvidersExhaustedException.Failure failure : failures) {
            errors.add(failure.describe());
        }
        FallbackAttempt attempt = new FallbackAttempt(Instant.now(), operation.key(), tried, successIndex,
                errors, Duration.ofNanos(System.nanoTime() - startNanos));
        synchronized (history) {
            if (history.size() >= historyCapacity) {
                history.removeFirst();
            }
            history.addLast(attempt);
        }
    }

    private void forEachMember(Consumer<IVectorProvider> call) {
        for (IVectorProvider member : members) {
            call.accept(member);
        }
    }

    private IVectorProvider requireCurrent(Operation operation) {
        return currentMember()
                .orElseThrow(() -> new AllProvidersExhaustedException(operation.key(), List.of()));
    }

    // ----------------------------------------------------------------- lifecycle

    @Override
    public void initialize(OperationContext ctx, ProviderSettings settings) {
        forEachMember(member -> member.initialize(ctx, MonitoredVectorProvider.settingsFor(member, settings)));
        logger.info(String.format("Fallback chain %s initialized with %d members (%s)", name, members.size(), policy));
    }

    @Override
    public void start(OperationContext ctx) {
        forEachMember(member -> member.start(ctx));
    }

    @Override
    public void stop(OperationContext ctx) {
        forEachMember(member -> member.stop(ctx));
    }

    @Override
    public HealthStatus health(OperationContext ctx) {
        Optional<IVectorProvider> member = currentMember();
        if (member.isEmpty()) {
            return HealthStatus.of(HealthState.UNHEALTHY, "no active providers in chain " + name);
        }
        return member.get().health(ctx);
    }

    // ----------------------------------------------------------------- data

    @Override
    public void store(OperationContext ctx, List<VectorData> vectors) {
        runWithFallback(ctx, Operation.STORE, member -> member.store(ctx, vectors));
    }

    @Override
    public List<VectorData> retrieve(OperationContext ctx, List<String> ids) {
        return withFallback(ctx, Operation.RETRIEVE, member -> member.retrieve(ctx, ids));
    }

    @Override
    public void update(OperationContext ctx, String id, VectorData vector) {
        runWithFallback(ctx, Operation.UPDATE, member -> member.update(ctx, id, vector));
    }

    @Override
    public void delete(OperationContext ctx, List<String> ids) {
        runWithFallback(ctx, Operation.DELETE, member -> member.delete(ctx, ids));
    }

    // ----------------------------------------------------------------- search

    @Override
    public VectorSearchResult search(OperationContext ctx, VectorQuery query) {
        return withFallback(ctx, Operation.SEARCH, member -> member.search(ctx, query));
    }

    @Override
    public List<SimilarityResult> findSimilar(OperationContext ctx, float[] embedding, int k, Map<String, Object> filters) {
        return withFallback(ctx, Operation.FIND_SIMILAR, member -> member.findSimilar(ctx, embedding, k, filters));
    }

    @Override
    public List<List<SimilarityResult>> batchFindSimilar(OperationContext ctx, List<float[]> queries, int k) {
        return withFallback(ctx, Operation.BATCH_FIND_SIMILAR, member -> member.batchFindSimilar(ctx, queries, k));
    }

    // ----------------------------------------------------------------- collections & indexes

    @Override
    public void createCollection(OperationContext ctx, String collection, CollectionConfig config) {
        runWithFallback(ctx, Operation.CREATE_COLLECTION,
                member -> member.createCollection(ctx, collection, config));
    }

    @Override
    public void deleteCollection(OperationContext ctx, String collection) {
        runWithFallback(ctx, Operation.DELETE_COLLECTION,
                member -> member.deleteCollection(ctx, collection));
    }

    @Override
    public List<CollectionInfo> listCollections(OperationContext ctx) {
        return withFallback(ctx, Operation.LIST_COLLECTIONS, member -> member.listCollections(ctx));
    }

    @Override
    public CollectionInfo getCollection(OperationContext ctx, String collection) {
        return withFallback(ctx, Operation.GET_COLLECTION, member -> member.getCollection(ctx, collection));
    }

    @Override
    public void createIndex(OperationContext ctx, String collection, IndexConfig config) {
        runWithFallback(ctx, Operation.CREATE_INDEX,
                member -> member.createIndex(ctx, collection, config));
    }

    @Override
    public void deleteIndex(OperationContext ctx, String collection, String indexName) {
        runWithFallback(ctx, Operation.DELETE_INDEX,
                member -> member.deleteIndex(ctx, collection, indexName));
    }

    @Override
    public List<IndexInfo> listIndexes(OperationContext ctx, String collection) {
        return withFallback(ctx, Operation.LIST_INDEXES, member -> member.listIndexes(ctx, collection));
    }

    // ----------------------------------------------------------------- metadata

    @Override
    public void addMetadata(OperationContext ctx, String id, Map<String, Object> metadata) {
        runWithFallback(ctx, Operation.ADD_METADATA,
                member -> member.addMetadata(ctx, id, metadata));
    }

    @Override
    public void updateMetadata(OperationContext ctx, String id, Map<String, Object> metadata) {
        runWithFallback(ctx, Operation.UPDATE_METADATA,
                member -> member.updateMetadata(ctx, id, metadata));
    }

    @Override
    public Map<String, Map<String, Object>> getMetadata(OperationContext ctx, List<String> ids) {
        return withFallback(ctx, Operation.GET_METADATA, member -> member.getMetadata(ctx, ids));
    }

    @Override
    public void deleteMetadata(OperationContext ctx, List<String> ids, List<String> keys) {
        runWithFallback(ctx, Operation.DELETE_METADATA,
                member -> member.deleteMetadata(ctx, ids, keys));
    }

    // ----------------------------------------------------------------- administration

    @Override
    public ProviderStats stats(OperationContext ctx) {
        return requireCurrent(Operation.STATS).stats(ctx);
    }

    @Override
    public void optimize(OperationContext ctx) {
        forEachMember(member -> member.optimize(ctx));
    }

    @Override
    public void backup(OperationContext ctx, String path) {
        forEachMember(member -> member.backup(ctx, path));
    }

    @Override
    public void restore(OperationContext ctx, String path) {
        forEachMember(member -> member.restore(ctx, path));
    }

    // ----------------------------------------------------------------- descriptive

    @Override
    public String name() {
        return name;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Set<String> capabilities() {
        Set<String> union = new LinkedHashSet<>();
        for (IVectorProvider member : members) {
            union.addAll(member.capabilities());
        }
        return Set.copyOf(union);
    }

    @Override
    public Map<String, Object> configuration() {
        return currentMember().map(IVectorProvider::configuration).orElse(Map.of());
    }

    @Override
    public boolean isCloud() {
        return currentMember().map(IVectorProvider::isCloud).orElse(false);
    }

    @Override
    public CostInfo costInfo() {
        return currentMember().map(IVectorProvider::costInfo).orElse(CostInfo.free());
    }

    @Override
    public String toString() {
        return String.format("FallbackChain{name=%s, members=%d, current=%d, policy=%s}",
                name, members.size(), current.get(), policy);
    }
}
