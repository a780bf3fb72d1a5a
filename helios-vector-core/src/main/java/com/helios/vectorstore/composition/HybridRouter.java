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
import com.helios.vectorstore.api.exceptions.VectorProviderException;
import com.helios.vectorstore.api.model.CollectionConfig;
import com.helios.vectorstore.api.model.CollectionInfo;
import com.helios.vectorstore.api.model.CostInfo;
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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Routes each call to exactly one of several named member providers.
 *
 * <p>Members are keyed by role ({@code "primary"}, {@code "search"}, ...) and kept
 * in insertion order. The member serving a call is chosen by the configured
 * {@link HybridStrategy}:
 * <ul>
 *   <li>{@code FAILOVER}: always the first member</li>
 *   <li>{@code ROUND_ROBIN} / {@code LOAD_BALANCE}: a shared counter advanced on
 *       every selection, whether or not the call then succeeds</li>
 *   <li>{@code OPERATION_BASED}: the role mapped to the {@link Operation}, else the
 *       default role, else the first member</li>
 * </ul>
 *
 * <p>Unlike {@link FallbackChain}, a failed call is not retried on another member.
 */
public final class HybridRouter implements IVectorProvider {

    private static final Logger logger = Logger.getLogger(HybridRouter.class.getName());

    public static final String TYPE = "hybrid";

    private final Map<String, IVectorProvider> members;
    private final List<String> roles;
    private final HybridRouting routing;
    private final AtomicLong counter = new AtomicLong();

    public HybridRouter(Map<String, ? extends IVectorProvider> members, HybridRouting routing) {
        if (members == null) {
            throw new IllegalArgumentException("Hybrid members cannot be null");
        }
        this.members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
        this.roles = List.copyOf(this.members.keySet());
        this.routing = routing != null ? routing : HybridRouting.of(HybridStrategy.FAILOVER);
        validateRoutes();
    }

    public HybridRouter(Map<String, ? extends IVectorProvider> members, HybridStrategy strategy) {
        this(members, HybridRouting.of(strategy));
    }

    private void validateRoutes() {
        for (Map.Entry<Operation, String> route : routing.routes().entrySet()) {
            if (!members.containsKey(route.getValue())) {
                throw new IllegalArgumentException(String.format(
                        "Route for %s references unknown role %s", route.getKey(), route.getValue()));
            }
        }
        String defaultRole = routing.defaultRole();
        if (defaultRole != null && !members.containsKey(defaultRole)) {
            throw new IllegalArgumentException("Default role references unknown role " + defaultRole);
        }
    }

    public Map<String, IVectorProvider> members() {
        return members;
    }

    public HybridRouting routing() {
        return routing;
    }

    public HybridStrategy strategy() {
        return routing.strategy();
    }

    /**
     * Selects the member that serves {@code operation}. Round-robin strategies
     * advance the shared counter on every call to this method.
     *
     * @throws AllProvidersExhaustedException if the router has no members
     */
    public IVectorProvider select(Operation operation) {
        if (roles.isEmpty()) {
            throw new AllProvidersExhaustedException(operation.key(), List.of());
        }
        String role = roleFor(operation);
        logger.fine(() -> String.format("Hybrid %s routed %s to %s", name(), operation.key(), role));
        return members.get(role);
    }

    private String roleFor(Operation operation) {
        switch (routing.strategy()) {
            case ROUND_ROBIN:
            case LOAD_BALANCE:
                long ticket = counter.getAndIncrement();
                return roles.get((int) Math.floorMod(ticket, (long) roles.size()));
            case OPERATION_BASED:
                String routed = routing.routes().get(operation);
                if (routed == null) {
                    routed = routing.defaultRole();
                }
                return routed != null ? routed : roles.get(0);
            default:
                return roles.get(0);
        }
    }

    private void applyToAll(String action, Consumer<IVectorProvider> call) {
        List<String> errors = new ArrayList<>();
        List<RuntimeException> causes = new ArrayList<>();
        for (Map.Entry<String, IVectorProvider> entry : members.entrySet()) {
            try {
                call.accept(entry.getValue());
            } catch (RuntimeException e) {
                errors.add(String.format("%s: %s", entry.getKey(), e.getMessage()));
                causes.add(e);
            }
        }
        if (!errors.isEmpty()) {
            VectorProviderException failure = new VectorProviderException(
                    String.format("Errors %s providers: %s", action, String.join("; ", errors)));
            causes.forEach(failure::addSuppressed);
            throw failure;
        }
    }

    // ----------------------------------------------------------------- lifecycle

    @Override
    public void initialize(OperationContext ctx, ProviderSettings settings) {
        applyToAll("initializing",
                member -> member.initialize(ctx, MonitoredVectorProvider.settingsFor(member, settings)));
        logger.info(String.format("Hybrid router %s initialized with roles %s", name(), roles));
    }

    @Override
    public void start(OperationContext ctx) {
        applyToAll("starting", member -> member.start(ctx));
    }

    @Override
    public void stop(OperationContext ctx) {
        applyToAll("stopping", member -> member.stop(ctx));
    }

    @Override
    public HealthStatus health(OperationContext ctx) {
        long start = System.nanoTime();
        List<String> problems = new ArrayList<>();
        Map<String, String> dependencies = new LinkedHashMap<>();
        for (Map.Entry<String, IVectorProvider> entry : members.entrySet()) {
            String role = entry.getKey();
            try {
                HealthStatus status = entry.getValue().health(ctx);
                dependencies.put(role, status.state().name());
                if (!status.isHealthy()) {
                    problems.add(String.format("%s: unhealthy (%s)", role, status.message()));
                }
            } catch (RuntimeException e) {
                dependencies.put(role, HealthState.UNREACHABLE.name());
                problems.add(String.format("%s: unhealthy (%s)", role, e.getMessage()));
            }
        }
        HealthState state = problems.isEmpty() ? HealthState.HEALTHY : HealthState.DEGRADED;
        String message = problems.isEmpty() ? "All providers healthy" : String.join("; ", problems);
        return new HealthStatus(state, message, Instant.now(), Duration.ofNanos(System.nanoTime() - start),
                Map.of(), dependencies);
    }

    // ----------------------------------------------------------------- data

    @Override
    public void store(OperationContext ctx, List<VectorData> vectors) {
        select(Operation.STORE).store(ctx, vectors);
    }

    @Override
    public List<VectorData> retrieve(OperationContext ctx, List<String> ids) {
        return select(Operation.RETRIEVE).retrieve(ctx, ids);
    }

    @Override
    public void update(OperationContext ctx, String id, VectorData vector) {
        select(Operation.UPDATE).update(ctx, id, vector);
    }

    @Override
    public void delete(OperationContext ctx, List<String> ids) {
        select(Operation.DELETE).delete(ctx, ids);
    }

    // ----------------------------------------------------------------- search

    @Override
    public VectorSearchResult search(OperationContext ctx, VectorQuery query) {
        return select(Operation.SEARCH).search(ctx, query);
    }

    @Override
    public List<SimilarityResult> findSimilar(OperationContext ctx, float[] embedding, int k, Map<String, Object> filters) {
        return select(Operation.FIND_SIMILAR).findSimilar(ctx, embedding, k, filters);
    }

    @Override
    public List<List<SimilarityResult>> batchFindSimilar(OperationContext ctx, List<float[]> queries, int k) {
        return select(Operation.BATCH_FIND_SIMILAR).batchFindSimilar(ctx, queries, k);
    }

    // ----------------------------------------------------------------- collections & indexes

    @Override
    public void createCollection(OperationContext ctx, String collection, CollectionConfig config) {
        select(Operation.CREATE_COLLECTION).createCollection(ctx, collection, config);
    }

    @Override
    public void deleteCollection(OperationContext ctx, String collection) {
        select(Operation.DELETE_COLLECTION).deleteCollection(ctx, collection);
    }

    @Override
    public List<CollectionInfo> listCollections(OperationContext ctx) {
        return select(Operation.LIST_COLLECTIONS).listCollections(ctx);
    }

    @Override
    public CollectionInfo getCollection(OperationContext ctx, String collection) {
        return select(Operation.GET_COLLECTION).getCollection(ctx, collection);
    }

    @Override
    public void createIndex(OperationContext ctx, String collection, IndexConfig config) {
        select(Operation.CREATE_INDEX).createIndex(ctx, collection, config);
    }

    @Override
    public void deleteIndex(OperationContext ctx, String collection, String indexName) {
        select(Operation.DELETE_INDEX).deleteIndex(ctx, collection, indexName);
    }

    @Override
    public List<IndexInfo> listIndexes(OperationContext ctx, String collection) {
        return select(Operation.LIST_INDEXES).listIndexes(ctx, collection);
    }

    // ----------------------------------------------------------------- metadata

    @Override
    public void addMetadata(OperationContext ctx, String id, Map<String, Object> metadata) {
        select(Operation.ADD_METADATA).addMetadata(ctx, id, metadata);
    }

    @Override
    public void updateMetadata(OperationContext ctx, String id, Map<String, Object> metadata) {
        select(Operation.UPDATE_METADATA).updateMetadata(ctx, id, metadata);
    }

    @Override
    public Map<String, Map<String, Object>> getMetadata(OperationContext ctx, List<String> ids) {
        return select(Operation.GET_METADATA).getMetadata(ctx, ids);
    }

    @Override
    public void deleteMetadata(OperationContext ctx, List<String> ids, List<String> keys) {
        select(Operation.DELETE_METADATA).deleteMetadata(ctx, ids, keys);
    }

    // ----------------------------------------------------------------- administration

    @Override
    public ProviderStats stats(OperationContext ctx) {
        return select(Operation.STATS).stats(ctx);
    }

    @Override
    public void optimize(OperationContext ctx) {
        select(Operation.OPTIMIZE).optimize(ctx);
    }

    @Override
    public void backup(OperationContext ctx, String path) {
        select(Operation.BACKUP).backup(ctx, path);
    }

    @Override
    public void restore(OperationContext ctx, String path) {
        select(Operation.RESTORE).restore(ctx, path);
    }

    // ----------------------------------------------------------------- descriptive

    @Override
    public String name() {
        return String.format("Hybrid(%s)", routing.strategy().name().toLowerCase(Locale.ROOT));
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Set<String> capabilities() {
        Set<String> union = new LinkedHashSet<>();
        for (IVectorProvider member : members.values()) {
            union.addAll(member.capabilities());
        }
        return Set.copyOf(union);
    }

    @Override
    public Map<String, Object> configuration() {
        Map<String, Object> perRole = new LinkedHashMap<>();
        members.forEach((role, member) -> perRole.put(role, member.configuration()));
        Map<String, Object> configuration = new LinkedHashMap<>();
        configuration.put("strategy", routing.strategy().name().toLowerCase(Locale.ROOT));
        configuration.put("providers", perRole);
        return Collections.unmodifiableMap(configuration);
    }

    @Override
    public boolean isCloud() {
        for (IVectorProvider member : members.values()) {
            if (member.isCloud()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public CostInfo costInfo() {
        CostInfo total = CostInfo.free();
        for (IVectorProvider member : members.values()) {
            CostInfo cost = member.costInfo();
            if (cost != null) {
                total = total.plus(cost);
            }
        }
        return total;
    }

    @Override
    public String toString() {
        return String.format("HybridRouter{strategy=%s, roles=%s}", routing.strategy(), roles);
    }
}
