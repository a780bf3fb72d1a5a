/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.management;

import com.helios.vectorstore.api.IVectorProvider;
import com.helios.vectorstore.api.IVectorProviderManager;
import com.helios.vectorstore.api.Operation;
import com.helios.vectorstore.api.OperationContext;
import com.helios.vectorstore.api.exceptions.NoActiveProviderException;
import com.helios.vectorstore.api.exceptions.OperationCancelledException;
import com.helios.vectorstore.api.exceptions.ProviderNotFoundException;
import com.helios.vectorstore.api.exceptions.ProviderOperationException;
import com.helios.vectorstore.api.exceptions.ProviderUnhealthyException;
import com.helios.vectorstore.api.exceptions.VectorProviderException;
import com.helios.vectorstore.api.model.CollectionConfig;
import com.helios.vectorstore.api.model.CollectionInfo;
import com.helios.vectorstore.api.model.FallbackAttempt;
import com.helios.vectorstore.api.model.HealthState;
import com.helios.vectorstore.api.model.HealthStatus;
import com.helios.vectorstore.api.model.ProviderHealth;
import com.helios.vectorstore.api.model.ProviderInfo;
import com.helios.vectorstore.api.model.ProviderPerformanceStats;
import com.helios.vectorstore.api.model.SimilarityResult;
import com.helios.vectorstore.api.model.VectorData;
import com.helios.vectorstore.api.model.VectorQuery;
import com.helios.vectorstore.api.model.VectorSearchResult;
import com.helios.vectorstore.composition.FallbackChain;
import com.helios.vectorstore.composition.HybridRouter;
import com.helios.vectorstore.config.ProviderSpec;
import com.helios.vectorstore.config.VectorProviderConfig;
import com.helios.vectorstore.factory.ProviderFactory;
import com.helios.vectorstore.infra.metrics.MetricsRegistry;
import com.helios.vectorstore.infra.telemetry.TracingService;
import com.helios.vectorstore.monitoring.MonitoredVectorProvider;
import com.helios.vectorstore.registry.ProviderRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the configured provider instances and exposes them to the application as one
 * uniform surface.
 *
 * <p><b>Active instance:</b> request operations go to exactly one active instance,
 * chosen at {@link #initialize} from configuration or by automatic selection (local
 * before cloud, first healthy wins). {@link #switchProvider} replaces it atomically
 * after a fresh health check. In-flight calls on the previous instance are not
 * drained.
 *
 * <p><b>Health:</b> when enabled, a daemon task polls every instance at the
 * configured interval. Results update the health table and the
 * {@code vector_provider_healthy} gauge; they never switch the active instance.
 *
 * <p><b>Concurrency:</b> instance map, health table and active pointer are guarded
 * by a {@link ReentrantReadWriteLock}. Request paths hold the read lock only while
 * resolving the active instance; backend and health calls are made with no lock held.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (VectorProviderManager manager = new VectorProviderManager(VectorProviderConfig.loadDefault())) {
 *     manager.initialize(OperationContext.background());
 *     manager.store(ctx, vectors);
 *     List<SimilarityResult> hits = manager.findSimilar(ctx, embedding, 10, Map.of());
 * }
 * }</pre>
 */
public final class VectorProviderManager implements IVectorProviderManager {

    private static final Logger logger = Logger.getLogger(VectorProviderManager.class.getName());

    static final String HEALTH_GAUGE = "vector_provider_healthy";
    private static final Duration EXECUTOR_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final VectorProviderConfig config;
    private final ProviderFactory factory;
    private final Tracer tracer;
    private final MetricsRegistry metricsRegistry;
    private final PerformanceMonitor performance;
    private final AtomicReference<ManagerState> state = new AtomicReference<>(ManagerState.UNINITIALIZED);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    // guarded by lock
    private final Map<String, MonitoredVectorProvider> providers = new LinkedHashMap<>();
    private final Map<String, ProviderHealth> health = new LinkedHashMap<>();
    private final Map<String, Instant> startedAt = new LinkedHashMap<>();
    private String activeName;
    private FallbackChain fallbackChain;
    private HybridRouter hybridRouter;
    private ScheduledExecutorService healthExecutor;

    public VectorProviderManager(VectorProviderConfig config) {
        this(config,
                new ProviderFactory(ProviderRegistry.defaultRegistry(), config.factoryConfig()),
                TracingService.getInstance().getTracer(),
                MetricsRegistry.getInstance());
    }

    public VectorProviderManager(VectorProviderConfig config, ProviderFactory factory, Tracer tracer,
                                 MetricsRegistry metricsRegistry) {
        if (config == null) {
            throw new IllegalArgumentException("Manager configuration cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("Provider factory cannot be null");
        }
        this.config = config;
        this.factory = factory;
        this.tracer = tracer != null ? tracer : TracingService.noop().getTracer();
        this.metricsRegistry = metricsRegistry != null ? metricsRegistry : MetricsRegistry.getInstance();
        this.performance = new PerformanceMonitor(config.alertThresholds(), this.metricsRegistry);
    }

    public ManagerState state() {
        return state.get();
    }

    // ----------------------------------------------------------------- initialization

    @Override
    public void initialize(OperationContext ctx) {
        if (!state.compareAndSet(ManagerState.UNINITIALIZED, ManagerState.INITIALIZING)) {
            throw new IllegalStateException("Manager cannot be initialized in state " + state.get());
        }

        Span span = tracer.spanBuilder("initialize").startSpan();
        Map<String, MonitoredVectorProvider> created = new LinkedHashMap<>();
        Map<String, Instant> started = new LinkedHashMap<>();
        try (Scope scope = span.makeCurrent()) {
            Map<String, ProviderSpec> enabled = config.enabledProviders();
            span.setAttribute("providers.configured", enabled.size());

            for (Map.Entry<String, ProviderSpec> entry : enabled.entrySet()) {
                ctx.checkCancelled("initialize");
                ensureStillInitializing();
                String name = entry.getKey();
                MonitoredVectorProvider provider = factory.create(name, entry.getValue());
                created.put(name, provider);
                provider.initialize(ctx, provider.settings());
                provider.start(ctx);
                started.put(name, Instant.now());
                span.addEvent("provider started: " + name);
                logger.info(String.format("Provider %s (%s) initialized and started", name, entry.getValue().type()));
            }

            FallbackChain chain = buildFallbackChain(created);
            HybridRouter router = buildHybridRouter(created);

            Map<String, ProviderHealth> initialHealth = new LinkedHashMap<>();
            String active = selectActive(ctx, created, started, initialHealth);

            // READY is published under the same write lock shutdown() clears state under
            lock.writeLock().lock();
            try {
                if (!state.compareAndSet(ManagerState.INITIALIZING, ManagerState.READY)) {
                    throw new IllegalStateException("Manager initialization aborted: state changed to " + state.get());
                }
                providers.putAll(created);
                startedAt.putAll(started);
                health.putAll(initialHealth);
                activeName = active;
                fallbackChain = chain;
                hybridRouter = router;
                startHealthChecks();
            } finally {
                lock.writeLock().unlock();
            }

            span.setAttribute("provider.active", active != null ? active : "");
            logger.info(String.format("Vector provider manager ready: %d providers, active=%s", created.size(), active));
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "initialization failed");
            logger.log(Level.SEVERE, "Vector provider manager initialization failed; stopping started providers", e);
            stopQuietly(ctx, started.keySet(), created);
            state.compareAndSet(ManagerState.INITIALIZING, ManagerState.UNINITIALIZED);
            throw e;
        } finally {
            span.end();
        }
    }

    private void ensureStillInitializing() {
        ManagerState current = state.get();
        if (current != ManagerState.INITIALIZING) {
            throw new IllegalStateException("Manager initialization aborted: state changed to " + current);
        }
    }

    private FallbackChain buildFallbackChain(Map<String, MonitoredVectorProvider> created) {
        if (config.fallbackOrder().isEmpty()) {
            return null;
        }
        List<IVectorProvider> members = new ArrayList<>();
        for (String name : config.fallbackOrder()) {
            MonitoredVectorProvider member = created.get(name);
            if (member != null) {
                members.add(member);
            } else {
                logger.warning("Fallback order skips disabled provider " + name);
            }
        }
        return new FallbackChain(FallbackChain.DEFAULT_NAME, members, config.fallbackPolicy(),
                FallbackChain.DEFAULT_HISTORY_CAPACITY);
    }

    private HybridRouter buildHybridRouter(Map<String, MonitoredVectorProvider> created) {
        if (config.hybridRoles().isEmpty()) {
            return null;
        }
        Map<String, IVectorProvider> members = new LinkedHashMap<>();
        config.hybridRoles().forEach((role, name) -> {
            MonitoredVectorProvider member = created.get(name);
            if (member != null) {
                members.put(role, member);
            } else {
                logger.warning(String.format("Hybrid role %s skips disabled provider %s", role, name));
            }
        });
        try {
            return new HybridRouter(members, config.hybridRouting());
        } catch (IllegalArgumentException e) {
            throw new VectorProviderException("Invalid hybrid configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Explicit configuration wins if that instance is healthy; otherwise local
     * instances are tried before cloud ones, each in configuration order.
     */
    private String selectActive(OperationContext ctx, Map<String, MonitoredVectorProvider> created,
                                Map<String, Instant> started, Map<String, ProviderHealth> results) {
        if (created.isEmpty()) {
            logger.warning("No enabled providers configured; manager starts without an active provider");
            return null;
        }

        String configured = config.activeProvider();
        if (configured != null) {
            MonitoredVectorProvider candidate = created.get(configured);
            if (candidate == null) {
                logger.warning(String.format("Configured active provider %s is not enabled; selecting automatically", configured));
            } else {
                ProviderHealth result = check(ctx, candidate, started.get(configured), ProviderHealth.unknown());
                results.put(configured, result);
                if (result.healthy()) {
                    return configured;
                }
                logger.warning(String.format("Configured active provider %s is %s; selecting automatically",
                        configured, result.status()));
            }
        }

        List<String> ordered = new ArrayList<>();
        created.forEach((name, provider) -> {
            if (!provider.isCloud()) {
                ordered.add(name);
            }
        });
        created.forEach((name, provider) -> {
            if (provider.isCloud()) {
                ordered.add(name);
            }
        });

        for (String name : ordered) {
            ProviderHealth result = results.get(name);
            if (result == null) {
                result = check(ctx, created.get(name), started.get(name), ProviderHealth.unknown());
                results.put(name, result);
            }
            if (result.healthy()) {
                logger.info(String.format("Auto-selected active provider %s", name));
                return name;
            }
        }

        String fallback = created.keySet().iterator().next();
        logger.warning(String.format("No provider reported healthy; starting degraded with %s", fallback));
        return fallback;
    }

    private void startHealthChecks() {
        if (!config.healthCheckEnabled()) {
            return;
        }
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "vector-provider-health");
            t.setDaemon(true);
            return t;
        });
        long intervalMillis = config.healthCheckInterval().toMillis();
        executor.scheduleAtFixedRate(this::runScheduledHealthCheck, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        lock.writeLock().lock();
        try {
            healthExecutor = executor;
        } finally {
            lock.writeLock().unlock();
        }
        logger.info(String.format("Health checks scheduled every %s", config.healthCheckInterval()));
    }

    // ----------------------------------------------------------------- request path

    private <T> T call(OperationContext ctx, Operation operation, Function<IVectorProvider, T> invocation) {
        ctx.checkCancelled(operation.key());
        String name;
        IVectorProvider provider;
        lock.readLock().lock();
        try {
            name = activeName;
            provider = name != null ? providers.get(name) : null;
        } finally {
            lock.readLock().unlock();
        }
        if (provider == null) {
            throw new NoActiveProviderException(name == null
                    ? "No active provider (manager state " + state.get() + ")"
                    : "Active provider " + name + " is no longer registered");
        }

        long start = System.nanoTime();
        try {
            T result = invocation.apply(provider);
            performance.record(name, operation, Duration.ofNanos(System.nanoTime() - start), true);
            return result;
        } catch (OperationCancelledException e) {
            logger.fine(() -> String.format("Caller cancelled %s on %s", operation.key(), name));
            throw e;
        } catch (RuntimeException e) {
            performance.record(name, operation, Duration.ofNanos(System.nanoTime() - start), false);
            throw new ProviderOperationException(name, operation.key(), e);
        }
    }

    private void run(OperationContext ctx, Operation operation, Consumer<IVectorProvider> invocation) {
        call(ctx, operation, provider -> {
            invocation.accept(provider);
            return null;
        });
    }

    @Override
    public void store(OperationContext ctx, List<VectorData> vectors) {
        run(ctx, Operation.STORE, provider -> provider.store(ctx, vectors));
    }

    @Override
    public List<VectorData> retrieve(OperationContext ctx, List<String> ids) {
        return call(ctx, Operation.RETRIEVE, provider -> provider.retrieve(ctx, ids));
    }

    @Override
    public void update(OperationContext ctx, String id, VectorData vector) {
        run(ctx, Operation.UPDATE, provider -> provider.update(ctx, id, vector));
    }

    @Override
    public void delete(OperationContext ctx, List<String> ids) {
        run(ctx, Operation.DELETE, provider -> provider.delete(ctx, ids));
    }

    @Override
    public VectorSearchResult search(OperationContext ctx, VectorQuery query) {
        return call(ctx, Operation.SEARCH, provider -> provider.search(ctx, query));
    }

    @Override
    public List<SimilarityResult> findSimilar(OperationContext ctx, float[] embedding, int k, Map<String, Object> filters) {
        return call(ctx, Operation.FIND_SIMILAR, provider -> provider.findSimilar(ctx, embedding, k, filters));
    }

    @Override
    public List<List<SimilarityResult>> batchFindSimilar(OperationContext ctx, List<float[]> queries, int k) {
        return call(ctx, Operation.BATCH_FIND_SIMILAR, provider -> provider.batchFindSimilar(ctx, queries, k));
    }

    @Override
    public void createCollection(OperationContext ctx, String name, CollectionConfig collectionConfig) {
        run(ctx, Operation.CREATE_COLLECTION, provider -> provider.createCollection(ctx, name, collectionConfig));
    }

    @Override
    public void deleteCollection(OperationContext ctx, String name) {
        run(ctx, Operation.DELETE_COLLECTION, provider -> provider.deleteCollection(ctx, name));
    }

    @Override
    public List<CollectionInfo> listCollections(OperationContext ctx) {
        return call(ctx, Operation.LIST_COLLECTIONS, provider -> provider.listCollections(ctx));
    }

    @Override
    public CollectionInfo getCollection(OperationContext ctx, String name) {
        return call(ctx, Operation.GET_COLLECTION, provider -> provider.getCollection(ctx, name));
    }

    // ----------------------------------------------------------------- administration

    @Override
    public void switchProvider(OperationContext ctx, String name) {
        Span span = tracer.spanBuilder("switch-provider").startSpan();
        boolean switching = state.compareAndSet(ManagerState.READY, ManagerState.SWITCHING);
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("provider.target", name);

            MonitoredVectorProvider target;
            Instant targetStartedAt;
            ProviderHealth previousHealth;
            lock.readLock().lock();
            try {
                target = providers.get(name);
                targetStartedAt = startedAt.get(name);
                previousHealth = health.getOrDefault(name, ProviderHealth.unknown());
            } finally {
                lock.readLock().unlock();
            }
            if (target == null) {
                throw new ProviderNotFoundException(name);
            }

            HealthStatus status;
            try {
                status = target.health(ctx);
            } catch (RuntimeException e) {
                publishHealth(name, unreachable(previousHealth, targetStartedAt, Duration.ZERO, e));
                throw new ProviderUnhealthyException(name, e.getMessage(), e);
            }
            ProviderHealth result = fromStatus(status, previousHealth, targetStartedAt);
            if (!status.isHealthy()) {
                publishHealth(name, result);
                throw new ProviderUnhealthyException(name,
                        status.message().isEmpty() ? status.state().name() : status.message());
            }

            String previous;
            lock.writeLock().lock();
            try {
                if (providers.get(name) != target) {
                    throw new ProviderNotFoundException(name);
                }
                previous = activeName;
                activeName = name;
                health.put(name, result);
            } finally {
                lock.writeLock().unlock();
            }
            span.setAttribute("provider.previous", previous != null ? previous : "");
            logger.info(String.format("Switched active provider from %s to %s", previous, name));
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "switch failed");
            throw e;
        } finally {
            if (switching) {
                state.compareAndSet(ManagerState.SWITCHING, ManagerState.READY);
            }
            span.end();
        }
    }

    @Override
    public Optional<String> getActiveProviderName() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(activeName);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<IVectorProvider> getProvider(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(providers.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Map<String, ProviderInfo> listProviders() {
        Map<String, ProviderInfo> result = new LinkedHashMap<>();
        lock.readLock().lock();
        try {
            providers.forEach((name, provider) -> result.put(name, new ProviderInfo(
                    name,
                    provider.type(),
                    provider.capabilities(),
                    provider.isCloud(),
                    name.equals(activeName),
                    health.getOrDefault(name, ProviderHealth.unknown()).healthy(),
                    provider.costInfo())));
        } finally {
            lock.readLock().unlock();
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public Map<String, ProviderHealth> getProviderHealth(OperationContext ctx) {
        return checkAll(ctx);
    }

    @Override
    public Map<String, ProviderPerformanceStats> getProviderPerformance() {
        return performance.snapshot();
    }

    /**
     * Alerts currently raised by the performance thresholds, keyed by provider.
     */
    public Map<String, Set<String>> activePerformanceAlerts() {
        return performance.activeAlerts();
    }

    @Override
    public void optimizeProviders(OperationContext ctx) {
        for (Map.Entry<String, MonitoredVectorProvider> entry : snapshotProviders().entrySet()) {
            try {
                entry.getValue().optimize(ctx);
                logger.info("Optimized provider " + entry.getKey());
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Failed to optimize provider " + entry.getKey(), e);
            }
        }
    }

    /**
     * Chain over the configured fallback order, if one is configured.
     */
    public Optional<FallbackChain> fallbackChain() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(fallbackChain);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Router over the configured hybrid roles, if any are configured.
     */
    public Optional<HybridRouter> hybridRouter() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(hybridRouter);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<FallbackAttempt> fallbackHistory() {
        return fallbackChain().map(FallbackChain::history).orElse(List.of());
    }

    // ----------------------------------------------------------------- health

    private void runScheduledHealthCheck() {
        Span span = tracer.spanBuilder("health-check").startSpan();
        try (Scope scope = span.makeCurrent()) {
            Map<String, ProviderHealth> results = checkAll(OperationContext.background());
            long unhealthy = results.values().stream().filter(h -> !h.healthy()).count();
            span.setAttribute("providers.checked", results.size());
            span.setAttribute("providers.unhealthy", unhealthy);
        } catch (Exception e) {
            span.recordException(e);
            logger.log(Level.SEVERE, "Unexpected error during scheduled health check", e);
        } finally {
            span.end();
        }
    }

    private Map<String, ProviderHealth> checkAll(OperationContext ctx) {
        Map<String, MonitoredVectorProvider> snapshot;
        Map<String, ProviderHealth> previous;
        Map<String, Instant> starts;
        lock.readLock().lock();
        try {
            snapshot = new LinkedHashMap<>(providers);
            previous = new LinkedHashMap<>(health);
            starts = new LinkedHashMap<>(startedAt);
        } finally {
            lock.readLock().unlock();
        }

        Map<String, ProviderHealth> results = new LinkedHashMap<>();
        for (Map.Entry<String, MonitoredVectorProvider> entry : snapshot.entrySet()) {
            String name = entry.getKey();
            ProviderHealth before = previous.getOrDefault(name, ProviderHealth.unknown());
            ProviderHealth after = check(ctx, entry.getValue(), starts.get(name), before);
            results.put(name, after);
            if (before.healthy() && !after.healthy()) {
                logger.warning(String.format("Provider %s became %s: %s", name, after.status(), after.errorMessage()));
            } else if (!before.healthy() && after.healthy() && before.lastCheck() != null) {
                logger.info(String.format("Provider %s recovered", name));
            }
        }

        lock.writeLock().lock();
        try {
            results.forEach((name, result) -> {
                if (providers.containsKey(name)) {
                    health.put(name, result);
                }
            });
        } finally {
            lock.writeLock().unlock();
        }
        results.forEach((name, result) -> metricsRegistry.gauge(HEALTH_GAUGE, "provider", name).set(result.healthy()));
        return Collections.unmodifiableMap(results);
    }

    private ProviderHealth check(OperationContext ctx, IVectorProvider provider, Instant started, ProviderHealth previous) {
        long start = System.nanoTime();
        try {
            HealthStatus status = provider.health(ctx);
            return fromStatus(status.responseTime().isZero()
                    ? status.withResponseTime(Duration.ofNanos(System.nanoTime() - start))
                    : status, previous, started);
        } catch (RuntimeException e) {
            logger.log(Level.FINE, "Health check failed for " + provider.name(), e);
            return unreachable(previous, started, Duration.ofNanos(System.nanoTime() - start), e);
        }
    }

    private static ProviderHealth fromStatus(HealthStatus status, ProviderHealth previous, Instant started) {
        boolean healthy = status.isHealthy();
        return new ProviderHealth(
                status.state(),
                status.checkedAt(),
                status.responseTime(),
                healthy ? previous.errorCount() : previous.errorCount() + 1,
                healthy ? null : status.message(),
                uptime(started));
    }

    private static ProviderHealth unreachable(ProviderHealth previous, Instant started, Duration elapsed, RuntimeException e) {
        return new ProviderHealth(HealthState.UNREACHABLE, Instant.now(), elapsed, previous.errorCount() + 1,
                e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), uptime(started));
    }

    private static Duration uptime(Instant started) {
        return started != null ? Duration.between(started, Instant.now()) : Duration.ZERO;
    }

    private void publishHealth(String name, ProviderHealth result) {
        lock.writeLock().lock();
        try {
            if (providers.containsKey(name)) {
                health.put(name, result);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Map<String, MonitoredVectorProvider> snapshotProviders() {
        lock.readLock().lock();
        try {
            return new LinkedHashMap<>(providers);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ----------------------------------------------------------------- shutdown

    @Override
    public void shutdown(OperationContext ctx) {
        ManagerState previous = state.getAndUpdate(s ->
                s == ManagerState.SHUT_DOWN || s == ManagerState.SHUTTING_DOWN ? s : ManagerState.SHUTTING_DOWN);
        if (previous == ManagerState.SHUT_DOWN || previous == ManagerState.SHUTTING_DOWN) {
            logger.fine("Shutdown already performed; ignoring");
            return;
        }

        Span span = tracer.spanBuilder("shutdown").startSpan();
        try (Scope scope = span.makeCurrent()) {
            ScheduledExecutorService executor;
            Map<String, MonitoredVectorProvider> toStop;
            lock.writeLock().lock();
            try {
                executor = healthExecutor;
                healthExecutor = null;
                toStop = new LinkedHashMap<>(providers);
                providers.clear();
                health.clear();
                startedAt.clear();
                activeName = null;
                fallbackChain = null;
                hybridRouter = null;
            } finally {
                lock.writeLock().unlock();
            }

            if (executor != null) {
                executor.shutdownNow();
                try {
                    if (!executor.awaitTermination(EXECUTOR_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                        logger.warning("Health check task did not terminate in time");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warning("Interrupted while waiting for health check task to stop");
                }
            }

            stopQuietly(ctx, toStop.keySet(), toStop);
            performance.clear();
            span.setAttribute("providers.stopped", toStop.size());
            logger.info(String.format("Vector provider manager shut down (%d providers stopped)", toStop.size()));
        } finally {
            state.set(ManagerState.SHUT_DOWN);
            span.end();
        }
    }

    private static void stopQuietly(OperationContext ctx, Iterable<String> names, Map<String, ? extends IVectorProvider> instances) {
        for (String name : names) {
            IVectorProvider provider = instances.get(name);
            if (provider == null) {
                continue;
            }
            try {
                provider.stop(ctx);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Failed to stop provider " + name, e);
            }
        }
    }

    @Override
    public String toString() {
        return String.format("VectorProviderManager{state=%s, active=%s}", state.get(), getActiveProviderName().orElse(null));
    }
}
