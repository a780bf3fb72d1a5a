/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.management;

import com.helios.vectorstore.api.Operation;
import com.helios.vectorstore.api.model.ProviderPerformanceStats;
import com.helios.vectorstore.config.AlertThresholds;
import com.helios.vectorstore.infra.metrics.MetricsRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Per-instance performance table fed by the manager's request path.
 *
 * <p>Alert thresholds are checked after every recorded operation. An alert logs
 * one warning when a provider crosses a threshold and is re-armed once the
 * provider falls back under it.
 */
public final class PerformanceMonitor {

    private static final Logger logger = Logger.getLogger(PerformanceMonitor.class.getName());

    static final String OPERATIONS_COUNTER = "vector_manager_operations";

    private final AlertThresholds thresholds;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final Object lock = new Object();
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public PerformanceMonitor(AlertThresholds thresholds, MetricsRegistry metricsRegistry) {
        this(thresholds, metricsRegistry, Clock.systemUTC());
    }

    PerformanceMonitor(AlertThresholds thresholds, MetricsRegistry metricsRegistry, Clock clock) {
        this.thresholds = thresholds != null ? thresholds : AlertThresholds.none();
        this.metricsRegistry = metricsRegistry != null ? metricsRegistry : MetricsRegistry.getInstance();
        this.clock = clock;
    }

    public void record(String provider, Operation operation, Duration latency, boolean success) {
        Instant now = clock.instant();
        ProviderPerformanceStats stats;
        Set<String> raised = new TreeSet<>();
        synchronized (lock) {
            Entry entry = entries.computeIfAbsent(provider, Entry::new);
            entry.record(operation, latency, success, now);
            stats = entry.toStats(now);
            evaluate(entry, stats, raised);
        }
        metricsRegistry.counter(OPERATIONS_COUNTER,
                "provider", provider, "operation", operation.key(), "status", success ? "success" : "failure").increment();
        for (String metric : raised) {
            logger.warning(String.format("Performance alert for provider %s: %s=%.3f exceeds threshold %.3f",
                    provider, metric, valueOf(metric, stats), thresholds.threshold(metric)));
        }
    }

    private void evaluate(Entry entry, ProviderPerformanceStats stats, Set<String> raised) {
        for (String metric : thresholds.thresholds().keySet()) {
            Double limit = thresholds.threshold(metric);
            double value = valueOf(metric, stats);
            if (limit == null || Double.isNaN(value)) {
                continue;
            }
            if (value > limit) {
                if (entry.alerts.add(metric)) {
                    raised.add(metric);
                }
            } else if (entry.alerts.remove(metric)) {
                logger.info(String.format("Performance alert cleared for provider %s: %s=%.3f",
                        stats.providerName(), metric, value));
            }
        }
    }

    private static double valueOf(String metric, ProviderPerformanceStats stats) {
        switch (metric) {
            case AlertThresholds.ERROR_RATE:
                return stats.errorRate();
            case AlertThresholds.AVERAGE_LATENCY_MS:
                return stats.averageLatency().toNanos() / 1_000_000.0;
            default:
                return Double.NaN;
        }
    }

    public Map<String, ProviderPerformanceStats> snapshot() {
        Instant now = clock.instant();
        Map<String, ProviderPerformanceStats> result = new LinkedHashMap<>();
        synchronized (lock) {
            entries.forEach((name, entry) -> result.put(name, entry.toStats(now)));
        }
        return result;
    }

    /**
     * Alerts currently raised, keyed by provider.
     */
    public Map<String, Set<String>> activeAlerts() {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        synchronized (lock) {
            entries.forEach((name, entry) -> {
                if (!entry.alerts.isEmpty()) {
                    result.put(name, Set.copyOf(entry.alerts));
                }
            });
        }
        return result;
    }

    public void clear() {
        synchronized (lock) {
            entries.clear();
        }
    }

    private static final class Entry {
        private final String provider;
        private final Map<String, Long> operationCounts = new HashMap<>();
        private final Set<String> alerts = new TreeSet<>();
        private long total;
        private long successful;
        private long failed;
        private long totalLatencyNanos;
        private long minLatencyNanos = Long.MAX_VALUE;
        private long maxLatencyNanos;
        private Instant first;
        private Instant last;
        private String lastOperation;

        Entry(String provider) {
            this.provider = provider;
        }

        void record(Operation operation, Duration latency, boolean success, Instant now) {
            long nanos = latency.toNanos();
            total++;
            if (success) {
                successful++;
            } else {
                failed++;
            }
            totalLatencyNanos += nanos;
            minLatencyNanos = Math.min(minLatencyNanos, nanos);
            maxLatencyNanos = Math.max(maxLatencyNanos, nanos);
            if (first == null) {
                first = now;
            }
            last = now;
            lastOperation = operation.key();
            operationCounts.merge(operation.key(), 1L, Long::sum);
        }

        ProviderPerformanceStats toStats(Instant now) {
            Duration average = total == 0 ? Duration.ZERO : Duration.ofNanos(totalLatencyNanos / total);
            Duration min = total == 0 ? Duration.ZERO : Duration.ofNanos(minLatencyNanos);
            double errorRate = total == 0 ? 0.0 : (double) failed / total;
            double elapsedSeconds = first == null ? 0.0 : Duration.between(first, now).toNanos() / 1_000_000_000.0;
            double throughput = elapsedSeconds > 0 ? total / elapsedSeconds : total;
            return new ProviderPerformanceStats(provider, total, successful, failed, average, min,
                    Duration.ofNanos(maxLatencyNanos), first, last, lastOperation, errorRate, throughput,
                    operationCounts);
        }
    }
}
