/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.infra.metrics.impl.prometheus;

import com.helios.vectorstore.infra.metrics.Counter;
import com.helios.vectorstore.infra.metrics.Gauge;
import com.helios.vectorstore.infra.metrics.MetricsRegistry;
import com.helios.vectorstore.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Histogram;
import io.prometheus.client.SimpleCollector;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prometheus-backed registry.
 *
 * <p>One Prometheus collector is registered per metric name, with the label names
 * fixed by the first use. Each distinct set of label values is a child of that
 * collector. Reusing a name with different label names is rejected.
 *
 * <p>Latency buckets are tuned for provider calls: 1ms up to 10s.
 */
public final class PrometheusMetricsRegistry implements MetricsRegistry {

    private static final double[] LATENCY_BUCKETS = {0.001, 0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0};

    private final CollectorRegistry registry;
    private final Map<String, Registered<io.prometheus.client.Counter>> counterCollectors = new ConcurrentHashMap<>();
    private final Map<String, Registered<io.prometheus.client.Gauge>> gaugeCollectors = new ConcurrentHashMap<>();
    private final Map<String, Registered<Histogram>> histogramCollectors = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Gauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public PrometheusMetricsRegistry() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMetricsRegistry(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Counter counter(String name, String... tags) {
        MetricsRegistry.checkTags(tags);
        return counters.computeIfAbsent(seriesKey(name, tags), key -> {
            Registered<io.prometheus.client.Counter> collector = counterCollectors.computeIfAbsent(name, n ->
                    new Registered<>(io.prometheus.client.Counter.build()
                            .name(sanitizeName(n) + "_total")
                            .help("Counter for " + n)
                            .labelNames(labelNames(tags))
                            .register(registry), labelNames(tags)));
            collector.checkLabels(name, tags);
            return new PrometheusCounterAdapter(collector.collector(), labelValues(tags));
        });
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        MetricsRegistry.checkTags(tags);
        return gauges.computeIfAbsent(seriesKey(name, tags), key -> {
            Registered<io.prometheus.client.Gauge> collector = gaugeCollectors.computeIfAbsent(name, n ->
                    new Registered<>(io.prometheus.client.Gauge.build()
                            .name(sanitizeName(n))
                            .help("Gauge for " + n)
                            .labelNames(labelNames(tags))
                            .register(registry), labelNames(tags)));
            collector.checkLabels(name, tags);
            return new PrometheusGaugeAdapter(collector.collector(), labelValues(tags));
        });
    }

    @Override
    public Timer timer(String name, String... tags) {
        MetricsRegistry.checkTags(tags);
        return timers.computeIfAbsent(seriesKey(name, tags), key -> {
            Registered<Histogram> collector = histogramCollectors.computeIfAbsent(name, n ->
                    new Registered<>(Histogram.build()
                            .name(sanitizeName(n) + "_seconds")
                            .help("Latency of " + n)
                            .buckets(LATENCY_BUCKETS)
                            .labelNames(labelNames(tags))
                            .register(registry), labelNames(tags)));
            collector.checkLabels(name, tags);
            return new PrometheusTimerAdapter(collector.collector(), labelValues(tags));
        });
    }

    static String sanitizeName(String name) {
        return name.toLowerCase()
                .replaceAll("[^a-z0-9_:]", "_")
                .replaceAll("_{2,}", "_");
    }

    private static String seriesKey(String name, String[] tags) {
        return tags.length == 0 ? name : name + Arrays.toString(tags);
    }

    private static String[] labelNames(String[] tags) {
        String[] labels = new String[tags.length / 2];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = sanitizeName(tags[i * 2]);
        }
        return labels;
    }

    private static String[] labelValues(String[] tags) {
        String[] values = new String[tags.length / 2];
        for (int i = 0; i < values.length; i++) {
            values[i] = tags[i * 2 + 1];
        }
        return values;
    }

    private record Registered<C extends SimpleCollector<?>>(C collector, String[] labelNames) {

        void checkLabels(String name, String[] tags) {
            if (!Arrays.equals(labelNames, PrometheusMetricsRegistry.labelNames(tags))) {
                throw new IllegalArgumentException(String.format(
                        "Metric %s already registered with labels %s", name, Arrays.toString(labelNames)));
            }
        }
    }
}
