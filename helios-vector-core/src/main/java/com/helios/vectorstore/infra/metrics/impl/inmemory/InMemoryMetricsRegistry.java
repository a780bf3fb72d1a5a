/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.infra.metrics.impl.inmemory;

import com.helios.vectorstore.infra.metrics.Counter;
import com.helios.vectorstore.infra.metrics.Gauge;
import com.helios.vectorstore.infra.metrics.MetricsRegistry;
import com.helios.vectorstore.infra.metrics.Timer;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry that keeps everything in memory, for tests and local runs.
 *
 * <p>Series are keyed by name plus tags, and the test helpers take the same
 * arguments as the factory methods.
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        MetricsRegistry.checkTags(tags);
        return counters.computeIfAbsent(key(name, tags), k -> new InMemoryCounter());
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        MetricsRegistry.checkTags(tags);
        return gauges.computeIfAbsent(key(name, tags), k -> new InMemoryGauge());
    }

    @Override
    public Timer timer(String name, String... tags) {
        MetricsRegistry.checkTags(tags);
        return timers.computeIfAbsent(key(name, tags), k -> new InMemoryTimer());
    }

    // Test helper methods

    public long getCounterValue(String name, String... tags) {
        InMemoryCounter counter = counters.get(key(name, tags));
        return counter != null ? counter.count() : 0L;
    }

    public double getGaugeValue(String name, String... tags) {
        InMemoryGauge gauge = gauges.get(key(name, tags));
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> getTimerRecordings(String name, String... tags) {
        InMemoryTimer timer = timers.get(key(name, tags));
        return timer != null ? timer.recordings() : List.of();
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }

    private static String key(String name, String[] tags) {
        return tags.length == 0 ? name : name + Arrays.toString(tags);
    }
}
