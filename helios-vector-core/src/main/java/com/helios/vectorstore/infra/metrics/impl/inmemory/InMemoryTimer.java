/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.infra.metrics.impl.inmemory;

import com.helios.vectorstore.infra.metrics.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every sample so tests can assert on exact recordings and percentiles.
 */
final class InMemoryTimer implements Timer {

    private final List<Duration> recordings = new CopyOnWriteArrayList<>();

    @Override
    public void record(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("Cannot record negative or null duration: " + duration);
        }
        recordings.add(duration);
    }

    @Override
    public long count() {
        return recordings.size();
    }

    @Override
    public Duration percentile(double percentile) {
        if (recordings.isEmpty()) {
            return Duration.ZERO;
        }
        double p = Math.max(0.0, Math.min(1.0, percentile));
        List<Duration> sorted = new ArrayList<>(recordings);
        Collections.sort(sorted);

        double index = (sorted.size() - 1) * p;
        int lowerIndex = (int) Math.floor(index);
        int upperIndex = (int) Math.ceil(index);
        Duration lower = sorted.get(lowerIndex);
        if (lowerIndex == upperIndex) {
            return lower;
        }
        Duration upper = sorted.get(upperIndex);
        double fraction = index - lowerIndex;
        return Duration.ofNanos(lower.toNanos() + (long) ((upper.toNanos() - lower.toNanos()) * fraction));
    }

    List<Duration> recordings() {
        return List.copyOf(recordings);
    }

    void reset() {
        recordings.clear();
    }
}
