/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.infra.metrics.impl.prometheus;

import com.helios.vectorstore.infra.metrics.Timer;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Bridges {@link Timer} to one labelled child of a Prometheus histogram.
 *
 * <p>Durations are observed in seconds. Percentiles are left to the Prometheus
 * server ({@code histogram_quantile}), so {@link #percentile(double)} is unsupported.
 */
final class PrometheusTimerAdapter implements Timer {

    private final Histogram.Child histogram;

    PrometheusTimerAdapter(Histogram histogram, String[] labelValues) {
        if (histogram == null) {
            throw new IllegalArgumentException("Histogram cannot be null");
        }
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.histogram = histogram.labels(labelValues);
    }

    @Override
    public void record(Duration duration) {
        if (duration == null) {
            throw new IllegalArgumentException("Duration cannot be null");
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration cannot be negative: " + duration);
        }
        histogram.observe(duration.toNanos() / 1_000_000_000.0);
    }

    @Override
    public long count() {
        double[] buckets = histogram.get().buckets;
        return buckets.length == 0 ? 0L : (long) buckets[buckets.length - 1];
    }

    @Override
    public Duration percentile(double percentile) {
        throw new UnsupportedOperationException(String.format(
                "Percentiles are calculated by the Prometheus server: histogram_quantile(%.2f, ...)", percentile));
    }

    double sumSeconds() {
        return histogram.get().sum;
    }
}
