/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.infra.metrics.impl.prometheus;

import com.helios.vectorstore.infra.metrics.Counter;
import com.helios.vectorstore.infra.metrics.Gauge;
import com.helios.vectorstore.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PrometheusMetricsRegistryTest {

    private static final String[] PROVIDER_LABEL = {"provider"};

    private CollectorRegistry collectorRegistry;
    private PrometheusMetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        collectorRegistry = new CollectorRegistry();
        metrics = new PrometheusMetricsRegistry(collectorRegistry);
    }

    @Test
    @DisplayName("Counters are exported with a _total suffix per label set")
    void counter_exportsPerLabelSet() {
        Counter local = metrics.counter("vector_provider_errors", "provider", "local");
        Counter remote = metrics.counter("vector_provider_errors", "provider", "remote");

        local.increment();
        local.increment(4);
        remote.increment();

        assertThat(local.count()).isEqualTo(5);
        assertThat(collectorRegistry.getSampleValue("vector_provider_errors_total", PROVIDER_LABEL, new String[]{"local"}))
                .isEqualTo(5.0);
        assertThat(collectorRegistry.getSampleValue("vector_provider_errors_total", PROVIDER_LABEL, new String[]{"remote"}))
                .isEqualTo(1.0);
    }

    @Test
    void sameSeries_returnsSameInstance() {
        assertThat(metrics.counter("ops", "provider", "a")).isSameAs(metrics.counter("ops", "provider", "a"));
        assertThat(metrics.gauge("up", "provider", "a")).isSameAs(metrics.gauge("up", "provider", "a"));
    }

    @Test
    void counter_rejectsNegativeIncrement() {
        Counter counter = metrics.counter("ops");

        assertThatThrownBy(() -> counter.increment(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("negative");
    }

    @Test
    void gauge_setsBooleanAndDoubleValues() {
        Gauge gauge = metrics.gauge("vector_provider_healthy", "provider", "local");

        gauge.set(true);
        assertThat(collectorRegistry.getSampleValue("vector_provider_healthy", PROVIDER_LABEL, new String[]{"local"}))
                .isEqualTo(1.0);

        gauge.set(0.25);
        assertThat(gauge.value()).isEqualTo(0.25);
    }

    @Test
    void timer_observesSecondsInHistogram() {
        Timer timer = metrics.timer("vector_provider_operation", "provider", "local");

        timer.record(Duration.ofMillis(20));
        timer.record(Duration.ofMillis(30));

        assertThat(timer.count()).isEqualTo(2);
        assertThat(collectorRegistry.getSampleValue("vector_provider_operation_seconds_count", PROVIDER_LABEL,
                new String[]{"local"})).isEqualTo(2.0);
        assertThat(collectorRegistry.getSampleValue("vector_provider_operation_seconds_sum", PROVIDER_LABEL,
                new String[]{"local"})).isCloseTo(0.05, within(1e-9));
    }

    @Test
    void timer_rejectsInvalidDurationsAndServerSidePercentiles() {
        Timer timer = metrics.timer("latency");

        assertThatThrownBy(() -> timer.record(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> timer.record(Duration.ofMillis(-1))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> timer.percentile(0.99))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessageContaining("histogram_quantile");
    }

    @Test
    void inconsistentLabels_areRejected() {
        metrics.counter("ops", "provider", "a");

        assertThatThrownBy(() -> metrics.counter("ops", "operation", "store"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already registered with labels");
    }

    @Test
    void oddTags_areRejected() {
        assertThatThrownBy(() -> metrics.counter("ops", "provider"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sanitizeName_replacesIllegalCharacters() {
        assertThat(PrometheusMetricsRegistry.sanitizeName("Vector-Ops.Count")).isEqualTo("vector_ops_count");
        assertThat(PrometheusMetricsRegistry.sanitizeName("a--b")).isEqualTo("a_b");
    }

    @Test
    void concurrentIncrements_areAllCounted() throws InterruptedException {
        Counter counter = metrics.counter("concurrent_ops");
        int threads = 8;
        int perThread = 1_000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                for (int i = 0; i < perThread; i++) {
                    counter.increment();
                }
                done.countDown();
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        assertThat(counter.count()).isEqualTo((long) threads * perThread);
    }
}
