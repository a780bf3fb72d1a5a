/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.infra.metrics;

import com.helios.vectorstore.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Framework-agnostic metrics registry used by the provider monitoring layer.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}. Metrics are
 * identified by name plus tags: the same name with different tag values yields
 * distinct series, and the same name with the same tags returns the same instance.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * Counter errors = metrics.counter("vector_provider_errors", "provider", "primary", "operation", "store");
 * errors.increment();
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * Creates or retrieves a counter metric.
     *
     * @param name metric name (lowercase, underscores only)
     * @param tags alternating label names and values
     * @return thread-safe counter instance
     */
    Counter counter(String name, String... tags);

    Gauge gauge(String name, String... tags);

    Timer timer(String name, String... tags);

    /**
     * Gets the process-wide registry.
     *
     * <p>Falls back to a no-op implementation when no provider is registered.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.instance();
    }

    /**
     * Validates tag arity.
     *
     * @throws IllegalArgumentException if tags are not name/value pairs
     */
    static void checkTags(String... tags) {
        if (tags == null || tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be alternating name/value pairs");
        }
    }
}
