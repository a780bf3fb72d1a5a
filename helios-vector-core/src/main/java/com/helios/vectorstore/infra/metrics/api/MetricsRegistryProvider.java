/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.infra.metrics.api;

import com.helios.vectorstore.infra.metrics.MetricsRegistry;

/**
 * Service Provider Interface for {@link MetricsRegistry} implementations.
 *
 * <p>Implementations must have a public no-arg constructor and register themselves in
 * {@code META-INF/services/com.helios.vectorstore.infra.metrics.api.MetricsRegistryProvider}.
 * When several are present the one with the highest {@link #priority()} wins.
 */
public interface MetricsRegistryProvider {

    MetricsRegistry create();

    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
