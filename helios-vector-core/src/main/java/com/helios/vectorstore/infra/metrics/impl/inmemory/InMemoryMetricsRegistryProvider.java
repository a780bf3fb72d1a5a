/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.infra.metrics.impl.inmemory;

import com.helios.vectorstore.infra.metrics.MetricsRegistry;
import com.helios.vectorstore.infra.metrics.api.MetricsRegistryProvider;

/**
 * Registered only on the test classpath, where it outranks Prometheus.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }

    @Override
    public String name() {
        return "InMemory";
    }
}
