/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.infra.metrics.internal;

import com.helios.vectorstore.infra.metrics.MetricsRegistry;
import com.helios.vectorstore.infra.metrics.api.MetricsRegistryProvider;

import java.util.Comparator;
import java.util.ServiceLoader;
import java.util.logging.Logger;
import java.util.stream.StreamSupport;

/**
 * Lazy holder for the process-wide MetricsRegistry.
 *
 * <p><b>INTERNAL USE ONLY</b> - API may change without notice.
 */
public final class MetricsRegistryHolder {

    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }

    public static MetricsRegistry instance() {
        return Lazy.INSTANCE;
    }

    /**
     * Initialization-on-demand: the class loader guarantees a single, safely
     * published instance on first use.
     */
    private static final class Lazy {
        static final MetricsRegistry INSTANCE = discover();
    }

    static MetricsRegistry discover() {
        ServiceLoader<MetricsRegistryProvider> loader = ServiceLoader.load(MetricsRegistryProvider.class);

        MetricsRegistryProvider provider = StreamSupport.stream(loader.spliterator(), false)
                .max(Comparator.comparingInt(MetricsRegistryProvider::priority))
                .orElse(null);

        if (provider == null) {
            logger.info("No metrics provider found, using no-op implementation");
            return new NoOpMetricsRegistry();
        }
        logger.info(String.format("Using metrics provider: %s (priority: %d)", provider.name(), provider.priority()));
        return provider.create();
    }
}
