/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.composition;

import com.helios.vectorstore.api.Operation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Selection settings of a {@link HybridRouter}.
 *
 * @param routes      operation to member role, consulted by {@link HybridStrategy#OPERATION_BASED}
 * @param defaultRole role for unrouted operations, or {@code null} for the first member
 */
public record HybridRouting(HybridStrategy strategy, Map<Operation, String> routes, String defaultRole) {

    public HybridRouting {
        strategy = strategy != null ? strategy : HybridStrategy.FAILOVER;
        routes = routes == null || routes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(routes));
    }

    public static HybridRouting of(HybridStrategy strategy) {
        return new HybridRouting(strategy, Map.of(), null);
    }

    public static HybridRouting operationBased(Map<Operation, String> routes, String defaultRole) {
        return new HybridRouting(HybridStrategy.OPERATION_BASED, routes, defaultRole);
    }
}
