/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.config;

import com.helios.vectorstore.composition.HybridRouting;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Members and routing for a hybrid router built by the factory.
 *
 * @param members role to provider spec, in selection order
 */
public record HybridConfig(HybridRouting routing, Map<String, ProviderSpec> members) {

    public HybridConfig {
        if (routing == null) {
            throw new IllegalArgumentException("Hybrid routing cannot be null");
        }
        members = members != null ? Collections.unmodifiableMap(new LinkedHashMap<>(members)) : Map.of();
    }
}
