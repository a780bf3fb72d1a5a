/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Requested provider: a type identifier plus free-form overrides.
 *
 * @param tags free-form labels, carried through to logs and listings only
 */
public record ProviderSpec(String type, boolean enabled, Map<String, Object> config, List<String> tags) {

    public ProviderSpec {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Provider type cannot be null or blank");
        }
        config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public ProviderSpec(String type, boolean enabled, Map<String, Object> config) {
        this(type, enabled, config, List.of());
    }

    public static ProviderSpec of(String type) {
        return new ProviderSpec(type, true, Map.of());
    }

    public static ProviderSpec of(String type, Map<String, Object> config) {
        return new ProviderSpec(type, true, config);
    }

    public ProviderSpec disabled() {
        return new ProviderSpec(type, false, config, tags);
    }
}
