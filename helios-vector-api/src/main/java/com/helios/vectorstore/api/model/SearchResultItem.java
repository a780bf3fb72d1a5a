/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One hit of a search.
 *
 * @param embedding present only when the query asked for vectors
 */
public record SearchResultItem(
        String id,
        double score,
        double distance,
        Map<String, Object> metadata,
        float[] embedding
) {

    public SearchResultItem {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }
}
