/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record SimilarityResult(
        String id,
        double score,
        double distance,
        Map<String, Object> metadata
) {

    public SimilarityResult {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }
}
