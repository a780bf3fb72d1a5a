/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.model;

import java.time.Duration;
import java.util.List;

/**
 * Results of a {@link VectorQuery}, best match first.
 */
public record VectorSearchResult(
        List<SearchResultItem> items,
        int total,
        VectorQuery query,
        Duration duration,
        String namespace
) {

    public VectorSearchResult {
        items = items != null ? List.copyOf(items) : List.of();
        duration = duration != null ? duration : Duration.ZERO;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
