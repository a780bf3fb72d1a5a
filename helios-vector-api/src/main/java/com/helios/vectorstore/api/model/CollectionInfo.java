/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.model;

import java.time.Instant;
import java.util.Map;

public record CollectionInfo(
        String name,
        int dimension,
        String metric,
        long vectorCount,
        long sizeBytes,
        String status,
        Instant createdAt,
        Instant updatedAt,
        Map<String, Object> metadata
) {

    public CollectionInfo {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }
}
