/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.model;

import java.time.Instant;
import java.util.Map;

public record IndexInfo(
        String name,
        String type,
        String state,
        Instant createdAt,
        Instant updatedAt,
        Map<String, Object> parameters
) {

    public IndexInfo {
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }
}
