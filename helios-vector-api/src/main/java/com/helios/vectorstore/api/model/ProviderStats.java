/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Backend-reported statistics.
 */
public record ProviderStats(
        String name,
        String type,
        HealthState status,
        long totalOperations,
        long successfulOperations,
        long failedOperations,
        Duration averageLatency,
        long totalVectors,
        long totalCollections,
        long totalSizeBytes,
        Instant lastHealthCheck,
        Instant lastOperation,
        long errorCount,
        Duration uptime,
        CostInfo costInfo,
        Map<String, Object> metadata
) {

    public ProviderStats {
        averageLatency = averageLatency != null ? averageLatency : Duration.ZERO;
        uptime = uptime != null ? uptime : Duration.ZERO;
        costInfo = costInfo != null ? costInfo : CostInfo.free();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public double successRate() {
        return totalOperations == 0 ? 0.0 : (double) successfulOperations / totalOperations;
    }
}
