/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Aggregated request performance for one provider instance.
 *
 * @param errorRate       failed / total, 0 when nothing ran
 * @param throughput      operations per second over the observed window
 * @param operationCounts calls per operation key
 */
public record ProviderPerformanceStats(
        String providerName,
        long totalOperations,
        long successfulOperations,
        long failedOperations,
        Duration averageLatency,
        Duration minLatency,
        Duration maxLatency,
        Instant firstOperation,
        Instant lastOperation,
        String lastOperationName,
        double errorRate,
        double throughput,
        Map<String, Long> operationCounts
) {

    public ProviderPerformanceStats {
        operationCounts = operationCounts != null ? Map.copyOf(operationCounts) : Map.of();
    }
}
