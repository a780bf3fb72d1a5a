/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.monitoring;

import com.helios.vectorstore.api.Operation;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable snapshot of one provider instance's call counters.
 *
 * @param minLatency    {@link Duration#ZERO} until the first call completes
 * @param lastOperation time the most recent call completed, {@code null} before any
 */
public record ProviderMetrics(
        long totalOperations,
        long successfulOperations,
        long failedOperations,
        Duration totalLatency,
        Duration minLatency,
        Duration maxLatency,
        Instant lastOperation,
        Operation lastOperationType
) {

    public static final ProviderMetrics EMPTY =
            new ProviderMetrics(0, 0, 0, Duration.ZERO, Duration.ZERO, Duration.ZERO, null, null);

    public Duration averageLatency() {
        return totalOperations == 0 ? Duration.ZERO : totalLatency.dividedBy(totalOperations);
    }

    public double successRate() {
        return totalOperations == 0 ? 0.0 : (double) successfulOperations / totalOperations;
    }

    ProviderMetrics record(Operation operation, Duration elapsed, boolean success, Instant completedAt) {
        return new ProviderMetrics(
                totalOperations + 1,
                successfulOperations + (success ? 1 : 0),
                failedOperations + (success ? 0 : 1),
                totalLatency.plus(elapsed),
                totalOperations == 0 || elapsed.compareTo(minLatency) < 0 ? elapsed : minLatency,
                elapsed.compareTo(maxLatency) > 0 ? elapsed : maxLatency,
                completedAt,
                operation);
    }

    public String format() {
        return String.format("ops=%d ok=%d failed=%d avg=%dus min=%dus max=%dus",
                totalOperations, successfulOperations, failedOperations,
                averageLatency().toNanos() / 1_000, minLatency.toNanos() / 1_000, maxLatency.toNanos() / 1_000);
    }
}
