/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Result of a single provider health query.
 *
 * @param state        reported state
 * @param message      human-readable detail, empty when healthy
 * @param checkedAt    when the check ran
 * @param responseTime how long the check took
 * @param metrics      numeric readings the backend chose to expose
 * @param dependencies state of downstream services keyed by name
 */
public record HealthStatus(
        HealthState state,
        String message,
        Instant checkedAt,
        Duration responseTime,
        Map<String, Double> metrics,
        Map<String, String> dependencies
) {

    public HealthStatus {
        if (state == null) {
            throw new IllegalArgumentException("Health state cannot be null");
        }
        message = message != null ? message : "";
        checkedAt = checkedAt != null ? checkedAt : Instant.now();
        responseTime = responseTime != null ? responseTime : Duration.ZERO;
        metrics = metrics != null ? Map.copyOf(metrics) : Map.of();
        dependencies = dependencies != null ? Map.copyOf(dependencies) : Map.of();
    }

    public static HealthStatus healthy() {
        return new HealthStatus(HealthState.HEALTHY, "", Instant.now(), Duration.ZERO, null, null);
    }

    public static HealthStatus of(HealthState state, String message) {
        return new HealthStatus(state, message, Instant.now(), Duration.ZERO, null, null);
    }

    public HealthStatus withResponseTime(Duration elapsed) {
        return new HealthStatus(state, message, checkedAt, elapsed, metrics, dependencies);
    }

    public boolean isHealthy() {
        return state.isHealthy();
    }
}
