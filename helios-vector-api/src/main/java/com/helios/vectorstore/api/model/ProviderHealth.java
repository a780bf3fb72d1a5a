/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Last-known health of a provider instance as recorded by the manager.
 *
 * @param errorCount cumulative number of failed or unhealthy checks
 * @param uptime     cumulative time observed healthy
 */
public record ProviderHealth(
        HealthState status,
        Instant lastCheck,
        Duration responseTime,
        long errorCount,
        String errorMessage,
        Duration uptime
) {

    public ProviderHealth {
        responseTime = responseTime != null ? responseTime : Duration.ZERO;
        uptime = uptime != null ? uptime : Duration.ZERO;
    }

    public static ProviderHealth unknown() {
        return new ProviderHealth(HealthState.NOT_STARTED, null, Duration.ZERO, 0, null, Duration.ZERO);
    }

    public boolean healthy() {
        return status.isHealthy();
    }
}
