/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.model;

/**
 * Liveness state reported by a provider or recorded by the manager.
 */
public enum HealthState {
    HEALTHY,
    DEGRADED,
    UNHEALTHY,
    /** The health call itself failed. */
    UNREACHABLE,
    NOT_INITIALIZED,
    NOT_STARTED;

    public boolean isHealthy() {
        return this == HEALTHY;
    }
}
