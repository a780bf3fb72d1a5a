/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.infra.metrics;

/**
 * Instantaneous value, e.g. the number of healthy providers.
 * Thread-safe.
 */
public interface Gauge {
    void set(double value);

    double value();

    default void set(boolean flag) {
        set(flag ? 1.0 : 0.0);
    }
}
