/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.infra.metrics;

/**
 * Monotonically increasing counter, e.g. provider errors per operation.
 * Thread-safe.
 */
public interface Counter {
    void increment();

    /**
     * @throws IllegalArgumentException if {@code amount} is negative
     */
    void increment(long amount);

    long count();
}
