/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.infra.metrics;

import java.time.Duration;

/**
 * Latency distribution of provider calls.
 * Thread-safe.
 */
public interface Timer {

    /**
     * Records a pre-measured duration.
     *
     * @throws IllegalArgumentException if {@code duration} is null or negative
     */
    void record(Duration duration);

    /**
     * Number of recorded observations.
     */
    long count();

    /**
     * Gets percentile value where the implementation keeps samples client side.
     *
     * @param percentile value between 0.0 and 1.0
     * @throws UnsupportedOperationException if percentiles are computed server side
     */
    Duration percentile(double percentile);
}
