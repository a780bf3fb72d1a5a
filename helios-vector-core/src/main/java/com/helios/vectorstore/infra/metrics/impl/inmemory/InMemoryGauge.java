/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.infra.metrics.impl.inmemory;

import com.helios.vectorstore.infra.metrics.Gauge;

final class InMemoryGauge implements Gauge {

    private volatile double value;

    @Override
    public void set(double value) {
        this.value = value;
    }

    @Override
    public double value() {
        return value;
    }
}
