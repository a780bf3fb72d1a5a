/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Performance levels above which the manager logs a warning for a provider.
 *
 * <p>Known metric keys are {@value #ERROR_RATE} (fraction 0..1) and
 * {@value #AVERAGE_LATENCY_MS}. Absent keys are not checked.
 */
public record AlertThresholds(Map<String, Double> thresholds) {

    public static final String ERROR_RATE = "error_rate";
    public static final String AVERAGE_LATENCY_MS = "average_latency_ms";

    public AlertThresholds {
        thresholds = thresholds != null ? Map.copyOf(thresholds) : Map.of();
    }

    public static AlertThresholds none() {
        return new AlertThresholds(Map.of());
    }

    public static AlertThresholds of(double errorRate, double averageLatencyMs) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(ERROR_RATE, errorRate);
        values.put(AVERAGE_LATENCY_MS, averageLatencyMs);
        return new AlertThresholds(values);
    }

    public Double threshold(String metric) {
        return thresholds.get(metric);
    }
}
