/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.infra.telemetry;

import io.opentelemetry.api.trace.Span;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TracingServiceTest {

    @Test
    void disabledTracing_yieldsNoopService() {
        TracingService service = TracingService.create(Map.of("OTEL_DISABLED", "true")::get);

        assertThat(service.isEnabled()).isFalse();
        Span span = service.getTracer().spanBuilder("noop").startSpan();
        assertThat(span.getSpanContext().isValid()).isFalse();
        span.end();
    }

    @Test
    void noneExporter_yieldsNoopService() {
        TracingService service = TracingService.create(Map.of("OTEL_EXPORTER_TYPE", "none")::get);

        assertThat(service.isEnabled()).isFalse();
    }

    @Test
    void loggingExporter_producesRecordingSpans() {
        TracingService service = TracingService.create(Map.of(
                "OTEL_EXPORTER_TYPE", "logging",
                "OTEL_TRACE_SAMPLING_RATIO", "1.0",
                "SERVICE_NAME", "vector-providers-test")::get);
        try {
            assertThat(service.isEnabled()).isTrue();
            Span span = service.getTracer().spanBuilder("store").startSpan();
            assertThat(span.isRecording()).isTrue();
            assertThat(span.getSpanContext().isValid()).isTrue();
            span.end();
        } finally {
            service.shutdown();
        }
    }

    @Test
    void noop_isAlwaysDisabled() {
        assertThat(TracingService.noop().isEnabled()).isFalse();
        TracingService.noop().shutdown();
    }
}
