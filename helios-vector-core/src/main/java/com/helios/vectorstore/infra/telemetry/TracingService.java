/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.infra.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * OpenTelemetry bootstrap for the provider manager.
 *
 * <p>Configuration via environment variables (or system properties of the same name):
 * <ul>
 *   <li>{@code OTEL_DISABLED}: disable tracing entirely (default: false)
 *   <li>{@code OTEL_EXPORTER_TYPE}: {@code logging} | {@code otlp} | {@code none} (default: logging)
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT}: OTLP endpoint (default: http://localhost:4317)
 *   <li>{@code OTEL_TRACE_SAMPLING_RATIO}: 0.0-1.0 (default: 1.0)
 *   <li>{@code SERVICE_NAME}: service identifier (default: vector-providers)
 * </ul>
 *
 * <p>Any failure during setup falls back to a no-op tracer; tracing never prevents
 * the manager from starting.
 */
public final class TracingService {

    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    public static final String INSTRUMENTATION_NAME = "com.helios.vector-providers";
    private static final String DEFAULT_SERVICE_NAME = "vector-providers";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    private TracingService(OpenTelemetry openTelemetry, SdkTracerProvider tracerProvider) {
        this.openTelemetry = openTelemetry;
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
        this.tracerProvider = tracerProvider;
    }

    public static TracingService getInstance() {
        TracingService instance = INSTANCE;
        if (instance == null) {
            synchronized (LOCK) {
                instance = INSTANCE;
                if (instance == null) {
                    instance = create(System::getenv);
                    INSTANCE = instance;
                }
            }
        }
        return instance;
    }

    /**
     * Builds a service from an explicit environment lookup. Does not register the
     * SDK globally.
     */
    static TracingService create(Function<String, String> env) {
        if (Boolean.parseBoolean(lookup(env, "OTEL_DISABLED", "false"))) {
            logger.info("OpenTelemetry tracing is DISABLED (OTEL_DISABLED=true)");
            return noop();
        }

        String exporterType = lookup(env, "OTEL_EXPORTER_TYPE", "logging").toLowerCase(Locale.ROOT);
        if ("none".equals(exporterType)) {
            return noop();
        }

        try {
            SpanExporter exporter = exporter(env, exporterType);
            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(Resource.getDefault().merge(Resource.create(Attributes.builder()
                            .put(SERVICE_NAME, lookup(env, "SERVICE_NAME", DEFAULT_SERVICE_NAME))
                            .put(DEPLOYMENT_ENVIRONMENT, lookup(env, "DEPLOYMENT_ENVIRONMENT", "dev"))
                            .build())))
                    .setSampler(Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(samplingRatio(env))).build())
                    .addSpanProcessor(BatchSpanProcessor.builder(exporter)
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .setExporterTimeout(Duration.ofSeconds(30))
                            .build())
                    .build();

            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .build();

            logger.info(String.format("OpenTelemetry initialized: exporter=%s", exporterType));
            TracingService service = new TracingService(sdk, tracerProvider);
            Runtime.getRuntime().addShutdownHook(new Thread(service::shutdown, "otel-shutdown-hook"));
            return service;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return noop();
        }
    }

    public static TracingService noop() {
        return new TracingService(OpenTelemetry.noop(), null);
    }

    private static SpanExporter exporter(Function<String, String> env, String exporterType) {
        if ("otlp".equals(exporterType)) {
            String endpoint = lookup(env, "OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
            logger.info("Using OTLP exporter: " + endpoint);
            return OtlpGrpcSpanExporter.builder()
                    .setEndpoint(endpoint)
                    .setTimeout(30, TimeUnit.SECONDS)
                    .build();
        }
        if (!"logging".equals(exporterType)) {
            logger.warning("Unknown exporter type: " + exporterType + ", using logging");
        }
        return LoggingSpanExporter.create();
    }

    private static double samplingRatio(Function<String, String> env) {
        String raw = lookup(env, "OTEL_TRACE_SAMPLING_RATIO", "1.0");
        try {
            return Math.max(0.0, Math.min(1.0, Double.parseDouble(raw)));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO '" + raw + "', using 1.0");
            return 1.0;
        }
    }

    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error during OpenTelemetry shutdown", e);
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }

    private static String lookup(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
