/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.helios.vectorstore.api.Operation;
import com.helios.vectorstore.composition.FallbackPolicy;
import com.helios.vectorstore.composition.HybridRouting;
import com.helios.vectorstore.composition.HybridStrategy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Complete configuration of a {@code VectorProviderManager}.
 *
 * <p>Sources, in increasing priority: builder defaults, a JSON document
 * ({@link #loadFromJson(Path)} or {@link #loadDefault()}), then environment
 * variables ({@link Builder#applyEnvironment}).
 *
 * <p><b>Example vector-providers.json:</b>
 * <pre>
 * {
 *   "active_provider": "primary",
 *   "providers": {
 *     "primary": { "type": "memory", "config": { "dimension": 384 } },
 *     "backup":  { "type": "memory", "enabled": true }
 *   },
 *   "fallback": { "order": ["primary", "backup"], "policy": "sticky" },
 *   "hybrid": {
 *     "strategy": "operation_based",
 *     "roles": { "search": "primary", "store": "backup" },
 *     "routes": { "search": "search", "store": "store" },
 *     "default_role": "store"
 *   },
 *   "health_check": { "enabled": true, "interval_seconds": 30 },
 *   "factory": { "fail_fast": false },
 *   "alerts": { "error_rate": 0.2, "average_latency_ms": 250 }
 * }
 * </pre>
 *
 * <p><b>Environment Variable Override:</b>
 * <pre>
 * VECTOR_ACTIVE_PROVIDER=backup
 * VECTOR_HEALTH_CHECK_ENABLED=false
 * VECTOR_HEALTH_CHECK_INTERVAL_SECONDS=10
 * VECTOR_FALLBACK_POLICY=retry_from_first
 * VECTOR_FACTORY_FAIL_FAST=true
 * </pre>
 */
public final class VectorProviderConfig {

    private static final Logger logger = Logger.getLogger(VectorProviderConfig.class.getName());

    public static final String DEFAULT_RESOURCE = "vector-providers.json";

    static final String ENV_ACTIVE_PROVIDER = "VECTOR_ACTIVE_PROVIDER";
    static final String ENV_HEALTH_CHECK_ENABLED = "VECTOR_HEALTH_CHECK_ENABLED";
    static final String ENV_HEALTH_CHECK_INTERVAL_SECONDS = "VECTOR_HEALTH_CHECK_INTERVAL_SECONDS";
    static final String ENV_FALLBACK_POLICY = "VECTOR_FALLBACK_POLICY";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, ProviderSpec> providers;
    private final String activeProvider;
    private final List<String> fallbackOrder;
    private final FallbackPolicy fallbackPolicy;
    private final Map<String, String> hybridRoles;
    private final HybridRouting hybridRouting;
    private final boolean healthCheckEnabled;
    private final Duration healthCheckInterval;
    private final FactoryConfig factoryConfig;
    private final AlertThresholds alertThresholds;

    private VectorProviderConfig(Builder builder) {
        this.providers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.providers));
        this.activeProvider = builder.activeProvider;
        this.fallbackOrder = List.copyOf(builder.fallbackOrder);
        this.fallbackPolicy = builder.fallbackPolicy;
        this.hybridRoles = Collections.unmodifiableMap(new LinkedHashMap<>(builder.hybridRoles));
        this.hybridRouting = builder.hybridRouting;
        this.healthCheckEnabled = builder.healthCheckEnabled;
        this.healthCheckInterval = builder.healthCheckInterval;
        this.factoryConfig = builder.factoryConfig;
        this.alertThresholds = builder.alertThresholds;
        validate();
    }

    private void validate() {
        if (healthCheckEnabled && (healthCheckInterval.isNegative() || healthCheckInterval.isZero())) {
            throw new IllegalArgumentException("Health check interval must be positive: " + healthCheckInterval);
        }
        for (String name : fallbackOrder) {
            if (!providers.containsKey(name)) {
                throw new IllegalArgumentException("Fallback order references unknown provider: " + name);
            }
        }
        for (Map.Entry<String, String> role : hybridRoles.entrySet()) {
            if (!providers.containsKey(role.getValue())) {
                throw new IllegalArgumentException(String.format(
                        "Hybrid role %s references unknown provider: %s", role.getKey(), role.getValue()));
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the class path and applies environment
     * overrides. Returns defaults with environment overrides when the resource is
     * absent.
     */
    public static VectorProviderConfig loadDefault() {
        try (InputStream is = VectorProviderConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                logger.warning("No " + DEFAULT_RESOURCE + " on classpath, using defaults");
                return builder().applyEnvironment(ConfigValues::systemLookup).build();
            }
            return fromDocument(MAPPER.readValue(is, VectorProviderConfigDocument.class))
                    .applyEnvironment(ConfigValues::systemLookup)
                    .build();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Loads a JSON document and applies environment overrides.
     *
     * @throws UncheckedIOException if the file cannot be read or parsed
     */
    public static VectorProviderConfig loadFromJson(Path path) {
        return loadFromJson(path, ConfigValues::systemLookup);
    }

    public static VectorProviderConfig loadFromJson(Path path, Function<String, String> env) {
        logger.info("Loading vector provider configuration from: " + path);
        try (InputStream is = Files.newInputStream(path)) {
            return fromDocument(MAPPER.readValue(is, VectorProviderConfigDocument.class))
                    .applyEnvironment(env)
                    .build();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load configuration from " + path, e);
        }
    }

    static Builder fromDocument(VectorProviderConfigDocument doc) {
        Builder builder = builder();
        if (doc.providers() != null) {
            doc.providers().forEach((name, p) ->
                    builder.provider(name, new ProviderSpec(p.type(), p.enabledOrDefault(), p.config(), p.tags())));
        }
        builder.activeProvider(doc.activeProvider());

        if (doc.fallback() != null) {
            if (doc.fallback().order() != null) {
                builder.fallbackOrder(doc.fallback().order());
            }
            builder.fallbackPolicy(FallbackPolicy.fromKey(doc.fallback().policy()));
        }

        if (doc.hybrid() != null) {
            VectorProviderConfigDocument.Hybrid hybrid = doc.hybrid();
            Map<Operation, String> routes = new EnumMap<>(Operation.class);
            if (hybrid.routes() != null) {
                hybrid.routes().forEach((op, role) -> routes.put(Operation.fromKey(op), role));
            }
            builder.hybridRouting(new HybridRouting(HybridStrategy.fromKey(hybrid.strategy()), routes, hybrid.defaultRole()));
            if (hybrid.roles() != null) {
                hybrid.roles().forEach(builder::hybridRole);
            }
        }

        if (doc.healthCheck() != null) {
            if (doc.healthCheck().enabled() != null) {
                builder.healthCheckEnabled(doc.healthCheck().enabled());
            }
            if (doc.healthCheck().intervalSeconds() != null) {
                builder.healthCheckInterval(Duration.ofSeconds(doc.healthCheck().intervalSeconds()));
            }
        }

        if (doc.factory() != null) {
            VectorProviderConfigDocument.Factory f = doc.factory();
            FactoryConfig.Builder factory = FactoryConfig.builder();
            if (f.enableValidation() != null) {
                factory.validationEnabled(f.enableValidation());
            }
            if (f.enableAutoConfig() != null) {
                factory.autoConfigEnabled(f.enableAutoConfig());
            }
            if (f.failFast() != null) {
                factory.failFast(f.failFast());
            }
            if (f.defaultTimeoutSeconds() != null) {
                factory.defaultTimeout(Duration.ofSeconds(f.defaultTimeoutSeconds()));
            }
            if (f.maxRetries() != null) {
                factory.maxRetries(f.maxRetries());
            }
            if (f.customConfigs() != null) {
                f.customConfigs().forEach(factory::customConfig);
            }
            builder.factoryConfig(factory.build());
        }

        if (doc.alerts() != null) {
            builder.alertThresholds(new AlertThresholds(doc.alerts()));
        }
        return builder;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.providers.putAll(providers);
        builder.activeProvider = activeProvider;
        builder.fallbackOrder.addAll(fallbackOrder);
        builder.fallbackPolicy = fallbackPolicy;
        builder.hybridRoles.putAll(hybridRoles);
        builder.hybridRouting = hybridRouting;
        builder.healthCheckEnabled = healthCheckEnabled;
        builder.healthCheckInterval = healthCheckInterval;
        builder.factoryConfig = factoryConfig;
        builder.alertThresholds = alertThresholds;
        return builder;
    }

    /**
     * Providers in configuration order, including disabled ones.
     */
    public Map<String, ProviderSpec> providers() {
        return providers;
    }

    /**
     * Enabled providers in configuration order.
     */
    public Map<String, ProviderSpec> enabledProviders() {
        Map<String, ProviderSpec> enabled = new LinkedHashMap<>();
        providers.forEach((name, spec) -> {
            if (spec.enabled()) {
                enabled.put(name, spec);
            }
        });
        return enabled;
    }

    public String activeProvider() {
        return activeProvider;
    }

    public List<String> fallbackOrder() {
        return fallbackOrder;
    }

    public FallbackPolicy fallbackPolicy() {
        return fallbackPolicy;
    }

    public Map<String, String> hybridRoles() {
        return hybridRoles;
    }

    public HybridRouting hybridRouting() {
        return hybridRouting;
    }

    public boolean healthCheckEnabled() {
        return healthCheckEnabled;
    }

    public Duration healthCheckInterval() {
        return healthCheckInterval;
    }

    public FactoryConfig factoryConfig() {
        return factoryConfig;
    }

    public AlertThresholds alertThresholds() {
        return alertThresholds;
    }

    @Override
    public String toString() {
        return String.format(
                "VectorProviderConfig{providers=%s, active=%s, fallback=%s (%s), hybridRoles=%s, healthCheck=%s/%s, %s}",
                providers.keySet(), activeProvider, fallbackOrder, fallbackPolicy, hybridRoles.keySet(),
                healthCheckEnabled, healthCheckInterval, factoryConfig);
    }

    public static final class Builder {
        private final Map<String, ProviderSpec> providers = new LinkedHashMap<>();
        private String activeProvider;
        private final List<String> fallbackOrder = new ArrayList<>();
        private FallbackPolicy fallbackPolicy = FallbackPolicy.STICKY;
        private final Map<String, String> hybridRoles = new LinkedHashMap<>();
        private HybridRouting hybridRouting = HybridRouting.of(HybridStrategy.FAILOVER);
        private boolean healthCheckEnabled = true;
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private FactoryConfig factoryConfig = FactoryConfig.defaults();
        private AlertThresholds alertThresholds = AlertThresholds.none();

        private Builder() {
        }

        public Builder provider(String name, ProviderSpec spec) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Provider name cannot be null or blank");
            }
            this.providers.put(name, spec);
            return this;
        }

        public Builder activeProvider(String activeProvider) {
            this.activeProvider = activeProvider;
            return this;
        }

        public Builder fallbackOrder(List<String> order) {
            this.fallbackOrder.clear();
            this.fallbackOrder.addAll(order);
            return this;
        }

        public Builder fallbackPolicy(FallbackPolicy fallbackPolicy) {
            this.fallbackPolicy = fallbackPolicy;
            return this;
        }

        public Builder hybridRole(String role, String providerName) {
            this.hybridRoles.put(role, providerName);
            return this;
        }

        public Builder hybridRouting(HybridRouting hybridRouting) {
            this.hybridRouting = hybridRouting;
            return this;
        }

        public Builder healthCheckEnabled(boolean healthCheckEnabled) {
            this.healthCheckEnabled = healthCheckEnabled;
            return this;
        }

        public Builder healthCheckInterval(Duration healthCheckInterval) {
            this.healthCheckInterval = healthCheckInterval;
            return this;
        }

        public Builder factoryConfig(FactoryConfig factoryConfig) {
            this.factoryConfig = factoryConfig;
            return this;
        }

        public Builder alertThresholds(AlertThresholds alertThresholds) {
            this.alertThresholds = alertThresholds;
            return this;
        }

        /**
         * Applies {@code VECTOR_*} overrides, including the factory's.
         */
        public Builder applyEnvironment(Function<String, String> env) {
            ConfigValues.string(env, ENV_ACTIVE_PROVIDER).ifPresent(v -> this.activeProvider = v);
            ConfigValues.bool(env, ENV_HEALTH_CHECK_ENABLED).ifPresent(v -> this.healthCheckEnabled = v);
            ConfigValues.longValue(env, ENV_HEALTH_CHECK_INTERVAL_SECONDS)
                    .ifPresent(v -> this.healthCheckInterval = Duration.ofSeconds(v));
            ConfigValues.string(env, ENV_FALLBACK_POLICY).ifPresent(v -> {
                try {
                    this.fallbackPolicy = FallbackPolicy.fromKey(v);
                } catch (IllegalArgumentException e) {
                    logger.warning("Invalid " + ENV_FALLBACK_POLICY + ": " + v + ", using " + this.fallbackPolicy);
                }
            });
            this.factoryConfig = factoryConfig.toBuilder().applyEnvironment(env).build();
            return this;
        }

        public VectorProviderConfig build() {
            return new VectorProviderConfig(this);
        }
    }
}
