/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.config;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Behaviour switches of the provider factory.
 *
 * <p><b>Environment Variable Override</b> (see {@link Builder#applyEnvironment}):
 * <pre>
 * VECTOR_FACTORY_VALIDATION=false
 * VECTOR_FACTORY_AUTO_CONFIG=true
 * VECTOR_FACTORY_FAIL_FAST=true
 * VECTOR_FACTORY_TIMEOUT_SECONDS=10
 * VECTOR_FACTORY_MAX_RETRIES=5
 * </pre>
 */
public final class FactoryConfig {

    private static final Logger logger = Logger.getLogger(FactoryConfig.class.getName());

    static final String ENV_VALIDATION = "VECTOR_FACTORY_VALIDATION";
    static final String ENV_AUTO_CONFIG = "VECTOR_FACTORY_AUTO_CONFIG";
    static final String ENV_FAIL_FAST = "VECTOR_FACTORY_FAIL_FAST";
    static final String ENV_TIMEOUT_SECONDS = "VECTOR_FACTORY_TIMEOUT_SECONDS";
    static final String ENV_MAX_RETRIES = "VECTOR_FACTORY_MAX_RETRIES";

    /** Built-in setting key carrying {@link #defaultTimeout()} in seconds. */
    public static final String TIMEOUT_SECONDS_KEY = "timeout_seconds";
    /** Built-in setting key carrying {@link #maxRetries()}. */
    public static final String MAX_RETRIES_KEY = "max_retries";

    private final Duration defaultTimeout;
    private final int maxRetries;
    private final boolean validationEnabled;
    private final boolean autoConfigEnabled;
    private final boolean failFast;
    private final Map<String, Map<String, Object>> customConfigs;

    private FactoryConfig(Builder builder) {
        this.defaultTimeout = builder.defaultTimeout;
        this.maxRetries = builder.maxRetries;
        this.validationEnabled = builder.validationEnabled;
        this.autoConfigEnabled = builder.autoConfigEnabled;
        this.failFast = builder.failFast;
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        builder.customConfigs.forEach((type, cfg) ->
                copy.put(type, Collections.unmodifiableMap(new LinkedHashMap<>(cfg))));
        this.customConfigs = Collections.unmodifiableMap(copy);
        validate();
    }

    public static FactoryConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults with {@code VECTOR_FACTORY_*} environment overrides applied.
     */
    public static FactoryConfig fromEnvironment() {
        return builder().applyEnvironment(ConfigValues::systemLookup).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.defaultTimeout = defaultTimeout;
        builder.maxRetries = maxRetries;
        builder.validationEnabled = validationEnabled;
        builder.autoConfigEnabled = autoConfigEnabled;
        builder.failFast = failFast;
        builder.customConfigs.putAll(customConfigs);
        return builder;
    }

    private void validate() {
        if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must be positive: " + defaultTimeout);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative: " + maxRetries);
        }
    }

    /**
     * Lowest-priority settings merged into every provider configuration.
     */
    public Map<String, Object> builtInDefaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put(TIMEOUT_SECONDS_KEY, defaultTimeout.toSeconds());
        defaults.put(MAX_RETRIES_KEY, maxRetries);
        return defaults;
    }

    public Map<String, Object> customConfigFor(String type) {
        return customConfigs.getOrDefault(type, Map.of());
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public boolean validationEnabled() {
        return validationEnabled;
    }

    public boolean autoConfigEnabled() {
        return autoConfigEnabled;
    }

    public boolean failFast() {
        return failFast;
    }

    public Map<String, Map<String, Object>> customConfigs() {
        return customConfigs;
    }

    @Override
    public String toString() {
        return String.format(
                "FactoryConfig{timeout=%s, maxRetries=%d, validation=%s, autoConfig=%s, failFast=%s, customTypes=%s}",
                defaultTimeout, maxRetries, validationEnabled, autoConfigEnabled, failFast, customConfigs.keySet());
    }

    public static final class Builder {
        private Duration defaultTimeout = Duration.ofSeconds(30);
        private int maxRetries = 3;
        private boolean validationEnabled = true;
        private boolean autoConfigEnabled = true;
        private boolean failFast = false;
        private final Map<String, Map<String, Object>> customConfigs = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder validationEnabled(boolean validationEnabled) {
            this.validationEnabled = validationEnabled;
            return this;
        }

        public Builder autoConfigEnabled(boolean autoConfigEnabled) {
            this.autoConfigEnabled = autoConfigEnabled;
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        /**
         * Highest-priority overrides applied to every provider of {@code type}.
         */
        public Builder customConfig(String type, Map<String, Object> config) {
            this.customConfigs.put(type, config);
            return this;
        }

        /**
         * Applies {@code VECTOR_FACTORY_*} overrides from {@code env}.
         */
        public Builder applyEnvironment(Function<String, String> env) {
            ConfigValues.bool(env, ENV_VALIDATION).ifPresent(v -> this.validationEnabled = v);
            ConfigValues.bool(env, ENV_AUTO_CONFIG).ifPresent(v -> this.autoConfigEnabled = v);
            ConfigValues.bool(env, ENV_FAIL_FAST).ifPresent(v -> this.failFast = v);
            ConfigValues.longValue(env, ENV_TIMEOUT_SECONDS).ifPresent(v -> this.defaultTimeout = Duration.ofSeconds(v));
            ConfigValues.longValue(env, ENV_MAX_RETRIES).ifPresent(v -> this.maxRetries = v.intValue());
            return this;
        }

        public FactoryConfig build() {
            FactoryConfig config = new FactoryConfig(this);
            logger.fine(() -> "Built " + config);
            return config;
        }
    }
}
