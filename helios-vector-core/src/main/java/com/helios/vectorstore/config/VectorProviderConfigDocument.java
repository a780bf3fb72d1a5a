/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON representation of {@link VectorProviderConfig} for deserialization.
 * Sections and keys not listed here are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record VectorProviderConfigDocument(
        @JsonProperty("active_provider") String activeProvider,
        @JsonProperty("providers") Map<String, Provider> providers,
        @JsonProperty("fallback") Fallback fallback,
        @JsonProperty("hybrid") Hybrid hybrid,
        @JsonProperty("health_check") HealthCheck healthCheck,
        @JsonProperty("factory") Factory factory,
        @JsonProperty("alerts") Map<String, Double> alerts
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Provider(
            @JsonProperty("type") String type,
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("config") Map<String, Object> config,
            @JsonProperty("tags") List<String> tags
    ) {
        boolean enabledOrDefault() {
            return enabled == null || enabled;
        }
    }

    record Fallback(
            @JsonProperty("order") List<String> order,
            @JsonProperty("policy") String policy
    ) {}

    record Hybrid(
            @JsonProperty("strategy") String strategy,
            @JsonProperty("roles") Map<String, String> roles,
            @JsonProperty("routes") Map<String, String> routes,
            @JsonProperty("default_role") String defaultRole
    ) {}

    record HealthCheck(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("interval_seconds") Long intervalSeconds
    ) {}

    record Factory(
            @JsonProperty("enable_validation") Boolean enableValidation,
            @JsonProperty("enable_auto_config") Boolean enableAutoConfig,
            @JsonProperty("fail_fast") Boolean failFast,
            @JsonProperty("default_timeout_seconds") Long defaultTimeoutSeconds,
            @JsonProperty("max_retries") Integer maxRetries,
            @JsonProperty("custom_configs") Map<String, Map<String, Object>> customConfigs
    ) {}
}
