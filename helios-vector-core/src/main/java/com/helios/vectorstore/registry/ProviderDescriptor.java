/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.registry;

import com.helios.vectorstore.api.model.CostInfo;

import java.util.Set;

/**
 * Static metadata of a provider type.
 *
 * <p>Everything discovery needs (capabilities, cloud flag, cost model) is declared
 * here so that listing or filtering types never constructs a backend.
 */
public record ProviderDescriptor(
        String type,
        String displayName,
        ProviderCategory category,
        Set<String> capabilities,
        boolean cloud,
        CostInfo costInfo,
        ProviderConfigSchema schema
) {

    public ProviderDescriptor {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Provider type cannot be null or blank");
        }
        displayName = displayName != null ? displayName : type;
        category = category != null ? category : ProviderDefaults.categoryOf(type);
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
        costInfo = costInfo != null ? costInfo : CostInfo.free();
        schema = schema != null ? schema : ProviderConfigSchema.permissive();
    }

    /**
     * Descriptor for a type registered with a bare constructor: local, free, no
     * declared capabilities and a permissive schema.
     */
    public static ProviderDescriptor minimal(String type) {
        return new ProviderDescriptor(type, null, null, null, false, null, null);
    }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    public static final class Builder {
        private final String type;
        private String displayName;
        private ProviderCategory category;
        private Set<String> capabilities;
        private boolean cloud;
        private CostInfo costInfo;
        private ProviderConfigSchema schema;

        private Builder(String type) {
            this.type = type;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder category(ProviderCategory category) {
            this.category = category;
            return this;
        }

        public Builder capabilities(Set<String> capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public Builder cloud(boolean cloud) {
            this.cloud = cloud;
            return this;
        }

        public Builder costInfo(CostInfo costInfo) {
            this.costInfo = costInfo;
            return this;
        }

        public Builder schema(ProviderConfigSchema schema) {
            this.schema = schema;
            return this;
        }

        public ProviderDescriptor build() {
            return new ProviderDescriptor(type, displayName, category, capabilities, cloud, costInfo, schema);
        }
    }
}
