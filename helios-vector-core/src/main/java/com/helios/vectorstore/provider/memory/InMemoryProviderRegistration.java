/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.provider.memory;

import com.helios.vectorstore.api.IVectorProvider;
import com.helios.vectorstore.api.ProviderSettings;
import com.helios.vectorstore.registry.ConfigProperty;
import com.helios.vectorstore.registry.ProviderCategory;
import com.helios.vectorstore.registry.ProviderConfigSchema;
import com.helios.vectorstore.registry.ProviderDescriptor;
import com.helios.vectorstore.registry.ProviderRegistration;

/**
 * Registers the {@code memory} type with the default registry.
 */
public final class InMemoryProviderRegistration implements ProviderRegistration {

    static final ProviderConfigSchema SCHEMA = ProviderConfigSchema.builder()
            .optional(InMemoryVectorProvider.DIMENSION_KEY, ConfigProperty.Type.INTEGER, 0L)
            .optional(InMemoryVectorProvider.METRIC_KEY, ConfigProperty.Type.STRING, "cosine")
            .optional(InMemoryVectorProvider.DEFAULT_COLLECTION_KEY, ConfigProperty.Type.STRING,
                    InMemoryVectorProvider.DEFAULT_COLLECTION)
            .optional(InMemoryVectorProvider.MAX_VECTORS_KEY, ConfigProperty.Type.INTEGER,
                    InMemoryVectorProvider.DEFAULT_MAX_VECTORS)
            .build();

    static final ProviderDescriptor DESCRIPTOR = ProviderDescriptor.builder(InMemoryVectorProvider.TYPE)
            .displayName("In-Memory (Caffeine)")
            .category(ProviderCategory.VECTOR_DATABASE)
            .capabilities(InMemoryVectorProvider.CAPABILITIES)
            .cloud(false)
            .schema(SCHEMA)
            .build();

    @Override
    public ProviderDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public IVectorProvider create(ProviderSettings settings) {
        return new InMemoryVectorProvider(settings);
    }
}
