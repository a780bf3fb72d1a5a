/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.model;

import java.util.Set;

/**
 * Manager-level view of one configured provider instance.
 */
public record ProviderInfo(
        String name,
        String type,
        Set<String> capabilities,
        boolean cloud,
        boolean active,
        boolean healthy,
        CostInfo costInfo
) {

    public ProviderInfo {
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
    }
}
