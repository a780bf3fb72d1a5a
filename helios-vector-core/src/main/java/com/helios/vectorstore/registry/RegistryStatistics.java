/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.registry;

import java.util.Map;

public record RegistryStatistics(
        int totalProviders,
        int cloudProviders,
        int localProviders,
        Map<ProviderCategory, Integer> providersByCategory
) {

    public RegistryStatistics {
        providersByCategory = Map.copyOf(providersByCategory);
    }
}
