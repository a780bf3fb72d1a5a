/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.registry;

import java.util.Set;

/**
 * Filter for {@link ProviderRegistry#compatibleTypes(ProviderRequirements)}.
 *
 * @param capabilities tags every matching type must declare
 * @param cloud        required deployment kind, or {@code null} for either
 * @param maxCost      ceiling on the declared total cost, or {@code null} for none
 */
public record ProviderRequirements(Set<String> capabilities, Boolean cloud, Double maxCost) {

    public ProviderRequirements {
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
    }

    public static ProviderRequirements any() {
        return new ProviderRequirements(Set.of(), null, null);
    }

    public static ProviderRequirements withCapabilities(String... capabilities) {
        return new ProviderRequirements(Set.of(capabilities), null, null);
    }

    public ProviderRequirements localOnly() {
        return new ProviderRequirements(capabilities, false, maxCost);
    }

    public ProviderRequirements cloudOnly() {
        return new ProviderRequirements(capabilities, true, maxCost);
    }

    public ProviderRequirements costAtMost(double ceiling) {
        return new ProviderRequirements(capabilities, cloud, ceiling);
    }

    boolean matches(ProviderDescriptor descriptor) {
        if (!descriptor.capabilities().containsAll(capabilities)) {
            return false;
        }
        if (cloud != null && cloud != descriptor.cloud()) {
            return false;
        }
        return maxCost == null || descriptor.costInfo().totalCost() <= maxCost;
    }
}
