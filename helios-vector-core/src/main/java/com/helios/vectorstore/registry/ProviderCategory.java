/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.registry;

/**
 * Broad family a provider type belongs to, used for registry statistics.
 */
public enum ProviderCategory {
    VECTOR_DATABASE("vector_database"),
    AI_MEMORY("ai_memory"),
    UTILITY("utility"),
    UNKNOWN("unknown");

    private final String key;

    ProviderCategory(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
