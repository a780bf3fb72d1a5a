/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api;

import java.util.Set;

/**
 * Well-known capability tags a provider may declare.
 *
 * <p>Tags are plain strings so third-party backends can declare their own.
 */
public final class ProviderCapabilities {

    public static final String VECTOR_STORAGE = "vector_storage";
    public static final String SIMILARITY_SEARCH = "similarity_search";
    public static final String METADATA_FILTERING = "metadata_filtering";
    public static final String COLLECTIONS = "collections";
    public static final String INDEXING = "indexing";
    public static final String BATCH_OPERATIONS = "batch_operations";
    public static final String BACKUP = "backup";
    public static final String TTL = "ttl";
    public static final String NAMESPACES = "namespaces";
    public static final String PERSISTENCE = "persistence";

    /**
     * Tags every vector database backend is expected to offer.
     */
    public static final Set<String> BASIC = Set.of(VECTOR_STORAGE, SIMILARITY_SEARCH, COLLECTIONS);

    private ProviderCapabilities() {
        throw new AssertionError("No instances");
    }
}
