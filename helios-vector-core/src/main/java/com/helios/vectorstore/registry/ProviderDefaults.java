/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.registry;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Canned configuration and categories for well-known backend type names.
 *
 * <p>Used when a type is looked up by name without a registered descriptor, so an
 * operator can see a sensible starting configuration for e.g. {@code qdrant}
 * before its client module is on the classpath.
 */
final class ProviderDefaults {

    private static final Map<String, Map<String, Object>> DEFAULTS = new LinkedHashMap<>();

    private static final Set<String> VECTOR_DATABASES = Set.of(
            "pinecone", "milvus", "weaviate", "qdrant", "redis", "chroma", "faiss",
            "deeplake", "clickhouse", "supabase", "vertexai", "memory");
    private static final Set<String> AI_MEMORY = Set.of(
            "memgpt", "crewai", "characterai", "replika", "anima");
    private static final Set<String> UTILITY = Set.of("agnostic");

    static {
        put("pinecone", "environment", "us-west1-gcp", "index_name", "vectors", "dimension", 1536, "metric", "cosine");
        put("milvus", "host", "localhost", "port", 19530, "database", "default",
                "index_type", "IVF_FLAT", "metric_type", "L2");
        put("redis", "addr", "localhost:6379", "db", 0, "enable_search", true, "compression", true);
        put("chroma", "host", "localhost", "port", 8000, "path", "./chroma_db");
        put("qdrant", "host", "localhost", "port", 6333, "api_key", "", "collection", "vectors");
        put("weaviate", "url", "http://localhost:8080", "api_key", "", "batch_size", 100);
        put("faiss", "index_type", "IVF", "dimension", 1536, "nlist", 100, "metric", "cosine");
        put("clickhouse", "host", "localhost", "port", 9000, "database", "vectors", "table", "embeddings");
        put("supabase", "url", "", "key", "", "table", "vectors");
        put("deeplake", "path", "./deeplake", "embedding_function", "text-embedding-ada-002");
        put("vertexai", "project_id", "", "location", "us-central1", "index_name", "vectors");
        put("openai", "model", "text-embedding-3-small", "timeout", 30, "max_retries", 3);
        put("cohere", "model", "embed-english-v3.0", "timeout", 30, "max_retries", 3);
        put("mistral", "model", "mistral-embed", "timeout", 30, "max_retries", 3);
        put("gemini", "model", "text-embedding-004", "timeout", 30, "max_retries", 3);
        put("huggingface", "model", "sentence-transformers/all-MiniLM-L6-v2", "task", "feature-extraction", "timeout", 30);
        put("llamaindex", "storage_type", "local", "persist_dir", "./llama_index", "chunk_size", 1024);
        put("memgpt", "base_url", "https://api.memgpt.ai", "model", "memgpt-1.0", "max_tokens", 4096);
        put("crewai", "base_url", "https://api.crewai.ai", "max_agents", 10, "parallel_execution", true);
        put("agnostic", "storage_type", "memory", "enable_persistence", false);
    }

    private ProviderDefaults() {
        throw new AssertionError("No instances");
    }

    /**
     * @return a fresh mutable copy, empty for unknown types
     */
    static Map<String, Object> configFor(String type) {
        Map<String, Object> defaults = DEFAULTS.get(normalize(type));
        return defaults != null ? new LinkedHashMap<>(defaults) : new LinkedHashMap<>();
    }

    static ProviderCategory categoryOf(String type) {
        String key = normalize(type);
        if (VECTOR_DATABASES.contains(key)) {
            return ProviderCategory.VECTOR_DATABASE;
        }
        if (AI_MEMORY.contains(key)) {
            return ProviderCategory.AI_MEMORY;
        }
        if (UTILITY.contains(key)) {
            return ProviderCategory.UTILITY;
        }
        return ProviderCategory.UNKNOWN;
    }

    private static String normalize(String type) {
        return type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
    }

    private static void put(String type, Object... keyValues) {
        Map<String, Object> config = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            config.put((String) keyValues[i], keyValues[i + 1]);
        }
        DEFAULTS.put(type, Map.copyOf(config));
    }
}
