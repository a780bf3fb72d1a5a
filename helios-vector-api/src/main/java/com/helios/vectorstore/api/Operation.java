/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Operations of the provider capability contract.
 *
 * <p>The {@link #key()} is the stable name used in configuration (hybrid routes),
 * performance tables and log messages.
 */
public enum Operation {
    INITIALIZE("initialize", Kind.LIFECYCLE),
    START("start", Kind.LIFECYCLE),
    STOP("stop", Kind.LIFECYCLE),
    HEALTH("health", Kind.DESCRIPTIVE),

    STORE("store", Kind.DATA),
    RETRIEVE("retrieve", Kind.DATA),
    UPDATE("update", Kind.DATA),
    DELETE("delete", Kind.DATA),

    SEARCH("search", Kind.SEARCH),
    FIND_SIMILAR("find_similar", Kind.SEARCH),
    BATCH_FIND_SIMILAR("batch_find_similar", Kind.SEARCH),

    CREATE_COLLECTION("create_collection", Kind.COLLECTION),
    DELETE_COLLECTION("delete_collection", Kind.COLLECTION),
    LIST_COLLECTIONS("list_collections", Kind.COLLECTION),
    GET_COLLECTION("get_collection", Kind.COLLECTION),
    CREATE_INDEX("create_index", Kind.COLLECTION),
    DELETE_INDEX("delete_index", Kind.COLLECTION),
    LIST_INDEXES("list_indexes", Kind.COLLECTION),

    ADD_METADATA("add_metadata", Kind.METADATA),
    UPDATE_METADATA("update_metadata", Kind.METADATA),
    GET_METADATA("get_metadata", Kind.METADATA),
    DELETE_METADATA("delete_metadata", Kind.METADATA),

    STATS("stats", Kind.ADMINISTRATION),
    OPTIMIZE("optimize", Kind.ADMINISTRATION),
    BACKUP("backup", Kind.ADMINISTRATION),
    RESTORE("restore", Kind.ADMINISTRATION);

    public enum Kind {
        LIFECYCLE, DESCRIPTIVE, DATA, SEARCH, COLLECTION, METADATA, ADMINISTRATION
    }

    private final String key;
    private final Kind kind;

    Operation(String key, Kind kind) {
        this.key = key;
        this.kind = kind;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Resolves an operation from its key or enum name, case-insensitively.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    @JsonCreator
    public static Operation fromKey(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Operation key cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Operation operation : values()) {
            if (operation.key.equals(normalized) || operation.name().equalsIgnoreCase(normalized)) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unknown operation: " + value);
    }

    @Override
    public String toString() {
        return key;
    }
}
