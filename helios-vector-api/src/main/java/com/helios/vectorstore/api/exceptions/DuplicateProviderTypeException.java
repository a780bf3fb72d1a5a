/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.exceptions;

/**
 * Raised when a provider type is registered twice.
 */
public class DuplicateProviderTypeException extends VectorProviderException {

    private final String providerType;

    public DuplicateProviderTypeException(String providerType) {
        super(String.format("Provider type %s is already registered", providerType));
        this.providerType = providerType;
    }

    public String getProviderType() {
        return providerType;
    }
}
