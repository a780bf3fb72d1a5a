/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.exceptions;

/**
 * Raised when a provider type identifier has no registration.
 */
public class UnknownProviderTypeException extends VectorProviderException {

    private final String providerType;

    public UnknownProviderTypeException(String providerType) {
        super(String.format("Unknown provider type: %s", providerType));
        this.providerType = providerType;
    }

    public String getProviderType() {
        return providerType;
    }
}
