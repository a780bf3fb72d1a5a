/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.exceptions;

public class ProviderNotFoundException extends VectorProviderException {

    private final String providerName;

    public ProviderNotFoundException(String providerName) {
        super(String.format("Provider %s not found", providerName));
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
