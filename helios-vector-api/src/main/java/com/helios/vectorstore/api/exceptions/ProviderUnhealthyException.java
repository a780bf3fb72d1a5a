/*
 * Copyright (c) 2025 Helios Vector Providers
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.vectorstore.api.exceptions;

/**
 * Raised when a provider switch is rejected because the target is not healthy.
 */
public class ProviderUnhealthyException extends VectorProviderException {

    private final String providerName;

    public ProviderUnhealthyException(String providerName, String reason) {
        super(String.format("Provider %s is not healthy: %s", providerName, reason));
        this.providerName = providerName;
    }

    public ProviderUnhealthyException(String providerName, String reason, Throwable cause) {
        super(String.format("Provider %s is not healthy: %s", providerName, reason), cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
